package com.polymind.ingestion.decoder;

import com.polymind.domain.OutcomeToken;
import org.web3j.crypto.Hash;
import org.web3j.utils.Numeric;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Derives CTF position ids (ERC-1155 token ids) for a condition.
 * collectionId = keccak256(parentCollectionId ++ conditionId ++ uint256(indexSet)), indexSet = 1 << outcomeIndex;
 * positionId = keccak256(collateral ++ collectionId).
 */
public class OutcomeTokenIds {

    private static final byte[] PARENT_COLLECTION_ID = new byte[32];

    private final byte[] collateral;

    public OutcomeTokenIds(String collateralAddress) {
        byte[] bytes = Numeric.hexStringToByteArray(collateralAddress);
        if (bytes.length != 20) {
            throw new IllegalArgumentException("Collateral must be a 20-byte address: " + collateralAddress);
        }
        this.collateral = bytes;
    }

    public List<OutcomeToken> deriveOutcomeTokens(String conditionId, int outcomeSlotCount) {
        String normalized = conditionId.toLowerCase(Locale.ROOT);
        List<OutcomeToken> tokens = new ArrayList<>(outcomeSlotCount);
        for (int i = 0; i < outcomeSlotCount; i++) {
            tokens.add(new OutcomeToken(positionId(normalized, i), normalized, i,
                    OutcomeToken.labelFor(i, outcomeSlotCount)));
        }
        return tokens;
    }

    /** Position id as an unsigned decimal string, the form Polymarket APIs use. */
    public String positionId(String conditionId, int outcomeIndex) {
        byte[] collectionId = collectionId(Numeric.hexStringToByteArray(conditionId), BigInteger.ONE.shiftLeft(outcomeIndex));
        byte[] packed = concat(collateral, collectionId);
        return Numeric.toBigInt(Hash.sha3(packed)).toString();
    }

    static byte[] collectionId(byte[] conditionId, BigInteger indexSet) {
        if (conditionId.length != 32) {
            throw new IllegalArgumentException("conditionId must be 32 bytes");
        }
        return Hash.sha3(concat(PARENT_COLLECTION_ID, conditionId, Numeric.toBytesPadded(indexSet, 32)));
    }

    private static byte[] concat(byte[]... parts) {
        int length = 0;
        for (byte[] p : parts) {
            length += p.length;
        }
        byte[] out = new byte[length];
        int offset = 0;
        for (byte[] p : parts) {
            System.arraycopy(p, 0, out, offset, p.length);
            offset += p.length;
        }
        return out;
    }
}
