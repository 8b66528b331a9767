package com.polymind.ingestion.decoder;

import com.polymind.domain.OutcomeToken;
import com.polymind.domain.TradeSide;
import com.polymind.ingestion.adapter.RawLog;
import com.polymind.ingestion.registry.TokenRegistry;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.web3j.abi.FunctionReturnDecoder;
import org.web3j.abi.TypeReference;
import org.web3j.abi.datatypes.Address;
import org.web3j.abi.datatypes.DynamicArray;
import org.web3j.abi.datatypes.Type;
import org.web3j.abi.datatypes.generated.Uint256;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Turns raw logs into {@link DomainEvent}s. No I/O; the only shared state is a read of {@link TokenRegistry}.
 * <p>
 * Collateral (USDC) and outcome tokens both use 6 decimals, so price = collateral amount / token amount.
 */
@Component
@RequiredArgsConstructor
public class EventDecoder {

    public static final int PRICE_SCALE = 6;
    public static final int AMOUNT_DECIMALS = 6;
    private static final RoundingMode ROUNDING = RoundingMode.HALF_UP;
    private static final int WORD_HEX_CHARS = 64;
    private static final int ORDER_FILLED_DATA_WORDS = 5;
    private static final int MAX_OUTCOME_SLOTS = 256;

    private final TokenRegistry tokenRegistry;
    private final OutcomeTokenIds outcomeTokenIds;

    public EventKind kindOf(RawLog log) {
        return EventSignatures.kindOf(log.topic(0));
    }

    public DecodeResult decode(RawLog log) {
        EventKind kind = kindOf(log);
        try {
            return switch (kind) {
                case TRADE_FILLED -> decodeTradeFilled(log);
                case MARKET_CREATED -> decodeMarketCreated(log);
                case MARKET_RESOLVED -> decodeMarketResolved(log);
                case UNRECOGNIZED -> DecodeResult.of(
                        new Unrecognized(log.blockNumber(), log.logIndex(), log.transactionHash(), log.topic(0)));
            };
        } catch (RuntimeException e) {
            // web3j rejects non-hex or truncated payloads with unchecked exceptions
            return DecodeResult.failure(DecodeError.MALFORMED_LOG, kind + " at " + position(log) + ": " + e.getMessage());
        }
    }

    private DecodeResult decodeTradeFilled(RawLog log) {
        if (log.topics().size() != 4 || dataWords(log.data()) < ORDER_FILLED_DATA_WORDS) {
            return malformed(log, "OrderFilled needs 4 topics and 5 data words");
        }
        List<Type> values = FunctionReturnDecoder.decode(log.data(), EventSignatures.ORDER_FILLED.getNonIndexedParameters());
        if (values.size() != ORDER_FILLED_DATA_WORDS) {
            return malformed(log, "OrderFilled data decoded to " + values.size() + " values");
        }
        BigInteger makerAssetId = uint(values.get(0));
        BigInteger takerAssetId = uint(values.get(1));
        BigInteger makerAmount = uint(values.get(2));
        BigInteger takerAmount = uint(values.get(3));
        BigInteger fee = uint(values.get(4));

        TradeSide side;
        BigInteger tokenId;
        BigInteger collateralAmount;
        BigInteger tokenAmount;
        if (makerAssetId.signum() == 0 && takerAssetId.signum() != 0) {
            side = TradeSide.BUY;
            tokenId = takerAssetId;
            collateralAmount = makerAmount;
            tokenAmount = takerAmount;
        } else if (takerAssetId.signum() == 0 && makerAssetId.signum() != 0) {
            side = TradeSide.SELL;
            tokenId = makerAssetId;
            collateralAmount = takerAmount;
            tokenAmount = makerAmount;
        } else {
            return DecodeResult.failure(DecodeError.INVALID_PRICE, "no collateral leg at " + position(log));
        }
        if (tokenAmount.signum() == 0 || collateralAmount.signum() == 0) {
            return DecodeResult.failure(DecodeError.INVALID_PRICE, "zero fill amount at " + position(log));
        }
        BigDecimal price = toPrice(collateralAmount, tokenAmount);
        if (price.signum() <= 0 || price.compareTo(BigDecimal.ONE) >= 0) {
            return DecodeResult.failure(DecodeError.INVALID_PRICE, "price " + price.toPlainString() + " at " + position(log));
        }
        Optional<OutcomeToken> token = tokenRegistry.resolve(tokenId.toString());
        if (token.isEmpty()) {
            return DecodeResult.failure(DecodeError.UNKNOWN_TOKEN, tokenId.toString());
        }
        return DecodeResult.of(new TradeFilled(
                log.blockNumber(),
                log.logIndex(),
                log.transactionHash(),
                log.address(),
                log.topic(1).toLowerCase(Locale.ROOT),
                topicAddress(log.topic(2)),
                topicAddress(log.topic(3)),
                token.get(),
                side,
                price,
                fromUnits(tokenAmount),
                fromUnits(fee),
                collateralAmount,
                tokenAmount,
                log.blockTimestamp()));
    }

    private DecodeResult decodeMarketCreated(RawLog log) {
        if (log.topics().size() != 4 || dataWords(log.data()) < 1) {
            return malformed(log, "ConditionPreparation needs 4 topics and 1 data word");
        }
        List<Type> values = FunctionReturnDecoder.decode(log.data(), EventSignatures.CONDITION_PREPARATION.getNonIndexedParameters());
        if (values.size() != 1) {
            return malformed(log, "ConditionPreparation data decoded to " + values.size() + " values");
        }
        BigInteger slots = uint(values.get(0));
        if (slots.compareTo(BigInteger.TWO) < 0 || slots.compareTo(BigInteger.valueOf(MAX_OUTCOME_SLOTS)) > 0) {
            return malformed(log, "outcomeSlotCount " + slots);
        }
        String conditionId = log.topic(1).toLowerCase(Locale.ROOT);
        int outcomeSlotCount = slots.intValueExact();
        return DecodeResult.of(new MarketCreated(
                log.blockNumber(),
                log.logIndex(),
                log.transactionHash(),
                conditionId,
                topicAddress(log.topic(2)),
                log.topic(3).toLowerCase(Locale.ROOT),
                outcomeSlotCount,
                outcomeTokenIds.deriveOutcomeTokens(conditionId, outcomeSlotCount),
                log.blockTimestamp()));
    }

    @SuppressWarnings("unchecked")
    private DecodeResult decodeMarketResolved(RawLog log) {
        if (log.topics().size() != 4 || dataWords(log.data()) < 3) {
            return malformed(log, "ConditionResolution needs 4 topics and at least 3 data words");
        }
        List<Type> values = FunctionReturnDecoder.decode(log.data(), EventSignatures.CONDITION_RESOLUTION.getNonIndexedParameters());
        if (values.size() != 2) {
            return malformed(log, "ConditionResolution data decoded to " + values.size() + " values");
        }
        int outcomeSlotCount = uint(values.get(0)).intValueExact();
        List<BigInteger> payouts = ((DynamicArray<Uint256>) values.get(1)).getValue().stream()
                .map(Uint256::getValue)
                .toList();
        if (payouts.size() < 2 || payouts.size() != outcomeSlotCount) {
            return malformed(log, "payout vector of " + payouts.size() + " for " + outcomeSlotCount + " outcomes");
        }
        int winner = uniqueArgMax(payouts);
        if (winner < 0) {
            return malformed(log, "payout vector without a single winner " + payouts);
        }
        return DecodeResult.of(new MarketResolved(
                log.blockNumber(),
                log.logIndex(),
                log.transactionHash(),
                log.topic(1).toLowerCase(Locale.ROOT),
                winner,
                payouts,
                log.blockTimestamp()));
    }

    /** Collateral / tokens, both in 6-decimal units, rounded to the price scale. */
    public static BigDecimal toPrice(BigInteger collateralAmount, BigInteger tokenAmount) {
        return new BigDecimal(collateralAmount).divide(new BigDecimal(tokenAmount), PRICE_SCALE, ROUNDING);
    }

    private static BigDecimal fromUnits(BigInteger units) {
        return new BigDecimal(units).movePointLeft(AMOUNT_DECIMALS).setScale(AMOUNT_DECIMALS, ROUNDING);
    }

    private static int uniqueArgMax(List<BigInteger> values) {
        int best = -1;
        boolean tie = false;
        for (int i = 0; i < values.size(); i++) {
            if (best < 0 || values.get(i).compareTo(values.get(best)) > 0) {
                best = i;
                tie = false;
            } else if (values.get(i).compareTo(values.get(best)) == 0) {
                tie = true;
            }
        }
        if (best < 0 || tie || values.get(best).signum() == 0) {
            return -1;
        }
        return best;
    }

    private static BigInteger uint(Type value) {
        return (BigInteger) value.getValue();
    }

    private static String topicAddress(String topic) {
        Address address = (Address) FunctionReturnDecoder.decodeIndexedValue(topic, new TypeReference<Address>() {});
        return address.getValue().toLowerCase(Locale.ROOT);
    }

    private static int dataWords(String data) {
        if (data == null) {
            return 0;
        }
        String hex = data.startsWith("0x") ? data.substring(2) : data;
        return hex.length() / WORD_HEX_CHARS;
    }

    private static DecodeResult malformed(RawLog log, String reason) {
        return DecodeResult.failure(DecodeError.MALFORMED_LOG, reason + " at " + position(log));
    }

    private static String position(RawLog log) {
        return log.transactionHash() + ":" + log.logIndex() + " (block " + log.blockNumber() + ")";
    }
}
