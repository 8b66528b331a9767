package com.polymind.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.CompoundIndexes;
import org.springframework.data.mongodb.core.mapping.Document;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * One OrderFilled fill. Id is txHash:logIndex; re-fetched duplicates upsert onto the same document.
 * Side is the maker's side; the taker took the opposite side.
 */
@Document(collection = "trades")
@CompoundIndexes({
        @CompoundIndex(name = "chain_order", def = "{'blockNumber': 1, 'logIndex': 1}"),
        @CompoundIndex(name = "market_chain_order", def = "{'marketId': 1, 'blockNumber': -1, 'logIndex': -1}"),
        @CompoundIndex(name = "maker_chain_order", def = "{'maker': 1, 'blockNumber': -1}"),
        @CompoundIndex(name = "taker_chain_order", def = "{'taker': 1, 'blockNumber': -1}")
})
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class Trade {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private String txHash;
    private int logIndex;
    private long blockNumber;
    private String exchange;
    private String orderHash;
    private String maker;
    private String taker;
    private String tokenId;
    private String marketId;
    private int outcomeIndex;
    private TradeSide side;
    /** Collateral per outcome token, scale 6, strictly between 0 and 1. */
    private BigDecimal price;
    /** Outcome tokens filled, scale 6. */
    private BigDecimal size;
    /** price * size in collateral units. */
    private BigDecimal notional;
    private BigDecimal fee;
    private Instant timestamp;

    public static String idOf(String txHash, int logIndex) {
        return txHash + ":" + logIndex;
    }
}
