package com.polymind.ingestion.decoder;

/**
 * Decoded log. The permitted records are the whole set of kinds; callers switch on {@link #kind()}.
 */
public sealed interface DomainEvent permits MarketCreated, MarketResolved, TradeFilled, Unrecognized {

    EventKind kind();

    long blockNumber();

    int logIndex();

    String transactionHash();
}
