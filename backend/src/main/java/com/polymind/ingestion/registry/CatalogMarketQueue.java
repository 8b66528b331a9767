package com.polymind.ingestion.registry;

import com.polymind.domain.Market;
import org.springframework.stereotype.Component;

import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.function.Consumer;

/**
 * Hand-off of catalogue markets from the sync job to the indexer thread, which stays the only writer of the
 * registry and the analytics engine.
 */
@Component
public class CatalogMarketQueue {

    private final Queue<Market> pending = new ConcurrentLinkedQueue<>();

    public void offer(Market market) {
        pending.add(market);
    }

    /** Hands every queued market to the consumer, oldest first. */
    public int drain(Consumer<Market> consumer) {
        int drained = 0;
        Market market;
        while ((market = pending.poll()) != null) {
            consumer.accept(market);
            drained++;
        }
        return drained;
    }

    public int size() {
        return pending.size();
    }
}
