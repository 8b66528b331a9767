package com.polymind.ingestion.indexer;

import com.polymind.ingestion.decoder.DecodeError;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Running totals since process start. Written by the indexer thread, read by the status endpoint.
 */
@Component
public class IngestionCounters {

    private final Map<DecodeError, AtomicLong> decodeErrors = new EnumMap<>(DecodeError.class);
    private final AtomicLong marketsCreated = new AtomicLong();
    private final AtomicLong marketsSeeded = new AtomicLong();
    private final AtomicLong marketsResolved = new AtomicLong();
    private final AtomicLong tradesApplied = new AtomicLong();
    private final AtomicLong unrecognized = new AtomicLong();

    public IngestionCounters() {
        for (DecodeError error : DecodeError.values()) {
            decodeErrors.put(error, new AtomicLong());
        }
    }

    public void decodeError(DecodeError error) {
        decodeErrors.get(error).incrementAndGet();
    }

    public long decodeErrors(DecodeError error) {
        return decodeErrors.get(error).get();
    }

    public void marketCreated() {
        marketsCreated.incrementAndGet();
    }

    public void marketSeeded() {
        marketsSeeded.incrementAndGet();
    }

    public void marketResolved() {
        marketsResolved.incrementAndGet();
    }

    public void tradeApplied() {
        tradesApplied.incrementAndGet();
    }

    public void unrecognized() {
        unrecognized.incrementAndGet();
    }

    public long tradesApplied() {
        return tradesApplied.get();
    }

    public Map<String, Long> snapshot() {
        Map<String, Long> out = new LinkedHashMap<>();
        out.put("marketsCreated", marketsCreated.get());
        out.put("marketsSeeded", marketsSeeded.get());
        out.put("marketsResolved", marketsResolved.get());
        out.put("tradesApplied", tradesApplied.get());
        out.put("unrecognized", unrecognized.get());
        decodeErrors.forEach((error, count) -> out.put(error.name(), count.get()));
        return out;
    }
}
