package com.polymind.ingestion.decoder;

import java.util.Optional;

/**
 * Outcome of decoding one log: either an event or a {@link DecodeError} with detail.
 */
public final class DecodeResult {

    private final DomainEvent event;
    private final DecodeError error;
    private final String detail;

    private DecodeResult(DomainEvent event, DecodeError error, String detail) {
        this.event = event;
        this.error = error;
        this.detail = detail;
    }

    public static DecodeResult of(DomainEvent event) {
        if (event == null) {
            throw new IllegalArgumentException("event required");
        }
        return new DecodeResult(event, null, null);
    }

    public static DecodeResult failure(DecodeError error, String detail) {
        if (error == null) {
            throw new IllegalArgumentException("error required");
        }
        return new DecodeResult(null, error, detail);
    }

    public boolean isSuccess() {
        return event != null;
    }

    public Optional<DomainEvent> getEvent() {
        return Optional.ofNullable(event);
    }

    public Optional<DecodeError> getError() {
        return Optional.ofNullable(error);
    }

    public String getDetail() {
        return detail;
    }

    @Override
    public String toString() {
        return isSuccess() ? "DecodeResult[" + event + "]" : "DecodeResult[" + error + ": " + detail + "]";
    }
}
