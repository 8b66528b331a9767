package com.polymind.ingestion.metadata;

/**
 * Gamma request failed (transport, status or body). The market stays pending and is retried next run.
 */
public class MarketMetadataException extends RuntimeException {

    public MarketMetadataException(String message, Throwable cause) {
        super(message, cause);
    }
}
