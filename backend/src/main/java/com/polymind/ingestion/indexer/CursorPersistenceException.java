package com.polymind.ingestion.indexer;

/**
 * Cursor could not be read or written. The batch that produced it is not committed.
 */
public class CursorPersistenceException extends RuntimeException {

    public CursorPersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
