package com.polymind.ingestion.adapter;

/**
 * Transport-level RPC failure (HTTP error status, unreadable body). Classified into {@link ChainFetchException} by the gateway.
 */
public class RpcException extends RuntimeException {

    private final int statusCode;

    public RpcException(String message) {
        this(message, 0, null);
    }

    public RpcException(String message, Throwable cause) {
        this(message, 0, cause);
    }

    public RpcException(String message, int statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    /** HTTP status, or 0 when the failure did not come with one. */
    public int getStatusCode() {
        return statusCode;
    }
}
