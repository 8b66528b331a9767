package com.polymind.ingestion.adapter.evm;

import com.polymind.ingestion.adapter.ChainFetchException;
import com.polymind.ingestion.adapter.FetchFailure;
import com.polymind.ingestion.adapter.RpcException;
import reactor.core.Exceptions;

import java.util.Locale;
import java.util.concurrent.TimeoutException;

/**
 * Maps provider errors onto {@link FetchFailure}. Unknown provider-side errors count as transient (TIMEOUT):
 * only requests the node will never accept are INVALID.
 */
final class RpcErrorClassifier {

    private RpcErrorClassifier() {
    }

    static ChainFetchException fromRpcError(String method, int code, String message) {
        String text = method + " error " + code + ": " + message;
        String msg = text.toLowerCase(Locale.ROOT);
        if (isRangeTooWide(msg)) {
            return new RangeTooWideException(text);
        }
        if (isRateLimited(msg)) {
            return new ChainFetchException(FetchFailure.RATE_LIMITED, text);
        }
        if (code == -32600 || code == -32601 || code == -32602 || code == -32700) {
            return new ChainFetchException(FetchFailure.INVALID, text);
        }
        return new ChainFetchException(FetchFailure.TIMEOUT, text);
    }

    static ChainFetchException fromThrowable(String method, String endpoint, Throwable error) {
        Throwable unwrapped = Exceptions.unwrap(error);
        if (unwrapped instanceof ChainFetchException cfe) {
            return cfe;
        }
        String text = method + " on " + endpoint + " failed: " + unwrapped.getMessage();
        if (hasCause(unwrapped, TimeoutException.class)) {
            return new ChainFetchException(FetchFailure.TIMEOUT, text, unwrapped);
        }
        String msg = String.valueOf(unwrapped.getMessage()).toLowerCase(Locale.ROOT);
        if (unwrapped instanceof RpcException rpc) {
            int status = rpc.getStatusCode();
            if (isRangeTooWide(msg)) {
                return new RangeTooWideException(text);
            }
            if (status == 429 || isRateLimited(msg)) {
                return new ChainFetchException(FetchFailure.RATE_LIMITED, text, unwrapped);
            }
            if (status == 400 || status == 404 || status == 405 || status == 413) {
                return new ChainFetchException(FetchFailure.INVALID, text, unwrapped);
            }
            return new ChainFetchException(FetchFailure.TIMEOUT, text, unwrapped);
        }
        if (isRateLimited(msg)) {
            return new ChainFetchException(FetchFailure.RATE_LIMITED, text, unwrapped);
        }
        // connection refused, DNS, reset: the endpoint may come back
        return new ChainFetchException(FetchFailure.TIMEOUT, text, unwrapped);
    }

    static boolean isRangeTooWide(String msg) {
        return msg.contains("-32701") || msg.contains("query returned more than")
                || msg.contains("too many results") || msg.contains("block range is too wide")
                || msg.contains("exceed maximum block range") || msg.contains("log response size exceeded")
                || msg.contains("range too large");
    }

    static boolean isRateLimited(String msg) {
        return msg.contains("429") || msg.contains("too many requests")
                || msg.contains("rate limit") || msg.contains("request limit")
                || msg.contains("-32005") || msg.contains("quota");
    }

    private static boolean hasCause(Throwable error, Class<? extends Throwable> type) {
        Throwable current = error;
        while (current != null) {
            if (type.isInstance(current)) {
                return true;
            }
            current = current.getCause() == current ? null : current.getCause();
        }
        return false;
    }
}
