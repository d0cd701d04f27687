package com.coinledger.ingestion.adapter;

import lombok.Getter;

/**
 * Thrown when an indexer HTTP call fails (transport error, HTTP error status or unreadable body).
 */
@Getter
public class IndexerCallException extends RuntimeException {

    /** HTTP status, or 0 when no response was received. */
    private final int statusCode;
    private final boolean retryable;

    public IndexerCallException(int statusCode, boolean retryable, String message, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
        this.retryable = retryable;
    }

    public static IndexerCallException ofStatus(int statusCode, String message, Throwable cause) {
        return new IndexerCallException(statusCode, statusCode == 429 || statusCode >= 500, message, cause);
    }

    public static IndexerCallException rateLimited(String message) {
        return new IndexerCallException(429, true, message, null);
    }
}
