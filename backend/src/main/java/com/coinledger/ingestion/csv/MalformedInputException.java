package com.coinledger.ingestion.csv;

import lombok.Getter;

/**
 * Thrown when an uploaded file cannot be normalized. Aborts the whole upload; the API maps it to 400.
 */
@Getter
public class MalformedInputException extends RuntimeException {

    /** Error code: MALFORMED_INPUT, UNPARSABLE_PAIR, INVALID_SIDE. */
    private final String errorCode;

    public MalformedInputException(String message) {
        this("MALFORMED_INPUT", message, null);
    }

    public MalformedInputException(String message, Throwable cause) {
        this("MALFORMED_INPUT", message, cause);
    }

    protected MalformedInputException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
}
