package com.coinledger.reporting;

import lombok.Getter;

/**
 * Dashboard or export filter that cannot be parsed. API layer maps to 400 INVALID_FILTER.
 */
@Getter
public class InvalidFilterException extends RuntimeException {

    public static final String ERROR_CODE = "INVALID_FILTER";

    private final String errorCode = ERROR_CODE;

    public InvalidFilterException(String message) {
        super(message);
    }
}
