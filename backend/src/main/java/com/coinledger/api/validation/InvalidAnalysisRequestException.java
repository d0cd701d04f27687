package com.coinledger.api.validation;

import lombok.Getter;

/**
 * Rejected analysis submission. Mapped to 400 with {@link #getErrorCode()}.
 */
@Getter
public class InvalidAnalysisRequestException extends RuntimeException {

    public static final String INVALID_REQUEST = "INVALID_REQUEST";
    public static final String INVALID_ADDRESS = "INVALID_ADDRESS";
    public static final String INVALID_NETWORK = "INVALID_NETWORK";

    private final String errorCode;

    public InvalidAnalysisRequestException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }
}
