package com.coinledger.session;

import lombok.Getter;

/**
 * Unknown, expired or deleted session id. API layer maps to 404 SESSION_NOT_FOUND.
 */
@Getter
public class SessionNotFoundException extends RuntimeException {

    public static final String ERROR_CODE = "SESSION_NOT_FOUND";

    private final String sessionId;

    public SessionNotFoundException(String sessionId) {
        super("Session not found: " + sessionId);
        this.sessionId = sessionId;
    }
}
