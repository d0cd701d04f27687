package com.coinledger.session;

import com.coinledger.domain.Session;

import java.util.Optional;

/**
 * Keeps finished sessions by id.
 */
public interface SessionStore {

    void save(Session session);

    Optional<Session> find(String sessionId);

    /**
     * @return whether a session was removed
     */
    boolean delete(String sessionId);
}
