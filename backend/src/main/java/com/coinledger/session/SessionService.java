package com.coinledger.session;

import com.coinledger.domain.Session;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Read and delete access to finished sessions.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SessionService {

    private final SessionStore sessionStore;

    public void save(Session session) {
        sessionStore.save(session);
        log.info("Stored session {} ({} transactions)", session.id(), session.ledger().size());
    }

    /**
     * @throws SessionNotFoundException when the id is unknown or expired
     */
    public Session get(String sessionId) {
        return sessionStore.find(sessionId).orElseThrow(() -> new SessionNotFoundException(sessionId));
    }

    /**
     * @throws SessionNotFoundException when the id is unknown; nothing is changed in that case
     */
    public void delete(String sessionId) {
        if (!sessionStore.delete(sessionId)) {
            throw new SessionNotFoundException(sessionId);
        }
        log.info("Deleted session {}", sessionId);
    }
}
