package com.coinledger.session;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.coinledger.domain.Session;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Optional;

/**
 * Sessions in a bounded Caffeine cache, evicted after {@code ttlHours} without access.
 */
@Component
@ConditionalOnProperty(prefix = "coinledger.session", name = "store", havingValue = "memory", matchIfMissing = true)
public class InMemorySessionStore implements SessionStore {

    private final Cache<String, Session> sessions;

    public InMemorySessionStore(SessionProperties properties) {
        this.sessions = Caffeine.newBuilder()
                .expireAfterAccess(Duration.ofHours(properties.getTtlHours()))
                .maximumSize(properties.getMaxSessions())
                .build();
    }

    @Override
    public void save(Session session) {
        sessions.put(session.id(), session);
    }

    @Override
    public Optional<Session> find(String sessionId) {
        return Optional.ofNullable(sessions.getIfPresent(sessionId));
    }

    @Override
    public boolean delete(String sessionId) {
        return sessions.asMap().remove(sessionId) != null;
    }
}
