package com.coinledger.session;

import com.coinledger.domain.Session;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Sessions persisted in the {@code sessions} collection.
 */
@Component
@ConditionalOnProperty(prefix = "coinledger.session", name = "store", havingValue = "mongo")
@RequiredArgsConstructor
public class MongoSessionStore implements SessionStore {

    private final MongoTemplate mongoTemplate;

    @Override
    public void save(Session session) {
        mongoTemplate.save(session);
    }

    @Override
    public Optional<Session> find(String sessionId) {
        return Optional.ofNullable(mongoTemplate.findById(sessionId, Session.class));
    }

    @Override
    public boolean delete(String sessionId) {
        return mongoTemplate.remove(Query.query(Criteria.where("_id").is(sessionId)), Session.class).getDeletedCount() > 0;
    }
}
