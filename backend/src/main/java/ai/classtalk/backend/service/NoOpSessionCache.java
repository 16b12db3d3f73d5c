package ai.classtalk.backend.service;

import ai.classtalk.backend.model.dto.SessionResponse;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.util.Optional;
import java.util.UUID;

/**
 * Used when Redis caching is disabled; every read goes to the database.
 */
@Service
@ConditionalOnProperty(name = "app.session.cache.enabled", havingValue = "false", matchIfMissing = true)
public class NoOpSessionCache implements SessionCache {

    @Override
    public Optional<SessionResponse> get(UUID sessionId) {
        return Optional.empty();
    }

    @Override
    public void put(UUID sessionId, SessionResponse session) {
    }

    @Override
    public void evict(UUID sessionId) {
    }
}
