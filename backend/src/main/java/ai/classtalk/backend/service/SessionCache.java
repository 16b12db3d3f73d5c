package ai.classtalk.backend.service;

import ai.classtalk.backend.model.dto.SessionResponse;

import java.util.Optional;
import java.util.UUID;

/**
 * Read cache for assembled session views.
 *
 * Every component that mutates a session must call {@link #evict(UUID)} afterwards.
 */
public interface SessionCache {

    Optional<SessionResponse> get(UUID sessionId);

    void put(UUID sessionId, SessionResponse session);

    void evict(UUID sessionId);
}
