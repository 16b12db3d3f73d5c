package ai.classtalk.backend.service;

import ai.classtalk.backend.model.dto.AppendSegmentsRequest;
import ai.classtalk.backend.model.dto.CreateSessionRequest;
import ai.classtalk.backend.model.dto.FinalizeSessionRequest;
import ai.classtalk.backend.model.dto.FlaggedContentResponse;
import ai.classtalk.backend.model.dto.ParticipationConfig;
import ai.classtalk.backend.model.dto.SessionResponse;
import ai.classtalk.backend.model.dto.TopicConfigRequest;

import java.util.List;
import java.util.UUID;

/**
 * Interface for the session lifecycle exposed to the API layer.
 */
public interface SessionService {

    /**
     * Opens a new draft session with an empty transcript.
     *
     * @param ownerId          the authenticated user's ID
     * @param ownerDisplayName name shown to observers in alerts
     * @param request          language and optional topic/participation configuration
     * @return the created session, cursor 0
     */
    SessionResponse createSession(String ownerId, String ownerDisplayName, CreateSessionRequest request);

    /**
     * Appends a batch of segments using the cursor protocol.
     *
     * @return the updated session including the flags this batch produced
     */
    SessionResponse appendSegments(String ownerId, UUID sessionId, AppendSegmentsRequest request);

    /**
     * Finalizes the session. Repeated calls return the stored final state.
     */
    SessionResponse finalizeSession(String ownerId, UUID sessionId, FinalizeSessionRequest request);

    /**
     * Returns the session with its flagged content in transcript order.
     */
    SessionResponse getSession(String ownerId, UUID sessionId);

    /**
     * Returns the caller's sessions, newest first, without flagged content.
     */
    List<SessionResponse> listSessions(String ownerId);

    /**
     * Returns flagged content across all of the caller's sessions, newest first.
     */
    List<FlaggedContentResponse> listFlaggedContent(String ownerId);

    SessionResponse updateTopicConfig(String ownerId, UUID sessionId, TopicConfigRequest request);

    SessionResponse updateParticipationConfig(String ownerId, UUID sessionId, ParticipationConfig config);
}
