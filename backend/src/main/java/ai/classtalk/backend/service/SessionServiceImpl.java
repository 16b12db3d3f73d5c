package ai.classtalk.backend.service;

import ai.classtalk.backend.model.dto.AppendSegmentsRequest;
import ai.classtalk.backend.model.dto.CreateSessionRequest;
import ai.classtalk.backend.model.dto.FinalizeSessionRequest;
import ai.classtalk.backend.model.dto.FlaggedContentResponse;
import ai.classtalk.backend.model.dto.ParticipationConfig;
import ai.classtalk.backend.model.dto.SessionResponse;
import ai.classtalk.backend.model.dto.TopicConfigRequest;
import ai.classtalk.backend.model.entity.DiscussionSession;
import ai.classtalk.backend.model.entity.SessionStatus;
import ai.classtalk.backend.model.entity.converter.ParticipationConfigConverter;
import ai.classtalk.backend.model.entity.converter.StringListConverter;
import ai.classtalk.backend.repository.DiscussionSessionRepository;
import ai.classtalk.backend.repository.FlaggedContentRepository;
import ai.classtalk.backend.service.exception.AccessDeniedException;
import ai.classtalk.backend.service.exception.ModerationServiceException;
import ai.classtalk.backend.service.exception.SessionClosedException;
import ai.classtalk.backend.service.exception.SessionNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Default implementation of the SessionService.
 *
 * Appends and finalization are delegated to the {@link IngestionCoordinator}
 * and the {@link SessionFinalizer}; this class handles reads, creation and
 * configuration, and keeps the {@link SessionCache} coherent.
 */
@Service
public class SessionServiceImpl implements SessionService {

    private static final Logger logger = LoggerFactory.getLogger(SessionServiceImpl.class);

    private final DiscussionSessionRepository sessionRepository;
    private final FlaggedContentRepository flaggedContentRepository;
    private final IngestionCoordinator ingestionCoordinator;
    private final SessionFinalizer sessionFinalizer;
    private final SessionCache sessionCache;

    private final StringListConverter stringListConverter = new StringListConverter();
    private final ParticipationConfigConverter participationConfigConverter = new ParticipationConfigConverter();

    @Autowired
    public SessionServiceImpl(DiscussionSessionRepository sessionRepository,
                              FlaggedContentRepository flaggedContentRepository,
                              IngestionCoordinator ingestionCoordinator,
                              SessionFinalizer sessionFinalizer,
                              SessionCache sessionCache) {
        this.sessionRepository = sessionRepository;
        this.flaggedContentRepository = flaggedContentRepository;
        this.ingestionCoordinator = ingestionCoordinator;
        this.sessionFinalizer = sessionFinalizer;
        this.sessionCache = sessionCache;
    }

    @Override
    public SessionResponse createSession(String ownerId, String ownerDisplayName, CreateSessionRequest request) {
        DiscussionSession session = new DiscussionSession();
        session.setOwnerId(ownerId);
        session.setOwnerDisplayName(ownerDisplayName);
        session.setStatus(SessionStatus.DRAFT);
        session.setLanguage(request.getLanguage());
        session.setTopicPrompt(request.getTopicPrompt());
        session.setTopicKeywords(request.getTopicKeywords());
        session.setParticipationConfig(request.getParticipationConfig());
        session.setSegments(new ArrayList<>());
        session.setCursor(0);
        Instant now = Instant.now();
        session.setCreatedAt(now);
        session.setUpdatedAt(now);

        try {
            DiscussionSession saved = sessionRepository.save(session);
            logger.info("Created discussion session {}", saved.getId());
            return SessionResponse.from(saved);
        } catch (DataAccessException e) {
            logger.error("Database error while creating session: {}", e.getMessage());
            throw new ModerationServiceException("Failed to create session", e);
        }
    }

    @Override
    public SessionResponse appendSegments(String ownerId, UUID sessionId, AppendSegmentsRequest request) {
        IngestionResult result = ingestionCoordinator.appendSegments(
                ownerId, sessionId, request.getSegments(), request.getFromIndex());

        SessionResponse response = SessionResponse.from(result.getSession());
        response.setNewFlaggedItems(SessionResponse.toResponses(result.getNewFlags()));
        return response;
    }

    @Override
    public SessionResponse finalizeSession(String ownerId, UUID sessionId, FinalizeSessionRequest request) {
        DiscussionSession completed = sessionFinalizer.finalizeSession(
                ownerId, sessionId, request.getDuration(), request.getExternalTranscriptRef());
        return withFlags(completed);
    }

    @Override
    public SessionResponse getSession(String ownerId, UUID sessionId) {
        Optional<SessionResponse> cached = sessionCache.get(sessionId);
        if (cached.isPresent()) {
            checkOwner(ownerId, cached.get().getOwnerId(), sessionId);
            return cached.get();
        }

        DiscussionSession session = loadOwned(ownerId, sessionId);
        SessionResponse response = withFlags(session);
        sessionCache.put(sessionId, response);
        return response;
    }

    @Override
    public List<SessionResponse> listSessions(String ownerId) {
        logger.info("Fetching sessions for authenticated user");
        try {
            return sessionRepository.findByOwnerIdOrderByCreatedAtDesc(ownerId).stream()
                    .map(SessionResponse::from)
                    .collect(Collectors.toList());
        } catch (DataAccessException e) {
            logger.error("Database error while listing sessions: {}", e.getMessage());
            throw new ModerationServiceException("Failed to list sessions", e);
        }
    }

    @Override
    public List<FlaggedContentResponse> listFlaggedContent(String ownerId) {
        try {
            return SessionResponse.toResponses(flaggedContentRepository.findByOwnerId(ownerId));
        } catch (DataAccessException e) {
            logger.error("Database error while listing flagged content: {}", e.getMessage());
            throw new ModerationServiceException("Failed to list flagged content", e);
        }
    }

    @Override
    public SessionResponse updateTopicConfig(String ownerId, UUID sessionId, TopicConfigRequest request) {
        loadOwned(ownerId, sessionId);
        try {
            int rows = sessionRepository.updateTopicConfig(sessionId, request.getTopicPrompt(),
                    stringListConverter.convertToDatabaseColumn(request.getTopicKeywords()), Instant.now());
            return afterConfigUpdate(sessionId, rows);
        } catch (DataAccessException e) {
            logger.error("Database error while updating topic config of session {}: {}", sessionId, e.getMessage());
            throw new ModerationServiceException("Failed to update topic configuration", e);
        }
    }

    @Override
    public SessionResponse updateParticipationConfig(String ownerId, UUID sessionId, ParticipationConfig config) {
        loadOwned(ownerId, sessionId);
        try {
            int rows = sessionRepository.updateParticipationConfig(sessionId,
                    participationConfigConverter.convertToDatabaseColumn(config), Instant.now());
            return afterConfigUpdate(sessionId, rows);
        } catch (DataAccessException e) {
            logger.error("Database error while updating participation config of session {}: {}", sessionId, e.getMessage());
            throw new ModerationServiceException("Failed to update participation configuration", e);
        }
    }

    private SessionResponse afterConfigUpdate(UUID sessionId, int rows) {
        sessionCache.evict(sessionId);
        DiscussionSession session = sessionRepository.findById(sessionId)
                .orElseThrow(() -> new SessionNotFoundException(sessionId));
        if (rows == 0) {
            throw new SessionClosedException("Session " + sessionId + " can no longer be reconfigured", session.getStatus());
        }
        logger.info("Updated configuration of session {}", sessionId);
        return SessionResponse.from(session);
    }

    private SessionResponse withFlags(DiscussionSession session) {
        try {
            return SessionResponse.from(session,
                    flaggedContentRepository.findBySessionIdOrderByTimestampMsAsc(session.getId()));
        } catch (DataAccessException e) {
            logger.error("Database error while loading flags of session {}: {}", session.getId(), e.getMessage());
            throw new ModerationServiceException("Failed to load flagged content", e);
        }
    }

    private DiscussionSession loadOwned(String ownerId, UUID sessionId) {
        DiscussionSession session;
        try {
            session = sessionRepository.findById(sessionId)
                    .orElseThrow(() -> new SessionNotFoundException(sessionId));
        } catch (DataAccessException e) {
            logger.error("Database error while loading session {}: {}", sessionId, e.getMessage());
            throw new ModerationServiceException("Failed to load session", e);
        }
        checkOwner(ownerId, session.getOwnerId(), sessionId);
        return session;
    }

    private void checkOwner(String ownerId, String sessionOwner, UUID sessionId) {
        if (!sessionOwner.equals(ownerId)) {
            logger.warn("User attempted to access a session they do not own: {}", sessionId);
            throw new AccessDeniedException("Not the owner of session " + sessionId);
        }
    }
}
