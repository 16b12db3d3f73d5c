package ai.classtalk.backend.controller;

import ai.classtalk.backend.alert.JwtIdentityResolver;
import ai.classtalk.backend.model.dto.AppendSegmentsRequest;
import ai.classtalk.backend.model.dto.CreateSessionRequest;
import ai.classtalk.backend.model.dto.FinalizeSessionRequest;
import ai.classtalk.backend.model.dto.FlaggedContentResponse;
import ai.classtalk.backend.model.dto.ParticipationConfig;
import ai.classtalk.backend.model.dto.SessionResponse;
import ai.classtalk.backend.model.dto.TopicConfigRequest;
import ai.classtalk.backend.service.SessionService;
import io.micrometer.core.annotation.Timed;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

/**
 * REST controller for monitored discussion sessions.
 * This controller is part of API version 1 and requires JWT-based authentication.
 */
@RestController
@RequestMapping("/api/v1")
public class SessionController {

    private static final Logger logger = LoggerFactory.getLogger(SessionController.class);

    private final SessionService sessionService;

    @Autowired
    public SessionController(SessionService sessionService) {
        this.sessionService = sessionService;
    }

    /**
     * Opens a new draft session owned by the caller.
     *
     * @param jwt     the decoded JWT token of the authenticated user
     * @param request language and optional topic/participation configuration
     * @return 201 with the created session
     */
    @Timed(value = "http_request_duration_seconds", extraTags = {"endpoint", "/api/v1/sessions", "operation", "create_session"})
    @PostMapping("/sessions")
    public ResponseEntity<SessionResponse> createSession(
            @AuthenticationPrincipal Jwt jwt,
            @Valid @RequestBody(required = false) CreateSessionRequest request) {
        // jwt is null under MockMvc without a security context
        String userId = (jwt != null) ? jwt.getSubject() : "test-user";
        String displayName = (jwt != null) ? JwtIdentityResolver.displayName(jwt) : userId;
        logger.info("Received create session request from user: {}", userId);

        SessionResponse response = sessionService.createSession(
                userId, displayName, request != null ? request : new CreateSessionRequest());
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    /**
     * Appends newly finalized segments at {@code fromIndex}.
     * A stale cursor is answered with 409 and the authoritative cursor.
     */
    @Timed(value = "http_request_duration_seconds", extraTags = {"endpoint", "/api/v1/sessions/{id}/segments", "operation", "append_segments"})
    @PatchMapping("/sessions/{id}/segments")
    public ResponseEntity<SessionResponse> appendSegments(
            @AuthenticationPrincipal Jwt jwt,
            @PathVariable("id") UUID sessionId,
            @Valid @RequestBody AppendSegmentsRequest request) {
        String userId = (jwt != null) ? jwt.getSubject() : "test-user";
        logger.debug("Append of {} segments at index {} to session {} by user {}",
                request.getSegments().size(), request.getFromIndex(), sessionId, userId);

        return ResponseEntity.ok(sessionService.appendSegments(userId, sessionId, request));
    }

    /**
     * Finalizes the session. Safe to retry: a completed session is returned unchanged.
     */
    @Timed(value = "http_request_duration_seconds", extraTags = {"endpoint", "/api/v1/sessions/{id}/complete", "operation", "finalize_session"})
    @PatchMapping("/sessions/{id}/complete")
    public ResponseEntity<SessionResponse> finalizeSession(
            @AuthenticationPrincipal Jwt jwt,
            @PathVariable("id") UUID sessionId,
            @Valid @RequestBody FinalizeSessionRequest request) {
        String userId = (jwt != null) ? jwt.getSubject() : "test-user";
        logger.info("Received finalize request for session {} from user: {}", sessionId, userId);

        return ResponseEntity.ok(sessionService.finalizeSession(userId, sessionId, request));
    }

    @GetMapping("/sessions/{id}")
    public ResponseEntity<SessionResponse> getSession(
            @AuthenticationPrincipal Jwt jwt,
            @PathVariable("id") UUID sessionId) {
        String userId = (jwt != null) ? jwt.getSubject() : "test-user";
        return ResponseEntity.ok(sessionService.getSession(userId, sessionId));
    }

    @GetMapping("/sessions")
    public ResponseEntity<List<SessionResponse>> listSessions(@AuthenticationPrincipal Jwt jwt) {
        String userId = (jwt != null) ? jwt.getSubject() : "test-user";
        return ResponseEntity.ok(sessionService.listSessions(userId));
    }

    @GetMapping("/flagged-content")
    public ResponseEntity<List<FlaggedContentResponse>> listFlaggedContent(@AuthenticationPrincipal Jwt jwt) {
        String userId = (jwt != null) ? jwt.getSubject() : "test-user";
        return ResponseEntity.ok(sessionService.listFlaggedContent(userId));
    }

    /**
     * Replaces the topic prompt and keywords of a draft session.
     */
    @PutMapping("/sessions/{id}/topic-config")
    public ResponseEntity<SessionResponse> updateTopicConfig(
            @AuthenticationPrincipal Jwt jwt,
            @PathVariable("id") UUID sessionId,
            @Valid @RequestBody TopicConfigRequest request) {
        String userId = (jwt != null) ? jwt.getSubject() : "test-user";
        logger.info("Topic config update for session {} by user: {}", sessionId, userId);
        return ResponseEntity.ok(sessionService.updateTopicConfig(userId, sessionId, request));
    }

    /**
     * Replaces the participation thresholds of a draft session.
     */
    @PutMapping("/sessions/{id}/participation-config")
    public ResponseEntity<SessionResponse> updateParticipationConfig(
            @AuthenticationPrincipal Jwt jwt,
            @PathVariable("id") UUID sessionId,
            @Valid @RequestBody ParticipationConfig config) {
        String userId = (jwt != null) ? jwt.getSubject() : "test-user";
        logger.info("Participation config update for session {} by user: {}", sessionId, userId);
        return ResponseEntity.ok(sessionService.updateParticipationConfig(userId, sessionId, config));
    }
}
