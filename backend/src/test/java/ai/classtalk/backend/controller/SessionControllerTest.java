package ai.classtalk.backend.controller;

import ai.classtalk.backend.model.dto.FinalizeSessionRequest;
import ai.classtalk.backend.model.dto.SessionResponse;
import ai.classtalk.backend.model.entity.SessionStatus;
import ai.classtalk.backend.service.SessionService;
import ai.classtalk.backend.service.exception.AccessDeniedException;
import ai.classtalk.backend.service.exception.CursorConflictException;
import ai.classtalk.backend.service.exception.SessionClosedException;
import ai.classtalk.backend.service.exception.SessionNotFoundException;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mockito;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.security.oauth2.jwt.JwtDecoder;
import org.springframework.security.web.method.annotation.AuthenticationPrincipalArgumentResolver;
import org.springframework.web.method.support.HandlerMethodArgumentResolver;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

import org.springframework.test.web.servlet.MockMvc;
import org.springframework.http.MediaType;

import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Unit tests for the SessionController using MockMvc.
 * Covers the append protocol's status codes and the error body contract.
 */
@WebMvcTest(controllers = SessionController.class,
            excludeAutoConfiguration = {
                org.springframework.boot.autoconfigure.security.servlet.SecurityAutoConfiguration.class,
                org.springframework.boot.autoconfigure.security.oauth2.resource.servlet.OAuth2ResourceServerAutoConfiguration.class
            })
class SessionControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @SuppressWarnings("removal")
    @MockBean
    private SessionService sessionService;

    // Required to prevent Spring Security from trying to decode JWTs
    @SuppressWarnings("removal")
    @MockBean
    private JwtDecoder jwtDecoder;

    // Security auto-configuration is excluded, so register the @AuthenticationPrincipal resolver it would provide
    @TestConfiguration
    static class AuthenticationPrincipalConfig implements WebMvcConfigurer {
        @Override
        public void addArgumentResolvers(List<HandlerMethodArgumentResolver> resolvers) {
            resolvers.add(new AuthenticationPrincipalArgumentResolver());
        }
    }

    @Test
    @DisplayName("POST /api/v1/sessions without a body creates a draft session")
    void createSessionWithoutBodyReturnsCreated() throws Exception {
        UUID sessionId = UUID.randomUUID();
        SessionResponse response = SessionResponse.builder()
                .id(sessionId)
                .ownerId("test-user")
                .status(SessionStatus.DRAFT)
                .cursor(0)
                .build();
        Mockito.when(sessionService.createSession(eq("test-user"), eq("test-user"), any())).thenReturn(response);

        mockMvc.perform(post("/api/v1/sessions"))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.id").value(sessionId.toString()))
            .andExpect(jsonPath("$.status").value("draft"))
            .andExpect(jsonPath("$.cursor").value(0));
    }

    @Test
    @DisplayName("PATCH /segments at the current cursor returns the advanced cursor")
    void appendSegmentsReturnsNewCursor() throws Exception {
        UUID sessionId = UUID.randomUUID();
        SessionResponse response = SessionResponse.builder()
                .id(sessionId)
                .status(SessionStatus.DRAFT)
                .cursor(2)
                .newFlaggedItems(List.of())
                .build();
        Mockito.when(sessionService.appendSegments(eq("test-user"), eq(sessionId), any())).thenReturn(response);

        String json = """
            {
              "fromIndex": 0,
              "segments": [
                { "speaker": "A", "text": "Let's start", "startTime": 0.0, "endTime": 1.5 },
                { "speaker": "B", "text": "Sure", "startTime": 1.5, "endTime": 2.0, "language": "en" }
              ]
            }
            """;

        mockMvc.perform(patch("/api/v1/sessions/{id}/segments", sessionId)
                .contentType(MediaType.APPLICATION_JSON)
                .content(json))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.cursor").value(2))
            .andExpect(jsonPath("$.newFlaggedItems").isArray());
    }

    @Test
    @DisplayName("PATCH /segments with a stale cursor returns 409 with the server cursor")
    void appendSegmentsWithStaleCursorReturnsConflict() throws Exception {
        UUID sessionId = UUID.randomUUID();
        Mockito.when(sessionService.appendSegments(any(), eq(sessionId), any()))
            .thenThrow(new CursorConflictException(1, 3));

        String json = """
            {
              "fromIndex": 1,
              "segments": [ { "speaker": "A", "text": "again", "startTime": 3.0, "endTime": 4.0 } ]
            }
            """;

        mockMvc.perform(patch("/api/v1/sessions/{id}/segments", sessionId)
                .contentType(MediaType.APPLICATION_JSON)
                .content(json))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.error").value("Index mismatch: expected 1, got 3"))
            .andExpect(jsonPath("$.expected").value(1))
            .andExpect(jsonPath("$.actual").value(3));
    }

    @Test
    @DisplayName("PATCH /segments on a completed session returns 409 with the status")
    void appendSegmentsToClosedSessionReturnsConflict() throws Exception {
        UUID sessionId = UUID.randomUUID();
        Mockito.when(sessionService.appendSegments(any(), eq(sessionId), any()))
            .thenThrow(new SessionClosedException("Session is complete", SessionStatus.COMPLETE));

        String json = """
            { "fromIndex": 4, "segments": [ { "speaker": "A", "text": "late", "startTime": 9.0, "endTime": 9.5 } ] }
            """;

        mockMvc.perform(patch("/api/v1/sessions/{id}/segments", sessionId)
                .contentType(MediaType.APPLICATION_JSON)
                .content(json))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.status").value("complete"))
            .andExpect(jsonPath("$.actual").doesNotExist());
    }

    @Test
    @DisplayName("PATCH /segments with invalid segments returns 400 with field details")
    void appendSegmentsWithInvalidBodyReturnsBadRequest() throws Exception {
        String json = """
            {
              "fromIndex": -1,
              "segments": [ { "speaker": "", "text": "hi", "startTime": 2.0, "endTime": 1.0 } ]
            }
            """;

        mockMvc.perform(patch("/api/v1/sessions/{id}/segments", UUID.randomUUID())
                .contentType(MediaType.APPLICATION_JSON)
                .content(json))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("Validation failed"))
            .andExpect(jsonPath("$.details").isArray());

        Mockito.verifyNoInteractions(sessionService);
    }

    @Test
    @DisplayName("Unparseable JSON returns 400")
    void appendSegmentsWithMalformedJsonReturnsBadRequest() throws Exception {
        mockMvc.perform(patch("/api/v1/sessions/{id}/segments", UUID.randomUUID())
                .contentType(MediaType.APPLICATION_JSON)
                .content("{ not json"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("Malformed request"));
    }

    @Test
    @DisplayName("PATCH /complete passes duration and transcript reference through")
    void finalizeSessionReturnsCompletedSession() throws Exception {
        UUID sessionId = UUID.randomUUID();
        SessionResponse response = SessionResponse.builder()
                .id(sessionId)
                .status(SessionStatus.COMPLETE)
                .duration(612.5)
                .topicAdherenceScore(0.8)
                .build();
        Mockito.when(sessionService.finalizeSession(eq("test-user"), eq(sessionId), any())).thenReturn(response);

        String json = """
            { "duration": 612.5, "externalTranscriptRef": "tx-42" }
            """;

        mockMvc.perform(patch("/api/v1/sessions/{id}/complete", sessionId)
                .contentType(MediaType.APPLICATION_JSON)
                .content(json))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("complete"))
            .andExpect(jsonPath("$.topicAdherenceScore").value(0.8));

        ArgumentCaptor<FinalizeSessionRequest> captor = ArgumentCaptor.forClass(FinalizeSessionRequest.class);
        Mockito.verify(sessionService).finalizeSession(eq("test-user"), eq(sessionId), captor.capture());
        assertEquals(612.5, captor.getValue().getDuration());
        assertEquals("tx-42", captor.getValue().getExternalTranscriptRef());
    }

    @Test
    @DisplayName("GET /sessions/{id} maps missing and foreign sessions to 404 and 403")
    void getSessionMapsErrors() throws Exception {
        UUID missing = UUID.randomUUID();
        UUID foreign = UUID.randomUUID();
        Mockito.when(sessionService.getSession("test-user", missing)).thenThrow(new SessionNotFoundException(missing));
        Mockito.when(sessionService.getSession("test-user", foreign))
            .thenThrow(new AccessDeniedException("Not the owner of session " + foreign));

        mockMvc.perform(get("/api/v1/sessions/{id}", missing))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.error").exists());

        mockMvc.perform(get("/api/v1/sessions/{id}", foreign))
            .andExpect(status().isForbidden());
    }

    @Test
    @DisplayName("A malformed session id returns 400")
    void getSessionWithInvalidIdReturnsBadRequest() throws Exception {
        mockMvc.perform(get("/api/v1/sessions/not-a-uuid"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("Malformed request"));
    }

    @Test
    @DisplayName("PUT /participation-config rejects thresholds outside 0..1")
    void participationConfigOutOfRangeReturnsBadRequest() throws Exception {
        String json = """
            { "dominanceThreshold": 1.5, "silenceThreshold": 0.1 }
            """;

        mockMvc.perform(put("/api/v1/sessions/{id}/participation-config", UUID.randomUUID())
                .contentType(MediaType.APPLICATION_JSON)
                .content(json))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.details[0]").value("dominanceThreshold: Dominance threshold must be between 0 and 1"));
    }
}
