package ai.classtalk.backend.client;

import ai.classtalk.backend.model.dto.TranscriptSegment;
import ai.classtalk.backend.model.entity.SessionStatus;
import ai.classtalk.backend.service.exception.AccessDeniedException;
import ai.classtalk.backend.service.exception.CursorConflictException;
import ai.classtalk.backend.service.exception.SessionClosedException;
import ai.classtalk.backend.service.exception.SessionNotFoundException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.RestTemplate;

import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class RestSegmentSinkTest {

    private final UUID sessionId = UUID.randomUUID();
    private final List<TranscriptSegment> segments = List.of(
            TranscriptSegment.builder().speaker("A").text("hello").startTime(0.0).endTime(1.0).build());

    private MockRestServiceServer server;
    private RestSegmentSink sink;

    @BeforeEach
    void setUp() {
        RestTemplate restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        ObjectMapper objectMapper = new ObjectMapper().registerModule(new JavaTimeModule());
        sink = new RestSegmentSink(restTemplate, objectMapper, "http://classtalk.local/", () -> "token-123");
    }

    @Test
    void shouldBuildSinkOnJdkHttpClient() {
        RestSegmentSink built = RestSegmentSink.create(new RestTemplateBuilder(),
                new ObjectMapper(), "http://classtalk.local", () -> null);

        assertThat(built.getRestTemplate().getRequestFactory()).isInstanceOf(JdkClientHttpRequestFactory.class);
    }

    @Test
    void shouldPatchSegmentsAndReturnCursor() {
        server.expect(requestTo("http://classtalk.local/api/v1/sessions/" + sessionId + "/segments"))
                .andExpect(method(HttpMethod.PATCH))
                .andExpect(header(HttpHeaders.AUTHORIZATION, "Bearer token-123"))
                .andExpect(jsonPath("$.fromIndex").value(4))
                .andExpect(jsonPath("$.segments[0].speaker").value("A"))
                .andRespond(withSuccess("{\"id\":\"" + sessionId + "\",\"status\":\"draft\",\"cursor\":5}",
                        MediaType.APPLICATION_JSON));

        int cursor = sink.append(sessionId, segments, 4);

        assertThat(cursor).isEqualTo(5);
        server.verify();
    }

    @Test
    void shouldTranslateCursorConflict() {
        server.expect(requestTo("http://classtalk.local/api/v1/sessions/" + sessionId + "/segments"))
                .andRespond(withStatus(HttpStatus.CONFLICT)
                        .contentType(MediaType.APPLICATION_JSON)
                        .body("{\"error\":\"Index mismatch: expected 4, got 6\",\"expected\":4,\"actual\":6}"));

        assertThatThrownBy(() -> sink.append(sessionId, segments, 4))
                .isInstanceOfSatisfying(CursorConflictException.class, e -> {
                    assertThat(e.getExpected()).isEqualTo(4);
                    assertThat(e.getActual()).isEqualTo(6);
                });
    }

    @Test
    void shouldTranslateClosedSession() {
        server.expect(requestTo("http://classtalk.local/api/v1/sessions/" + sessionId + "/segments"))
                .andRespond(withStatus(HttpStatus.CONFLICT)
                        .contentType(MediaType.APPLICATION_JSON)
                        .body("{\"error\":\"Session is complete\",\"status\":\"complete\"}"));

        assertThatThrownBy(() -> sink.append(sessionId, segments, 0))
                .isInstanceOfSatisfying(SessionClosedException.class,
                        e -> assertThat(e.getStatus()).isEqualTo(SessionStatus.COMPLETE));
    }

    @Test
    void shouldTranslateNotFoundAndForbidden() {
        server.expect(requestTo("http://classtalk.local/api/v1/sessions/" + sessionId + "/segments"))
                .andRespond(withStatus(HttpStatus.NOT_FOUND));
        server.expect(requestTo("http://classtalk.local/api/v1/sessions/" + sessionId + "/segments"))
                .andRespond(withStatus(HttpStatus.FORBIDDEN)
                        .contentType(MediaType.APPLICATION_JSON)
                        .body("{\"error\":\"Not the owner\"}"));

        assertThatThrownBy(() -> sink.append(sessionId, segments, 0)).isInstanceOf(SessionNotFoundException.class);
        assertThatThrownBy(() -> sink.append(sessionId, segments, 0))
                .isInstanceOf(AccessDeniedException.class)
                .hasMessage("Not the owner");
    }

    @Test
    void shouldLeaveServerErrorsForRetry() {
        server.expect(requestTo("http://classtalk.local/api/v1/sessions/" + sessionId + "/segments"))
                .andRespond(withStatus(HttpStatus.INTERNAL_SERVER_ERROR));

        assertThatThrownBy(() -> sink.append(sessionId, segments, 0)).isInstanceOf(HttpServerErrorException.class);
    }
}
