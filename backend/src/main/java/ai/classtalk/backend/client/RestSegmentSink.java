package ai.classtalk.backend.client;

import ai.classtalk.backend.model.dto.AppendSegmentsRequest;
import ai.classtalk.backend.model.dto.SessionResponse;
import ai.classtalk.backend.model.dto.TranscriptSegment;
import ai.classtalk.backend.model.entity.SessionStatus;
import ai.classtalk.backend.service.exception.AccessDeniedException;
import ai.classtalk.backend.service.exception.CursorConflictException;
import ai.classtalk.backend.service.exception.InvalidSegmentException;
import ai.classtalk.backend.service.exception.SessionClosedException;
import ai.classtalk.backend.service.exception.SessionNotFoundException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.List;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Appends over HTTP against {@code PATCH /api/v1/sessions/{id}/segments}.
 * Error responses are mapped back onto the service exceptions so that
 * {@link SegmentAppendClient} handles both sinks the same way.
 */
public class RestSegmentSink implements SegmentSink {

    private static final Logger logger = LoggerFactory.getLogger(RestSegmentSink.class);

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final String baseUrl;
    private final Supplier<String> tokenSupplier;

    public RestSegmentSink(RestTemplate restTemplate, ObjectMapper objectMapper,
                           String baseUrl, Supplier<String> tokenSupplier) {
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.tokenSupplier = tokenSupplier;
    }

    /**
     * Builds a sink on the JDK HTTP client, which supports PATCH.
     */
    public static RestSegmentSink create(RestTemplateBuilder builder, ObjectMapper objectMapper,
                                         String baseUrl, Supplier<String> tokenSupplier) {
        RestTemplate restTemplate = builder.requestFactory(() -> new JdkClientHttpRequestFactory()).build();
        return new RestSegmentSink(restTemplate, objectMapper, baseUrl, tokenSupplier);
    }

    RestTemplate getRestTemplate() {
        return restTemplate;
    }

    @Override
    public int append(UUID sessionId, List<TranscriptSegment> segments, int fromIndex) {
        String url = baseUrl + "/api/v1/sessions/" + sessionId + "/segments";

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        String token = tokenSupplier.get();
        if (token != null) {
            headers.setBearerAuth(token);
        }

        AppendSegmentsRequest request = AppendSegmentsRequest.builder()
                .segments(segments)
                .fromIndex(fromIndex)
                .build();

        try {
            ResponseEntity<SessionResponse> response = restTemplate.exchange(
                    url, HttpMethod.PATCH, new HttpEntity<>(request, headers), SessionResponse.class);
            SessionResponse body = response.getBody();
            if (body == null) {
                throw new RestClientException("Append response had no body");
            }
            return body.getCursor();
        } catch (HttpClientErrorException e) {
            throw translate(sessionId, e);
        }
    }

    private RuntimeException translate(UUID sessionId, HttpClientErrorException e) {
        JsonNode body = readBody(e);
        String message = body.path("error").asText(e.getStatusText());

        if (e.getStatusCode().isSameCodeAs(HttpStatus.CONFLICT)) {
            if (body.has("actual")) {
                return new CursorConflictException(body.path("expected").asInt(), body.path("actual").asInt());
            }
            return new SessionClosedException(message, parseStatus(body.path("status").asText(null)));
        }
        if (e.getStatusCode().isSameCodeAs(HttpStatus.NOT_FOUND)) {
            return new SessionNotFoundException(sessionId);
        }
        if (e.getStatusCode().isSameCodeAs(HttpStatus.FORBIDDEN)) {
            return new AccessDeniedException(message);
        }
        if (e.getStatusCode().isSameCodeAs(HttpStatus.BAD_REQUEST)) {
            return new InvalidSegmentException(message);
        }
        return e;
    }

    private JsonNode readBody(HttpClientErrorException e) {
        try {
            return objectMapper.readTree(e.getResponseBodyAsString());
        } catch (JsonProcessingException ex) {
            logger.warn("Unreadable error body for status {}", e.getStatusCode().value());
            return objectMapper.createObjectNode();
        }
    }

    private static SessionStatus parseStatus(String value) {
        if (value == null) {
            return null;
        }
        for (SessionStatus status : SessionStatus.values()) {
            if (status.toJson().equalsIgnoreCase(value)) {
                return status;
            }
        }
        return null;
    }
}
