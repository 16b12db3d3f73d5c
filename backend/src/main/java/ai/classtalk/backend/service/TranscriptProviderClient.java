package ai.classtalk.backend.service;

import ai.classtalk.backend.model.dto.TranscriptSegment;
import ai.classtalk.backend.service.exception.ExternalProviderUnavailableException;
import ai.classtalk.backend.util.SecurityUtils;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.Collections;
import java.util.List;

/**
 * Client for the external speech-to-text provider.
 *
 * Fetches the authoritative transcript of a finished recording and merges its
 * tokens into segments. Every failure mode surfaces as
 * {@link ExternalProviderUnavailableException} so callers can degrade.
 */
@Service
public class TranscriptProviderClient {

    private static final Logger logger = LoggerFactory.getLogger(TranscriptProviderClient.class);

    private final RestTemplate restTemplate;
    private final TranscriptTokenMerger tokenMerger;
    private final String providerUrl;
    private final String apiKey;
    private final boolean providerEnabled;

    @Autowired
    public TranscriptProviderClient(
            @Qualifier("transcriptProvider") RestTemplate restTemplate,
            TranscriptTokenMerger tokenMerger,
            @Value("${app.transcript-provider.url:https://api.soniox.com}") String providerUrl,
            @Value("${app.transcript-provider.api-key:}") String apiKey,
            @Value("${app.transcript-provider.enabled:false}") boolean providerEnabled) {
        this.restTemplate = restTemplate;
        this.tokenMerger = tokenMerger;
        this.providerUrl = providerUrl;
        this.apiKey = apiKey;
        this.providerEnabled = providerEnabled;
    }

    /**
     * Fetches and merges the final transcript.
     *
     * @param transcriptRef the provider's transcription identifier
     * @return the authoritative segments, never empty
     * @throws ExternalProviderUnavailableException if the transcript cannot be obtained
     */
    public List<TranscriptSegment> fetchFinalTranscript(String transcriptRef) throws ExternalProviderUnavailableException {
        if (!providerEnabled) {
            throw new ExternalProviderUnavailableException("Transcript provider is disabled");
        }
        if (!SecurityUtils.isSafeIdentifier(transcriptRef)) {
            logger.warn("Rejected transcript reference: {}", SecurityUtils.sanitizeForLogging(transcriptRef));
            throw new ExternalProviderUnavailableException("Invalid transcript reference");
        }

        String url = providerUrl + "/v1/transcriptions/" + transcriptRef + "/transcript";

        HttpHeaders headers = new HttpHeaders();
        headers.setBearerAuth(apiKey);
        headers.setAccept(Collections.singletonList(MediaType.APPLICATION_JSON));

        try {
            logger.debug("Fetching final transcript {} from provider", transcriptRef);
            ResponseEntity<TranscriptResponse> response = restTemplate.exchange(
                    url, HttpMethod.GET, new HttpEntity<>(headers), TranscriptResponse.class);

            if (!response.getStatusCode().is2xxSuccessful()) {
                throw new ExternalProviderUnavailableException(
                        "Transcript provider returned status " + response.getStatusCode().value());
            }

            TranscriptResponse body = response.getBody();
            if (body == null || body.getTokens() == null || body.getTokens().isEmpty()) {
                throw new ExternalProviderUnavailableException("Transcript provider returned an empty transcript");
            }

            List<TranscriptSegment> segments = tokenMerger.merge(body.getTokens());
            if (segments.isEmpty()) {
                throw new ExternalProviderUnavailableException("Transcript contained no usable tokens");
            }

            logger.info("Fetched final transcript {}: {} tokens merged into {} segments",
                    transcriptRef, body.getTokens().size(), segments.size());
            return segments;

        } catch (RestClientException e) {
            logger.error("Failed to communicate with transcript provider: {}", e.getMessage());
            throw new ExternalProviderUnavailableException("Failed to communicate with transcript provider", e);
        }
    }

    public boolean isProviderEnabled() {
        return providerEnabled;
    }

    public String getProviderUrl() {
        return providerUrl;
    }

    /**
     * Response model for the provider's transcript endpoint.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class TranscriptResponse {

        @JsonProperty("tokens")
        private List<TranscriptToken> tokens;

        public List<TranscriptToken> getTokens() {
            return tokens;
        }

        public void setTokens(List<TranscriptToken> tokens) {
            this.tokens = tokens;
        }
    }

    /**
     * One recognized token. Text includes its own leading whitespace.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class TranscriptToken {

        @JsonProperty("text")
        private String text;

        @JsonProperty("start_ms")
        private Long startMs;

        @JsonProperty("end_ms")
        private Long endMs;

        @JsonProperty("speaker")
        private String speaker;

        @JsonProperty("language")
        private String language;

        public TranscriptToken() {
        }

        public TranscriptToken(String text, Long startMs, Long endMs, String speaker, String language) {
            this.text = text;
            this.startMs = startMs;
            this.endMs = endMs;
            this.speaker = speaker;
            this.language = language;
        }

        public String getText() { return text; }
        public void setText(String text) { this.text = text; }

        public Long getStartMs() { return startMs; }
        public void setStartMs(Long startMs) { this.startMs = startMs; }

        public Long getEndMs() { return endMs; }
        public void setEndMs(Long endMs) { this.endMs = endMs; }

        public String getSpeaker() { return speaker; }
        public void setSpeaker(String speaker) { this.speaker = speaker; }

        public String getLanguage() { return language; }
        public void setLanguage(String language) { this.language = language; }
    }
}
