package ai.classtalk.backend.health;

import ai.classtalk.backend.service.TranscriptProviderClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;
import java.time.Instant;

/**
 * Health indicator for the external speech-to-text provider used during finalization.
 *
 * The provider is optional: finalization falls back to the accumulated transcript when it
 * is unreachable, so a DOWN provider always reports {@code fallback_available}.
 */
@Component
public class TranscriptProviderHealthIndicator implements HealthIndicator {

    private static final Logger logger = LoggerFactory.getLogger(TranscriptProviderHealthIndicator.class);

    private static final long GOOD_RESPONSE_TIME_MS = 500;
    private static final long WARNING_RESPONSE_TIME_MS = 2000;

    private final RestTemplate restTemplate;
    private final TranscriptProviderClient providerClient;
    private final String healthCheckUrl;

    public TranscriptProviderHealthIndicator(
            RestTemplate restTemplate,
            TranscriptProviderClient providerClient,
            @Value("${app.health.transcript-provider.url:}") String healthCheckUrl) {
        this.restTemplate = restTemplate;
        this.providerClient = providerClient;
        this.healthCheckUrl = (healthCheckUrl == null || healthCheckUrl.isBlank())
                ? providerClient.getProviderUrl()
                : healthCheckUrl;
    }

    @Override
    public Health health() {
        Health.Builder healthBuilder = new Health.Builder();

        if (!providerClient.isProviderEnabled()) {
            return healthBuilder
                .unknown()
                .withDetail("service", "Transcript Provider")
                .withDetail("status", "Provider disabled via configuration")
                .withDetail("enabled", false)
                .withDetail("fallback_available", true)
                .build();
        }

        Instant startTime = Instant.now();
        String error = probe();
        long responseTimeMs = Duration.between(startTime, Instant.now()).toMillis();

        if (error == null) {
            healthBuilder.up()
                .withDetail("service", "Transcript Provider")
                .withDetail("status", "Available")
                .withDetail("url", healthCheckUrl)
                .withDetail("response_time_ms", responseTimeMs)
                .withDetail("performance_rating", getPerformanceRating(responseTimeMs));
        } else {
            healthBuilder.down()
                .withDetail("service", "Transcript Provider")
                .withDetail("status", "Unavailable")
                .withDetail("url", healthCheckUrl)
                .withDetail("error", error)
                .withDetail("response_time_ms", responseTimeMs);
        }

        return healthBuilder
            .withDetail("enabled", true)
            .withDetail("fallback_available", true)
            .withDetail("last_check", Instant.now().toString())
            .build();
    }

    /**
     * @return null when the provider answered, otherwise a description of the failure
     */
    private String probe() {
        try {
            ResponseEntity<String> response = restTemplate.getForEntity(healthCheckUrl, String.class);
            return response.getStatusCode().is5xxServerError()
                    ? "Provider returned status " + response.getStatusCode().value()
                    : null;
        } catch (HttpStatusCodeException e) {
            // an auth or routing error still proves the provider is reachable
            if (e.getStatusCode().is4xxClientError()) {
                return null;
            }
            return "Provider returned status " + e.getStatusCode().value();
        } catch (RestClientException e) {
            logger.warn("Transcript provider health check failed: {}", e.getMessage());
            return "Connection failed: " + e.getMessage();
        }
    }

    private String getPerformanceRating(long responseTimeMs) {
        if (responseTimeMs <= GOOD_RESPONSE_TIME_MS) {
            return "EXCELLENT";
        } else if (responseTimeMs <= WARNING_RESPONSE_TIME_MS) {
            return "GOOD";
        }
        return "SLOW";
    }
}
