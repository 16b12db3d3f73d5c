package ai.classtalk.backend.config;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;

/**
 * Configuration class for HTTP client beans.
 *
 * This configuration provides separate RestTemplate beans:
 * - Standard RestTemplate for general outbound calls (segment sinks, health checks)
 * - Transcript provider RestTemplate whose read timeout follows the provider fetch budget
 */
@Configuration
public class HttpClientConfig {

    /**
     * Creates a primary RestTemplate bean with standard timeouts.
     *
     * @param builder the RestTemplateBuilder provided by Spring Boot
     * @return a configured RestTemplate instance
     */
    @Bean
    @Primary
    public RestTemplate restTemplate(RestTemplateBuilder builder) {
        return builder
            .setConnectTimeout(Duration.ofSeconds(10))
            .setReadTimeout(Duration.ofSeconds(30))
            .build();
    }

    /**
     * Creates the RestTemplate used to fetch final transcripts from the external provider.
     * Its read timeout matches the finalizer's wait so a hung connection does not outlive it.
     *
     * @param builder the RestTemplateBuilder provided by Spring Boot
     * @param timeoutMs the provider fetch budget in milliseconds
     * @return a configured RestTemplate instance
     */
    @Bean
    @Qualifier("transcriptProvider")
    public RestTemplate transcriptProviderRestTemplate(
            RestTemplateBuilder builder,
            @Value("${app.transcript-provider.timeout-ms:10000}") long timeoutMs) {
        return builder
            .setConnectTimeout(Duration.ofSeconds(5))
            .setReadTimeout(Duration.ofMillis(timeoutMs))
            .build();
    }
}
