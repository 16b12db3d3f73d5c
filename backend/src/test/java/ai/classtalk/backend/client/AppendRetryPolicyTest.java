package ai.classtalk.backend.client;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class AppendRetryPolicyTest {

    @Test
    void testExponentialDelaysWithoutJitter() {
        // Given
        AppendRetryPolicy policy = AppendRetryPolicy.builder()
                .baseDelay(Duration.ofMillis(100))
                .backoffMultiplier(2.0)
                .jitterFactor(0.0)
                .build();

        // When & Then
        assertEquals(Duration.ofMillis(100), policy.delayBeforeRetry(0));
        assertEquals(Duration.ofMillis(200), policy.delayBeforeRetry(1));
        assertEquals(Duration.ofMillis(400), policy.delayBeforeRetry(2));
    }

    @Test
    void testDelayIsCappedAtMaxDelay() {
        AppendRetryPolicy policy = AppendRetryPolicy.builder()
                .baseDelay(Duration.ofSeconds(1))
                .maxDelay(Duration.ofSeconds(3))
                .jitterFactor(0.0)
                .build();

        assertEquals(Duration.ofSeconds(3), policy.delayBeforeRetry(5));
    }

    @Test
    void testJitterStaysWithinRange() {
        AppendRetryPolicy policy = AppendRetryPolicy.builder()
                .baseDelay(Duration.ofMillis(1000))
                .jitterFactor(0.2)
                .build();

        for (int i = 0; i < 50; i++) {
            long delay = policy.delayBeforeRetry(0).toMillis();
            assertTrue(delay >= 800 && delay <= 1200, "Delay out of jitter range: " + delay);
        }
    }

    @Test
    void testAttemptLimit() {
        AppendRetryPolicy policy = AppendRetryPolicy.builder().maxAttempts(3).build();

        assertTrue(policy.shouldRetry(1));
        assertTrue(policy.shouldRetry(2));
        assertFalse(policy.shouldRetry(3));
    }

    @Test
    void testDefaults() {
        AppendRetryPolicy policy = AppendRetryPolicy.DEFAULT;

        assertEquals(4, policy.getMaxAttempts());
        assertEquals(Duration.ofMillis(100), policy.getBaseDelay());
        assertEquals(2.0, policy.getBackoffMultiplier());
        assertEquals(0.2, policy.getJitterFactor());
    }

    @Test
    void testInvalidAttemptLimitIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> AppendRetryPolicy.builder().maxAttempts(0));
    }
}
