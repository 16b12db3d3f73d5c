package ai.classtalk.backend.client;

import java.time.Duration;
import java.util.Random;

/**
 * Exponential backoff policy for segment appends.
 * Default: 100ms, 200ms, 400ms with 20% jitter, 4 attempts in total.
 */
public class AppendRetryPolicy {

    private static final Random RANDOM = new Random();

    public static final AppendRetryPolicy DEFAULT = builder().build();

    private final int maxAttempts;
    private final Duration baseDelay;
    private final Duration maxDelay;
    private final double backoffMultiplier;
    private final double jitterFactor;

    private AppendRetryPolicy(Builder builder) {
        this.maxAttempts = builder.maxAttempts;
        this.baseDelay = builder.baseDelay;
        this.maxDelay = builder.maxDelay;
        this.backoffMultiplier = builder.backoffMultiplier;
        this.jitterFactor = builder.jitterFactor;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @param attemptsMade number of appends already sent for the current flush
     * @return whether another attempt is allowed
     */
    public boolean shouldRetry(int attemptsMade) {
        return attemptsMade < maxAttempts;
    }

    /**
     * Delay before retry number {@code retry} (0-based), jittered and capped at the max delay.
     */
    public Duration delayBeforeRetry(int retry) {
        double delayMs = baseDelay.toMillis() * Math.pow(backoffMultiplier, retry);
        long jitteredMs = applyJitter((long) delayMs);
        return Duration.ofMillis(Math.min(jitteredMs, maxDelay.toMillis()));
    }

    private long applyJitter(long baseMs) {
        if (jitterFactor <= 0.0 || baseMs == 0) {
            return baseMs;
        }
        double jitterRange = baseMs * jitterFactor;
        double jitter = (RANDOM.nextDouble() - 0.5) * 2 * jitterRange; // -jitterRange to +jitterRange
        return Math.max(0, baseMs + (long) jitter);
    }

    public int getMaxAttempts() { return maxAttempts; }
    public Duration getBaseDelay() { return baseDelay; }
    public Duration getMaxDelay() { return maxDelay; }
    public double getBackoffMultiplier() { return backoffMultiplier; }
    public double getJitterFactor() { return jitterFactor; }

    public static class Builder {
        private int maxAttempts = 4;
        private Duration baseDelay = Duration.ofMillis(100);
        private Duration maxDelay = Duration.ofSeconds(5);
        private double backoffMultiplier = 2.0;
        private double jitterFactor = 0.2;

        public Builder maxAttempts(int maxAttempts) {
            if (maxAttempts < 1) {
                throw new IllegalArgumentException("maxAttempts must be at least 1");
            }
            this.maxAttempts = maxAttempts;
            return this;
        }

        public Builder baseDelay(Duration baseDelay) { this.baseDelay = baseDelay; return this; }
        public Builder maxDelay(Duration maxDelay) { this.maxDelay = maxDelay; return this; }
        public Builder backoffMultiplier(double multiplier) { this.backoffMultiplier = multiplier; return this; }
        public Builder jitterFactor(double jitter) { this.jitterFactor = jitter; return this; }

        public AppendRetryPolicy build() {
            return new AppendRetryPolicy(this);
        }
    }
}
