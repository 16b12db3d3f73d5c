package ai.classtalk.backend.service;

import ai.classtalk.backend.model.dto.AlertType;
import ai.classtalk.backend.model.entity.FlagType;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for the moderation counters, timer and observer gauge.
 */
public class ModerationMetricsServiceTest {

    private MeterRegistry meterRegistry;
    private ModerationMetricsService metricsService;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        metricsService = new ModerationMetricsService(meterRegistry);
    }

    @Test
    void testAppendAndConflictCounters() {
        metricsService.recordSegmentsAppended(3);
        metricsService.recordSegmentsAppended(2);
        metricsService.recordCursorConflict();

        assertThat(meterRegistry.get("segments_appended_total").counter().count()).isEqualTo(5.0);
        assertThat(meterRegistry.get("cursor_conflicts_total").counter().count()).isEqualTo(1.0);
    }

    @Test
    void testFlagAndAlertCountersAreTagged() {
        metricsService.recordFlagCreated(FlagType.PROFANITY);
        metricsService.recordFlagCreated(FlagType.PROFANITY);
        metricsService.recordFlagCreated(FlagType.LANGUAGE_POLICY);
        metricsService.recordAlertBroadcast(AlertType.PROFANITY_ALERT);
        metricsService.recordAlertDeliveryFailure();

        assertThat(meterRegistry.get("flags_created_total").tag("flag_type", "profanity").counter().count())
                .isEqualTo(2.0);
        assertThat(meterRegistry.get("flags_created_total").tag("flag_type", "language_policy").counter().count())
                .isEqualTo(1.0);
        assertThat(meterRegistry.get("alerts_broadcast_total").tag("alert_type", "PROFANITY_ALERT").counter().count())
                .isEqualTo(1.0);
        assertThat(meterRegistry.get("alert_delivery_failures_total").counter().count()).isEqualTo(1.0);
    }

    @Test
    void testFinalizationOutcomesAndTimer() {
        Timer.Sample sample = metricsService.startFinalizationTimer();
        metricsService.recordFinalization(ModerationMetricsService.OUTCOME_COMPLETED);
        metricsService.recordFinalization(ModerationMetricsService.OUTCOME_REPLAYED);
        metricsService.stopFinalizationTimer(sample);

        assertThat(meterRegistry.get("finalizations_total").tag("outcome", "completed").counter().count())
                .isEqualTo(1.0);
        assertThat(meterRegistry.get("finalizations_total").tag("outcome", "replayed").counter().count())
                .isEqualTo(1.0);
        assertThat(meterRegistry.get("session_finalization_duration_seconds").timer().count()).isEqualTo(1L);
    }

    @Test
    void testObserverGaugeFollowsSupplier() {
        AtomicInteger observers = new AtomicInteger(2);
        metricsService.registerObserverGauge(observers::get);

        assertThat(meterRegistry.get("alert_observers_connected").gauge().value()).isEqualTo(2.0);

        observers.set(5);
        assertThat(meterRegistry.get("alert_observers_connected").gauge().value()).isEqualTo(5.0);
    }
}
