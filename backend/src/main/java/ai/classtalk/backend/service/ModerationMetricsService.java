package ai.classtalk.backend.service;

import ai.classtalk.backend.model.dto.AlertType;
import ai.classtalk.backend.model.entity.FlagType;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.function.Supplier;

/**
 * Micrometer metrics for the ingestion, analysis and alerting pipeline.
 */
@Slf4j
@Service
public class ModerationMetricsService {

    public static final String OUTCOME_COMPLETED = "completed";
    public static final String OUTCOME_DEGRADED = "degraded";
    public static final String OUTCOME_REPLAYED = "replayed";
    public static final String OUTCOME_FAILED = "failed";

    private final MeterRegistry meterRegistry;

    private final Counter segmentsAppended;
    private final Counter cursorConflicts;
    private final Counter alertDeliveryFailures;
    private final Timer finalizationTimer;

    @Autowired
    public ModerationMetricsService(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        this.segmentsAppended = Counter.builder("segments_appended_total")
                .description("Transcript segments committed through the append protocol")
                .register(meterRegistry);

        this.cursorConflicts = Counter.builder("cursor_conflicts_total")
                .description("Appends rejected because the client cursor was stale")
                .register(meterRegistry);

        this.alertDeliveryFailures = Counter.builder("alert_delivery_failures_total")
                .description("Alert sends that failed for an individual observer")
                .register(meterRegistry);

        this.finalizationTimer = Timer.builder("session_finalization_duration_seconds")
                .description("Time taken to finalize a session")
                .register(meterRegistry);

        log.info("ModerationMetricsService initialized");
    }

    public void recordSegmentsAppended(int count) {
        segmentsAppended.increment(count);
    }

    public void recordCursorConflict() {
        cursorConflicts.increment();
    }

    public void recordFlagCreated(FlagType flagType) {
        Counter.builder("flags_created_total")
                .description("Flagged content records created")
                .tag("flag_type", flagType.getValue())
                .register(meterRegistry)
                .increment();
    }

    public void recordAlertBroadcast(AlertType alertType) {
        Counter.builder("alerts_broadcast_total")
                .description("Alert events fanned out to observers")
                .tag("alert_type", alertType.name())
                .register(meterRegistry)
                .increment();
    }

    public void recordAlertDeliveryFailure() {
        alertDeliveryFailures.increment();
    }

    public void recordFinalization(String outcome) {
        Counter.builder("finalizations_total")
                .description("Session finalization attempts by outcome")
                .tag("outcome", outcome)
                .register(meterRegistry)
                .increment();
    }

    public Timer.Sample startFinalizationTimer() {
        return Timer.start(meterRegistry);
    }

    public void stopFinalizationTimer(Timer.Sample sample) {
        sample.stop(finalizationTimer);
    }

    /**
     * Exposes the live observer count. Registered by the broadcaster once it exists.
     */
    public void registerObserverGauge(Supplier<Number> connectedObservers) {
        Gauge.builder("alert_observers_connected", connectedObservers)
                .description("Observers currently connected to the alert stream")
                .register(meterRegistry);
    }
}
