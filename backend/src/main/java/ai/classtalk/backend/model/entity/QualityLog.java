package ai.classtalk.backend.model.entity;

import ai.classtalk.backend.model.entity.converter.MetadataConverter;
import jakarta.persistence.*;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Observability record explaining why an analyzer or alert fired for a session.
 */
@Entity
@Table(name = "quality_log", indexes = {
        @Index(name = "idx_quality_log_session", columnList = "session_id")
})
public class QualityLog {

    public static final String DETECTION_DECISION = "detection_decision";
    public static final String QUALITY_METRIC = "quality_metric";
    public static final String ALERT_TRIGGERED = "alert_triggered";
    public static final String TEST_RESULT = "test_result";

    @Id
    @GeneratedValue
    private UUID id;

    @Column(name = "session_id", nullable = false)
    private UUID sessionId;

    @Column(name = "log_type", nullable = false, length = 40)
    private String logType;

    @Convert(converter = MetadataConverter.class)
    @Column(name = "metadata", columnDefinition = "TEXT", nullable = false)
    private Map<String, Object> metadata;

    @Column(name = "created_at")
    private Instant createdAt = Instant.now();

    public UUID getId() { return id; }
    public void setId(UUID id) { this.id = id; }

    public UUID getSessionId() { return sessionId; }
    public void setSessionId(UUID sessionId) { this.sessionId = sessionId; }

    public String getLogType() { return logType; }
    public void setLogType(String logType) { this.logType = logType; }

    public Map<String, Object> getMetadata() { return metadata; }
    public void setMetadata(Map<String, Object> metadata) { this.metadata = metadata; }

    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }
}
