package ai.classtalk.backend.service;

import ai.classtalk.backend.model.entity.QualityLog;
import ai.classtalk.backend.repository.QualityLogRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Records why analyzers and alerts fired, for later quality review.
 *
 * Writing a log entry must never break the moderation pipeline, so every
 * persistence failure is logged and dropped here.
 */
@Service
public class QualityLogService {

    private static final Logger logger = LoggerFactory.getLogger(QualityLogService.class);

    private final QualityLogRepository qualityLogRepository;

    @Autowired
    public QualityLogService(QualityLogRepository qualityLogRepository) {
        this.qualityLogRepository = qualityLogRepository;
    }

    /**
     * Logs a detection decision, e.g. why profanity was flagged.
     */
    public void logDetectionDecision(UUID sessionId, String decisionType, Map<String, Object> metadata) {
        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("decisionType", decisionType);
        write(sessionId, QualityLog.DETECTION_DECISION, entry, metadata);
    }

    /**
     * Logs a session quality metric such as participation balance or topic adherence.
     */
    public void logQualityMetric(UUID sessionId, String metricName, Object metricValue, Map<String, Object> metadata) {
        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("metricName", metricName);
        entry.put("metricValue", metricValue);
        write(sessionId, QualityLog.QUALITY_METRIC, entry, metadata);
    }

    public void logAlertTriggered(UUID sessionId, String alertType, Map<String, Object> alertData) {
        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("alertType", alertType);
        write(sessionId, QualityLog.ALERT_TRIGGERED, entry, alertData);
    }

    public void logTestResult(UUID sessionId, String testName, boolean passed, Map<String, Object> details) {
        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("testName", testName);
        entry.put("passed", passed);
        write(sessionId, QualityLog.TEST_RESULT, entry, details);
    }

    public List<QualityLog> findLogs(UUID sessionId, String logType) {
        return qualityLogRepository.findBySessionIdAndLogTypeOrderByCreatedAtAsc(sessionId, logType);
    }

    private void write(UUID sessionId, String logType, Map<String, Object> entry, Map<String, Object> extra) {
        if (extra != null) {
            entry.putAll(extra);
        }
        Instant now = Instant.now();
        entry.put("timestamp", now.toString());

        QualityLog log = new QualityLog();
        log.setSessionId(sessionId);
        log.setLogType(logType);
        log.setMetadata(entry);
        log.setCreatedAt(now);

        try {
            qualityLogRepository.save(log);
        } catch (RuntimeException e) {
            logger.error("Failed to write {} quality log for session {}: {}", logType, sessionId, e.getMessage());
        }
    }
}
