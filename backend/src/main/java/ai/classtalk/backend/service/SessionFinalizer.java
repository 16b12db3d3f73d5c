package ai.classtalk.backend.service;

import ai.classtalk.backend.alert.AlertBroadcaster;
import ai.classtalk.backend.analysis.ContentAnalysisService;
import ai.classtalk.backend.analysis.DetectedFlag;
import ai.classtalk.backend.analysis.LanguagePolicyAnalyzer;
import ai.classtalk.backend.analysis.SessionAnalysis;
import ai.classtalk.backend.model.dto.AlertEvent;
import ai.classtalk.backend.model.dto.AlertType;
import ai.classtalk.backend.model.dto.ParticipationBalance;
import ai.classtalk.backend.model.dto.TranscriptSegment;
import ai.classtalk.backend.model.entity.DiscussionSession;
import ai.classtalk.backend.model.entity.FlagType;
import ai.classtalk.backend.model.entity.FlaggedContent;
import ai.classtalk.backend.model.entity.SessionStatus;
import ai.classtalk.backend.repository.DiscussionSessionRepository;
import ai.classtalk.backend.repository.FlaggedContentRepository;
import ai.classtalk.backend.service.exception.AccessDeniedException;
import ai.classtalk.backend.service.exception.ExternalProviderUnavailableException;
import ai.classtalk.backend.service.exception.InvalidSegmentException;
import ai.classtalk.backend.service.exception.ModerationServiceException;
import ai.classtalk.backend.service.exception.SessionClosedException;
import ai.classtalk.backend.service.exception.SessionNotFoundException;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Moves a session to its terminal COMPLETE state exactly once.
 *
 * A session is claimed by atomically moving it from DRAFT to RECONCILING, so
 * concurrent or repeated calls never run the provider fetch or the side effects
 * twice. Enrichment failures degrade the result but the session still completes.
 */
@Service
public class SessionFinalizer {

    private static final Logger logger = LoggerFactory.getLogger(SessionFinalizer.class);

    static final String PARTICIPATION_IMBALANCE = "participation_imbalance";
    static final String LOW_TOPIC_ADHERENCE = "low_topic_adherence";
    static final String MULTIPLE_SPEAKERS = "Multiple";
    static final String GROUP_SPEAKER = "Group";

    private final DiscussionSessionRepository sessionRepository;
    private final FlaggedContentRepository flaggedContentRepository;
    private final SegmentStore segmentStore;
    private final TranscriptProviderClient transcriptProviderClient;
    private final ContentAnalysisService contentAnalysisService;
    private final LanguagePolicyAnalyzer languagePolicyAnalyzer;
    private final QualityLogService qualityLogService;
    private final QualityCheckService qualityCheckService;
    private final AlertBroadcaster alertBroadcaster;
    private final SessionCache sessionCache;
    private final ModerationMetricsService metricsService;
    private final AsyncTaskExecutor providerExecutor;
    private final long providerTimeoutMs;

    @Autowired
    public SessionFinalizer(DiscussionSessionRepository sessionRepository,
                            FlaggedContentRepository flaggedContentRepository,
                            SegmentStore segmentStore,
                            TranscriptProviderClient transcriptProviderClient,
                            ContentAnalysisService contentAnalysisService,
                            LanguagePolicyAnalyzer languagePolicyAnalyzer,
                            QualityLogService qualityLogService,
                            QualityCheckService qualityCheckService,
                            AlertBroadcaster alertBroadcaster,
                            SessionCache sessionCache,
                            ModerationMetricsService metricsService,
                            @Qualifier("providerExecutor") AsyncTaskExecutor providerExecutor,
                            @Value("${app.transcript-provider.timeout-ms:10000}") long providerTimeoutMs) {
        this.sessionRepository = sessionRepository;
        this.flaggedContentRepository = flaggedContentRepository;
        this.segmentStore = segmentStore;
        this.transcriptProviderClient = transcriptProviderClient;
        this.contentAnalysisService = contentAnalysisService;
        this.languagePolicyAnalyzer = languagePolicyAnalyzer;
        this.qualityLogService = qualityLogService;
        this.qualityCheckService = qualityCheckService;
        this.alertBroadcaster = alertBroadcaster;
        this.sessionCache = sessionCache;
        this.metricsService = metricsService;
        this.providerExecutor = providerExecutor;
        this.providerTimeoutMs = providerTimeoutMs;
    }

    /**
     * Finalizes a session. Calling it again on a COMPLETE session returns the stored state untouched.
     *
     * @param ownerId               the caller, who must own the session
     * @param sessionId             the session to finalize
     * @param duration              session length in seconds
     * @param externalTranscriptRef provider identifier of the authoritative transcript, may be null
     * @return the completed session
     */
    public DiscussionSession finalizeSession(String ownerId, UUID sessionId, double duration, String externalTranscriptRef) {
        if (Double.isNaN(duration) || duration < 0) {
            throw new InvalidSegmentException("Duration must not be negative");
        }

        Timer.Sample sample = metricsService.startFinalizationTimer();
        DiscussionSession session = loadOwned(ownerId, sessionId);

        if (session.getStatus() == SessionStatus.COMPLETE) {
            logger.info("Session {} already complete, returning stored state", sessionId);
            metricsService.recordFinalization(ModerationMetricsService.OUTCOME_REPLAYED);
            return session;
        }

        if (sessionRepository.claimForFinalization(sessionId, Instant.now()) == 0) {
            DiscussionSession latest = sessionRepository.findById(sessionId)
                    .orElseThrow(() -> new SessionNotFoundException(sessionId));
            if (latest.getStatus() == SessionStatus.COMPLETE) {
                metricsService.recordFinalization(ModerationMetricsService.OUTCOME_REPLAYED);
                return latest;
            }
            throw new SessionClosedException("Session " + sessionId + " is already being finalized", latest.getStatus());
        }

        logger.info("Finalizing session {} (duration {}s, authoritative transcript: {})",
                sessionId, duration, externalTranscriptRef != null ? "requested" : "none");

        FinalizationOutcome outcome;
        try {
            outcome = reconcileAndComplete(session, duration, externalTranscriptRef);
        } catch (RuntimeException e) {
            releaseClaim(sessionId);
            metricsService.recordFinalization(ModerationMetricsService.OUTCOME_FAILED);
            throw e;
        }

        DiscussionSession completed = outcome.session;
        SessionAnalysis analysis = outcome.analysis;
        sessionCache.evict(sessionId);

        if (analysis != null) {
            broadcastSummaryAlerts(completed, analysis, duration);
            logFinalAnalysis(sessionId, analysis);
            qualityCheckService.runAll(sessionId, analysis, outcome.segmentCount, analysis.allFlags(), duration,
                    languagePolicyAnalyzer.resolveAllowedLanguage(session.getLanguage()));
        }

        metricsService.recordFinalization(outcome.degraded ? ModerationMetricsService.OUTCOME_DEGRADED
                : ModerationMetricsService.OUTCOME_COMPLETED);
        metricsService.stopFinalizationTimer(sample);
        logger.info("Session {} complete: {} new flags, degraded={}", sessionId, outcome.newFlagCount, outcome.degraded);
        return completed;
    }

    /**
     * Everything between the claim and the COMPLETE write. Enrichment failures degrade;
     * anything thrown from here leaves the claim to be released by the caller.
     */
    private FinalizationOutcome reconcileAndComplete(DiscussionSession session, double duration,
                                                     String externalTranscriptRef) {
        UUID sessionId = session.getId();
        boolean degraded = false;
        SessionAnalysis analysis = null;
        List<TranscriptSegment> segments = session.getSegments();
        List<DetectedFlag> newFlags = new ArrayList<>();

        if (externalTranscriptRef != null && !externalTranscriptRef.isBlank()) {
            Optional<List<TranscriptSegment>> authoritative = fetchAuthoritativeTranscript(sessionId, externalTranscriptRef);
            if (authoritative.isPresent()) {
                try {
                    segments = segmentStore.replaceAll(sessionId, authoritative.get());
                } catch (DataAccessException | ModerationServiceException e) {
                    // rolled back as a whole: incremental segments and their flags are still stored
                    logger.error("Could not replace transcript of session {}, keeping incremental segments: {}",
                            sessionId, e.getMessage());
                    degraded = true;
                }
            } else {
                degraded = true;
            }
        }

        try {
            analysis = contentAnalysisService.analyzeSession(session, segments);
            newFlags = persistNewFlags(sessionId, analysis.allFlags());
        } catch (RuntimeException e) {
            logger.error("Final analysis failed for session {}, completing without scores: {}", sessionId, e.getMessage());
            analysis = null;
            degraded = true;
        }

        DiscussionSession completed = markComplete(sessionId, duration, analysis);
        return new FinalizationOutcome(completed, analysis, segments.size(), newFlags.size(), degraded);
    }

    private void releaseClaim(UUID sessionId) {
        try {
            if (sessionRepository.releaseFinalizationClaim(sessionId, Instant.now()) == 1) {
                logger.warn("Finalization of session {} failed, session returned to draft for retry", sessionId);
            }
        } catch (DataAccessException e) {
            logger.error("Could not release finalization claim of session {}: {}", sessionId, e.getMessage());
        }
        sessionCache.evict(sessionId);
    }

    private Optional<List<TranscriptSegment>> fetchAuthoritativeTranscript(UUID sessionId, String transcriptRef) {
        Future<List<TranscriptSegment>> future;
        try {
            future = providerExecutor.submit(() -> transcriptProviderClient.fetchFinalTranscript(transcriptRef));
        } catch (TaskRejectedException e) {
            logger.warn("Transcript provider executor is saturated, using incremental transcript for session {}",
                    sessionId);
            return Optional.empty();
        }
        try {
            return Optional.of(future.get(providerTimeoutMs, TimeUnit.MILLISECONDS));
        } catch (TimeoutException e) {
            future.cancel(true);
            logger.warn("Transcript provider timed out after {}ms for session {}, using incremental transcript",
                    providerTimeoutMs, sessionId);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof ExternalProviderUnavailableException) {
                logger.warn("Transcript provider unavailable for session {}, using incremental transcript: {}",
                        sessionId, cause.getMessage());
            } else {
                logger.error("Unexpected error fetching final transcript for session {}", sessionId, cause);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            logger.warn("Interrupted while fetching final transcript for session {}", sessionId);
        }
        return Optional.empty();
    }

    private List<DetectedFlag> persistNewFlags(UUID sessionId, List<DetectedFlag> detected) {
        Set<String> known = new HashSet<>();
        for (FlaggedContent existing : flaggedContentRepository.findBySessionIdOrderByTimestampMsAsc(sessionId)) {
            known.add(DetectedFlag.dedupKey(existing));
        }

        List<DetectedFlag> fresh = new ArrayList<>();
        List<FlaggedContent> entities = new ArrayList<>();
        for (DetectedFlag flag : detected) {
            if (known.add(flag.dedupKey())) {
                fresh.add(flag);
                entities.add(flag.toEntity());
            }
        }

        if (!entities.isEmpty()) {
            flaggedContentRepository.saveAll(entities);
            for (FlaggedContent entity : entities) {
                metricsService.recordFlagCreated(entity.getFlagType());
            }
        }
        logger.debug("Session {}: {} detected flags, {} new", sessionId, detected.size(), fresh.size());
        return fresh;
    }

    private DiscussionSession markComplete(UUID sessionId, double duration, SessionAnalysis analysis) {
        try {
            DiscussionSession session = sessionRepository.findById(sessionId)
                    .orElseThrow(() -> new SessionNotFoundException(sessionId));

            if (analysis != null) {
                session.setParticipationBalance(analysis.getParticipationBalance());
                session.setTopicAdherenceScore(analysis.getTopicAdherence().getScore());
            }
            session.setProfanityCount(
                    Math.toIntExact(flaggedContentRepository.countBySessionIdAndFlagType(sessionId, FlagType.PROFANITY)));
            session.setLanguageViolationCount(
                    Math.toIntExact(flaggedContentRepository.countBySessionIdAndFlagType(sessionId, FlagType.LANGUAGE_POLICY)));
            session.setDuration(duration);
            session.setStatus(SessionStatus.COMPLETE);
            session.setUpdatedAt(Instant.now());

            return sessionRepository.save(session);
        } catch (DataAccessException e) {
            logger.error("Database error while completing session {}: {}", sessionId, e.getMessage());
            throw new ModerationServiceException("Failed to complete session", e);
        }
    }

    private void broadcastSummaryAlerts(DiscussionSession session, SessionAnalysis analysis, double duration) {
        long timestampMs = (long) Math.floor(duration * 1000);
        ParticipationBalance balance = analysis.getParticipationBalance();

        if (!balance.isBalanced()) {
            AlertEvent event = AlertEvent.builder()
                    .type(AlertType.PARTICIPATION_ALERT)
                    .sessionId(session.getId())
                    .ownerDisplayName(session.getOwnerDisplayName())
                    .flaggedWord(PARTICIPATION_IMBALANCE)
                    .timestampMs(timestampMs)
                    .speaker(balance.getDominantSpeaker() != null ? balance.getDominantSpeaker() : MULTIPLE_SPEAKERS)
                    .context(balance.getImbalanceReason() != null ? balance.getImbalanceReason() : "")
                    .flagType(FlagType.PARTICIPATION)
                    .build();
            publishAndLog(event);
        }

        double score = analysis.getTopicAdherence().getScore();
        if (score < contentAnalysisService.getAdherenceThreshold()) {
            AlertEvent event = AlertEvent.builder()
                    .type(AlertType.TOPIC_ADHERENCE_ALERT)
                    .sessionId(session.getId())
                    .ownerDisplayName(session.getOwnerDisplayName())
                    .flaggedWord(LOW_TOPIC_ADHERENCE)
                    .timestampMs(timestampMs)
                    .speaker(GROUP_SPEAKER)
                    .context(String.format(Locale.ROOT, "Topic adherence score: %.0f%%", score * 100))
                    .flagType(FlagType.OFF_TOPIC)
                    .build();
            publishAndLog(event);
        }
    }

    private void publishAndLog(AlertEvent event) {
        alertBroadcaster.publish(event);

        Map<String, Object> alertData = new LinkedHashMap<>();
        alertData.put("flaggedWord", event.getFlaggedWord());
        alertData.put("speaker", event.getSpeaker());
        alertData.put("context", event.getContext());
        qualityLogService.logAlertTriggered(event.getSessionId(), event.getType().name(), alertData);
    }

    private void logFinalAnalysis(UUID sessionId, SessionAnalysis analysis) {
        Map<String, Object> value = new LinkedHashMap<>();
        value.put("profanityCount", analysis.getProfanityFlags().size());
        value.put("languageViolations", analysis.getLanguagePolicyFlags().size());
        value.put("participationBalanced", analysis.getParticipationBalance().isBalanced());
        value.put("topicAdherenceScore", analysis.getTopicAdherence().getScore());
        qualityLogService.logQualityMetric(sessionId, "final_analysis", value, null);
    }

    private DiscussionSession loadOwned(String ownerId, UUID sessionId) {
        DiscussionSession session;
        try {
            session = sessionRepository.findById(sessionId)
                    .orElseThrow(() -> new SessionNotFoundException(sessionId));
        } catch (DataAccessException e) {
            logger.error("Database error while loading session {}: {}", sessionId, e.getMessage());
            throw new ModerationServiceException("Failed to load session", e);
        }
        if (!session.getOwnerId().equals(ownerId)) {
            logger.warn("User attempted to finalize a session they do not own: {}", sessionId);
            throw new AccessDeniedException("Not the owner of session " + sessionId);
        }
        return session;
    }

    private static final class FinalizationOutcome {
        private final DiscussionSession session;
        private final SessionAnalysis analysis;
        private final int segmentCount;
        private final int newFlagCount;
        private final boolean degraded;

        private FinalizationOutcome(DiscussionSession session, SessionAnalysis analysis, int segmentCount,
                                    int newFlagCount, boolean degraded) {
            this.session = session;
            this.analysis = analysis;
            this.segmentCount = segmentCount;
            this.newFlagCount = newFlagCount;
            this.degraded = degraded;
        }
    }
}
