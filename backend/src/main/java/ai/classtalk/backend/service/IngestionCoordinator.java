package ai.classtalk.backend.service;

import ai.classtalk.backend.alert.AlertBroadcaster;
import ai.classtalk.backend.analysis.ContentAnalysisService;
import ai.classtalk.backend.analysis.DetectedFlag;
import ai.classtalk.backend.analysis.IncomingAnalysis;
import ai.classtalk.backend.analysis.ParticipationAnalyzer;
import ai.classtalk.backend.model.dto.AlertEvent;
import ai.classtalk.backend.model.dto.TranscriptSegment;
import ai.classtalk.backend.model.entity.DiscussionSession;
import ai.classtalk.backend.model.entity.FlagType;
import ai.classtalk.backend.model.entity.FlaggedContent;
import ai.classtalk.backend.repository.DiscussionSessionRepository;
import ai.classtalk.backend.repository.FlaggedContentRepository;
import ai.classtalk.backend.service.exception.AccessDeniedException;
import ai.classtalk.backend.service.exception.InvalidSegmentException;
import ai.classtalk.backend.service.exception.ModerationServiceException;
import ai.classtalk.backend.service.exception.SessionNotFoundException;
import ai.classtalk.backend.util.SecurityUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * Owns the append protocol.
 *
 * Each batch is committed through the {@link SegmentStore} cursor check first;
 * only a committed batch is analyzed, so a rejected retry never produces flags.
 */
@Service
public class IngestionCoordinator {

    private static final Logger logger = LoggerFactory.getLogger(IngestionCoordinator.class);

    private final DiscussionSessionRepository sessionRepository;
    private final FlaggedContentRepository flaggedContentRepository;
    private final SegmentStore segmentStore;
    private final ContentAnalysisService contentAnalysisService;
    private final AlertBroadcaster alertBroadcaster;
    private final SessionCache sessionCache;
    private final ModerationMetricsService metricsService;

    @Autowired
    public IngestionCoordinator(DiscussionSessionRepository sessionRepository,
                                FlaggedContentRepository flaggedContentRepository,
                                SegmentStore segmentStore,
                                ContentAnalysisService contentAnalysisService,
                                AlertBroadcaster alertBroadcaster,
                                SessionCache sessionCache,
                                ModerationMetricsService metricsService) {
        this.sessionRepository = sessionRepository;
        this.flaggedContentRepository = flaggedContentRepository;
        this.segmentStore = segmentStore;
        this.contentAnalysisService = contentAnalysisService;
        this.alertBroadcaster = alertBroadcaster;
        this.sessionCache = sessionCache;
        this.metricsService = metricsService;
    }

    /**
     * Appends a batch of finalized segments and analyzes the newly committed ones.
     *
     * @param ownerId   the caller, who must own the session
     * @param sessionId the target session
     * @param segments  the new segments, in order
     * @param fromIndex the cursor the batch is based on
     * @return the updated session and the flags this batch produced
     */
    public IngestionResult appendSegments(String ownerId, UUID sessionId, List<TranscriptSegment> segments, int fromIndex) {
        validateBatch(segments, fromIndex);

        DiscussionSession session = loadOwned(ownerId, sessionId);

        AppendResult appendResult = segmentStore.append(sessionId, segments, fromIndex);

        try {
            Set<String> flaggedParticipation = existingParticipationKeys(sessionId);
            IncomingAnalysis analysis = contentAnalysisService.analyzeIncoming(
                    session, appendResult.getSegments(), fromIndex, flaggedParticipation);

            List<FlaggedContent> saved = persistFlags(analysis.getAllFlags());

            int profanity = analysis.getProfanityFlags().size();
            int language = analysis.getLanguagePolicyFlags().size();
            if (profanity > 0 || language > 0) {
                sessionRepository.incrementViolationCounts(sessionId, profanity, language, Instant.now());
            }

            sessionCache.evict(sessionId);

            for (FlaggedContent flag : saved) {
                alertBroadcaster.publish(AlertEvent.fromFlag(flag, session.getOwnerDisplayName()));
            }

            DiscussionSession updated = sessionRepository.findById(sessionId)
                    .orElseThrow(() -> new SessionNotFoundException(sessionId));

            if (!saved.isEmpty()) {
                logger.info("Batch for session {} produced {} flags", sessionId, saved.size());
            }
            return new IngestionResult(updated, saved);

        } catch (DataAccessException e) {
            sessionCache.evict(sessionId);
            logger.error("Segments committed to session {} up to cursor {} but flag persistence failed: {}",
                    sessionId, appendResult.getNewCursor(), e.getMessage());
            throw new ModerationServiceException("Failed to record analysis results", e);
        }
    }

    private void validateBatch(List<TranscriptSegment> segments, int fromIndex) {
        if (fromIndex < 0) {
            throw new InvalidSegmentException("fromIndex must not be negative");
        }
        if (segments == null || segments.isEmpty()) {
            throw new InvalidSegmentException("At least one segment is required");
        }
        for (int i = 0; i < segments.size(); i++) {
            TranscriptSegment segment = segments.get(i);
            if (segment == null || !segment.isWellFormed()) {
                throw new InvalidSegmentException("Segment " + i + " is malformed: speaker, text and "
                        + "non-decreasing start/end times are required");
            }
        }
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
            logger.warn("User attempted to append to a session they do not own: {}", sessionId);
            throw new AccessDeniedException("Not the owner of session " + sessionId);
        }
        return session;
    }

    private Set<String> existingParticipationKeys(UUID sessionId) {
        Set<String> keys = new HashSet<>();
        for (FlaggedContent flag : flaggedContentRepository.findBySessionIdAndFlagType(sessionId, FlagType.PARTICIPATION)) {
            keys.add(ParticipationAnalyzer.flagKey(flag.getSpeaker(), flag.getFlaggedWord()));
        }
        return keys;
    }

    private List<FlaggedContent> persistFlags(List<DetectedFlag> detected) {
        if (detected.isEmpty()) {
            return new ArrayList<>();
        }
        List<FlaggedContent> entities = new ArrayList<>();
        for (DetectedFlag flag : detected) {
            entities.add(flag.toEntity());
        }
        List<FlaggedContent> saved = flaggedContentRepository.saveAll(entities);
        for (FlaggedContent flag : saved) {
            metricsService.recordFlagCreated(flag.getFlagType());
            logger.debug("Flagged {} '{}' at {}ms", flag.getFlagType().getValue(),
                    SecurityUtils.sanitizeForLogging(flag.getFlaggedWord()),
                    flag.getTimestampMs());
        }
        return saved;
    }
}
