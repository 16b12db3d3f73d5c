package ai.classtalk.backend.service;

import ai.classtalk.backend.model.dto.TranscriptSegment;
import ai.classtalk.backend.model.entity.DiscussionSession;
import ai.classtalk.backend.model.entity.FlagType;
import ai.classtalk.backend.model.entity.SessionStatus;
import ai.classtalk.backend.model.entity.converter.SegmentListConverter;
import ai.classtalk.backend.repository.DiscussionSessionRepository;
import ai.classtalk.backend.repository.FlaggedContentRepository;
import ai.classtalk.backend.service.exception.CursorConflictException;
import ai.classtalk.backend.service.exception.ModerationServiceException;
import ai.classtalk.backend.service.exception.SessionClosedException;
import ai.classtalk.backend.service.exception.SessionNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.UUID;

/**
 * Database-backed segment store.
 *
 * The conditional UPDATE in {@link DiscussionSessionRepository#compareAndSetSegments}
 * is the only serialization point: of two concurrent appends against the same
 * cursor exactly one updates a row.
 */
@Service
public class SegmentStoreImpl implements SegmentStore {

    private static final Logger logger = LoggerFactory.getLogger(SegmentStoreImpl.class);

    private final DiscussionSessionRepository sessionRepository;
    private final FlaggedContentRepository flaggedContentRepository;
    private final ModerationMetricsService metricsService;
    private final SegmentListConverter segmentListConverter = new SegmentListConverter();

    @Autowired
    public SegmentStoreImpl(DiscussionSessionRepository sessionRepository,
                            FlaggedContentRepository flaggedContentRepository,
                            ModerationMetricsService metricsService) {
        this.sessionRepository = sessionRepository;
        this.flaggedContentRepository = flaggedContentRepository;
        this.metricsService = metricsService;
    }

    @Override
    public AppendResult append(UUID sessionId, List<TranscriptSegment> segments, int fromIndex) {
        try {
            DiscussionSession session = sessionRepository.findById(sessionId)
                    .orElseThrow(() -> new SessionNotFoundException(sessionId));

            if (session.getStatus() != SessionStatus.DRAFT) {
                throw new SessionClosedException("Session " + sessionId + " no longer accepts segments",
                        session.getStatus());
            }

            int currentCursor = session.getCursor();
            if (currentCursor != fromIndex) {
                throw conflict(sessionId, fromIndex, currentCursor);
            }

            List<TranscriptSegment> updated = new ArrayList<>(session.getSegments());
            updated.addAll(segments);
            int newCursor = updated.size();

            int rows = sessionRepository.compareAndSetSegments(sessionId, fromIndex, newCursor,
                    segmentListConverter.convertToDatabaseColumn(updated), Instant.now());

            if (rows == 0) {
                // lost the race between read and conditional write
                DiscussionSession latest = sessionRepository.findById(sessionId)
                        .orElseThrow(() -> new SessionNotFoundException(sessionId));
                if (latest.getStatus() != SessionStatus.DRAFT) {
                    throw new SessionClosedException("Session " + sessionId + " no longer accepts segments",
                            latest.getStatus());
                }
                throw conflict(sessionId, fromIndex, latest.getCursor());
            }

            metricsService.recordSegmentsAppended(segments.size());
            logger.info("Appended {} segments to session {} (cursor {} -> {})",
                    segments.size(), sessionId, fromIndex, newCursor);

            return new AppendResult(updated, fromIndex, newCursor);

        } catch (DataAccessException e) {
            logger.error("Database error while appending segments to session {}: {}", sessionId, e.getMessage());
            throw new ModerationServiceException("Failed to append segments", e);
        }
    }

    @Override
    @Transactional
    public List<TranscriptSegment> replaceAll(UUID sessionId, List<TranscriptSegment> segments) {
        List<TranscriptSegment> stored = new ArrayList<>(segments);
        try {
            int rows = sessionRepository.replaceSegments(sessionId, stored.size(),
                    segmentListConverter.convertToDatabaseColumn(stored), Instant.now());
            if (rows == 0) {
                SessionStatus status = sessionRepository.findById(sessionId)
                        .map(DiscussionSession::getStatus)
                        .orElseThrow(() -> new SessionNotFoundException(sessionId));
                throw new SessionClosedException("Session " + sessionId + " is not being finalized", status);
            }
            int deleted = flaggedContentRepository.deleteBySessionIdAndFlagTypes(sessionId, EnumSet.allOf(FlagType.class));
            logger.info("Replaced segments of session {} with {} authoritative segments, invalidated {} flags",
                    sessionId, stored.size(), deleted);
            return stored;
        } catch (DataAccessException e) {
            logger.error("Database error while replacing segments of session {}: {}", sessionId, e.getMessage());
            throw new ModerationServiceException("Failed to replace segments", e);
        }
    }

    private CursorConflictException conflict(UUID sessionId, int fromIndex, int currentCursor) {
        metricsService.recordCursorConflict();
        logger.warn("Cursor conflict on session {}: client sent fromIndex {}, stored cursor is {}",
                sessionId, fromIndex, currentCursor);
        return new CursorConflictException(fromIndex, currentCursor);
    }
}
