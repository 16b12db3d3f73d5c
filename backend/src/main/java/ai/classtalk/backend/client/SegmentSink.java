package ai.classtalk.backend.client;

import ai.classtalk.backend.model.dto.TranscriptSegment;

import java.util.List;
import java.util.UUID;

/**
 * Transport for one conditional append.
 *
 * Implementations throw {@link ai.classtalk.backend.service.exception.CursorConflictException}
 * on a stale cursor, the other service exceptions for terminal rejections, and any other
 * runtime exception for transient failures.
 */
@FunctionalInterface
public interface SegmentSink {

    /**
     * @return the new cursor after the append
     */
    int append(UUID sessionId, List<TranscriptSegment> segments, int fromIndex);
}
