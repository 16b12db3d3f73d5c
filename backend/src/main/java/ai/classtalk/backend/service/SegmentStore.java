package ai.classtalk.backend.service;

import ai.classtalk.backend.model.dto.TranscriptSegment;
import ai.classtalk.backend.service.exception.CursorConflictException;
import ai.classtalk.backend.service.exception.SessionClosedException;
import ai.classtalk.backend.service.exception.SessionNotFoundException;

import java.util.List;
import java.util.UUID;

/**
 * Durable per-session segment sequence guarded by an integer cursor.
 */
public interface SegmentStore {

    /**
     * Appends {@code segments} if and only if the stored cursor equals {@code fromIndex}.
     *
     * @throws CursorConflictException  if the stored cursor differs; nothing is written
     * @throws SessionClosedException   if the session no longer accepts appends
     * @throws SessionNotFoundException if the session does not exist
     */
    AppendResult append(UUID sessionId, List<TranscriptSegment> segments, int fromIndex);

    /**
     * Replaces the whole sequence with an authoritative transcript and deletes every flag
     * derived from the old sequence, as one unit of work. Only valid while reconciling.
     *
     * @return the segments now stored for the session
     * @throws SessionClosedException if the session is not reconciling; nothing is written
     */
    List<TranscriptSegment> replaceAll(UUID sessionId, List<TranscriptSegment> segments);
}
