package ai.classtalk.backend.client;

import ai.classtalk.backend.model.dto.TranscriptSegment;
import ai.classtalk.backend.service.exception.AccessDeniedException;
import ai.classtalk.backend.service.exception.CursorConflictException;
import ai.classtalk.backend.service.exception.InvalidSegmentException;
import ai.classtalk.backend.service.exception.SessionClosedException;
import ai.classtalk.backend.service.exception.SessionNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Client side of the cursor protocol for a single recording session.
 *
 * Holds every finalized segment produced locally and the last cursor the server
 * acknowledged. A flush sends the unacknowledged tail. On a cursor conflict the
 * tail is re-read from the server's cursor, so resubmitting after a lost response
 * never duplicates segments. Assumes this client is the session's only writer,
 * which keeps buffer positions and server cursor positions aligned.
 */
public class SegmentAppendClient {

    private static final Logger logger = LoggerFactory.getLogger(SegmentAppendClient.class);

    /**
     * Waits between retries; replaced in tests.
     */
    @FunctionalInterface
    public interface Sleeper {
        void sleep(Duration duration) throws InterruptedException;
    }

    private final UUID sessionId;
    private final SegmentSink sink;
    private final AppendRetryPolicy retryPolicy;
    private final Sleeper sleeper;

    private final List<TranscriptSegment> buffer = new ArrayList<>();
    private int acknowledgedCursor;
    private volatile SaveStatus status = SaveStatus.SAVED;

    public SegmentAppendClient(UUID sessionId, SegmentSink sink, AppendRetryPolicy retryPolicy) {
        this(sessionId, sink, retryPolicy, duration -> Thread.sleep(duration.toMillis()));
    }

    public SegmentAppendClient(UUID sessionId, SegmentSink sink, AppendRetryPolicy retryPolicy, Sleeper sleeper) {
        this.sessionId = sessionId;
        this.sink = sink;
        this.retryPolicy = retryPolicy;
        this.sleeper = sleeper;
    }

    /**
     * Adds newly finalized segments to the local buffer. Nothing is sent until {@link #flush()}.
     */
    public synchronized void addSegments(List<TranscriptSegment> segments) {
        if (status == SaveStatus.FAILED) {
            throw new IllegalStateException("Save already failed for session " + sessionId);
        }
        buffer.addAll(segments);
        if (acknowledgedCursor < buffer.size()) {
            status = SaveStatus.SAVING;
        }
    }

    /**
     * Sends the unacknowledged tail, retrying per the policy.
     *
     * @return SAVED when everything is acknowledged, FAILED when retries are exhausted
     *         or the session rejected the append
     */
    public synchronized SaveStatus flush() {
        if (status == SaveStatus.FAILED) {
            return status;
        }

        int attempts = 0;
        while (acknowledgedCursor < buffer.size()) {
            status = SaveStatus.SAVING;
            int fromIndex = acknowledgedCursor;
            List<TranscriptSegment> tail = new ArrayList<>(buffer.subList(fromIndex, buffer.size()));

            try {
                attempts++;
                acknowledgedCursor = sink.append(sessionId, tail, fromIndex);
                logger.debug("Session {} acknowledged up to {}", sessionId, acknowledgedCursor);
                continue;
            } catch (CursorConflictException e) {
                if (e.getActual() > buffer.size()) {
                    logger.error("Session {} has {} segments but only {} are buffered locally",
                            sessionId, e.getActual(), buffer.size());
                    return fail();
                }
                logger.warn("Cursor conflict for session {}: resyncing from {} to {}",
                        sessionId, fromIndex, e.getActual());
                acknowledgedCursor = e.getActual();
            } catch (SessionClosedException | SessionNotFoundException | AccessDeniedException | InvalidSegmentException e) {
                logger.error("Append to session {} rejected: {}", sessionId, e.getMessage());
                return fail();
            } catch (RuntimeException e) {
                logger.warn("Append to session {} failed (attempt {}/{}): {}",
                        sessionId, attempts, retryPolicy.getMaxAttempts(), e.getMessage());
            }

            if (acknowledgedCursor >= buffer.size()) {
                break;
            }
            if (!retryPolicy.shouldRetry(attempts)) {
                logger.error("Giving up on session {} after {} attempts", sessionId, attempts);
                return fail();
            }
            try {
                sleeper.sleep(retryPolicy.delayBeforeRetry(attempts - 1));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return fail();
            }
        }

        status = SaveStatus.SAVED;
        return status;
    }

    public SaveStatus getStatus() {
        return status;
    }

    public synchronized int getAcknowledgedCursor() {
        return acknowledgedCursor;
    }

    public synchronized int getBufferedCount() {
        return buffer.size();
    }

    private SaveStatus fail() {
        status = SaveStatus.FAILED;
        return status;
    }
}
