package ai.classtalk.backend.service;

import ai.classtalk.backend.model.dto.TranscriptSegment;

import java.util.Collections;
import java.util.List;

/**
 * Outcome of a successful conditional append.
 */
public class AppendResult {

    private final List<TranscriptSegment> segments;
    private final int fromIndex;
    private final int newCursor;

    public AppendResult(List<TranscriptSegment> segments, int fromIndex, int newCursor) {
        this.segments = Collections.unmodifiableList(segments);
        this.fromIndex = fromIndex;
        this.newCursor = newCursor;
    }

    /**
     * The full committed segment sequence after the append.
     */
    public List<TranscriptSegment> getSegments() {
        return segments;
    }

    public int getFromIndex() {
        return fromIndex;
    }

    public int getNewCursor() {
        return newCursor;
    }

    public List<TranscriptSegment> getAppendedSegments() {
        return segments.subList(fromIndex, newCursor);
    }
}
