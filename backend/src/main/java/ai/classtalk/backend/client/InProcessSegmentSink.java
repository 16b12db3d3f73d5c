package ai.classtalk.backend.client;

import ai.classtalk.backend.model.dto.AppendSegmentsRequest;
import ai.classtalk.backend.model.dto.TranscriptSegment;
import ai.classtalk.backend.service.SessionService;

import java.util.List;
import java.util.UUID;

/**
 * Appends directly through the {@link SessionService}, for callers running inside this process.
 */
public class InProcessSegmentSink implements SegmentSink {

    private final SessionService sessionService;
    private final String ownerId;

    public InProcessSegmentSink(SessionService sessionService, String ownerId) {
        this.sessionService = sessionService;
        this.ownerId = ownerId;
    }

    @Override
    public int append(UUID sessionId, List<TranscriptSegment> segments, int fromIndex) {
        AppendSegmentsRequest request = AppendSegmentsRequest.builder()
                .segments(segments)
                .fromIndex(fromIndex)
                .build();
        return sessionService.appendSegments(ownerId, sessionId, request).getCursor();
    }
}
