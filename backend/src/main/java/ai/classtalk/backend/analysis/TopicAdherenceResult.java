package ai.classtalk.backend.analysis;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TopicAdherenceResult {

    /**
     * On-topic share of segments, in [0, 1].
     */
    private double score;

    private int onTopicSegments;

    private int totalSegments;

    @Builder.Default
    private List<DetectedFlag> offTopicFlags = new ArrayList<>();

    @Builder.Default
    private List<String> detectedKeywords = new ArrayList<>();

    @Builder.Default
    private List<String> detectedOffTopicIndicators = new ArrayList<>();
}
