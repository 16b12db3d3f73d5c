package ai.classtalk.backend.analysis;

import ai.classtalk.backend.model.dto.TranscriptSegment;
import ai.classtalk.backend.model.entity.FlagType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class TopicAdherenceAnalyzerTest {

    private final UUID sessionId = UUID.randomUUID();
    private final TopicAdherenceAnalyzer analyzer =
            new TopicAdherenceAnalyzer(Collections.emptyList(), Collections.emptyList());

    @Test
    @DisplayName("An empty transcript should score 1.0")
    void shouldScoreEmptyTranscriptAsFullyOnTopic() {
        TopicAdherenceResult result = analyzer.analyze(sessionId, List.of(), null);

        assertThat(result.getScore()).isEqualTo(1.0);
        assertThat(result.getTotalSegments()).isZero();
        assertThat(result.getOffTopicFlags()).isEmpty();
    }

    @Test
    @DisplayName("Off-topic requires an indicator and no keyword")
    void shouldFlagOnlyIndicatorWithoutKeyword() {
        List<TranscriptSegment> segments = List.of(
                segment("I think the main idea is clear", 0, 5),
                segment("Did you see that movie last night?", 5, 10),
                segment("What do you think about the movie in this lesson?", 10, 15),
                segment("Okay sure", 15, 17));

        TopicAdherenceResult result = analyzer.analyze(sessionId, segments, null);

        assertThat(result.getTotalSegments()).isEqualTo(4);
        assertThat(result.getOnTopicSegments()).isEqualTo(3);
        assertThat(result.getScore()).isCloseTo(0.75, within(1e-9));
        assertThat(result.getOffTopicFlags()).hasSize(1);
        DetectedFlag flag = result.getOffTopicFlags().get(0);
        assertThat(flag.getFlagType()).isEqualTo(FlagType.OFF_TOPIC);
        assertThat(flag.getFlaggedWord()).isEqualTo(TopicAdherenceAnalyzer.OFF_TOPIC_SENTINEL);
        assertThat(flag.getTimestampMs()).isEqualTo(5000L);
        assertThat(result.getDetectedOffTopicIndicators()).containsExactly("movie");
        assertThat(result.getDetectedKeywords()).contains("think", "idea", "lesson");
    }

    @Test
    @DisplayName("Session keywords should replace the default keyword list")
    void shouldUseSessionKeywords() {
        List<TranscriptSegment> segments = List.of(segment("Photosynthesis needs sunlight, not a video game", 0, 4));

        TopicAdherenceResult withDefaults = analyzer.analyze(sessionId, segments, null);
        TopicAdherenceResult withSessionKeywords = analyzer.analyze(sessionId, segments, List.of("Photosynthesis"));

        assertThat(withDefaults.getScore()).isEqualTo(0.0);
        assertThat(withSessionKeywords.getScore()).isEqualTo(1.0);
        assertThat(withSessionKeywords.getDetectedKeywords()).containsExactly("photosynthesis");
    }

    @Test
    @DisplayName("Configured indicators should replace the built-in indicators")
    void shouldUseConfiguredIndicators() {
        TopicAdherenceAnalyzer custom = new TopicAdherenceAnalyzer(List.of("budget"), List.of("weekend"));
        List<TranscriptSegment> segments = List.of(
                segment("Plans for the weekend", 0, 2),
                segment("Let's play a game", 2, 4));

        TopicAdherenceResult result = custom.analyze(sessionId, segments, null);

        assertThat(result.getOffTopicFlags()).hasSize(1);
        assertThat(result.getScore()).isCloseTo(0.5, within(1e-9));
    }

    private static TranscriptSegment segment(String text, double start, double end) {
        return TranscriptSegment.builder().speaker("A").text(text).startTime(start).endTime(end).build();
    }
}
