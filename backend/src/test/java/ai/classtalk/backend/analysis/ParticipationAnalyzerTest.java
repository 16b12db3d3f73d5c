package ai.classtalk.backend.analysis;

import ai.classtalk.backend.model.dto.ParticipationBalance;
import ai.classtalk.backend.model.dto.ParticipationConfig;
import ai.classtalk.backend.model.dto.SpeakerParticipation;
import ai.classtalk.backend.model.dto.TranscriptSegment;
import ai.classtalk.backend.model.entity.FlagType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class ParticipationAnalyzerTest {

    private final UUID sessionId = UUID.randomUUID();
    private final ParticipationAnalyzer analyzer = new ParticipationAnalyzer();

    @Test
    @DisplayName("60/30/10 split should mark the first speaker dominant and nobody silent")
    void shouldDetectDominantSpeaker() {
        // Arrange: fair share 1/3, dominance threshold 0.5, silence threshold 0.1
        List<TranscriptSegment> segments = List.of(
                segment("S1", 0, 60),
                segment("S2", 60, 90),
                segment("S3", 90, 100));

        // Act
        ParticipationBalance balance = analyzer.analyze(segments, null);

        // Assert
        assertThat(balance.getDominantSpeaker()).isEqualTo("S1");
        assertThat(balance.getSilentSpeakers()).isEmpty();
        assertThat(balance.isBalanced()).isFalse();
        assertThat(balance.getImbalanceReason()).isEqualTo("S1 dominates with 60% of talk time");
        assertThat(balance.getSpeakers()).extracting(SpeakerParticipation::getSpeakerId)
                .containsExactly("S1", "S2", "S3");
    }

    @Test
    @DisplayName("Percentages should sum to one and talk time should be per speaker")
    void shouldComputePercentages() {
        List<TranscriptSegment> segments = List.of(
                segment("A", 0, 7.5),
                segment("B", 7.5, 10),
                segment("A", 10, 12.5),
                segment("C", 12.5, 20));

        ParticipationBalance balance = analyzer.analyze(segments, null);

        double sum = balance.getSpeakers().stream().mapToDouble(SpeakerParticipation::getPercentage).sum();
        assertThat(sum).isCloseTo(1.0, within(1e-6));
        SpeakerParticipation a = balance.getSpeakers().get(0);
        assertThat(a.getSpeakerId()).isEqualTo("A");
        assertThat(a.getTalkTime()).isCloseTo(10.0, within(1e-9));
        assertThat(a.getSegmentCount()).isEqualTo(2);
    }

    @Test
    @DisplayName("Silence needs at least three speakers; a quiet speaker among three is reported")
    void shouldDetectSilentSpeakers() {
        List<TranscriptSegment> twoSpeakers = List.of(segment("A", 0, 97), segment("B", 97, 100));
        List<TranscriptSegment> threeSpeakers = List.of(
                segment("A", 0, 48), segment("B", 48, 96), segment("C", 96, 100));

        ParticipationBalance two = analyzer.analyze(twoSpeakers, null);
        ParticipationBalance three = analyzer.analyze(threeSpeakers, null);

        assertThat(two.getSilentSpeakers()).isEmpty();
        assertThat(two.getDominantSpeaker()).isEqualTo("A");
        assertThat(three.getSilentSpeakers()).containsExactly("C");
        assertThat(three.getDominantSpeaker()).isNull();
        assertThat(three.getImbalanceReason()).isEqualTo("1 speaker(s) barely participating: C");
    }

    @Test
    @DisplayName("A single speaker is never dominant")
    void shouldNotFlagSingleSpeaker() {
        ParticipationBalance balance = analyzer.analyze(List.of(segment("A", 0, 30)), null);

        assertThat(balance.isBalanced()).isTrue();
        assertThat(balance.getDominantSpeaker()).isNull();
        assertThat(balance.getImbalanceReason()).isNull();
    }

    @Test
    @DisplayName("Zero total talk time should fall back to segment share")
    void shouldFallBackToSegmentShareWhenNoTalkTime() {
        List<TranscriptSegment> segments = List.of(segment("A", 5, 5), segment("A", 5, 5), segment("B", 5, 5), segment("C", 5, 5));

        ParticipationBalance balance = analyzer.analyze(segments, null);

        assertThat(balance.getSpeakers().get(0).getPercentage()).isCloseTo(0.5, within(1e-9));
        double sum = balance.getSpeakers().stream().mapToDouble(SpeakerParticipation::getPercentage).sum();
        assertThat(sum).isCloseTo(1.0, within(1e-6));
    }

    @Test
    @DisplayName("Empty input should be balanced with no speakers")
    void shouldHandleEmptyInput() {
        ParticipationBalance balance = analyzer.analyze(new ArrayList<>(), null);

        assertThat(balance.isBalanced()).isTrue();
        assertThat(balance.getSpeakers()).isEmpty();
    }

    @Test
    @DisplayName("Explicit config should override the derived thresholds without capping")
    void shouldApplyExplicitThresholds() {
        List<TranscriptSegment> segments = List.of(segment("S1", 0, 60), segment("S2", 60, 90), segment("S3", 90, 100));
        ParticipationConfig lenient = ParticipationConfig.builder().dominanceThreshold(0.7).silenceThreshold(0.2).build();

        ParticipationBalance balance = analyzer.analyze(segments, lenient);

        assertThat(balance.getDominantSpeaker()).isNull();
        assertThat(balance.getSilentSpeakers()).containsExactly("S3");

        ParticipationAnalyzer.Thresholds uncapped = analyzer.resolveThresholds(2,
                ParticipationConfig.builder().dominanceThreshold(0.9).build());
        assertThat(uncapped.getDominance()).isEqualTo(0.9);
        assertThat(uncapped.getSilence()).isCloseTo(0.15, within(1e-9));

        ParticipationAnalyzer.Thresholds derived = analyzer.resolveThresholds(2, null);
        assertThat(derived.getDominance()).isEqualTo(0.6);
    }

    @Test
    @DisplayName("Incoming analysis should flag each speaker/condition once per session")
    void shouldFlagIncomingDominanceOnce() {
        TranscriptSegment first = segment("A", 0, 1);
        TranscriptSegment second = segment("B", 1, 2);
        TranscriptSegment third = segment("A", 2, 10);
        TranscriptSegment fourth = segment("A", 10, 20);
        List<TranscriptSegment> cumulative = List.of(first, second, third, fourth);
        Set<String> alreadyFlagged = new HashSet<>();

        List<DetectedFlag> atThird = analyzer.analyzeIncoming(sessionId, third, cumulative.subList(0, 3), null, alreadyFlagged);
        List<DetectedFlag> atFourth = analyzer.analyzeIncoming(sessionId, fourth, cumulative, null, alreadyFlagged);

        assertThat(atThird).hasSize(1);
        DetectedFlag flag = atThird.get(0);
        assertThat(flag.getFlagType()).isEqualTo(FlagType.PARTICIPATION);
        assertThat(flag.getFlaggedWord()).isEqualTo(ParticipationAnalyzer.DOMINANCE_SENTINEL);
        assertThat(flag.getSpeaker()).isEqualTo("A");
        assertThat(flag.getTimestampMs()).isEqualTo(2000L);
        assertThat(atFourth).isEmpty();
        assertThat(alreadyFlagged).containsExactly(ParticipationAnalyzer.flagKey("A", ParticipationAnalyzer.DOMINANCE_SENTINEL));
    }

    @Test
    @DisplayName("Incoming analysis should only evaluate the incoming segment's speaker")
    void shouldOnlyEvaluateIncomingSpeaker() {
        // A dominates, but the incoming segment belongs to B
        List<TranscriptSegment> cumulative = List.of(segment("A", 0, 50), segment("B", 50, 51));

        List<DetectedFlag> flags = analyzer.analyzeIncoming(sessionId, cumulative.get(1), cumulative, null, new HashSet<>());

        assertThat(flags).isEmpty();
    }

    @Test
    @DisplayName("Session flags should anchor at each flagged speaker's first segment")
    void shouldBuildSessionFlags() {
        List<TranscriptSegment> segments = List.of(
                segment("A", 0, 40), segment("B", 40, 90), segment("C", 90, 92), segment("B", 92, 100));
        ParticipationBalance balance = analyzer.analyze(segments, null);

        List<DetectedFlag> flags = analyzer.sessionFlags(sessionId, segments, balance);

        assertThat(balance.getDominantSpeaker()).isEqualTo("B");
        assertThat(flags).extracting(DetectedFlag::getFlaggedWord)
                .containsExactly(ParticipationAnalyzer.DOMINANCE_SENTINEL, ParticipationAnalyzer.SILENCE_SENTINEL);
        assertThat(flags).extracting(DetectedFlag::getTimestampMs).containsExactly(40000L, 90000L);
    }

    private static TranscriptSegment segment(String speaker, double start, double end) {
        return TranscriptSegment.builder()
                .speaker(speaker)
                .text("some words from " + speaker)
                .startTime(start)
                .endTime(end)
                .build();
    }
}
