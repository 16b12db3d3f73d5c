package ai.classtalk.backend.analysis;

import ai.classtalk.backend.model.dto.ParticipationBalance;
import ai.classtalk.backend.model.dto.ParticipationConfig;
import ai.classtalk.backend.model.dto.SpeakerParticipation;
import ai.classtalk.backend.model.dto.TranscriptSegment;
import ai.classtalk.backend.model.entity.FlagType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Computes how talk time is distributed across speakers.
 *
 * Thresholds default to values derived from the speaker count. An explicit
 * {@link ParticipationConfig} value always wins over the derived one.
 */
@Component
public class ParticipationAnalyzer {

    private static final Logger logger = LoggerFactory.getLogger(ParticipationAnalyzer.class);

    public static final String DOMINANCE_SENTINEL = "participation_dominance";
    public static final String SILENCE_SENTINEL = "participation_silence";

    private static final double DOMINANCE_FAIR_SHARE_MULTIPLIER = 1.5;
    private static final double DOMINANCE_CAP = 0.6;
    private static final double SILENCE_FAIR_SHARE_MULTIPLIER = 0.3;
    private static final double SILENCE_FLOOR = 0.05;

    private static final int MIN_SPEAKERS_FOR_DOMINANCE = 2;
    private static final int MIN_SPEAKERS_FOR_SILENCE = 3;

    private static final int CONTEXT_LENGTH = 150;

    /**
     * Full-session balance over every well-formed segment.
     *
     * @param segments the complete segment history
     * @param config   explicit thresholds, may be null
     */
    public ParticipationBalance analyze(List<TranscriptSegment> segments, ParticipationConfig config) {
        Map<String, SpeakerParticipation> stats = aggregate(segments);
        if (stats.isEmpty()) {
            return ParticipationBalance.empty();
        }

        int speakerCount = stats.size();
        Thresholds thresholds = resolveThresholds(speakerCount, config);

        List<SpeakerParticipation> speakers = new ArrayList<>(stats.values());
        speakers.sort(Comparator.comparingDouble(SpeakerParticipation::getPercentage).reversed());

        String dominantSpeaker = null;
        if (speakerCount >= MIN_SPEAKERS_FOR_DOMINANCE) {
            SpeakerParticipation top = speakers.get(0);
            if (top.getPercentage() > thresholds.getDominance()) {
                dominantSpeaker = top.getSpeakerId();
            }
        }

        List<String> silentSpeakers = new ArrayList<>();
        if (speakerCount >= MIN_SPEAKERS_FOR_SILENCE) {
            for (SpeakerParticipation speaker : speakers) {
                if (speaker.getPercentage() < thresholds.getSilence()) {
                    silentSpeakers.add(speaker.getSpeakerId());
                }
            }
        }

        boolean balanced = dominantSpeaker == null && silentSpeakers.isEmpty();

        return ParticipationBalance.builder()
                .speakers(speakers)
                .dominantSpeaker(dominantSpeaker)
                .silentSpeakers(silentSpeakers)
                .balanced(balanced)
                .imbalanceReason(balanced ? null : describeImbalance(stats, dominantSpeaker, silentSpeakers))
                .build();
    }

    /**
     * Real-time check for a single incoming segment against the cumulative state.
     *
     * Only the incoming segment's own speaker is evaluated, and each
     * speaker/condition pair is flagged at most once.
     *
     * @param cumulative     every committed segment up to and including {@code segment}
     * @param alreadyFlagged keys of conditions already flagged for this session;
     *                       updated with any condition flagged here
     */
    public List<DetectedFlag> analyzeIncoming(UUID sessionId,
                                              TranscriptSegment segment,
                                              List<TranscriptSegment> cumulative,
                                              ParticipationConfig config,
                                              Set<String> alreadyFlagged) {
        List<DetectedFlag> flags = new ArrayList<>();
        if (segment == null || !segment.isWellFormed()) {
            logger.warn("Skipping malformed segment in participation analysis for session {}", sessionId);
            return flags;
        }

        Map<String, SpeakerParticipation> stats = aggregate(cumulative);
        SpeakerParticipation current = stats.get(segment.getSpeaker());
        if (current == null) {
            return flags;
        }

        Thresholds thresholds = resolveThresholds(stats.size(), config);

        if (stats.size() >= MIN_SPEAKERS_FOR_DOMINANCE && current.getPercentage() > thresholds.getDominance()) {
            addOnce(flags, alreadyFlagged, sessionId, segment, DOMINANCE_SENTINEL);
        }
        if (stats.size() >= MIN_SPEAKERS_FOR_SILENCE && current.getPercentage() < thresholds.getSilence()) {
            addOnce(flags, alreadyFlagged, sessionId, segment, SILENCE_SENTINEL);
        }

        return flags;
    }

    /**
     * Session-level flags for a computed balance: one for the dominant speaker and one per
     * silent speaker, each anchored at that speaker's first segment.
     */
    public List<DetectedFlag> sessionFlags(UUID sessionId, List<TranscriptSegment> segments, ParticipationBalance balance) {
        List<DetectedFlag> flags = new ArrayList<>();
        if (balance == null || balance.isBalanced()) {
            return flags;
        }

        if (balance.getDominantSpeaker() != null) {
            TranscriptSegment first = firstSegmentOf(segments, balance.getDominantSpeaker());
            if (first != null) {
                flags.add(buildFlag(sessionId, first, DOMINANCE_SENTINEL));
            }
        }
        for (String silentSpeaker : balance.getSilentSpeakers()) {
            TranscriptSegment first = firstSegmentOf(segments, silentSpeaker);
            if (first != null) {
                flags.add(buildFlag(sessionId, first, SILENCE_SENTINEL));
            }
        }
        return flags;
    }

    public static String flagKey(String speaker, String sentinel) {
        return speaker + "|" + sentinel;
    }

    Thresholds resolveThresholds(int speakerCount, ParticipationConfig config) {
        double fairShare = 1.0 / speakerCount;
        double dominance = Math.min(DOMINANCE_FAIR_SHARE_MULTIPLIER * fairShare, DOMINANCE_CAP);
        double silence = Math.max(SILENCE_FAIR_SHARE_MULTIPLIER * fairShare, SILENCE_FLOOR);

        if (config != null) {
            if (config.getDominanceThreshold() != null) {
                dominance = config.getDominanceThreshold();
            }
            if (config.getSilenceThreshold() != null) {
                silence = config.getSilenceThreshold();
            }
        }
        return new Thresholds(dominance, silence);
    }

    private Map<String, SpeakerParticipation> aggregate(List<TranscriptSegment> segments) {
        Map<String, SpeakerParticipation> stats = new LinkedHashMap<>();
        double totalTalkTime = 0;
        int totalSegments = 0;

        for (TranscriptSegment segment : segments) {
            if (segment == null || !segment.isWellFormed()) {
                continue;
            }
            SpeakerParticipation speaker = stats.computeIfAbsent(segment.getSpeaker(),
                    id -> SpeakerParticipation.builder().speakerId(id).build());
            speaker.setTalkTime(speaker.getTalkTime() + segment.getDurationSeconds());
            speaker.setSegmentCount(speaker.getSegmentCount() + 1);
            totalTalkTime += segment.getDurationSeconds();
            totalSegments++;
        }

        for (SpeakerParticipation speaker : stats.values()) {
            // zero total talk time: fall back to segment share so percentages still sum to 1
            double percentage = totalTalkTime > 0
                    ? speaker.getTalkTime() / totalTalkTime
                    : (double) speaker.getSegmentCount() / totalSegments;
            speaker.setPercentage(percentage);
        }
        return stats;
    }

    private void addOnce(List<DetectedFlag> flags, Set<String> alreadyFlagged, UUID sessionId,
                         TranscriptSegment segment, String sentinel) {
        if (alreadyFlagged.add(flagKey(segment.getSpeaker(), sentinel))) {
            flags.add(buildFlag(sessionId, segment, sentinel));
        }
    }

    private DetectedFlag buildFlag(UUID sessionId, TranscriptSegment segment, String sentinel) {
        return DetectedFlag.builder()
                .sessionId(sessionId)
                .flagType(FlagType.PARTICIPATION)
                .flaggedWord(sentinel)
                .context(TextTokens.truncate(segment.getText(), CONTEXT_LENGTH))
                .timestampMs(segment.getStartMs())
                .speaker(segment.getSpeaker())
                .build();
    }

    private TranscriptSegment firstSegmentOf(List<TranscriptSegment> segments, String speaker) {
        for (TranscriptSegment segment : segments) {
            if (segment != null && segment.isWellFormed() && speaker.equals(segment.getSpeaker())) {
                return segment;
            }
        }
        return null;
    }

    private String describeImbalance(Map<String, SpeakerParticipation> stats, String dominantSpeaker,
                                     List<String> silentSpeakers) {
        List<String> reasons = new ArrayList<>();
        if (dominantSpeaker != null) {
            reasons.add(String.format(Locale.ROOT, "%s dominates with %.0f%% of talk time",
                    dominantSpeaker, stats.get(dominantSpeaker).getPercentage() * 100));
        }
        if (!silentSpeakers.isEmpty()) {
            reasons.add(String.format(Locale.ROOT, "%d speaker(s) barely participating: %s",
                    silentSpeakers.size(), String.join(", ", silentSpeakers)));
        }
        return String.join("; ", reasons);
    }

    static final class Thresholds {
        private final double dominance;
        private final double silence;

        Thresholds(double dominance, double silence) {
            this.dominance = dominance;
            this.silence = silence;
        }

        double getDominance() { return dominance; }
        double getSilence() { return silence; }
    }
}
