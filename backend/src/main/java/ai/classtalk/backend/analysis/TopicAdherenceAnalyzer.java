package ai.classtalk.backend.analysis;

import ai.classtalk.backend.model.dto.TranscriptSegment;
import ai.classtalk.backend.model.entity.FlagType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.UUID;

/**
 * Keyword heuristic for discussion drift.
 *
 * A segment is off-topic when it has no on-topic keyword and at least one
 * off-topic indicator. Only meaningful over a whole session.
 */
@Component
public class TopicAdherenceAnalyzer {

    private static final Logger logger = LoggerFactory.getLogger(TopicAdherenceAnalyzer.class);

    public static final String OFF_TOPIC_SENTINEL = "off_topic";

    static final List<String> BUILT_IN_KEYWORDS = Arrays.asList(
            "discuss", "discussion", "topic", "question", "answer", "think", "opinion",
            "agree", "disagree", "why", "how", "what", "explain", "understand",
            "learn", "study", "class", "lesson", "subject", "idea", "point");

    static final List<String> BUILT_IN_OFF_TOPIC_INDICATORS = Arrays.asList(
            "game", "play", "fun", "bored", "tired", "hungry", "lunch", "break",
            "homework", "test", "exam", "grade", "teacher", "school", "friend",
            "phone", "video", "movie", "music", "song", "dance");

    private static final int CONTEXT_LENGTH = 150;

    private final Set<String> defaultKeywords;
    private final Set<String> offTopicIndicators;

    public TopicAdherenceAnalyzer(
            @Value("${app.moderation.topic.default-keywords:}") List<String> defaultKeywords,
            @Value("${app.moderation.topic.off-topic-indicators:}") List<String> offTopicIndicators) {
        this.defaultKeywords = normalizeAll(defaultKeywords, BUILT_IN_KEYWORDS);
        this.offTopicIndicators = normalizeAll(offTopicIndicators, BUILT_IN_OFF_TOPIC_INDICATORS);
    }

    /**
     * @param topicKeywords session-specific keywords, replacing the defaults when non-empty
     */
    public TopicAdherenceResult analyze(UUID sessionId, List<TranscriptSegment> segments, Collection<String> topicKeywords) {
        Set<String> keywords = normalizeAll(topicKeywords, defaultKeywords);

        int total = 0;
        int onTopic = 0;
        List<DetectedFlag> offTopicFlags = new ArrayList<>();
        Set<String> detectedKeywords = new TreeSet<>();
        Set<String> detectedIndicators = new TreeSet<>();

        for (TranscriptSegment segment : segments) {
            if (segment == null || !segment.isWellFormed()) {
                logger.warn("Skipping malformed segment in topic adherence analysis for session {}", sessionId);
                continue;
            }
            total++;

            boolean hasKeyword = false;
            boolean hasIndicator = false;
            for (String word : TextTokens.split(segment.getText())) {
                String cleanWord = TextTokens.normalize(word);
                if (keywords.contains(cleanWord)) {
                    hasKeyword = true;
                    detectedKeywords.add(cleanWord);
                }
                if (offTopicIndicators.contains(cleanWord)) {
                    hasIndicator = true;
                    detectedIndicators.add(cleanWord);
                }
            }

            if (!hasKeyword && hasIndicator) {
                offTopicFlags.add(DetectedFlag.builder()
                        .sessionId(sessionId)
                        .flagType(FlagType.OFF_TOPIC)
                        .flaggedWord(OFF_TOPIC_SENTINEL)
                        .context(TextTokens.truncate(segment.getText(), CONTEXT_LENGTH))
                        .timestampMs(segment.getStartMs())
                        .speaker(segment.getSpeaker())
                        .build());
            } else {
                onTopic++;
            }
        }

        double score = total == 0 ? 1.0 : (double) onTopic / total;

        return TopicAdherenceResult.builder()
                .score(score)
                .onTopicSegments(onTopic)
                .totalSegments(total)
                .offTopicFlags(offTopicFlags)
                .detectedKeywords(new ArrayList<>(detectedKeywords))
                .detectedOffTopicIndicators(new ArrayList<>(detectedIndicators))
                .build();
    }

    private static Set<String> normalizeAll(Collection<String> words, Collection<String> fallback) {
        Set<String> normalized = new HashSet<>();
        if (words != null) {
            for (String word : words) {
                String clean = TextTokens.normalize(word);
                if (!clean.isEmpty()) {
                    normalized.add(clean);
                }
            }
        }
        if (normalized.isEmpty()) {
            normalized.addAll(fallback);
        }
        return Collections.unmodifiableSet(normalized);
    }
}
