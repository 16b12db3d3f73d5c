package ai.classtalk.backend.analysis;

import ai.classtalk.backend.model.dto.TranscriptSegment;
import ai.classtalk.backend.model.entity.FlagType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * Flags denylisted words token by token.
 *
 * Matching is exact after normalization, so words that merely contain a
 * denylisted substring ("class", "assess") are never flagged.
 */
@Component
public class ProfanityAnalyzer {

    private static final Logger logger = LoggerFactory.getLogger(ProfanityAnalyzer.class);

    static final String DENYLIST_RESOURCE = "moderation/profanity-denylist.txt";

    private static final int CONTEXT_WORDS_BEFORE = 3;
    private static final int CONTEXT_WORDS_AFTER = 3;

    private final Set<String> denylist;

    @Autowired
    public ProfanityAnalyzer(@Value("${app.moderation.profanity.additional-words:}") List<String> additionalWords) {
        this(loadBaseDenylist(), additionalWords);
    }

    public ProfanityAnalyzer(Collection<String> baseWords, Collection<String> additionalWords) {
        Set<String> words = new HashSet<>();
        addNormalized(words, baseWords);
        addNormalized(words, additionalWords);
        this.denylist = Collections.unmodifiableSet(words);
        logger.info("Profanity analyzer initialized with {} denylisted words", denylist.size());
    }

    /**
     * Scans every segment and returns one flag per denylisted token.
     *
     * @param sessionId the session the segments belong to
     * @param segments  segments to scan
     * @return detected profanity, in segment and token order
     */
    public List<DetectedFlag> analyze(UUID sessionId, List<TranscriptSegment> segments) {
        List<DetectedFlag> flags = new ArrayList<>();

        for (TranscriptSegment segment : segments) {
            if (segment == null || !segment.isWellFormed()) {
                logger.warn("Skipping malformed segment in profanity analysis for session {}", sessionId);
                continue;
            }

            List<String> words = TextTokens.split(segment.getText());
            if (words.isEmpty()) {
                continue;
            }

            double startMs = segment.getStartTime() * 1000;
            double msPerWord = (segment.getDurationSeconds() * 1000) / words.size();

            for (int index = 0; index < words.size(); index++) {
                String cleanWord = TextTokens.normalize(words.get(index));
                if (cleanWord.isEmpty() || !denylist.contains(cleanWord)) {
                    continue;
                }

                int contextStart = Math.max(0, index - CONTEXT_WORDS_BEFORE);
                int contextEnd = Math.min(words.size(), index + CONTEXT_WORDS_AFTER + 1);

                flags.add(DetectedFlag.builder()
                        .sessionId(sessionId)
                        .flagType(FlagType.PROFANITY)
                        .flaggedWord(cleanWord)
                        .context(String.join(" ", words.subList(contextStart, contextEnd)))
                        .timestampMs((long) Math.floor(startMs + index * msPerWord))
                        .speaker(segment.getSpeaker())
                        .build());
            }
        }

        return flags;
    }

    public boolean isProfane(String word) {
        String cleanWord = TextTokens.normalize(word);
        return !cleanWord.isEmpty() && denylist.contains(cleanWord);
    }

    public int getDenylistSize() {
        return denylist.size();
    }

    private static void addNormalized(Set<String> target, Collection<String> words) {
        if (words == null) {
            return;
        }
        for (String word : words) {
            String normalized = TextTokens.normalize(word);
            if (!normalized.isEmpty()) {
                target.add(normalized);
            }
        }
    }

    static List<String> loadBaseDenylist() {
        ClassPathResource resource = new ClassPathResource(DENYLIST_RESOURCE);
        List<String> words = new ArrayList<>();
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(resource.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                String trimmed = line.trim();
                if (!trimmed.isEmpty() && !trimmed.startsWith("#")) {
                    words.add(trimmed);
                }
            }
        } catch (IOException e) {
            throw new IllegalStateException("Unable to load profanity denylist from " + DENYLIST_RESOURCE, e);
        }
        return words;
    }
}
