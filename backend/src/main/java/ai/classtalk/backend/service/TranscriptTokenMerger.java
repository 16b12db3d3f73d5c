package ai.classtalk.backend.service;

import ai.classtalk.backend.model.dto.TranscriptSegment;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Merges provider tokens into segments: consecutive tokens of the same speaker
 * form one segment, which closes when the speaker changes.
 */
@Component
public class TranscriptTokenMerger {

    static final String DEFAULT_SPEAKER = "SPEAKER 1";
    static final String DEFAULT_LANGUAGE = "en";

    private static final String SPEAKER_PREFIX = "SPEAKER";

    public List<TranscriptSegment> merge(List<TranscriptProviderClient.TranscriptToken> tokens) {
        List<TranscriptSegment> segments = new ArrayList<>();
        if (tokens == null || tokens.isEmpty()) {
            return segments;
        }

        TranscriptSegment current = null;
        StringBuilder text = new StringBuilder();

        for (TranscriptProviderClient.TranscriptToken token : tokens) {
            if (token == null) {
                continue;
            }
            String speaker = normalizeSpeaker(token.getSpeaker());
            String tokenText = token.getText() != null ? token.getText() : "";
            double startSeconds = toSeconds(token.getStartMs());
            double endSeconds = Math.max(toSeconds(token.getEndMs()), startSeconds);

            if (current == null || !current.getSpeaker().equals(speaker)) {
                if (current != null) {
                    current.setText(text.toString());
                    segments.add(current);
                }
                text.setLength(0);
                text.append(tokenText);
                current = TranscriptSegment.builder()
                        .speaker(speaker)
                        .startTime(startSeconds)
                        .endTime(endSeconds)
                        .language(languageName(token.getLanguage()))
                        .build();
            } else {
                // tokens carry their own leading whitespace
                text.append(tokenText);
                current.setEndTime(Math.max(endSeconds, current.getStartTime()));
            }
        }

        if (current != null) {
            current.setText(text.toString());
            segments.add(current);
        }
        return segments;
    }

    static String normalizeSpeaker(String speaker) {
        if (speaker == null || speaker.isBlank()) {
            return DEFAULT_SPEAKER;
        }
        String trimmed = speaker.trim();
        return trimmed.startsWith(SPEAKER_PREFIX) ? trimmed : SPEAKER_PREFIX + " " + trimmed;
    }

    /**
     * English display name of a language code, e.g. {@code "es"} becomes {@code "Spanish"}.
     * Unknown codes are upper-cased.
     */
    static String languageName(String code) {
        String language = (code == null || code.isBlank()) ? DEFAULT_LANGUAGE : code.trim();
        String name = Locale.forLanguageTag(language).getDisplayLanguage(Locale.ENGLISH);
        if (name.isEmpty() || name.equalsIgnoreCase(language)) {
            return language.toUpperCase(Locale.ROOT);
        }
        return name;
    }

    private static double toSeconds(Long millis) {
        return millis == null ? 0.0 : millis / 1000.0;
    }
}
