package ai.classtalk.backend.analysis;

import ai.classtalk.backend.model.dto.TranscriptSegment;
import ai.classtalk.backend.model.entity.FlagType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.UUID;

/**
 * Flags segments spoken in a language other than the allowed one.
 *
 * Codes and English display names are treated as the same language,
 * so "en" and "English" never conflict.
 */
@Component
public class LanguagePolicyAnalyzer {

    private static final Logger logger = LoggerFactory.getLogger(LanguagePolicyAnalyzer.class);

    private static final int CONTEXT_LENGTH = 100;

    private final String defaultAllowedLanguage;

    public LanguagePolicyAnalyzer(@Value("${app.moderation.allowed-language:en}") String defaultAllowedLanguage) {
        this.defaultAllowedLanguage = defaultAllowedLanguage;
    }

    /**
     * @param allowedLanguage allowed language for this session, or null for the deployment default
     */
    public List<DetectedFlag> analyze(UUID sessionId, List<TranscriptSegment> segments, String allowedLanguage) {
        String allowed = resolveAllowedLanguage(allowedLanguage);
        List<DetectedFlag> violations = new ArrayList<>();

        for (TranscriptSegment segment : segments) {
            if (segment == null || !segment.isWellFormed()) {
                logger.warn("Skipping malformed segment in language policy analysis for session {}", sessionId);
                continue;
            }

            String language = segment.getLanguage();
            if (language == null || language.isBlank() || isSameLanguage(language, allowed)) {
                continue;
            }

            violations.add(DetectedFlag.builder()
                    .sessionId(sessionId)
                    .flagType(FlagType.LANGUAGE_POLICY)
                    .flaggedWord(language)
                    .context(TextTokens.truncate(segment.getText(), CONTEXT_LENGTH))
                    .timestampMs(segment.getStartMs())
                    .speaker(segment.getSpeaker())
                    .build());
        }

        return violations;
    }

    public String resolveAllowedLanguage(String allowedLanguage) {
        return (allowedLanguage == null || allowedLanguage.isBlank()) ? defaultAllowedLanguage : allowedLanguage;
    }

    static boolean isSameLanguage(String detected, String allowed) {
        String a = detected.trim();
        String b = allowed.trim();
        return a.equalsIgnoreCase(b)
                || displayName(a).equalsIgnoreCase(b)
                || a.equalsIgnoreCase(displayName(b));
    }

    private static String displayName(String language) {
        if (language.length() < 2 || language.length() > 3) {
            return language;
        }
        String name = Locale.forLanguageTag(language.toLowerCase(Locale.ROOT)).getDisplayLanguage(Locale.ENGLISH);
        return name.isEmpty() ? language : name;
    }
}
