package ai.classtalk.backend.analysis;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Whitespace tokenization and word normalization shared by the keyword analyzers.
 */
public final class TextTokens {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern NON_WORD = Pattern.compile("[^\\w]");

    private TextTokens() {
    }

    /**
     * Splits text on whitespace. Blank text yields no tokens.
     */
    public static List<String> split(String text) {
        if (text == null || text.isBlank()) {
            return Collections.emptyList();
        }
        return Arrays.asList(WHITESPACE.split(text.trim()));
    }

    /**
     * Strips non-word characters and lowercases, e.g. {@code "Damn!"} becomes {@code "damn"}.
     */
    public static String normalize(String word) {
        if (word == null) {
            return "";
        }
        return NON_WORD.matcher(word).replaceAll("").toLowerCase(Locale.ROOT);
    }

    public static String truncate(String text, int maxLength) {
        if (text == null) {
            return "";
        }
        return text.length() <= maxLength ? text : text.substring(0, maxLength);
    }
}
