package ai.classtalk.backend.util;

import java.util.regex.Pattern;

/**
 * Security utilities for input sanitization and validation.
 * Transcript text and speaker labels are user supplied and must be sanitized
 * before they reach log files.
 */
public class SecurityUtils {

    // Pattern to match potentially dangerous characters for logging
    private static final Pattern DANGEROUS_LOG_CHARS = Pattern.compile("[\\r\\n\\t\\x00-\\x1F\\x7F-\\x9F]");

    // Pattern to match control characters and non-printable characters
    private static final Pattern CONTROL_CHARS = Pattern.compile("[\\p{Cntrl}]");

    // External identifiers end up in request paths, so only a conservative charset is allowed
    private static final Pattern SAFE_IDENTIFIER = Pattern.compile("[A-Za-z0-9_\\-]{1,200}");

    private static final int MAX_LOG_LENGTH = 500;

    /**
     * Sanitizes a general string for safe logging.
     * Removes control characters and newlines that could be used for log injection.
     *
     * @param input the string to sanitize
     * @return sanitized string safe for logging
     */
    public static String sanitizeForLogging(String input) {
        if (input == null) {
            return "null";
        }

        if (input.isEmpty()) {
            return "empty";
        }

        String sanitized = DANGEROUS_LOG_CHARS.matcher(input).replaceAll("_");
        sanitized = CONTROL_CHARS.matcher(sanitized).replaceAll("_");

        if (sanitized.length() > MAX_LOG_LENGTH) {
            sanitized = sanitized.substring(0, MAX_LOG_LENGTH - 3) + "...";
        }

        return sanitized;
    }

    /**
     * Validates that an external identifier cannot alter the request path it is placed into.
     *
     * @param identifier the identifier to validate
     * @return true if the identifier is safe, false otherwise
     */
    public static boolean isSafeIdentifier(String identifier) {
        return identifier != null && SAFE_IDENTIFIER.matcher(identifier).matches();
    }
}
