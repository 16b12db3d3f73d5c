package ai.classtalk.backend.util;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SecurityUtilsTest {

    @Test
    void testSanitizeForLoggingStripsLineBreaks() {
        assertEquals("damn_INFO forged entry", SecurityUtils.sanitizeForLogging("damn\nINFO forged entry"));
        assertEquals("null", SecurityUtils.sanitizeForLogging(null));
        assertEquals("empty", SecurityUtils.sanitizeForLogging(""));
    }

    @Test
    void testSanitizeForLoggingTruncatesLongInput() {
        String sanitized = SecurityUtils.sanitizeForLogging("x".repeat(600));

        assertEquals(500, sanitized.length());
        assertTrue(sanitized.endsWith("..."));
    }

    @Test
    void testIsSafeIdentifier() {
        assertTrue(SecurityUtils.isSafeIdentifier("tx_42-abc"));
        assertFalse(SecurityUtils.isSafeIdentifier("../admin"));
        assertFalse(SecurityUtils.isSafeIdentifier("a b"));
        assertFalse(SecurityUtils.isSafeIdentifier(""));
        assertFalse(SecurityUtils.isSafeIdentifier(null));
    }
}
