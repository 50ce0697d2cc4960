package villagecompute.vouch.services;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link ContentSanitizer}.
 *
 * <p>
 * Config fields are set directly and patterns compiled by hand, the same way the container would after injection.
 */
class ContentSanitizerTest {

    private ContentSanitizer sanitizer;

    @BeforeEach
    void setUp() {
        sanitizer = new ContentSanitizer();
        sanitizer.bannedWords = List.of("scam", "fraud", "fake");
        sanitizer.redactionMarker = "[redacted]";
        sanitizer.maxLength = 120;
        sanitizer.compilePatterns();
    }

    @Test
    void testSanitize_nullReturnsEmpty() {
        assertEquals("", sanitizer.sanitize(null));
    }

    @Test
    void testSanitize_cleanTextUnchanged() {
        assertEquals("Great trader, fast and honest", sanitizer.sanitize("Great trader, fast and honest"));
    }

    @Test
    void testSanitize_redactsCaseInsensitively() {
        assertEquals("Not a [redacted], not a [redacted]!", sanitizer.sanitize("Not a SCAM, not a Fraud!"));
    }

    /**
     * Matching is by substring, so banned words inside longer words are redacted too.
     */
    @Test
    void testSanitize_redactsInsideWords() {
        assertEquals("[redacted]s everywhere", sanitizer.sanitize("scams everywhere"));
    }

    @Test
    void testSanitize_truncatesToMaxLength() {
        String longText = "a".repeat(200);
        assertEquals(120, sanitizer.sanitize(longText).length());
    }

    @Test
    void testSanitize_redactsBeforeTruncating() {
        sanitizer.maxLength = 10;
        assertEquals("[redacted]", sanitizer.sanitize("fraudulent behaviour"));
    }

    @Test
    void testSanitize_countsEmojiAsSingleCharacters() {
        sanitizer.maxLength = 3;
        assertEquals("ab👍", sanitizer.sanitize("ab👍"));
        assertEquals("ab👍", sanitizer.sanitize("ab👍c"));
    }

    @Test
    void testSanitize_truncatesEmojiMessageToMaxCharacters() {
        String result = sanitizer.sanitize("👍".repeat(130));

        assertEquals(120, result.codePointCount(0, result.length()));
        assertEquals("👍".repeat(120), result);
    }

    @Test
    void testSanitize_markerWithRegexCharacters() {
        sanitizer.redactionMarker = "$1***";
        assertEquals("a $1*** b", sanitizer.sanitize("a fake b"));
    }
}
