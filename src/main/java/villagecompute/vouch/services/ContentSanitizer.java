package villagecompute.vouch.services;

import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Cleans user-supplied vouch messages before they are stored.
 *
 * <p>
 * Two steps, in order:
 * <ol>
 * <li>Every case-insensitive occurrence of a configured banned word is replaced with the redaction marker.</li>
 * <li>The result is truncated to {@code vouch.messages.max-length} characters, counted as code points.</li>
 * </ol>
 *
 * <p>
 * Redaction runs first so a banned word straddling the length limit is still caught.
 */
@ApplicationScoped
public class ContentSanitizer {

    private static final Logger LOG = Logger.getLogger(ContentSanitizer.class);

    @ConfigProperty(
            name = "vouch.messages.banned-words",
            defaultValue = "scam,fraud,fake,cheat,steal,hack,phishing,ponzi,pyramid")
    List<String> bannedWords;

    @ConfigProperty(
            name = "vouch.messages.redaction-marker",
            defaultValue = "[redacted]")
    String redactionMarker;

    @ConfigProperty(
            name = "vouch.messages.max-length",
            defaultValue = "120")
    int maxLength;

    private List<Pattern> bannedPatterns = List.of();

    @PostConstruct
    void compilePatterns() {
        List<Pattern> patterns = new ArrayList<>();
        for (String word : bannedWords) {
            if (word != null && !word.isBlank()) {
                patterns.add(Pattern.compile(Pattern.quote(word.trim()), Pattern.CASE_INSENSITIVE));
            }
        }
        bannedPatterns = List.copyOf(patterns);
        LOG.debugf("Content sanitizer initialized with %d banned words, max length %d", patterns.size(), maxLength);
    }

    /**
     * Redacts banned words and enforces the maximum length.
     *
     * @param text
     *            raw message, may be null
     * @return sanitized message, empty string for null input
     */
    public String sanitize(String text) {
        if (text == null) {
            return "";
        }

        String result = text;
        String replacement = Matcher.quoteReplacement(redactionMarker);
        for (Pattern pattern : bannedPatterns) {
            result = pattern.matcher(result).replaceAll(replacement);
        }

        return truncate(result);
    }

    private String truncate(String text) {
        if (text.codePointCount(0, text.length()) <= maxLength) {
            return text;
        }
        return text.substring(0, text.offsetByCodePoints(0, maxLength));
    }
}
