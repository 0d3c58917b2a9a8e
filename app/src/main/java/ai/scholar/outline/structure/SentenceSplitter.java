package ai.scholar.outline.structure;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits text at its first sentence boundary: a {@code .}, {@code !} or {@code ?} followed by whitespace.
 */
public final class SentenceSplitter {

    private static final Pattern BOUNDARY = Pattern.compile("[.!?](?=\\s)");

    /**
     * Text before and after a sentence boundary. The lead excludes the boundary punctuation; both parts are trimmed.
     */
    public record Split(String lead, String rest) {
    }

    private SentenceSplitter() {
    }

    public static Optional<Split> split(String text) {
        return split(text, Integer.MAX_VALUE);
    }

    /**
     * Splits at the first boundary found within the first {@code maxLeadLength} characters.
     */
    public static Optional<Split> split(String text, int maxLeadLength) {
        if (text == null || text.isEmpty()) {
            return Optional.empty();
        }
        Matcher matcher = BOUNDARY.matcher(text);
        if (!matcher.find() || matcher.start() > maxLeadLength) {
            return Optional.empty();
        }
        String lead = text.substring(0, matcher.start()).trim();
        if (lead.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new Split(lead, text.substring(matcher.end()).trim()));
    }

    /**
     * First sentence including its closing punctuation, or the whole text when it has no boundary.
     */
    public static String firstSentence(String text) {
        if (text == null) {
            return "";
        }
        Matcher matcher = BOUNDARY.matcher(text);
        return matcher.find() ? text.substring(0, matcher.end()) : text;
    }
}
