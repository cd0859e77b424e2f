package ai.svgtranslate.text;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Normalizes text used as mapping keys and values.
 */
public final class TextNormalizer {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);

    private TextNormalizer() {
    }

    /**
     * Collapses every whitespace run (newlines and tabs included) to a single space and trims both ends.
     */
    public static String normalize(String text) {
        if (text == null) {
            return "";
        }
        return WHITESPACE.matcher(text).replaceAll(" ").strip();
    }

    public static String normalize(String text, boolean caseInsensitive) {
        String normalized = normalize(text);
        return caseInsensitive ? fold(normalized) : normalized;
    }

    public static String fold(String text) {
        return text == null ? null : text.toLowerCase(Locale.ROOT);
    }
}
