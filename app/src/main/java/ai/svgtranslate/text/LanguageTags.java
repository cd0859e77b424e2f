package ai.svgtranslate.text;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Lightweight canonicalizer for {@code systemLanguage} tags. Not a BCP-47 parser.
 *
 * <p>{@code en_us -> en-US}, {@code EN -> en}, {@code sr_Latn_RS -> sr-Latn-RS}.
 */
public final class LanguageTags {

    private static final Pattern SEPARATORS = Pattern.compile("[-_\\s]+");
    private static final Pattern LIST_SEPARATOR = Pattern.compile("\\s*,\\s*");

    private LanguageTags() {
    }

    public static String normalize(String tag) {
        if (tag == null || tag.isEmpty()) {
            return tag;
        }
        String trimmed = tag.strip();
        if (trimmed.isEmpty()) {
            return trimmed;
        }
        String[] pieces = SEPARATORS.split(trimmed);
        StringBuilder builder = new StringBuilder(trimmed.length());
        for (String piece : pieces) {
            if (piece.isEmpty()) {
                continue;
            }
            if (builder.length() == 0) {
                builder.append(piece.toLowerCase(Locale.ROOT));
                continue;
            }
            builder.append('-');
            if (piece.length() == 2) {
                builder.append(piece.toUpperCase(Locale.ROOT));
            } else {
                builder.append(titleCase(piece));
            }
        }
        return builder.toString();
    }

    /**
     * Canonicalizes every entry of a comma-separated tag list and rejoins it with {@code ,}.
     */
    public static String normalizeList(String tags) {
        if (tags == null || tags.isEmpty() || tags.indexOf(',') < 0) {
            return normalize(tags);
        }
        return String.join(",", split(tags));
    }

    public static List<String> split(String tags) {
        if (tags == null || tags.isBlank()) {
            return List.of();
        }
        List<String> result = new ArrayList<>();
        for (String item : LIST_SEPARATOR.split(tags.strip())) {
            if (!item.isEmpty()) {
                result.add(normalize(item));
            }
        }
        return result;
    }

    private static String titleCase(String piece) {
        return piece.substring(0, 1).toUpperCase(Locale.ROOT) + piece.substring(1).toLowerCase(Locale.ROOT);
    }
}
