package ai.svgtranslate.mapping;

import java.util.Optional;

/**
 * Detects a trailing four-digit year such as {@code "Population 2020"}.
 */
final class YearSuffix {

    static final int LENGTH = 4;

    private YearSuffix() {
    }

    static Optional<String> of(String text) {
        if (text == null || text.length() <= LENGTH) {
            return Optional.empty();
        }
        int start = text.length() - LENGTH;
        for (int i = start; i < text.length(); i++) {
            if (!isAsciiDigit(text.charAt(i))) {
                return Optional.empty();
            }
        }
        if (isAsciiDigit(text.charAt(start - 1))) {
            return Optional.empty();
        }
        return Optional.of(text.substring(start));
    }

    static String prefix(String text) {
        return text.substring(0, text.length() - LENGTH);
    }

    private static boolean isAsciiDigit(char c) {
        return c >= '0' && c <= '9';
    }
}
