package ai.svgtranslate.mapping;

import java.util.Collection;
import java.util.Map;
import java.util.Optional;

/**
 * Re-attaches years to generalized titles: with {@code "Population" -> {fr: "Population"}} the
 * candidate {@code "Population 2021"} expands to {@code {fr: "Population 2021"}}.
 */
public final class TitleExpander {

    private TitleExpander() {
    }

    public static TranslationMapping expand(TitleMapping titles, Collection<String> candidates) {
        return expand(titles, candidates, false);
    }

    public static TranslationMapping expand(TitleMapping titles, Collection<String> candidates, boolean caseInsensitive) {
        if (titles.isEmpty()) {
            return TranslationMapping.empty();
        }
        TranslationMapping.Builder builder = TranslationMapping.builder();
        for (String candidate : candidates) {
            Optional<String> year = YearSuffix.of(candidate);
            if (year.isEmpty()) {
                continue;
            }
            Optional<Map<String, String>> stored = titles.lookup(YearSuffix.prefix(candidate), caseInsensitive);
            stored.ifPresent(values -> values.forEach(
                    (language, value) -> builder.put(candidate, language, value + " " + year.get())));
        }
        return builder.build();
    }
}
