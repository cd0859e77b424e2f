package ai.svgtranslate.mapping;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Translations of year-stripped titles, used to translate the same title for a different year.
 */
public record TitleMapping(TranslationMapping entries) {

    private static final TitleMapping EMPTY = new TitleMapping(TranslationMapping.empty());

    public TitleMapping {
        Objects.requireNonNull(entries, "entries");
    }

    public static TitleMapping empty() {
        return EMPTY;
    }

    /**
     * Generalizes every entry whose text and translations all end in the same year, so that
     * {@code "Population 2020" -> {fr: "Population 2020"}} yields {@code "Population" -> {fr: "Population"}}.
     */
    public static TitleMapping liftYears(TranslationMapping translations) {
        TranslationMapping.Builder builder = TranslationMapping.builder();
        translations.asMap().forEach((text, values) -> {
            Optional<String> year = YearSuffix.of(text);
            if (year.isEmpty() || values.isEmpty()) {
                return;
            }
            boolean sameYear = values.values().stream().allMatch(value -> value.endsWith(year.get()));
            if (!sameYear) {
                return;
            }
            String key = YearSuffix.prefix(text).strip();
            values.forEach((language, value) -> builder.put(key, language, YearSuffix.prefix(value).strip()));
        });
        return new TitleMapping(builder.build());
    }

    /**
     * Looks up a year-stripped prefix as given, then trimmed.
     */
    public Optional<Map<String, String>> lookup(String prefix, boolean caseInsensitive) {
        Optional<Map<String, String>> raw = entries.lookup(prefix, caseInsensitive);
        if (raw.isPresent() || prefix == null) {
            return raw;
        }
        return entries.lookup(prefix.strip(), caseInsensitive);
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public TitleMapping merge(TitleMapping other, MergePolicy policy) {
        return new TitleMapping(entries.merge(other.entries, policy));
    }
}
