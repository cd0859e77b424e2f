package ai.svgtranslate.mapping;

import ai.svgtranslate.text.TextNormalizer;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable table of translations keyed on the normalized fallback text, then on language tag.
 * Iteration follows insertion order.
 */
public final class TranslationMapping {

    private static final TranslationMapping EMPTY = new TranslationMapping(Map.of());

    private final Map<String, Map<String, String>> entries;
    private final Map<String, String> foldedKeys;

    private TranslationMapping(Map<String, Map<String, String>> entries) {
        this.entries = entries;
        Map<String, String> folded = new LinkedHashMap<>();
        for (String key : entries.keySet()) {
            folded.putIfAbsent(TextNormalizer.fold(key), key);
        }
        this.foldedKeys = Collections.unmodifiableMap(folded);
    }

    public static TranslationMapping empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder(MergePolicy.FIRST_WINS);
    }

    public static Builder builder(MergePolicy policy) {
        return new Builder(policy);
    }

    /**
     * Finds the translations of {@code text}. The exact key is tried first; in case-insensitive
     * mode a case-folded match is accepted as well.
     */
    public Optional<Map<String, String>> lookup(String text, boolean caseInsensitive) {
        if (text == null) {
            return Optional.empty();
        }
        Map<String, String> exact = entries.get(text);
        if (exact != null || !caseInsensitive) {
            return Optional.ofNullable(exact);
        }
        String key = foldedKeys.get(TextNormalizer.fold(text));
        return key == null ? Optional.empty() : Optional.of(entries.get(key));
    }

    public Map<String, Map<String, String>> asMap() {
        return entries;
    }

    public Set<String> keys() {
        return entries.keySet();
    }

    public Set<String> languages() {
        Set<String> languages = new LinkedHashSet<>();
        entries.values().forEach(translations -> languages.addAll(translations.keySet()));
        return languages;
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public TranslationMapping merge(TranslationMapping other, MergePolicy policy) {
        return builder(policy).putAll(this).putAll(other).build();
    }

    @Override
    public boolean equals(Object other) {
        return other instanceof TranslationMapping mapping && entries.equals(mapping.entries);
    }

    @Override
    public int hashCode() {
        return entries.hashCode();
    }

    @Override
    public String toString() {
        return "TranslationMapping" + entries;
    }

    public static final class Builder {

        private final MergePolicy policy;
        private final Map<String, Map<String, String>> entries = new LinkedHashMap<>();

        private Builder(MergePolicy policy) {
            this.policy = Objects.requireNonNull(policy, "policy");
        }

        public Builder put(String text, String language, String translation) {
            Objects.requireNonNull(text, "text");
            Objects.requireNonNull(language, "language");
            Objects.requireNonNull(translation, "translation");
            Map<String, String> translations = entries.computeIfAbsent(text, key -> new LinkedHashMap<>());
            if (policy.replaces(translations.get(language))) {
                translations.put(language, translation);
            }
            return this;
        }

        public Builder putAll(String text, Map<String, String> translations) {
            translations.forEach((language, translation) -> put(text, language, translation));
            return this;
        }

        public Builder putAll(TranslationMapping mapping) {
            mapping.entries.forEach(this::putAll);
            return this;
        }

        public boolean isEmpty() {
            return entries.isEmpty();
        }

        public TranslationMapping build() {
            if (entries.isEmpty()) {
                return EMPTY;
            }
            Map<String, Map<String, String>> copy = new LinkedHashMap<>();
            entries.forEach((text, translations) ->
                    copy.put(text, Collections.unmodifiableMap(new LinkedHashMap<>(translations))));
            return new TranslationMapping(Collections.unmodifiableMap(copy));
        }
    }
}
