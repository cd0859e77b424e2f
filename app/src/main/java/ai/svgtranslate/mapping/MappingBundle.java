package ai.svgtranslate.mapping;

import java.util.Objects;

/**
 * Plain and title translations travelling together, as stored under {@code "new"} and
 * {@code "title"} in a mapping file.
 */
public record MappingBundle(TranslationMapping translations, TitleMapping titles) {

    public MappingBundle {
        Objects.requireNonNull(translations, "translations");
        Objects.requireNonNull(titles, "titles");
    }

    public static MappingBundle empty() {
        return new MappingBundle(TranslationMapping.empty(), TitleMapping.empty());
    }

    public static MappingBundle of(TranslationMapping translations) {
        return new MappingBundle(translations, TitleMapping.empty());
    }

    public MappingBundle merge(MappingBundle other, MergePolicy policy) {
        return new MappingBundle(translations.merge(other.translations, policy), titles.merge(other.titles, policy));
    }

    public boolean isEmpty() {
        return translations.isEmpty() && titles.isEmpty();
    }
}
