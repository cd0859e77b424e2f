package ai.svgtranslate.mapping;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Map;
import org.junit.jupiter.api.Test;

class TranslationMappingTest {

    @Test
    void keepsFirstTranslationByDefault() {
        TranslationMapping mapping = TranslationMapping.builder()
                .put("Hello", "fr", "Bonjour")
                .put("Hello", "fr", "Salut")
                .put("Hello", "de", "Hallo")
                .build();

        assertThat(mapping.lookup("Hello", false)).contains(Map.of("fr", "Bonjour", "de", "Hallo"));
    }

    @Test
    void mergeFollowsPolicyPerLanguage() {
        TranslationMapping first = TranslationMapping.builder().put("Hello", "fr", "Bonjour").build();
        TranslationMapping second = TranslationMapping.builder()
                .put("Hello", "fr", "Salut")
                .put("Hello", "es", "Hola")
                .build();

        assertThat(first.merge(second, MergePolicy.FIRST_WINS).lookup("Hello", false))
                .contains(Map.of("fr", "Bonjour", "es", "Hola"));
        assertThat(first.merge(second, MergePolicy.LAST_WINS).lookup("Hello", false))
                .contains(Map.of("fr", "Salut", "es", "Hola"));
    }

    @Test
    void fallsBackToCaseFoldedKeyOnlyWhenCaseInsensitive() {
        TranslationMapping mapping = TranslationMapping.builder().put("Hello World", "fr", "Bonjour").build();

        assertThat(mapping.lookup("hello world", true)).isPresent();
        assertThat(mapping.lookup("hello world", false)).isEmpty();
    }

    @Test
    void preservesInsertionOrder() {
        TranslationMapping mapping = TranslationMapping.builder()
                .put("b", "fr", "b-fr")
                .put("a", "de", "a-de")
                .put("a", "ar", "a-ar")
                .build();

        assertThat(mapping.keys()).containsExactly("b", "a");
        assertThat(mapping.languages()).containsExactly("fr", "de", "ar");
    }
}
