package ai.svgtranslate.mapping;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads and writes mapping files of the form
 * {@code {"new": {text: {lang: translation}}, "title": {text: {lang: translation}}}}.
 */
public class MappingStore {

    private static final Logger LOGGER = LoggerFactory.getLogger(MappingStore.class);

    static final String TRANSLATIONS_FIELD = "new";
    static final String TITLES_FIELD = "title";

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT);

    /**
     * Merges every readable file into one bundle, earlier files winning on conflicts. Missing or
     * malformed files are logged and skipped.
     */
    public MappingBundle load(List<Path> files) {
        MappingBundle bundle = MappingBundle.empty();
        for (Path file : files) {
            bundle = bundle.merge(load(file), MergePolicy.FIRST_WINS);
        }
        return bundle;
    }

    public MappingBundle load(Path file) {
        JsonNode root;
        try {
            root = MAPPER.readTree(Files.readAllBytes(file));
        } catch (NoSuchFileException ex) {
            LOGGER.warn("Mapping file not found: {}", file);
            return MappingBundle.empty();
        } catch (IOException ex) {
            LOGGER.warn("Ignoring unreadable mapping file {}: {}", file, ex.getMessage());
            return MappingBundle.empty();
        }
        if (root == null || !root.isObject()) {
            LOGGER.warn("Ignoring mapping file {} without a JSON object at the top level", file);
            return MappingBundle.empty();
        }
        TranslationMapping translations = section(root.get(TRANSLATIONS_FIELD));
        TitleMapping titles = new TitleMapping(section(root.get(TITLES_FIELD)));
        LOGGER.debug("Loaded {} translations and {} titles from {}", translations.size(), titles.entries().size(), file);
        return new MappingBundle(translations, titles);
    }

    public void write(Path file, MappingBundle bundle) {
        ObjectNode root = MAPPER.createObjectNode();
        root.set(TRANSLATIONS_FIELD, toJson(bundle.translations()));
        root.set(TITLES_FIELD, toJson(bundle.titles().entries()));
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            MAPPER.writeValue(file.toFile(), root);
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to write mapping file: " + file, ex);
        }
    }

    private TranslationMapping section(JsonNode node) {
        if (node == null || !node.isObject()) {
            return TranslationMapping.empty();
        }
        TranslationMapping.Builder builder = TranslationMapping.builder();
        Iterator<Map.Entry<String, JsonNode>> texts = node.fields();
        while (texts.hasNext()) {
            Map.Entry<String, JsonNode> text = texts.next();
            if (!text.getValue().isObject()) {
                continue;
            }
            Iterator<Map.Entry<String, JsonNode>> languages = text.getValue().fields();
            while (languages.hasNext()) {
                Map.Entry<String, JsonNode> language = languages.next();
                if (language.getValue().isTextual()) {
                    builder.put(text.getKey(), language.getKey(), language.getValue().asText());
                }
            }
        }
        return builder.build();
    }

    private ObjectNode toJson(TranslationMapping mapping) {
        ObjectNode section = MAPPER.createObjectNode();
        mapping.asMap().forEach((text, translations) -> {
            ObjectNode languages = section.putObject(text);
            translations.forEach(languages::put);
        });
        return section;
    }
}
