package ai.svgtranslate.extract;

import static ai.svgtranslate.svg.SvgDocuments.attribute;
import static ai.svgtranslate.svg.SvgDocuments.childElements;

import ai.svgtranslate.mapping.MappingBundle;
import ai.svgtranslate.mapping.MergePolicy;
import ai.svgtranslate.mapping.TitleMapping;
import ai.svgtranslate.mapping.TranslationMapping;
import ai.svgtranslate.prepare.SwitchOrdering;
import ai.svgtranslate.svg.SvgDocuments;
import ai.svgtranslate.svg.SvgNames;
import ai.svgtranslate.text.TextNormalizer;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

/**
 * Collects the translations already present in a prepared document. A translated span is paired
 * with its fallback span through the id it was cloned from ({@code trsvg7-fr} belongs to
 * {@code trsvg7}).
 */
public class TranslationExtractor {

    private static final Logger LOGGER = LoggerFactory.getLogger(TranslationExtractor.class);

    public MappingBundle extract(Document document, boolean caseInsensitive) {
        TranslationMapping.Builder builder = TranslationMapping.builder(MergePolicy.LAST_WINS);
        int switches = 0;
        for (Element switchElement : SvgDocuments.descendants(document, SvgNames.SWITCH)) {
            Optional<Element> fallback = childElements(switchElement, SvgNames.TEXT).stream()
                    .filter(SwitchOrdering::isFallback)
                    .findFirst();
            if (fallback.isEmpty()) {
                continue;
            }
            FallbackSpans spans = FallbackSpans.of(fallback.get());
            if (spans.isEmpty()) {
                continue;
            }
            switches++;
            for (Element text : childElements(switchElement, SvgNames.TEXT)) {
                if (SwitchOrdering.isFallback(text)) {
                    continue;
                }
                String language = text.getAttribute(SvgNames.ATTR_SYSTEM_LANGUAGE);
                for (Element span : childElements(text, SvgNames.TSPAN)) {
                    String translation = TextNormalizer.normalize(span.getTextContent());
                    if (translation.isEmpty()) {
                        continue;
                    }
                    spans.resolve(attribute(span, SvgNames.ATTR_ID), language).ifPresent(source ->
                            builder.put(TextNormalizer.normalize(source, caseInsensitive), language, translation));
                }
            }
        }
        TranslationMapping translations = builder.build();
        LOGGER.debug("Extracted {} translations from {} switches", translations.size(), switches);
        return new MappingBundle(translations, TitleMapping.liftYears(translations));
    }

    private static final class FallbackSpans {

        private final Map<String, String> byId = new HashMap<>();
        private final Map<String, String> byFoldedId = new HashMap<>();

        static FallbackSpans of(Element fallback) {
            FallbackSpans spans = new FallbackSpans();
            for (Element span : childElements(fallback, SvgNames.TSPAN)) {
                String id = attribute(span, SvgNames.ATTR_ID);
                String text = TextNormalizer.normalize(span.getTextContent());
                if (id == null || text.isEmpty()) {
                    continue;
                }
                spans.byId.putIfAbsent(id, text);
                spans.byFoldedId.putIfAbsent(TextNormalizer.fold(id), text);
            }
            return spans;
        }

        boolean isEmpty() {
            return byId.isEmpty();
        }

        Optional<String> resolve(String spanId, String language) {
            if (spanId == null) {
                return Optional.empty();
            }
            int dash = spanId.indexOf('-');
            String base = (dash < 0 ? spanId : spanId.substring(0, dash)).strip();
            Optional<String> found = find(base);
            String suffix = "-" + language;
            if (found.isEmpty() && spanId.endsWith(suffix)) {
                // custom ids may contain dashes of their own
                found = find(spanId.substring(0, spanId.length() - suffix.length()));
            }
            return found;
        }

        private Optional<String> find(String id) {
            String text = byId.get(id);
            if (text == null) {
                text = byFoldedId.get(TextNormalizer.fold(id));
            }
            return Optional.ofNullable(text);
        }
    }
}
