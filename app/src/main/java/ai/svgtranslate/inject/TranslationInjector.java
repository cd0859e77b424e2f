package ai.svgtranslate.inject;

import static ai.svgtranslate.svg.SvgDocuments.attribute;
import static ai.svgtranslate.svg.SvgDocuments.childElements;

import ai.svgtranslate.mapping.MappingBundle;
import ai.svgtranslate.mapping.TitleExpander;
import ai.svgtranslate.mapping.TranslationMapping;
import ai.svgtranslate.prepare.SwitchOrdering;
import ai.svgtranslate.prepare.TranslationPreparer;
import ai.svgtranslate.prepare.UniqueIdGenerator;
import ai.svgtranslate.svg.SvgDocuments;
import ai.svgtranslate.svg.SvgNames;
import ai.svgtranslate.text.LanguageTags;
import ai.svgtranslate.text.TextNormalizer;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

/**
 * Adds the translations of a {@link MappingBundle} to every switch whose fallback text is known.
 *
 * <p>The document is prepared first, so the caller's document is left untouched and structural
 * problems surface as {@link ai.svgtranslate.prepare.SvgStructureException}.
 */
public class TranslationInjector {

    private static final Logger LOGGER = LoggerFactory.getLogger(TranslationInjector.class);

    private final TranslationPreparer preparer;

    public TranslationInjector() {
        this(new TranslationPreparer());
    }

    public TranslationInjector(TranslationPreparer preparer) {
        this.preparer = Objects.requireNonNull(preparer, "preparer");
    }

    public InjectionResult inject(Document source, MappingBundle bundle, InjectionOptions options) {
        Objects.requireNonNull(bundle, "bundle");
        Objects.requireNonNull(options, "options");
        Document document = preparer.prepare(source);
        Run run = new Run(document, bundle, options);
        for (Element switchElement : SvgDocuments.descendants(document, SvgNames.SWITCH)) {
            run.process(switchElement);
        }
        InjectionStats stats = run.stats();
        LOGGER.debug("Injection finished: {}", stats);
        return new InjectionResult(document, stats);
    }

    /** Per-document state of one injection. */
    private static final class Run {

        private final MappingBundle bundle;
        private final InjectionOptions options;
        private final UniqueIdGenerator ids;
        private final Set<String> documentLanguages = new HashSet<>();

        private int processed;
        private int inserted;
        private int updated;
        private int skipped;
        private int newLanguages;

        Run(Document document, MappingBundle bundle, InjectionOptions options) {
            this.bundle = bundle;
            this.options = options;
            this.ids = UniqueIdGenerator.forDocument(document);
            for (Element text : SvgDocuments.descendants(document, SvgNames.TEXT)) {
                if (!SwitchOrdering.isFallback(text)) {
                    documentLanguages.add(SwitchOrdering.tag(text));
                }
            }
        }

        void process(Element switchElement) {
            Optional<Element> fallback = childElements(switchElement, SvgNames.TEXT).stream()
                    .filter(SwitchOrdering::isFallback)
                    .findFirst();
            if (fallback.isEmpty()) {
                return;
            }
            List<Element> spans = childElements(fallback.get(), SvgNames.TSPAN);
            List<Map<String, String>> translations = new ArrayList<>(spans.size());
            Set<String> languages = new LinkedHashSet<>();
            for (Element span : spans) {
                Map<String, String> found = translate(span.getTextContent());
                translations.add(found);
                languages.addAll(found.keySet());
            }
            if (languages.isEmpty()) {
                return;
            }
            processed++;
            for (String language : languages) {
                Optional<Element> existing = childElements(switchElement, SvgNames.TEXT).stream()
                        .filter(text -> language.equals(SwitchOrdering.tag(text)))
                        .findFirst();
                if (existing.isEmpty()) {
                    insert(switchElement, fallback.get(), language, translations);
                } else if (options.overwrite()) {
                    update(existing.get(), language, translations);
                } else {
                    skipped++;
                }
            }
            SwitchOrdering.reorder(switchElement);
        }

        /** Canonical language -> translation for the text of one fallback span. */
        private Map<String, String> translate(String spanText) {
            String key = TextNormalizer.normalize(spanText, options.caseInsensitive());
            Map<String, String> result = new LinkedHashMap<>();
            if (key.isEmpty()) {
                return result;
            }
            Optional<Map<String, String>> found = bundle.translations().lookup(key, options.caseInsensitive());
            if (found.isEmpty()) {
                TranslationMapping expanded = TitleExpander.expand(bundle.titles(), List.of(key), options.caseInsensitive());
                found = expanded.lookup(key, false);
            }
            found.ifPresent(values -> values.forEach((language, translation) -> {
                String tag = LanguageTags.normalize(language);
                if (!tag.isEmpty()) {
                    result.putIfAbsent(tag, translation);
                }
            }));
            return result;
        }

        private void insert(Element switchElement, Element fallback, String language, List<Map<String, String>> translations) {
            Element clone = (Element) fallback.cloneNode(true);
            clone.setAttribute(SvgNames.ATTR_SYSTEM_LANGUAGE, language);
            clone.setAttribute(SvgNames.ATTR_ID, ids.generate(attribute(fallback, SvgNames.ATTR_ID), language));
            List<Element> spans = childElements(clone, SvgNames.TSPAN);
            for (int i = 0; i < spans.size(); i++) {
                Element span = spans.get(i);
                span.setAttribute(SvgNames.ATTR_ID, ids.generate(attribute(span, SvgNames.ATTR_ID), language));
                String translation = translations.get(i).get(language);
                if (translation != null) {
                    span.setTextContent(translation);
                }
            }
            switchElement.appendChild(clone);
            inserted++;
            if (documentLanguages.add(language)) {
                newLanguages++;
            }
        }

        private void update(Element existing, String language, List<Map<String, String>> translations) {
            List<Element> spans = childElements(existing, SvgNames.TSPAN);
            int count = Math.min(spans.size(), translations.size());
            for (int i = 0; i < count; i++) {
                String translation = translations.get(i).get(language);
                if (translation != null) {
                    spans.get(i).setTextContent(translation);
                }
            }
            updated++;
        }

        InjectionStats stats() {
            return new InjectionStats(processed, inserted, updated, skipped, newLanguages, 0);
        }
    }
}
