package ai.svgtranslate.workflow;

import ai.svgtranslate.batch.TargetPathResolver;
import ai.svgtranslate.extract.TranslationExtractor;
import ai.svgtranslate.inject.InjectionResult;
import ai.svgtranslate.inject.TranslationInjector;
import ai.svgtranslate.mapping.MappingBundle;
import ai.svgtranslate.mapping.MappingStore;
import ai.svgtranslate.prepare.SvgStructureException;
import ai.svgtranslate.prepare.TranslationPreparer;
import ai.svgtranslate.svg.SvgDocuments;
import ai.svgtranslate.svg.SvgParseException;
import ai.svgtranslate.writer.DocumentWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Copies the translations of one SVG into another: extract from the source, inject into the target.
 */
public class ExtractInjectWorkflow {

    private static final Logger LOGGER = LoggerFactory.getLogger(ExtractInjectWorkflow.class);

    private final TranslationPreparer preparer;
    private final TranslationExtractor extractor;
    private final TranslationInjector injector;
    private final MappingStore mappingStore;
    private final DocumentWriter writer;

    public ExtractInjectWorkflow() {
        this(new TranslationPreparer(), new TranslationExtractor(), new MappingStore(), new DocumentWriter());
    }

    public ExtractInjectWorkflow(TranslationPreparer preparer,
                                 TranslationExtractor extractor,
                                 MappingStore mappingStore,
                                 DocumentWriter writer) {
        this.preparer = Objects.requireNonNull(preparer, "preparer");
        this.extractor = Objects.requireNonNull(extractor, "extractor");
        this.injector = new TranslationInjector(preparer);
        this.mappingStore = Objects.requireNonNull(mappingStore, "mappingStore");
        this.writer = Objects.requireNonNull(writer, "writer");
    }

    /**
     * Reads, prepares and extracts one document.
     *
     * @throws SvgParseException     when the file is missing or malformed
     * @throws SvgStructureException when the document cannot be prepared
     */
    public MappingBundle extract(Path source, boolean caseInsensitive) {
        return extractor.extract(preparer.prepare(SvgDocuments.read(source)), caseInsensitive);
    }

    public Optional<InjectionResult> run(Path source, Path target, WorkflowOptions options) {
        Objects.requireNonNull(options, "options");
        MappingBundle bundle;
        try {
            bundle = extract(source, options.injection().caseInsensitive());
        } catch (SvgParseException | SvgStructureException ex) {
            LOGGER.warn("Cannot extract translations from {}: {}", source, ex.getMessage());
            return Optional.empty();
        }
        if (bundle.translations().isEmpty()) {
            LOGGER.info("No translations found in {}", source);
        }
        options.dataOutput().ifPresent(file -> {
            mappingStore.write(file, bundle);
            LOGGER.info("Saved extracted translations to {}", file);
        });

        byte[] original;
        InjectionResult result;
        try {
            original = SvgDocuments.readBytes(target);
            result = injector.inject(SvgDocuments.parse(original), bundle, options.injection());
        } catch (SvgParseException | SvgStructureException ex) {
            LOGGER.warn("Cannot inject translations into {}: {}", target, ex.getMessage());
            return Optional.empty();
        }

        byte[] serialized = SvgDocuments.toXml(result.document()).getBytes(StandardCharsets.UTF_8);
        if (!result.stats().hasChanges() || Arrays.equals(serialized, original)) {
            LOGGER.info("{} already up to date", target);
        } else {
            Path output = TargetPathResolver.resolve(target, options.outputFile(), options.outputDir());
            writer.write(output, serialized);
            LOGGER.info("Saved {} ({} inserted, {} updated, {} skipped)", output,
                    result.stats().insertedTranslations(), result.stats().updatedTranslations(),
                    result.stats().skippedTranslations());
        }
        return Optional.of(result);
    }
}
