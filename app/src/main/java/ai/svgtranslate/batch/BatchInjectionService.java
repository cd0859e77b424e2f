package ai.svgtranslate.batch;

import ai.svgtranslate.inject.InjectionResult;
import ai.svgtranslate.inject.InjectionStats;
import ai.svgtranslate.inject.TranslationInjector;
import ai.svgtranslate.logging.LoggingConfigurator;
import ai.svgtranslate.mapping.MappingBundle;
import ai.svgtranslate.prepare.SvgStructureException;
import ai.svgtranslate.svg.SvgDocuments;
import ai.svgtranslate.svg.SvgParseException;
import ai.svgtranslate.writer.DocumentWriter;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Prepares and injects a mapping into many documents. A document is written back only when a
 * translation was inserted or updated and its serialization differs from the bytes read.
 */
public class BatchInjectionService {

    private static final Logger LOGGER = LoggerFactory.getLogger(BatchInjectionService.class);

    static final String WRITE_ERROR = "write-error";
    static final String UNEXPECTED_ERROR = "unexpected-error";

    private final TranslationInjector injector;
    private final DocumentWriter writer;
    private final BatchOptions options;
    private final AtomicBoolean cancelled = new AtomicBoolean();

    public BatchInjectionService(BatchOptions options) {
        this(new TranslationInjector(), new DocumentWriter(), options);
    }

    public BatchInjectionService(TranslationInjector injector, DocumentWriter writer, BatchOptions options) {
        this.injector = Objects.requireNonNull(injector, "injector");
        this.writer = Objects.requireNonNull(writer, "writer");
        this.options = Objects.requireNonNull(options, "options");
    }

    public BatchResult run(List<Path> sources, MappingBundle bundle) {
        Objects.requireNonNull(sources, "sources");
        Objects.requireNonNull(bundle, "bundle");
        Map<Path, DocumentOutcome> outcomes = new ConcurrentHashMap<>();
        AtomicInteger threadIndex = new AtomicInteger();
        ExecutorService pool = Executors.newFixedThreadPool(options.parallelism(), runnable -> {
            Thread thread = new Thread(runnable, "svg-batch-" + threadIndex.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
        try {
            List<Future<?>> futures = new ArrayList<>(sources.size());
            for (Path source : sources) {
                futures.add(pool.submit(() -> {
                    if (!cancelled.get()) {
                        outcomes.put(source, processWithContext(source, bundle));
                    }
                }));
            }
            awaitAll(futures);
        } finally {
            pool.shutdownNow();
        }
        BatchResult result = BatchResult.of(sources, outcomes);
        LOGGER.info("Batch finished: saved={} notSaved={} noChanges={} nested={} notStarted={}",
                result.saved(), result.notSaved(), result.noChanges(), result.nestedErrors(), result.notStarted());
        return result;
    }

    /**
     * Stops dispatching documents that have not started yet. Documents in progress complete.
     */
    public void cancel() {
        cancelled.set(true);
    }

    private DocumentOutcome processWithContext(Path source, MappingBundle bundle) {
        MDC.put(LoggingConfigurator.DOCUMENT_KEY, source.toString());
        try {
            return process(source, bundle);
        } finally {
            MDC.remove(LoggingConfigurator.DOCUMENT_KEY);
        }
    }

    DocumentOutcome process(Path source, MappingBundle bundle) {
        byte[] original;
        InjectionResult result;
        try {
            original = SvgDocuments.readBytes(source);
            result = injector.inject(SvgDocuments.parse(original), bundle, options.injection());
        } catch (SvgParseException ex) {
            LOGGER.warn("Skipping unreadable document: {}", ex.getMessage());
            return DocumentOutcome.failed(source, ex.code(), InjectionStats.empty());
        } catch (SvgStructureException ex) {
            LOGGER.warn("Skipping document with unsupported structure: {}", ex.getMessage());
            return DocumentOutcome.failed(source, ex.code(), InjectionStats.structuralError());
        } catch (RuntimeException ex) {
            LOGGER.error("Failed to process document", ex);
            return DocumentOutcome.failed(source, UNEXPECTED_ERROR, InjectionStats.empty());
        }

        byte[] serialized = SvgDocuments.toXml(result.document()).getBytes(StandardCharsets.UTF_8);
        Path target = TargetPathResolver.resolve(source, options.outputFile(), options.outputDir());
        if (!result.stats().hasChanges() || Arrays.equals(serialized, original)) {
            LOGGER.debug("No changes");
            return DocumentOutcome.unchanged(source, result.stats());
        }
        try {
            writer.write(target, serialized);
        } catch (UncheckedIOException ex) {
            LOGGER.error("Failed to save {}", target, ex);
            return DocumentOutcome.failed(source, WRITE_ERROR, result.stats());
        }
        LOGGER.info("Saved {} ({} inserted, {} updated)", target,
                result.stats().insertedTranslations(), result.stats().updatedTranslations());
        return DocumentOutcome.saved(source, target, result.stats());
    }

    private void awaitAll(List<Future<?>> futures) {
        for (Future<?> future : futures) {
            try {
                future.get();
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                cancel();
                throw new IllegalStateException("Interrupted while waiting for batch documents", ex);
            } catch (ExecutionException ex) {
                LOGGER.error("Batch task ended without an outcome", ex.getCause());
            }
        }
    }
}
