package ai.svgtranslate.batch;

import ai.svgtranslate.inject.InjectionStats;
import ai.svgtranslate.prepare.StructureError;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Aggregate of a batch run. Outcomes are keyed by the source path as given.
 */
public record BatchResult(int saved,
                          int notSaved,
                          int nestedErrors,
                          int noChanges,
                          int notStarted,
                          InjectionStats stats,
                          Map<String, DocumentOutcome> documents,
                          Map<String, List<Path>> errors) {

    public BatchResult {
        documents = Collections.unmodifiableMap(new LinkedHashMap<>(documents));
        Map<String, List<Path>> copy = new LinkedHashMap<>();
        errors.forEach((code, paths) -> copy.put(code, List.copyOf(paths)));
        errors = Collections.unmodifiableMap(copy);
    }

    static BatchResult of(List<Path> order, Map<Path, DocumentOutcome> outcomes) {
        int saved = 0;
        int notSaved = 0;
        int nested = 0;
        int unchanged = 0;
        int notStarted = 0;
        InjectionStats total = InjectionStats.empty();
        Map<String, DocumentOutcome> documents = new LinkedHashMap<>();
        Map<String, List<Path>> errors = new LinkedHashMap<>();
        for (Path source : order) {
            DocumentOutcome outcome = outcomes.get(source);
            if (outcome == null) {
                notStarted++;
                continue;
            }
            documents.put(source.toString(), outcome);
            total = total.plus(outcome.stats());
            switch (outcome.status()) {
                case SAVED -> saved++;
                case NO_CHANGES -> unchanged++;
                case FAILED -> {
                    notSaved++;
                    String code = outcome.errorCode().orElse("unknown");
                    errors.computeIfAbsent(code, key -> new ArrayList<>()).add(source);
                    if (StructureError.NESTED_TSPANS_NOT_SUPPORTED.code().equals(code)) {
                        nested++;
                    }
                }
            }
        }
        return new BatchResult(saved, notSaved, nested, unchanged, notStarted, total, documents, errors);
    }
}
