package ai.svgtranslate.inject;

import java.util.Objects;
import org.w3c.dom.Document;

/**
 * Injected document together with the counters of the run.
 */
public record InjectionResult(Document document, InjectionStats stats) {

    public InjectionResult {
        Objects.requireNonNull(document, "document");
        Objects.requireNonNull(stats, "stats");
    }
}
