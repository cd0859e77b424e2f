package ai.svgtranslate.batch;

import ai.svgtranslate.inject.InjectionStats;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * What happened to one document of a batch.
 */
public record DocumentOutcome(Path source, Status status, Optional<Path> target, InjectionStats stats, Optional<String> errorCode) {

    public enum Status {
        SAVED,
        NO_CHANGES,
        FAILED
    }

    public DocumentOutcome {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(status, "status");
        target = target == null ? Optional.empty() : target;
        Objects.requireNonNull(stats, "stats");
        errorCode = errorCode == null ? Optional.empty() : errorCode;
    }

    static DocumentOutcome saved(Path source, Path target, InjectionStats stats) {
        return new DocumentOutcome(source, Status.SAVED, Optional.of(target), stats, Optional.empty());
    }

    static DocumentOutcome unchanged(Path source, InjectionStats stats) {
        return new DocumentOutcome(source, Status.NO_CHANGES, Optional.empty(), stats, Optional.empty());
    }

    static DocumentOutcome failed(Path source, String errorCode, InjectionStats stats) {
        return new DocumentOutcome(source, Status.FAILED, Optional.empty(), stats, Optional.of(errorCode));
    }
}
