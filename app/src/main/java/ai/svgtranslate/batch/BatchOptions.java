package ai.svgtranslate.batch;

import ai.svgtranslate.inject.InjectionOptions;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Settings shared by every document of a batch.
 */
public record BatchOptions(InjectionOptions injection, Optional<Path> outputDir, Optional<Path> outputFile, int parallelism) {

    public BatchOptions {
        Objects.requireNonNull(injection, "injection");
        outputDir = outputDir == null ? Optional.empty() : outputDir;
        outputFile = outputFile == null ? Optional.empty() : outputFile;
        if (parallelism < 1) {
            throw new IllegalArgumentException("parallelism must be at least 1");
        }
    }

    public static BatchOptions inPlace(InjectionOptions injection) {
        return new BatchOptions(injection, Optional.empty(), Optional.empty(), 1);
    }
}
