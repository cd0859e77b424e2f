package ai.svgtranslate.config;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable runtime configuration assembled from CLI arguments and environment values.
 */
public record Config(
        Mode mode,
        List<Path> inputs,
        List<Path> mappingFiles,
        Optional<Path> source,
        Optional<Path> outputDir,
        Optional<Path> outputFile,
        Optional<Path> dataOutput,
        boolean overwrite,
        boolean caseInsensitive,
        int parallelism,
        LogFormat logFormat
) {

    public Config {
        Objects.requireNonNull(mode, "mode");
        inputs = List.copyOf(Objects.requireNonNull(inputs, "inputs"));
        mappingFiles = mappingFiles == null ? List.of() : List.copyOf(mappingFiles);
        source = source == null ? Optional.empty() : source;
        outputDir = outputDir == null ? Optional.empty() : outputDir;
        outputFile = outputFile == null ? Optional.empty() : outputFile;
        dataOutput = dataOutput == null ? Optional.empty() : dataOutput;
        Objects.requireNonNull(logFormat, "logFormat");
        if (parallelism < 1) {
            throw new IllegalArgumentException("parallelism must be at least 1");
        }
        if (inputs.isEmpty()) {
            throw new IllegalArgumentException("at least one input file must be provided");
        }
        if (outputFile.isPresent() && inputs.size() > 1) {
            throw new IllegalArgumentException("--output-file requires a single input file");
        }
        switch (mode) {
            case EXTRACT -> {
                if (dataOutput.isEmpty()) {
                    throw new IllegalArgumentException("extract mode requires --data-output");
                }
            }
            case INJECT -> {
                if (mappingFiles.isEmpty()) {
                    throw new IllegalArgumentException("inject mode requires at least one --mapping file");
                }
            }
            case COPY -> {
                if (source.isEmpty()) {
                    throw new IllegalArgumentException("copy mode requires --source");
                }
            }
        }
    }
}
