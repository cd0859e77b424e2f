package ai.svgtranslate.workflow;

import ai.svgtranslate.inject.InjectionOptions;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * @param dataOutput where the translations extracted from the source are saved, if anywhere
 */
public record WorkflowOptions(InjectionOptions injection, Optional<Path> outputDir, Optional<Path> outputFile, Optional<Path> dataOutput) {

    public WorkflowOptions {
        Objects.requireNonNull(injection, "injection");
        outputDir = outputDir == null ? Optional.empty() : outputDir;
        outputFile = outputFile == null ? Optional.empty() : outputFile;
        dataOutput = dataOutput == null ? Optional.empty() : dataOutput;
    }

    public static WorkflowOptions inPlace(InjectionOptions injection) {
        return new WorkflowOptions(injection, Optional.empty(), Optional.empty(), Optional.empty());
    }
}
