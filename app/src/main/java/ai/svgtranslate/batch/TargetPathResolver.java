package ai.svgtranslate.batch;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Chooses where a processed document is written: the explicit output file, else the output
 * directory with the source file name, else the source itself.
 */
public final class TargetPathResolver {

    private TargetPathResolver() {
    }

    public static Path resolve(Path source, Optional<Path> outputFile, Optional<Path> outputDir) {
        if (outputFile.isPresent()) {
            return outputFile.get();
        }
        if (outputDir.isPresent()) {
            return outputDir.get().resolve(source.getFileName());
        }
        return source;
    }
}
