package ai.svgtranslate.config;

import ai.svgtranslate.cli.CliArguments;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Builds a {@link Config} from CLI arguments, falling back to environment variables and defaults.
 */
public class ConfigLoader {

    static final String ENV_MODE = "SVG_TRANSLATE_MODE";
    static final String ENV_MAPPING_FILES = "SVG_TRANSLATE_MAPPING_FILES";
    static final String ENV_OUTPUT_DIR = "SVG_TRANSLATE_OUTPUT_DIR";
    static final String ENV_OVERWRITE = "SVG_TRANSLATE_OVERWRITE";
    static final String ENV_CASE_SENSITIVE = "SVG_TRANSLATE_CASE_SENSITIVE";
    static final String ENV_PARALLELISM = "SVG_TRANSLATE_PARALLELISM";
    static final String ENV_LOG_FORMAT = "LOG_FORMAT";

    private static final int DEFAULT_PARALLELISM = 1;

    private final EnvironmentReader environmentReader;

    public ConfigLoader(EnvironmentReader environmentReader) {
        this.environmentReader = Objects.requireNonNull(environmentReader, "environmentReader");
    }

    public Config load(CliArguments arguments) {
        Objects.requireNonNull(arguments, "arguments");
        Mode mode = resolveMode(arguments);
        List<Path> mappingFiles = resolveMappingFiles(arguments);
        Optional<Path> outputDir = Optional.ofNullable(arguments.outputDir())
                .or(() -> environmentReader.get(ENV_OUTPUT_DIR).filter(ConfigLoader::isNotBlank).map(String::trim).map(Path::of));
        boolean overwrite = arguments.overwrite() || flag(ENV_OVERWRITE);
        boolean caseSensitive = arguments.caseSensitive() || flag(ENV_CASE_SENSITIVE);

        return new Config(mode,
                arguments.inputs(),
                mappingFiles,
                Optional.ofNullable(arguments.source()),
                outputDir,
                Optional.ofNullable(arguments.outputFile()),
                Optional.ofNullable(arguments.dataOutput()),
                overwrite,
                !caseSensitive,
                resolveParallelism(arguments),
                resolveLogFormat(arguments));
    }

    private Mode resolveMode(CliArguments arguments) {
        Mode cliMode = arguments.mode();
        if (cliMode != null) {
            return cliMode;
        }
        return environmentReader.get(ENV_MODE)
                .map(Mode::from)
                .orElse(Mode.INJECT);
    }

    private List<Path> resolveMappingFiles(CliArguments arguments) {
        if (!arguments.mappingFiles().isEmpty()) {
            return arguments.mappingFiles();
        }
        return environmentReader.get(ENV_MAPPING_FILES)
                .filter(ConfigLoader::isNotBlank)
                .map(ConfigLoader::parsePaths)
                .orElse(List.of());
    }

    private int resolveParallelism(CliArguments arguments) {
        Integer cliValue = arguments.parallelism();
        if (cliValue != null) {
            if (cliValue < 1) {
                throw new IllegalArgumentException("--parallelism must be at least 1");
            }
            return cliValue;
        }
        return environmentReader.get(ENV_PARALLELISM)
                .filter(ConfigLoader::isNotBlank)
                .map(String::trim)
                .map(ConfigLoader::parseParallelism)
                .orElse(DEFAULT_PARALLELISM);
    }

    private LogFormat resolveLogFormat(CliArguments arguments) {
        LogFormat cliFormat = arguments.logFormat();
        if (cliFormat != null) {
            return cliFormat;
        }
        return environmentReader.get(ENV_LOG_FORMAT)
                .filter(ConfigLoader::isNotBlank)
                .map(LogFormat::from)
                .orElse(LogFormat.TEXT);
    }

    private boolean flag(String key) {
        return environmentReader.get(key)
                .map(String::trim)
                .map(value -> value.equalsIgnoreCase("true") || value.equals("1"))
                .orElse(false);
    }

    private static int parseParallelism(String raw) {
        try {
            int value = Integer.parseInt(raw);
            if (value < 1) {
                throw new IllegalArgumentException(ENV_PARALLELISM + " must be at least 1");
            }
            return value;
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException(ENV_PARALLELISM + " must be an integer", ex);
        }
    }

    private static List<Path> parsePaths(String raw) {
        return Arrays.stream(raw.split(","))
                .map(String::trim)
                .filter(ConfigLoader::isNotBlank)
                .map(Path::of)
                .collect(Collectors.toList());
    }

    private static boolean isNotBlank(String value) {
        return value != null && !value.isBlank();
    }
}
