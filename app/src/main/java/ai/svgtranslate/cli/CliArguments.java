package ai.svgtranslate.cli;

import ai.svgtranslate.config.LogFormat;
import ai.svgtranslate.config.Mode;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import picocli.CommandLine;

@CommandLine.Command(name = "svg-translate", mixinStandardHelpOptions = true,
        description = "Extracts, injects and copies translations of multilingual SVG files")
public class CliArguments {

    @CommandLine.Parameters(description = "SVG files to process", paramLabel = "FILE")
    private List<Path> inputs = new ArrayList<>();

    @CommandLine.Option(names = "--mode", converter = ModeConverter.class, description = "Execution mode: extract, inject or copy (default: inject)")
    private Mode mode;

    @CommandLine.Option(names = "--mapping", description = "Mapping JSON file, may be repeated", paramLabel = "FILE")
    private List<Path> mappingFiles = new ArrayList<>();

    @CommandLine.Option(names = "--source", description = "SVG whose translations are copied (copy mode)", paramLabel = "FILE")
    private Path source;

    @CommandLine.Option(names = "--output-dir", description = "Directory receiving the translated files", paramLabel = "DIR")
    private Path outputDir;

    @CommandLine.Option(names = "--output-file", description = "Target file for a single input", paramLabel = "FILE")
    private Path outputFile;

    @CommandLine.Option(names = "--data-output", description = "Where extracted translations are written as JSON", paramLabel = "FILE")
    private Path dataOutput;

    @CommandLine.Option(names = "--overwrite", description = "Replace translations that already exist")
    private boolean overwrite;

    @CommandLine.Option(names = "--case-sensitive", description = "Match texts case-sensitively")
    private boolean caseSensitive;

    @CommandLine.Option(names = "--parallelism", description = "Number of files processed concurrently", paramLabel = "COUNT")
    private Integer parallelism;

    @CommandLine.Option(names = "--log-format", description = "Log format: text or json", converter = LogFormatConverter.class)
    private LogFormat logFormat;

    public List<Path> inputs() {
        return inputs;
    }

    public Mode mode() {
        return mode;
    }

    public List<Path> mappingFiles() {
        return mappingFiles;
    }

    public Path source() {
        return source;
    }

    public Path outputDir() {
        return outputDir;
    }

    public Path outputFile() {
        return outputFile;
    }

    public Path dataOutput() {
        return dataOutput;
    }

    public boolean overwrite() {
        return overwrite;
    }

    public boolean caseSensitive() {
        return caseSensitive;
    }

    public Integer parallelism() {
        return parallelism;
    }

    public LogFormat logFormat() {
        return logFormat;
    }
}
