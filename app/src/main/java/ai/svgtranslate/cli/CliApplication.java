package ai.svgtranslate.cli;

import ai.svgtranslate.batch.BatchInjectionService;
import ai.svgtranslate.batch.BatchOptions;
import ai.svgtranslate.batch.BatchResult;
import ai.svgtranslate.config.Config;
import ai.svgtranslate.config.ConfigLoader;
import ai.svgtranslate.config.SystemEnvironmentReader;
import ai.svgtranslate.inject.InjectionOptions;
import ai.svgtranslate.inject.InjectionResult;
import ai.svgtranslate.logging.LoggingConfigurator;
import ai.svgtranslate.mapping.MappingBundle;
import ai.svgtranslate.mapping.MappingStore;
import ai.svgtranslate.mapping.MergePolicy;
import ai.svgtranslate.prepare.SvgStructureException;
import ai.svgtranslate.svg.SvgParseException;
import ai.svgtranslate.workflow.ExtractInjectWorkflow;
import ai.svgtranslate.workflow.WorkflowOptions;
import java.nio.file.Path;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

/**
 * Entry point wiring the command-line parser, configuration loader and the three modes.
 */
public final class CliApplication {

    private static final Logger LOGGER = LoggerFactory.getLogger(CliApplication.class);

    static final int EXIT_OK = 0;
    static final int EXIT_DOCUMENT_FAILURES = 1;

    private final ConfigLoader configLoader;
    private final MappingStore mappingStore;
    private final ExtractInjectWorkflow workflow;

    public CliApplication() {
        this(new ConfigLoader(new SystemEnvironmentReader()), new MappingStore(), new ExtractInjectWorkflow());
    }

    CliApplication(ConfigLoader configLoader, MappingStore mappingStore, ExtractInjectWorkflow workflow) {
        this.configLoader = configLoader;
        this.mappingStore = mappingStore;
        this.workflow = workflow;
    }

    public static void main(String[] args) {
        System.exit(new CliApplication().run(args));
    }

    public int run(String[] args) {
        CliArguments cliArguments = new CliArguments();
        CommandLine commandLine = new CommandLine(cliArguments);

        try {
            commandLine.parseArgs(args);
        } catch (CommandLine.ParameterException ex) {
            commandLine.getErr().println(ex.getMessage());
            commandLine.usage(commandLine.getErr());
            return commandLine.getCommandSpec().exitCodeOnInvalidInput();
        }

        if (commandLine.isUsageHelpRequested()) {
            commandLine.usage(commandLine.getOut());
            return commandLine.getCommandSpec().exitCodeOnUsageHelp();
        }
        if (commandLine.isVersionHelpRequested()) {
            commandLine.printVersionHelp(commandLine.getOut());
            return commandLine.getCommandSpec().exitCodeOnVersionHelp();
        }

        Config config;
        try {
            config = configLoader.load(cliArguments);
        } catch (IllegalArgumentException ex) {
            commandLine.getErr().println(ex.getMessage());
            return commandLine.getCommandSpec().exitCodeOnInvalidInput();
        }
        LoggingConfigurator.configure(config.logFormat());
        LOGGER.info("Running in {} mode on {} file(s)", config.mode().label(), config.inputs().size());

        return switch (config.mode()) {
            case EXTRACT -> extract(config);
            case INJECT -> inject(config);
            case COPY -> copy(config);
        };
    }

    private int extract(Config config) {
        MappingBundle bundle = MappingBundle.empty();
        int failures = 0;
        for (Path input : config.inputs()) {
            try {
                bundle = bundle.merge(workflow.extract(input, config.caseInsensitive()), MergePolicy.FIRST_WINS);
            } catch (SvgParseException | SvgStructureException ex) {
                LOGGER.warn("Cannot extract translations from {}: {}", input, ex.getMessage());
                failures++;
            }
        }
        Path dataOutput = config.dataOutput().orElseThrow();
        mappingStore.write(dataOutput, bundle);
        LOGGER.info("Wrote {} translations and {} titles to {}",
                bundle.translations().size(), bundle.titles().entries().size(), dataOutput);
        return failures == 0 ? EXIT_OK : EXIT_DOCUMENT_FAILURES;
    }

    private int inject(Config config) {
        MappingBundle bundle = mappingStore.load(config.mappingFiles());
        if (bundle.isEmpty()) {
            LOGGER.warn("No translations loaded from {}", config.mappingFiles());
        }
        BatchOptions options = new BatchOptions(injectionOptions(config), config.outputDir(), config.outputFile(),
                config.parallelism());
        BatchResult result = new BatchInjectionService(options).run(config.inputs(), bundle);
        result.errors().forEach((code, paths) -> LOGGER.warn("{}: {}", code, paths));
        LOGGER.info("Totals: {}", result.stats());
        return result.notSaved() == 0 ? EXIT_OK : EXIT_DOCUMENT_FAILURES;
    }

    private int copy(Config config) {
        Path source = config.source().orElseThrow();
        WorkflowOptions options = new WorkflowOptions(injectionOptions(config), config.outputDir(), config.outputFile(),
                config.dataOutput());
        int failures = 0;
        for (Path input : config.inputs()) {
            Optional<InjectionResult> result = workflow.run(source, input, options);
            if (result.isEmpty()) {
                failures++;
            }
        }
        return failures == 0 ? EXIT_OK : EXIT_DOCUMENT_FAILURES;
    }

    private static InjectionOptions injectionOptions(Config config) {
        return new InjectionOptions(config.overwrite(), config.caseInsensitive());
    }
}
