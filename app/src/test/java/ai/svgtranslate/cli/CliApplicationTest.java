package ai.svgtranslate.cli;

import static ai.svgtranslate.svg.SvgTestSupport.svg;
import static org.assertj.core.api.Assertions.assertThat;

import ai.svgtranslate.config.ConfigLoader;
import ai.svgtranslate.mapping.MappingStore;
import ai.svgtranslate.workflow.ExtractInjectWorkflow;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CliApplicationTest {

    private static final String TRANSLATED = svg("<switch>"
            + "<text id=\"trsvg2-fr\" systemLanguage=\"fr\"><tspan id=\"trsvg1-fr\">Bonjour</tspan></text>"
            + "<text id=\"trsvg2\"><tspan id=\"trsvg1\">Hello</tspan></text>"
            + "</switch>");

    @TempDir
    Path tempDir;

    @Test
    void injectsMappingIntoInputs() throws Exception {
        Path mapping = write("mapping.json", "{\"new\": {\"hello\": {\"fr\": \"Bonjour\"}}}");
        Path chart = write("chart.svg", svg("<text>Hello</text>"));

        int exitCode = application().run(new String[] {"--mapping", mapping.toString(), chart.toString()});

        assertThat(exitCode).isEqualTo(CliApplication.EXIT_OK);
        assertThat(Files.readString(chart)).contains("Bonjour");
    }

    @Test
    void reportsDocumentFailuresThroughExitCode() throws Exception {
        Path mapping = write("mapping.json", "{\"new\": {\"hello\": {\"fr\": \"Bonjour\"}}}");

        int exitCode = application().run(new String[] {"--mapping", mapping.toString(),
                tempDir.resolve("missing.svg").toString()});

        assertThat(exitCode).isEqualTo(CliApplication.EXIT_DOCUMENT_FAILURES);
    }

    @Test
    void extractsTranslationsToDataFile() throws Exception {
        Path chart = write("chart.svg", TRANSLATED);
        Path data = tempDir.resolve("mapping.json");

        int exitCode = application().run(new String[] {"--mode", "extract", "--data-output", data.toString(),
                chart.toString()});

        assertThat(exitCode).isEqualTo(CliApplication.EXIT_OK);
        assertThat(new MappingStore().load(data).translations().lookup("hello", false)).contains(Map.of("fr", "Bonjour"));
    }

    @Test
    void copiesTranslationsFromSource() throws Exception {
        Path source = write("source.svg", TRANSLATED);
        Path chart = write("chart.svg", svg("<text>Hello</text>"));
        Path outputDir = tempDir.resolve("out");

        int exitCode = application().run(new String[] {"--mode", "copy", "--source", source.toString(),
                "--output-dir", outputDir.toString(), chart.toString()});

        assertThat(exitCode).isEqualTo(CliApplication.EXIT_OK);
        assertThat(Files.readString(outputDir.resolve("chart.svg"))).contains("Bonjour");
    }

    @Test
    void rejectsIncompleteConfiguration() {
        int exitCode = application().run(new String[] {"--mode", "copy", "chart.svg"});

        assertThat(exitCode).isEqualTo(2);
    }

    @Test
    void rejectsUnknownOptions() {
        assertThat(application().run(new String[] {"--bogus"})).isEqualTo(2);
    }

    private CliApplication application() {
        return new CliApplication(new ConfigLoader(key -> Optional.empty()), new MappingStore(), new ExtractInjectWorkflow());
    }

    private Path write(String name, String content) throws Exception {
        Path file = tempDir.resolve(name);
        Files.writeString(file, content, StandardCharsets.UTF_8);
        return file;
    }
}
