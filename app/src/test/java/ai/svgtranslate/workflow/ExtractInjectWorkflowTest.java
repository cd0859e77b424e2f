package ai.svgtranslate.workflow;

import static ai.svgtranslate.svg.SvgTestSupport.svg;
import static org.assertj.core.api.Assertions.assertThat;

import ai.svgtranslate.inject.InjectionOptions;
import ai.svgtranslate.inject.InjectionResult;
import ai.svgtranslate.mapping.MappingStore;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ExtractInjectWorkflowTest {

    private static final String TRANSLATED_SOURCE = svg("<switch>"
            + "<text id=\"trsvg2-fr\" systemLanguage=\"fr\"><tspan id=\"trsvg1-fr\">Bonjour</tspan></text>"
            + "<text id=\"trsvg2\"><tspan id=\"trsvg1\">Hello</tspan></text>"
            + "</switch>");

    @TempDir
    Path tempDir;

    private final ExtractInjectWorkflow workflow = new ExtractInjectWorkflow();

    @Test
    void copiesTranslationsIntoTarget() throws Exception {
        Path source = write("source.svg", TRANSLATED_SOURCE);
        Path target = write("target.svg", svg("<text>Hello</text>"));
        Path data = tempDir.resolve("data/mapping.json");
        WorkflowOptions options = new WorkflowOptions(InjectionOptions.defaults(), Optional.empty(), Optional.empty(),
                Optional.of(data));

        Optional<InjectionResult> result = workflow.run(source, target, options);

        assertThat(result).isPresent();
        assertThat(result.get().stats().insertedTranslations()).isEqualTo(1);
        assertThat(Files.readString(target)).contains("systemLanguage=\"fr\"", "Bonjour");
        assertThat(new MappingStore().load(data).translations().lookup("hello", false)).contains(Map.of("fr", "Bonjour"));
    }

    @Test
    void writesToOutputFileWhenGiven() throws Exception {
        Path source = write("source.svg", TRANSLATED_SOURCE);
        String original = svg("<text>Hello</text>");
        Path target = write("target.svg", original);
        Path output = tempDir.resolve("translated/target.svg");
        WorkflowOptions options = new WorkflowOptions(InjectionOptions.defaults(), Optional.empty(), Optional.of(output),
                Optional.empty());

        workflow.run(source, target, options);

        assertThat(Files.readString(output)).contains("Bonjour");
        assertThat(Files.readString(target)).isEqualTo(original);
    }

    @Test
    void returnsEmptyWhenSourceCannotBeRead() throws Exception {
        Path target = write("target.svg", svg("<text>Hello</text>"));

        Optional<InjectionResult> result = workflow.run(tempDir.resolve("missing.svg"), target,
                WorkflowOptions.inPlace(InjectionOptions.defaults()));

        assertThat(result).isEmpty();
    }

    @Test
    void returnsEmptyWhenTargetHasUnsupportedStructure() throws Exception {
        Path source = write("source.svg", TRANSLATED_SOURCE);
        Path target = write("target.svg", svg("<text><tref href=\"#a\"/></text>"));

        assertThat(workflow.run(source, target, WorkflowOptions.inPlace(InjectionOptions.defaults()))).isEmpty();
    }

    private Path write(String name, String content) throws Exception {
        Path file = tempDir.resolve(name);
        Files.writeString(file, content, StandardCharsets.UTF_8);
        return file;
    }
}
