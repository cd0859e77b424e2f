package ai.svgtranslate.writer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class DocumentWriterTest {

    @TempDir
    Path tempDir;

    @Test
    void writesDocumentAndCreatesDirectories() throws Exception {
        DocumentWriter writer = new DocumentWriter();
        Path target = tempDir.resolve("charts/population.svg");

        writer.write(target, "<svg>é</svg>");

        assertThat(Files.readString(target, StandardCharsets.UTF_8)).isEqualTo("<svg>é</svg>");
    }

    @Test
    void replacesExistingFileWithoutLeavingTemporaryFiles() throws Exception {
        DocumentWriter writer = new DocumentWriter();
        Path target = tempDir.resolve("population.svg");
        Files.writeString(target, "old");

        writer.write(target, "new");

        assertThat(Files.readString(target)).isEqualTo("new");
        try (Stream<Path> files = Files.list(tempDir)) {
            assertThat(files).containsExactly(target);
        }
    }

    @Test
    void reportsFailuresAsUncheckedIoException() throws Exception {
        Path blocker = tempDir.resolve("blocker");
        Files.writeString(blocker, "not a directory");

        assertThatThrownBy(() -> new DocumentWriter().write(blocker.resolve("population.svg"), "x"))
                .isInstanceOf(UncheckedIOException.class);
    }

    @Test
    void rejectsMissingArguments() {
        assertThatThrownBy(() -> new DocumentWriter().write(tempDir.resolve("a.svg"), (String) null))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
