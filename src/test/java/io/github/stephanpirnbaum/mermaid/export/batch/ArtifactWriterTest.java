package io.github.stephanpirnbaum.mermaid.export.batch;

import io.github.stephanpirnbaum.mermaid.export.ExportErrorKind;
import io.github.stephanpirnbaum.mermaid.export.ExportFileSystemException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link ArtifactWriter}.
 */
class ArtifactWriterTest {

    @TempDir
    Path tempDir;

    private final ArtifactWriter writer = new ArtifactWriter();

    @Test
    void write_createsMissingDirectories() throws Exception {
        Path target = tempDir.resolve("a/b/diagram-01-0badc0de.svg");

        writer.write(target, "<svg/>".getBytes(StandardCharsets.UTF_8));

        assertThat(target).hasContent("<svg/>");
    }

    @Test
    void write_replacesExistingFileWithoutLeavingTemporaryFiles() throws Exception {
        Path target = tempDir.resolve("diagram1.svg");
        Files.writeString(target, "old");

        writer.write(target, "new".getBytes(StandardCharsets.UTF_8));

        assertThat(target).hasContent("new");
        try (Stream<Path> files = Files.list(tempDir)) {
            assertThat(files).containsExactly(target);
        }
    }

    @Test
    void write_withFileInPlaceOfDirectory_throwsFileSystemError() throws Exception {
        Path blocker = tempDir.resolve("blocker");
        Files.writeString(blocker, "not a directory");

        assertThatThrownBy(() -> writer.write(blocker.resolve("diagram.svg"), new byte[]{1}))
                .isInstanceOf(ExportFileSystemException.class)
                .satisfies(e -> assertThat(((ExportFileSystemException) e).getKind()).isEqualTo(ExportErrorKind.FILE_SYSTEM));
    }

}
