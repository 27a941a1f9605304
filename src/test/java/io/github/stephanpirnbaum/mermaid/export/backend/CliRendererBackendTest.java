package io.github.stephanpirnbaum.mermaid.export.backend;

import io.github.stephanpirnbaum.mermaid.export.RenderFailureException;
import io.github.stephanpirnbaum.mermaid.export.model.ExportFormat;
import io.github.stephanpirnbaum.mermaid.export.model.MermaidTheme;
import io.github.stephanpirnbaum.mermaid.export.model.RenderOptions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;
import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link CliRendererBackend}, using shell scripts in place of the Mermaid CLI.
 */
class CliRendererBackendTest {

    @TempDir
    Path tempDir;

    @Test
    void buildArguments_withDefaultTheme_omitsThemeFlag() {
        CliRendererBackend backend = new CliRendererBackend();

        List<String> args = backend.buildArguments(Path.of("in.mmd"), Path.of("out.svg"), RenderOptions.defaults());

        assertThat(args).containsExactly("mmdc", "--input", "in.mmd", "--output", "out.svg",
                "--width", "800", "--height", "600", "--backgroundColor", "transparent");
    }

    @Test
    void buildArguments_withDarkPdf_addsThemeAndPdfFit() {
        CliRendererBackend backend = new CliRendererBackend("/opt/mmdc", Duration.ofSeconds(5));
        RenderOptions options = RenderOptions.builder()
                .format(ExportFormat.PDF)
                .theme(MermaidTheme.DARK)
                .backgroundColor("#ffffff")
                .build();

        List<String> args = backend.buildArguments(Path.of("in.mmd"), Path.of("out.pdf"), options);

        assertThat(args).startsWith("/opt/mmdc")
                .containsSubsequence("--theme", "dark")
                .containsSubsequence("--backgroundColor", "#ffffff")
                .endsWith("--pdfFit");
    }

    @Test
    void probe_withMissingCommand_returnsFalse() {
        CliRendererBackend backend = new CliRendererBackend(tempDir.resolve("does-not-exist").toString(), Duration.ofSeconds(5));

        assertThat(backend.probe()).isFalse();
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    void probe_withWorkingCommand_returnsTrue() throws IOException {
        CliRendererBackend backend = new CliRendererBackend(script("fake-mmdc", WRITING_SCRIPT), Duration.ofSeconds(5));

        assertThat(backend.probe()).isTrue();
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    void render_withWorkingCommand_returnsOutputFileContent() throws Exception {
        CliRendererBackend backend = new CliRendererBackend(script("fake-mmdc", WRITING_SCRIPT), Duration.ofSeconds(10));

        byte[] bytes = backend.render("graph TD\n  A --> B", RenderOptions.defaults());

        assertThat(new String(bytes, StandardCharsets.UTF_8)).isEqualTo("<svg>rendered</svg>");
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    void render_withFailingCommand_throwsWithProcessOutput() throws IOException {
        String failing = "#!/bin/sh\necho 'Parse error on line 2'\nexit 1\n";
        CliRendererBackend backend = new CliRendererBackend(script("failing-mmdc", failing), Duration.ofSeconds(10));

        assertThatThrownBy(() -> backend.render("graph TD\n  A -->", RenderOptions.defaults()))
                .isInstanceOf(RenderFailureException.class)
                .hasMessageContaining("exit code 1")
                .hasMessageContaining("Parse error on line 2");
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    void render_withoutOutputFile_throws() throws IOException {
        String silent = "#!/bin/sh\nexit 0\n";
        CliRendererBackend backend = new CliRendererBackend(script("silent-mmdc", silent), Duration.ofSeconds(10));

        assertThatThrownBy(() -> backend.render("graph TD\n  A --> B", RenderOptions.defaults()))
                .isInstanceOf(RenderFailureException.class)
                .hasMessageContaining("did not produce an output file");
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    void render_exceedingTimeout_throws() throws IOException {
        String slow = "#!/bin/sh\nsleep 10\n";
        CliRendererBackend backend = new CliRendererBackend(script("slow-mmdc", slow), Duration.ofMillis(300));

        assertThatThrownBy(() -> backend.render("graph TD\n  A --> B", RenderOptions.defaults()))
                .isInstanceOf(RenderFailureException.class)
                .hasMessageContaining("timed out");
    }

    private static final String WRITING_SCRIPT = "#!/bin/sh\n"
            + "if [ \"$1\" = \"--version\" ]; then echo '10.9.1'; exit 0; fi\n"
            + "out=''\n"
            + "while [ $# -gt 0 ]; do\n"
            + "  if [ \"$1\" = \"--output\" ]; then out=\"$2\"; shift; fi\n"
            + "  shift\n"
            + "done\n"
            + "printf '<svg>rendered</svg>' > \"$out\"\n";

    private String script(String name, String content) throws IOException {
        Path script = tempDir.resolve(name);
        Files.writeString(script, content);
        Files.setPosixFilePermissions(script, PosixFilePermissions.fromString("rwxr-xr-x"));
        return script.toString();
    }

}
