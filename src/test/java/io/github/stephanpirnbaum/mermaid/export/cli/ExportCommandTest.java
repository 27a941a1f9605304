package io.github.stephanpirnbaum.mermaid.export.cli;

import io.github.stephanpirnbaum.mermaid.export.MermaidExportService;
import io.github.stephanpirnbaum.mermaid.export.backend.FakeRendererBackend;
import io.github.stephanpirnbaum.mermaid.export.batch.BatchRequest;
import io.github.stephanpirnbaum.mermaid.export.config.ExportConfig;
import io.github.stephanpirnbaum.mermaid.export.model.ExportFormat;
import io.github.stephanpirnbaum.mermaid.export.model.MermaidTheme;
import io.github.stephanpirnbaum.mermaid.export.model.NamingMode;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link ExportCommand} and {@link BackendsCommand}.
 */
class ExportCommandTest {

    @TempDir
    Path root;

    private final FakeRendererBackend primary = FakeRendererBackend.primary();

    private final FakeRendererBackend fallback = FakeRendererBackend.fallback();

    private final StringWriter out = new StringWriter();

    private final StringWriter err = new StringWriter();

    @Test
    void export_withoutFailures_exitsWithZero() throws Exception {
        Files.writeString(root.resolve("a.mmd"), "graph TD");

        int exitCode = execute(new ExportCommand(this::service), root.toString(), "--format", "svg", "--format", "png");

        assertThat(exitCode).isEqualTo(ExportCommand.EXIT_OK);
        assertThat(out.toString()).contains("2 total, 2 succeeded, 0 skipped, 0 failed");
        assertThat(root.resolve("a.mmd")).exists();
    }

    @Test
    void export_withFailedItem_exitsWithOneAndPrintsReason() throws Exception {
        Files.writeString(root.resolve("a.mmd"), "graph TD");
        Files.writeString(root.resolve("b.mmd"), "broken");
        primary.failingOn("broken");
        fallback.failingOn("broken");

        int exitCode = execute(new ExportCommand(this::service), root.toString());

        assertThat(exitCode).isEqualTo(ExportCommand.EXIT_PARTIAL_FAILURE);
        assertThat(out.toString())
                .contains("1 failed")
                .contains("FAILED")
                .contains("b.mmd")
                .contains("RENDER_FAILURE");
    }

    @Test
    void export_withoutBackend_exitsWithTwo() throws Exception {
        Files.writeString(root.resolve("a.mmd"), "graph TD");
        primary.available(false);
        fallback.available(false);

        int exitCode = execute(new ExportCommand(this::service), root.toString());

        assertThat(exitCode).isEqualTo(ExportCommand.EXIT_FATAL);
        assertThat(err.toString()).contains("Export aborted");
    }

    @Test
    void export_withMissingPath_exitsWithTwo() {
        int exitCode = execute(new ExportCommand(this::service), root.resolve("missing").toString());

        assertThat(exitCode).isEqualTo(ExportCommand.EXIT_FATAL);
    }

    @Test
    void export_withOverwriteNaming_writesStableNames() throws Exception {
        Files.writeString(root.resolve("flow.mmd"), "graph TD");

        int exitCode = execute(new ExportCommand(this::service), root.toString(), "--naming", "overwrite", "--output-dir", "out");

        assertThat(exitCode).isEqualTo(ExportCommand.EXIT_OK);
        assertThat(root.resolve("out").resolve("flow1.svg")).exists();
    }

    @Test
    void buildRequest_appliesOptionsOverConfig() {
        ExportCommand command = new ExportCommand(this::service);
        new CommandLine(command).parseArgs(root.toString(),
                "-f", "pdf", "-d", "2", "-n", "overwrite", "--organize-by-format", "--follow-symlinks",
                "-t", "dark", "--width", "1024", "-b", "white", "--backend", "browser", "-w", "3");

        BatchRequest request = command.buildRequest(service(ExportConfig.defaults()));

        assertThat(request.getFormats()).containsExactly(ExportFormat.PDF);
        assertThat(request.getMaxDepth()).isEqualTo(2);
        assertThat(request.getNamingMode()).isEqualTo(NamingMode.OVERWRITE);
        assertThat(request.isOrganizeByFormat()).isTrue();
        assertThat(request.toDiscoveryOptions().isFollowSymlinks()).isTrue();
        assertThat(request.getRenderOptions().getTheme()).isEqualTo(MermaidTheme.DARK);
        assertThat(request.getRenderOptions().getWidth()).isEqualTo(1024);
        assertThat(request.getRenderOptions().getHeight()).isEqualTo(600);
        assertThat(request.getRenderOptions().getBackgroundColor()).isEqualTo("white");
        assertThat(request.getPreferredBackend()).isEqualTo("browser");
        assertThat(request.getWorkers()).isEqualTo(3);
    }

    @Test
    void backends_listsProbeResults() {
        fallback.available(false);

        int exitCode = execute(new BackendsCommand(this::service));

        assertThat(exitCode).isZero();
        assertThat(out.toString()).contains("cli").contains("available").contains("unavailable");
    }

    private MermaidExportService service(ExportConfig config) {
        return new MermaidExportService(config, List.of(primary, fallback));
    }

    private int execute(Object command, String... args) {
        CommandLine commandLine = new CommandLine(command);
        commandLine.setOut(new PrintWriter(out));
        commandLine.setErr(new PrintWriter(err));
        return commandLine.execute(args);
    }

}
