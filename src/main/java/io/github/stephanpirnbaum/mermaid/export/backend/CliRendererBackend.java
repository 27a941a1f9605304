package io.github.stephanpirnbaum.mermaid.export.backend;

import io.github.stephanpirnbaum.mermaid.export.RenderFailureException;
import io.github.stephanpirnbaum.mermaid.export.model.ExportFormat;
import io.github.stephanpirnbaum.mermaid.export.model.MermaidTheme;
import io.github.stephanpirnbaum.mermaid.export.model.RenderOptions;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Renders diagrams by spawning the Mermaid CLI, e.g. installed via npm install -g @mermaid-js/mermaid-cli.
 *
 * @author Stephan Pirnbaum
 */
@Slf4j
public class CliRendererBackend implements RendererBackend {

    public static final String NAME = "cli";

    public static final String DEFAULT_COMMAND = "mmdc";

    private static final Duration PROBE_TIMEOUT = Duration.ofSeconds(5);

    private static final int MAX_REPORTED_OUTPUT = 500;

    private final String command;

    private final Duration timeout;

    public CliRendererBackend() {
        this(DEFAULT_COMMAND, Duration.ofSeconds(30));
    }

    public CliRendererBackend(String command, Duration timeout) {
        this.command = command;
        this.timeout = timeout;
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public BackendTier getTier() {
        return BackendTier.PRIMARY;
    }

    @Override
    public boolean probe() {
        Path probeLog = null;
        try {
            probeLog = Files.createTempFile("mermaid-export-probe-", ".log");
            ProcessResult result = run(List.of(command, "--version"), probeLog, PROBE_TIMEOUT);
            log.debug("Mermaid CLI '{}' --version exited with {}: {}", command, result.exitCode, abbreviate(result.output));
            return result.exitCode == 0;
        } catch (IOException | RenderFailureException e) {
            log.debug("Mermaid CLI '{}' not available: {}", command, e.getMessage());
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        } finally {
            deleteQuietly(probeLog);
        }
    }

    @Override
    public byte[] render(String text, RenderOptions options) throws RenderFailureException {
        Path input = null;
        Path output = null;
        Path processLog = null;
        try {
            input = Files.createTempFile("mermaid-export-", ".mmd");
            output = Files.createTempFile("mermaid-export-", "." + options.getFormat().getExtension());
            processLog = Files.createTempFile("mermaid-export-", ".log");
            Files.deleteIfExists(output);
            Files.writeString(input, text, StandardCharsets.UTF_8);

            ProcessResult result = run(buildArguments(input, output, options), processLog, timeout);
            if (result.exitCode != 0) {
                throw new RenderFailureException("Mermaid CLI failed with exit code " + result.exitCode + ": " + abbreviate(result.output));
            }
            if (!Files.isRegularFile(output) || Files.size(output) == 0) {
                throw new RenderFailureException("Mermaid CLI did not produce an output file for format " + options.getFormat().getExtension());
            }
            log.debug("Mermaid CLI rendered {} bytes of {}", Files.size(output), options.getFormat().getExtension());
            return Files.readAllBytes(output);
        } catch (IOException e) {
            throw new RenderFailureException("Failed to run Mermaid CLI '" + command + "'", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RenderFailureException("Interrupted while waiting for Mermaid CLI", e);
        } finally {
            deleteQuietly(input);
            deleteQuietly(output);
            deleteQuietly(processLog);
        }
    }

    List<String> buildArguments(Path input, Path output, RenderOptions options) {
        List<String> args = new ArrayList<>();
        args.add(command);
        args.add("--input");
        args.add(input.toString());
        args.add("--output");
        args.add(output.toString());
        if (options.getTheme() != MermaidTheme.DEFAULT) {
            args.add("--theme");
            args.add(options.getTheme().getRepresentation());
        }
        if (options.getWidth() > 0) {
            args.add("--width");
            args.add(Integer.toString(options.getWidth()));
        }
        if (options.getHeight() > 0) {
            args.add("--height");
            args.add(Integer.toString(options.getHeight()));
        }
        if (StringUtils.isNotBlank(options.getBackgroundColor())) {
            args.add("--backgroundColor");
            args.add(options.getBackgroundColor());
        }
        if (options.getFormat() == ExportFormat.PDF) {
            args.add("--pdfFit");
        }
        return args;
    }

    private ProcessResult run(List<String> args, Path processLog, Duration limit) throws IOException, InterruptedException, RenderFailureException {
        ProcessBuilder pb = new ProcessBuilder(args);
        pb.redirectErrorStream(true);
        pb.redirectOutput(ProcessBuilder.Redirect.to(processLog.toFile()));
        Process process = pb.start();
        if (!process.waitFor(limit.toMillis(), TimeUnit.MILLISECONDS)) {
            process.destroyForcibly();
            throw new RenderFailureException("Mermaid CLI timed out after " + limit.toSeconds() + "s");
        }
        return new ProcessResult(process.exitValue(), new String(Files.readAllBytes(processLog), StandardCharsets.UTF_8));
    }

    private static String abbreviate(String output) {
        return StringUtils.abbreviate(StringUtils.defaultIfBlank(output, "<no output>").trim(), MAX_REPORTED_OUTPUT);
    }

    private static void deleteQuietly(Path path) {
        if (path == null) {
            return;
        }
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            log.warn("Failed to delete temporary file {}: {}", path, e.getMessage());
        }
    }

    private static final class ProcessResult {

        private final int exitCode;

        private final String output;

        private ProcessResult(int exitCode, String output) {
            this.exitCode = exitCode;
            this.output = output;
        }
    }

}
