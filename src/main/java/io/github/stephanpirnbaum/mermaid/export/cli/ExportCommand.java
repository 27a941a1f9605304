package io.github.stephanpirnbaum.mermaid.export.cli;

import io.github.stephanpirnbaum.mermaid.export.InvalidSourceException;
import io.github.stephanpirnbaum.mermaid.export.MermaidExportService;
import io.github.stephanpirnbaum.mermaid.export.StrategyUnavailableException;
import io.github.stephanpirnbaum.mermaid.export.batch.BatchRequest;
import io.github.stephanpirnbaum.mermaid.export.batch.BatchResult;
import io.github.stephanpirnbaum.mermaid.export.config.ConfigLoader;
import io.github.stephanpirnbaum.mermaid.export.config.ExportConfig;
import io.github.stephanpirnbaum.mermaid.export.model.ExportFormat;
import io.github.stephanpirnbaum.mermaid.export.model.MermaidTheme;
import io.github.stephanpirnbaum.mermaid.export.model.NamingMode;
import io.github.stephanpirnbaum.mermaid.export.model.RenderOptions;
import lombok.extern.slf4j.Slf4j;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.function.Function;

/**
 * Exports all diagrams of a file or directory.
 * <p>
 * Exit codes: {@value #EXIT_OK} if nothing failed, {@value #EXIT_PARTIAL_FAILURE} if some items failed and
 * {@value #EXIT_FATAL} if the run could not start.
 *
 * @author Stephan Pirnbaum
 */
@Slf4j
@CommandLine.Command(name = "export", mixinStandardHelpOptions = true, description = "Exports the Mermaid diagrams of a file or directory.")
public class ExportCommand implements Callable<Integer> {

    public static final int EXIT_OK = 0;

    public static final int EXIT_PARTIAL_FAILURE = 1;

    public static final int EXIT_FATAL = 2;

    private final Function<ExportConfig, MermaidExportService> serviceFactory;

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Parameters(index = "0", description = "Markdown or .mmd file, or a directory to scan.")
    private Path path;

    @CommandLine.Option(names = {"-f", "--format"}, description = "Output format, repeatable. One of: svg, png, pdf, webp, jpg, jpeg.", converter = FormatConverter.class)
    private List<ExportFormat> formats;

    @CommandLine.Option(names = {"-d", "--depth"}, description = "Maximum directory depth, files in the root are at depth 1.")
    private Integer maxDepth;

    @CommandLine.Option(names = {"-n", "--naming"}, description = "versioned or overwrite.", converter = NamingModeConverter.class)
    private NamingMode namingMode;

    @CommandLine.Option(names = {"-o", "--output-dir"}, description = "Output directory. Defaults to the directory of each source.")
    private Path outputDirectory;

    @CommandLine.Option(names = "--organize-by-format", description = "Place each format in its own subdirectory.")
    private Boolean organizeByFormat;

    @CommandLine.Option(names = "--follow-symlinks", description = "Descend into symbolically linked directories.")
    private Boolean followSymlinks;

    @CommandLine.Option(names = {"-t", "--theme"}, description = "default, dark, forest or neutral.", converter = ThemeConverter.class)
    private MermaidTheme theme;

    @CommandLine.Option(names = "--width", description = "Width in pixels.")
    private Integer width;

    @CommandLine.Option(names = "--height", description = "Height in pixels.")
    private Integer height;

    @CommandLine.Option(names = {"-b", "--background"}, description = "CSS color or 'transparent'.")
    private String backgroundColor;

    @CommandLine.Option(names = "--backend", description = "Preferred backend: auto, cli or browser.")
    private String backend;

    @CommandLine.Option(names = {"-w", "--workers"}, description = "Number of concurrent export jobs.")
    private Integer workers;

    @CommandLine.Option(names = {"-c", "--config"}, description = "Configuration file. Defaults to " + ConfigLoader.DEFAULT_FILE_NAME + " in the working directory, if present.")
    private Path configPath;

    public ExportCommand() {
        this(MermaidExportService::new);
    }

    ExportCommand(Function<ExportConfig, MermaidExportService> serviceFactory) {
        this.serviceFactory = serviceFactory;
    }

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        MermaidExportService service = serviceFactory.apply(loadConfig());
        BatchRequest request = buildRequest(service);

        BatchResult result;
        try {
            result = service.exportBatch(service.prepareRun(), request, new LoggingProgressListener());
        } catch (InvalidSourceException | StrategyUnavailableException e) {
            log.error("Export aborted: {}", e.getMessage());
            err.println("Export aborted: " + e.getMessage());
            err.flush();
            return EXIT_FATAL;
        } catch (IllegalArgumentException e) {
            err.println("Invalid arguments: " + e.getMessage());
            err.flush();
            return EXIT_FATAL;
        }

        printSummary(out, result);
        return result.hasFailures() ? EXIT_PARTIAL_FAILURE : EXIT_OK;
    }

    private ExportConfig loadConfig() {
        if (configPath != null) {
            return ConfigLoader.load(configPath);
        }
        Path defaultConfig = Path.of(ConfigLoader.DEFAULT_FILE_NAME);
        return Files.exists(defaultConfig) ? ConfigLoader.load(defaultConfig) : ExportConfig.defaults();
    }

    BatchRequest buildRequest(MermaidExportService service) {
        BatchRequest.BatchRequestBuilder builder = service.newRequest(path);
        if (formats != null && !formats.isEmpty()) {
            builder.clearFormats().formats(formats);
        }
        if (maxDepth != null) {
            builder.maxDepth(maxDepth);
        }
        if (namingMode != null) {
            builder.namingMode(namingMode);
        }
        if (outputDirectory != null) {
            builder.outputDirectory(outputDirectory);
        }
        if (organizeByFormat != null) {
            builder.organizeByFormat(organizeByFormat);
        }
        if (followSymlinks != null) {
            builder.followSymlinks(followSymlinks);
        }
        if (workers != null) {
            builder.workers(workers);
        }
        if (backend != null) {
            builder.preferredBackend(ExportConfig.AUTO_STRATEGY.equalsIgnoreCase(backend.trim()) ? null : backend.trim());
        }

        RenderOptions.RenderOptionsBuilder renderOptions = service.getConfig().toRenderOptions().toBuilder();
        if (theme != null) {
            renderOptions.theme(theme);
        }
        if (width != null) {
            renderOptions.width(width);
        }
        if (height != null) {
            renderOptions.height(height);
        }
        if (backgroundColor != null) {
            renderOptions.backgroundColor(backgroundColor);
        }
        return builder.renderOptions(renderOptions.build()).build();
    }

    private static void printSummary(PrintWriter out, BatchResult result) {
        out.printf("Export %s: %d total, %d succeeded, %d skipped, %d failed%n",
                result.getState().name().toLowerCase(), result.getTotal(), result.getSucceeded(),
                result.getSkipped(), result.getFailed());
        for (BatchResult.Failure failure : result.getFailures()) {
            out.printf("  FAILED %s%s: [%s] %s%n",
                    failure.getSource(),
                    failure.getFormat() != null ? " (" + failure.getFormat().getExtension() + ")" : "",
                    failure.getKind(),
                    failure.getReason());
        }
        out.flush();
    }

    static class FormatConverter implements CommandLine.ITypeConverter<ExportFormat> {
        @Override
        public ExportFormat convert(String value) {
            return ExportFormat.fromValue(value);
        }
    }

    static class NamingModeConverter implements CommandLine.ITypeConverter<NamingMode> {
        @Override
        public NamingMode convert(String value) {
            return NamingMode.fromValue(value);
        }
    }

    static class ThemeConverter implements CommandLine.ITypeConverter<MermaidTheme> {
        @Override
        public MermaidTheme convert(String value) {
            return MermaidTheme.fromValue(value);
        }
    }

}
