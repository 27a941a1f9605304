package io.github.stephanpirnbaum.mermaid.export;

import io.github.stephanpirnbaum.mermaid.export.backend.BrowserRendererBackend;
import io.github.stephanpirnbaum.mermaid.export.backend.CliRendererBackend;
import io.github.stephanpirnbaum.mermaid.export.backend.RendererBackend;
import io.github.stephanpirnbaum.mermaid.export.batch.ArtifactWriter;
import io.github.stephanpirnbaum.mermaid.export.batch.BatchOrchestrator;
import io.github.stephanpirnbaum.mermaid.export.batch.BatchRequest;
import io.github.stephanpirnbaum.mermaid.export.batch.BatchResult;
import io.github.stephanpirnbaum.mermaid.export.batch.BatchRun;
import io.github.stephanpirnbaum.mermaid.export.batch.JobOutcome;
import io.github.stephanpirnbaum.mermaid.export.batch.ProgressListener;
import io.github.stephanpirnbaum.mermaid.export.config.ExportConfig;
import io.github.stephanpirnbaum.mermaid.export.discovery.DiagramDiscovery;
import io.github.stephanpirnbaum.mermaid.export.model.DiagramSource;
import io.github.stephanpirnbaum.mermaid.export.model.ExportFormat;
import io.github.stephanpirnbaum.mermaid.export.model.NamingMode;
import io.github.stephanpirnbaum.mermaid.export.naming.NamingEngine;
import io.github.stephanpirnbaum.mermaid.export.strategy.StrategySelector;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.jspecify.annotations.NonNull;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Entry point for exporting Mermaid diagrams, either a single diagram or all diagrams below a directory.
 * <p>
 * One instance keeps the probe cache of its backends and the registry of live runs, so it should be reused across
 * exports.
 *
 * @author Stephan Pirnbaum
 */
@Slf4j
public class MermaidExportService {

    @Getter
    private final ExportConfig config;

    private final StrategySelector strategySelector;

    private final BatchOrchestrator orchestrator;

    private final Map<String, BatchRun> runs = new ConcurrentHashMap<>();

    public MermaidExportService() {
        this(ExportConfig.defaults());
    }

    public MermaidExportService(ExportConfig config) {
        this(config, createBackends(config));
    }

    public MermaidExportService(ExportConfig config, List<RendererBackend> backends) {
        this(config, new StrategySelector(backends, Duration.ofSeconds(config.getProbeValiditySeconds()), Clock.systemUTC()));
    }

    public MermaidExportService(ExportConfig config, StrategySelector strategySelector) {
        this.config = config;
        this.strategySelector = strategySelector;
        this.orchestrator = new BatchOrchestrator(new DiagramDiscovery(), strategySelector, new NamingEngine(), new ArtifactWriter());
    }

    /**
     * Exports a single diagram.
     *
     * @param source The diagram to export.
     * @param format The target format.
     * @param namingMode How the output file is named.
     *
     * @return The path of the written artifact, or of the existing artifact with identical content.
     *
     * @throws MermaidExportException The failure of the export, e.g. a {@link RenderFailureException}.
     */
    public Path exportSingle(@NonNull DiagramSource source, @NonNull ExportFormat format, @NonNull NamingMode namingMode) throws MermaidExportException {
        BatchRun run = prepareRun();
        try {
            BatchRequest request = newRequest(source.getPath())
                    .clearFormats()
                    .format(format)
                    .namingMode(namingMode)
                    .build();
            JobOutcome outcome = orchestrator.runSingle(run, request, source);
            if (outcome.isFailed() && outcome.getError() != null) {
                throw outcome.getError();
            }
            return outcome.getOutputPath();
        } finally {
            runs.remove(run.getRunId());
        }
    }

    /**
     * Exports all diagrams found below {@code root}, using the configured output location and render options.
     *
     * @throws InvalidSourceException In case {@code root} cannot be read.
     * @throws StrategyUnavailableException In case no backend is available.
     */
    public BatchResult exportBatch(@NonNull Path root, @NonNull List<ExportFormat> formats, int maxDepth, @NonNull NamingMode namingMode)
            throws InvalidSourceException, StrategyUnavailableException {
        BatchRequest request = newRequest(root)
                .clearFormats()
                .formats(formats)
                .maxDepth(maxDepth)
                .namingMode(namingMode)
                .build();
        return exportBatch(prepareRun(), request, ProgressListener.NONE);
    }

    /**
     * Executes a prepared run. The run can be cancelled via {@link #cancel(String)} while this method blocks.
     */
    public BatchResult exportBatch(@NonNull BatchRun run, @NonNull BatchRequest request, @NonNull ProgressListener listener)
            throws InvalidSourceException, StrategyUnavailableException {
        runs.putIfAbsent(run.getRunId(), run);
        try {
            return orchestrator.run(run, request, listener);
        } finally {
            runs.remove(run.getRunId());
        }
    }

    /**
     * Registers a new run, so that its id is known before the run starts.
     */
    public BatchRun prepareRun() {
        BatchRun run = new BatchRun();
        runs.put(run.getRunId(), run);
        return run;
    }

    /**
     * Requests cooperative cancellation of a live run.
     *
     * @return {@code true} if a live run with this id has been signalled.
     */
    public boolean cancel(String runId) {
        BatchRun run = runs.get(runId);
        if (run == null) {
            log.debug("No live run with id {}", runId);
            return false;
        }
        boolean signalled = run.cancel();
        if (signalled) {
            log.info("Cancellation requested for run {}", runId);
        }
        return signalled;
    }

    /**
     * A request pre-filled from the configuration.
     */
    public BatchRequest.BatchRequestBuilder newRequest(@NonNull Path root) {
        return BatchRequest.builder()
                .root(root)
                .formats(config.getFormats())
                .maxDepth(config.getMaxDepth())
                .namingMode(config.getNamingMode())
                .outputDirectory(config.getOutputDirectory() != null ? Path.of(config.getOutputDirectory()) : null)
                .organizeByFormat(config.isOrganizeByFormat())
                .renderOptions(config.toRenderOptions())
                .workers(config.getWorkers())
                .preferredBackend(config.getPreferredBackend())
                .includePatterns(config.getDiscovery().getIncludePatterns())
                .excludeDirectories(config.getDiscovery().getExcludeDirectories())
                .followSymlinks(config.getDiscovery().isFollowSymlinks());
    }

    /**
     * @return the backends in priority order.
     */
    public List<RendererBackend> getBackends() {
        return strategySelector.getBackends();
    }

    static List<RendererBackend> createBackends(ExportConfig config) {
        CliRendererBackend cli = new CliRendererBackend(config.getCli().getCommand(),
                Duration.ofSeconds(config.getCli().getTimeoutSeconds()));

        ExportConfig.Browser browserConfig = config.getBrowser();
        Duration browserTimeout = Duration.ofSeconds(browserConfig.getTimeoutSeconds());
        BrowserRendererBackend browser;
        if (browserConfig.isInstallBrowser()) {
            try {
                browser = new BrowserRendererBackend(browserConfig.getMermaidScriptUrl(), browserTimeout, true);
            } catch (StrategyUnavailableException e) {
                log.warn("Chromium installation failed, the browser backend will probe as unavailable: {}", e.getMessage());
                browser = new BrowserRendererBackend(browserConfig.getMermaidScriptUrl(), browserTimeout);
            }
        } else {
            browser = new BrowserRendererBackend(browserConfig.getMermaidScriptUrl(), browserTimeout);
        }
        return List.of(cli, browser);
    }

}
