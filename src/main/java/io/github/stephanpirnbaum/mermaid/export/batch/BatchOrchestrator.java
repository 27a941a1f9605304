package io.github.stephanpirnbaum.mermaid.export.batch;

import io.github.stephanpirnbaum.mermaid.export.ExportCancelledException;
import io.github.stephanpirnbaum.mermaid.export.ExportErrorKind;
import io.github.stephanpirnbaum.mermaid.export.InvalidSourceException;
import io.github.stephanpirnbaum.mermaid.export.MermaidExportException;
import io.github.stephanpirnbaum.mermaid.export.StrategyUnavailableException;
import io.github.stephanpirnbaum.mermaid.export.backend.RendererBackend;
import io.github.stephanpirnbaum.mermaid.export.discovery.DiagramDiscovery;
import io.github.stephanpirnbaum.mermaid.export.discovery.DiscoveryResult;
import io.github.stephanpirnbaum.mermaid.export.model.DiagramSource;
import io.github.stephanpirnbaum.mermaid.export.model.ExportFormat;
import io.github.stephanpirnbaum.mermaid.export.model.ExportJob;
import io.github.stephanpirnbaum.mermaid.export.naming.BaseNames;
import io.github.stephanpirnbaum.mermaid.export.naming.NamingEngine;
import io.github.stephanpirnbaum.mermaid.export.naming.NamingRecord;
import io.github.stephanpirnbaum.mermaid.export.strategy.RenderOutcome;
import io.github.stephanpirnbaum.mermaid.export.strategy.StrategySelector;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.jspecify.annotations.Nullable;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Drives a batch run: discovers sources, plans one job per source and format, and processes the jobs while isolating
 * their failures from each other.
 * <p>
 * Jobs run sequentially in discovery order unless the request asks for more than one worker. Cancellation is
 * checked before each job starts, a render already in progress is never interrupted.
 *
 * @author Stephan Pirnbaum
 */
@Slf4j
@RequiredArgsConstructor
public class BatchOrchestrator {

    private final DiagramDiscovery discovery;

    private final StrategySelector strategySelector;

    private final NamingEngine namingEngine;

    private final ArtifactWriter artifactWriter;

    /**
     * Executes a batch run.
     *
     * @param run The run handle, must not have been used before.
     * @param request What to export.
     * @param listener Progress callbacks.
     *
     * @return The aggregated result, also if individual jobs failed or the run has been cancelled.
     *
     * @throws InvalidSourceException In case the root cannot be read. No job is processed.
     * @throws StrategyUnavailableException In case no backend is available. No job is processed.
     */
    public BatchResult run(BatchRun run, BatchRequest request, ProgressListener listener)
            throws InvalidSourceException, StrategyUnavailableException {
        validate(request);
        long start = System.nanoTime();

        transition(run, RunState.DISCOVERING, listener);
        DiscoveryResult discovered = discovery.discover(request.getRoot(), request.toDiscoveryOptions());

        preflight(request);

        List<ExportJob> jobs = planJobs(discovered.getSources(), request);
        int total = jobs.size() + discovered.getUnreadablePaths().size();
        BatchResultCollector collector = new BatchResultCollector(run.getRunId(), total);
        discovered.getUnreadablePaths().forEach(collector::addUnreadable);

        transition(run, RunState.PROCESSING, listener);
        listener.onRunStarted(run.getRunId(), jobs.size());
        log.info("Processing {} export jobs for {} diagrams with {} worker(s)",
                jobs.size(), discovered.getSources().size(), request.getWorkers());

        boolean allStarted = request.getWorkers() > 1
                ? processConcurrently(run, jobs, request, listener, collector)
                : processSequentially(run, jobs, request, listener, collector);

        RunState terminal = allStarted ? RunState.COMPLETED : RunState.CANCELLED;
        transition(run, terminal, listener);
        BatchResult result = collector.build(terminal, Duration.ofNanos(System.nanoTime() - start));
        log.info("Batch run {} {}: {} total, {} succeeded, {} skipped, {} failed in {}ms",
                run.getRunId(), terminal == RunState.CANCELLED ? "cancelled" : "completed", result.getTotal(),
                result.getSucceeded(), result.getSkipped(), result.getFailed(), result.getDuration().toMillis());
        return result;
    }

    /**
     * Exports a single source to the first format of the request as a run of exactly one job.
     *
     * @return The outcome of the job. A failed job carries its exception.
     *
     * @throws StrategyUnavailableException In case no backend is available.
     * @throws ExportCancelledException In case the run has been cancelled before the job started.
     */
    public JobOutcome runSingle(BatchRun run, BatchRequest request, DiagramSource source)
            throws StrategyUnavailableException, ExportCancelledException {
        validate(request);
        preflight(request);

        ExportJob job = planJob(0, source, request.getFormats().get(0), request);
        transition(run, RunState.PROCESSING, ProgressListener.NONE);
        if (run.isCancellationRequested()) {
            transition(run, RunState.CANCELLED, ProgressListener.NONE);
            throw new ExportCancelledException("Export of " + source.describe() + " has been cancelled");
        }
        JobOutcome outcome = processJob(job, request.getPreferredBackend());
        transition(run, RunState.COMPLETED, ProgressListener.NONE);
        return outcome;
    }

    /**
     * Builds one job per source and format, sources in discovery order, formats in request order.
     */
    List<ExportJob> planJobs(List<DiagramSource> sources, BatchRequest request) {
        List<ExportJob> jobs = new ArrayList<>(sources.size() * request.getFormats().size());
        for (DiagramSource source : sources) {
            for (ExportFormat format : request.getFormats()) {
                jobs.add(planJob(jobs.size(), source, format, request));
            }
        }
        return jobs;
    }

    private ExportJob planJob(int index, DiagramSource source, ExportFormat format, BatchRequest request) {
        return ExportJob.builder()
                .index(index)
                .source(source)
                .baseName(BaseNames.forSource(source))
                .format(format)
                .renderOptions(request.renderOptionsFor(format))
                .outputDirectory(request.outputDirectoryFor(source, format))
                .namingMode(request.getNamingMode())
                .build();
    }

    /**
     * @return {@code false} if cancellation left jobs unstarted.
     */
    private boolean processSequentially(BatchRun run,
                                        List<ExportJob> jobs,
                                        BatchRequest request,
                                        ProgressListener listener,
                                        BatchResultCollector collector) {
        for (ExportJob job : jobs) {
            if (run.isCancellationRequested()) {
                log.info("Batch run {} cancelled before job {} of {}", run.getRunId(), job.getIndex() + 1, jobs.size());
                return false;
            }
            collector.add(execute(job, request.getPreferredBackend(), listener));
        }
        return true;
    }

    private boolean processConcurrently(BatchRun run,
                                        List<ExportJob> jobs,
                                        BatchRequest request,
                                        ProgressListener listener,
                                        BatchResultCollector collector) {
        ExecutorService executor = Executors.newFixedThreadPool(Math.min(request.getWorkers(), Math.max(jobs.size(), 1)));
        boolean allStarted = true;
        try {
            List<Future<JobOutcome>> futures = new ArrayList<>(jobs.size());
            for (ExportJob job : jobs) {
                futures.add(executor.submit(() -> run.isCancellationRequested()
                        ? null
                        : execute(job, request.getPreferredBackend(), listener)));
            }
            for (int i = 0; i < futures.size(); i++) {
                try {
                    JobOutcome outcome = futures.get(i).get();
                    if (outcome != null) {
                        collector.add(outcome);
                    } else {
                        allStarted = false;
                    }
                } catch (ExecutionException e) {
                    collector.add(JobOutcome.failed(jobs.get(i), unexpected(e.getCause())));
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    log.warn("Interrupted while waiting for export jobs, cancelling run {}", run.getRunId());
                    run.cancel();
                    return false;
                }
            }
        } finally {
            executor.shutdownNow();
        }
        return allStarted;
    }

    private JobOutcome execute(ExportJob job, @Nullable String preferredBackend, ProgressListener listener) {
        listener.onJobStarted(job);
        JobOutcome outcome = processJob(job, preferredBackend);
        listener.onJobCompleted(job, outcome);
        return outcome;
    }

    /**
     * Runs naming, rendering and persisting of one job. The sequence lock of the job's output triple is held for the
     * whole job so that concurrent jobs never allocate the same sequence number.
     */
    private JobOutcome processJob(ExportJob job, @Nullable String preferredBackend) {
        String label = job.getSource().describe() + " [" + job.getFormat().getExtension() + "]";
        try (NamingEngine.SequenceLock ignored = namingEngine.acquire(job.getOutputDirectory(), job.getBaseName(), job.getFormat())) {
            NamingRecord naming = namingEngine.resolve(job);
            if (naming.isReused()) {
                log.info("Skipping {}: unchanged content already exported to {}", label, naming.getOutputPath());
                return JobOutcome.skipped(job, naming.getOutputPath());
            }

            log.debug("Rendering {} ({} diagram)", label, job.getSource().getDiagramType());
            RenderOutcome rendered = strategySelector.render(job.getContent(), job.getRenderOptions(), preferredBackend);
            artifactWriter.write(naming.getOutputPath(), rendered.getBytes());
            log.info("Exported {} to {} using '{}'", label, naming.getOutputPath(), rendered.getBackendName());
            return JobOutcome.succeeded(job, naming.getOutputPath(), rendered.getBackendName(), rendered.isFallbackUsed());
        } catch (MermaidExportException e) {
            log.warn("Failed to export {} ({}): {}", label, e.getKind(), BatchResultCollector.reason(e));
            return JobOutcome.failed(job, e);
        } catch (RuntimeException e) {
            log.warn("Unexpected error while exporting {}", label, e);
            return JobOutcome.failed(job, unexpected(e));
        }
    }

    private void preflight(BatchRequest request) throws StrategyUnavailableException {
        RendererBackend backend = strategySelector.resolve(request.getPreferredBackend());
        log.info("Using renderer backend '{}'", backend.getName());
    }

    private static MermaidExportException unexpected(Throwable cause) {
        return new MermaidExportException(ExportErrorKind.UNEXPECTED, "Unexpected error: " + cause.getMessage(), cause);
    }

    private static void transition(BatchRun run, RunState state, ProgressListener listener) {
        run.transitionTo(state);
        listener.onStateChanged(run.getRunId(), state);
    }

    private static void validate(BatchRequest request) {
        if (request.getFormats().isEmpty()) {
            throw new IllegalArgumentException("At least one export format is required");
        }
        if (request.getMaxDepth() < 1) {
            throw new IllegalArgumentException("Maximum depth must be at least 1, was " + request.getMaxDepth());
        }
        if (request.getWorkers() < 1) {
            throw new IllegalArgumentException("Worker count must be at least 1, was " + request.getWorkers());
        }
    }

}
