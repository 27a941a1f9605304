package io.github.stephanpirnbaum.mermaid.export.cli;

import io.github.stephanpirnbaum.mermaid.export.batch.JobOutcome;
import io.github.stephanpirnbaum.mermaid.export.batch.ProgressListener;
import io.github.stephanpirnbaum.mermaid.export.batch.RunState;
import io.github.stephanpirnbaum.mermaid.export.model.ExportJob;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Reports progress of a run to the log.
 *
 * @author Stephan Pirnbaum
 */
@Slf4j
class LoggingProgressListener implements ProgressListener {

    private final AtomicInteger completed = new AtomicInteger();

    private volatile int jobCount;

    @Override
    public void onRunStarted(String runId, int jobCount) {
        this.jobCount = jobCount;
        log.info("Run {} started with {} jobs", runId, jobCount);
    }

    @Override
    public void onStateChanged(String runId, RunState state) {
        log.debug("Run {} is {}", runId, state);
    }

    @Override
    public void onJobCompleted(ExportJob job, JobOutcome outcome) {
        log.info("[{}/{}] {} {} ({})", completed.incrementAndGet(), jobCount, outcome.getStatus(),
                job.getSource().describe(), job.getFormat().getExtension());
    }

}
