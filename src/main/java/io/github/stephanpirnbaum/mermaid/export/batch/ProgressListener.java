package io.github.stephanpirnbaum.mermaid.export.batch;

import io.github.stephanpirnbaum.mermaid.export.model.ExportJob;

/**
 * Receives progress notifications of a batch run. Callbacks may arrive from worker threads when the run uses more
 * than one worker.
 *
 * @author Stephan Pirnbaum
 */
public interface ProgressListener {

    ProgressListener NONE = new ProgressListener() {
    };

    default void onRunStarted(String runId, int jobCount) {
    }

    default void onStateChanged(String runId, RunState state) {
    }

    default void onJobStarted(ExportJob job) {
    }

    default void onJobCompleted(ExportJob job, JobOutcome outcome) {
    }

}
