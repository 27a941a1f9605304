package io.github.stephanpirnbaum.mermaid.export.batch;

import io.github.stephanpirnbaum.mermaid.export.ExportErrorKind;
import io.github.stephanpirnbaum.mermaid.export.MermaidExportException;
import io.github.stephanpirnbaum.mermaid.export.discovery.DiscoveryResult;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.exception.ExceptionUtils;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Accumulates job outcomes while a run is processing. Thread-safe, outcomes may be added in any order.
 *
 * @author Stephan Pirnbaum
 */
class BatchResultCollector {

    private final String runId;

    private final int total;

    private final List<BatchResult.Failure> discoveryFailures = new ArrayList<>();

    private final List<JobOutcome> outcomes = new ArrayList<>();

    BatchResultCollector(String runId, int total) {
        this.runId = runId;
        this.total = total;
    }

    synchronized void addUnreadable(DiscoveryResult.UnreadablePath unreadable) {
        discoveryFailures.add(new BatchResult.Failure(-1, unreadable.getPath().toString(), null,
                ExportErrorKind.INVALID_SOURCE, unreadable.getReason()));
    }

    synchronized void add(JobOutcome outcome) {
        outcomes.add(outcome);
    }

    synchronized BatchResult build(RunState state, Duration duration) {
        List<JobOutcome> ordered = new ArrayList<>(outcomes);
        ordered.sort(Comparator.comparingInt(JobOutcome::getJobIndex));

        BatchResult.BatchResultBuilder builder = BatchResult.builder()
                .runId(runId)
                .state(state)
                .total(total)
                .duration(duration)
                .failures(discoveryFailures);

        int succeeded = 0;
        int skipped = 0;
        int failed = discoveryFailures.size();
        for (JobOutcome outcome : ordered) {
            switch (outcome.getStatus()) {
                case SUCCEEDED -> {
                    succeeded++;
                    builder.output(outcome.getOutputPath());
                }
                case SKIPPED -> {
                    skipped++;
                    builder.output(outcome.getOutputPath());
                }
                case FAILED -> {
                    failed++;
                    builder.failure(toFailure(outcome));
                }
            }
        }
        return builder.succeeded(succeeded).skipped(skipped).failed(failed).build();
    }

    private static BatchResult.Failure toFailure(JobOutcome outcome) {
        MermaidExportException error = outcome.getError();
        ExportErrorKind kind = error != null ? error.getKind() : ExportErrorKind.UNEXPECTED;
        return new BatchResult.Failure(outcome.getJobIndex(), outcome.getJob().getSource().describe(),
                outcome.getJob().getFormat(), kind, reason(error));
    }

    /**
     * The message of the exception, extended by the root cause message if that adds information.
     */
    static String reason(Throwable error) {
        if (error == null) {
            return "Unknown error";
        }
        String message = StringUtils.defaultIfBlank(error.getMessage(), error.getClass().getSimpleName());
        Throwable root = ExceptionUtils.getRootCause(error);
        if (root != null && root != error && StringUtils.isNotBlank(root.getMessage()) && !message.contains(root.getMessage())) {
            return message + " (" + root.getMessage() + ")";
        }
        return message;
    }

}
