package io.github.stephanpirnbaum.mermaid.export.batch;

import io.github.stephanpirnbaum.mermaid.export.ExportErrorKind;
import io.github.stephanpirnbaum.mermaid.export.model.ExportFormat;
import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;
import org.jspecify.annotations.Nullable;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

/**
 * Aggregated outcome of a batch run.
 * <p>
 * {@code total} counts every planned job plus every path that could not be read during discovery. For a cancelled
 * run, {@code succeeded + failed + skipped} may be lower than {@code total}.
 *
 * @author Stephan Pirnbaum
 */
@Value
@Builder
public class BatchResult {

    @NonNull
    String runId;

    @NonNull
    RunState state;

    int total;

    int succeeded;

    int failed;

    int skipped;

    /**
     * Ordered by job index. Discovery failures come first.
     */
    @Singular
    List<Failure> failures;

    /**
     * Written or reused artifacts ordered by job index.
     */
    @Singular
    List<Path> outputs;

    @NonNull
    @Builder.Default
    Duration duration = Duration.ZERO;

    @Value
    public static class Failure {

        /**
         * Index of the failed job, {@code -1} for paths that failed during discovery.
         */
        int jobIndex;

        @NonNull
        String source;

        @Nullable
        ExportFormat format;

        @NonNull
        ExportErrorKind kind;

        @NonNull
        String reason;

    }

    public boolean hasFailures() {
        return failed > 0;
    }

    public int getProcessed() {
        return succeeded + failed + skipped;
    }

}
