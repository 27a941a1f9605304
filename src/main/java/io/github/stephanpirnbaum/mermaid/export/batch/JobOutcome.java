package io.github.stephanpirnbaum.mermaid.export.batch;

import io.github.stephanpirnbaum.mermaid.export.MermaidExportException;
import io.github.stephanpirnbaum.mermaid.export.model.ExportJob;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.NonNull;
import lombok.Value;
import org.jspecify.annotations.Nullable;

import java.nio.file.Path;

/**
 * Result of processing a single {@link ExportJob}.
 *
 * @author Stephan Pirnbaum
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class JobOutcome {

    public enum Status {
        SUCCEEDED,
        SKIPPED,
        FAILED
    }

    @NonNull
    ExportJob job;

    @NonNull
    Status status;

    /**
     * The written or reused artifact, {@code null} for failed jobs.
     */
    @Nullable
    Path outputPath;

    /**
     * The backend that rendered the artifact, {@code null} unless the job succeeded.
     */
    @Nullable
    String backendName;

    boolean fallbackUsed;

    @Nullable
    MermaidExportException error;

    public static JobOutcome succeeded(ExportJob job, Path outputPath, String backendName, boolean fallbackUsed) {
        return new JobOutcome(job, Status.SUCCEEDED, outputPath, backendName, fallbackUsed, null);
    }

    public static JobOutcome skipped(ExportJob job, Path outputPath) {
        return new JobOutcome(job, Status.SKIPPED, outputPath, null, false, null);
    }

    public static JobOutcome failed(ExportJob job, MermaidExportException error) {
        return new JobOutcome(job, Status.FAILED, null, null, false, error);
    }

    public int getJobIndex() {
        return job.getIndex();
    }

    public boolean isFailed() {
        return status == Status.FAILED;
    }

}
