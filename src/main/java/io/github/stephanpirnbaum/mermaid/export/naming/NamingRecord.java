package io.github.stephanpirnbaum.mermaid.export.naming;

import lombok.NonNull;
import lombok.Value;
import org.jspecify.annotations.Nullable;

import java.nio.file.Path;

/**
 * Result of resolving the output of a job.
 *
 * @author Stephan Pirnbaum
 */
@Value
public class NamingRecord {

    @NonNull
    Path outputPath;

    @NonNull
    String contentHash;

    /**
     * Sequence number of a versioned name, {@code null} in overwrite mode.
     */
    @Nullable
    Integer sequenceNumber;

    /**
     * {@code true} if an artifact with the same content identity already exists at {@link #outputPath} and
     * rendering must be skipped.
     */
    boolean reused;

}
