package io.github.stephanpirnbaum.mermaid.export.naming;

import io.github.stephanpirnbaum.mermaid.export.ExportFileSystemException;
import io.github.stephanpirnbaum.mermaid.export.model.ExportFormat;
import lombok.Value;
import org.jspecify.annotations.Nullable;

import java.nio.file.Path;

/**
 * Strategy for naming output files. One implementation per {@link io.github.stephanpirnbaum.mermaid.export.model.NamingMode}.
 *
 * @author Stephan Pirnbaum
 */
public interface NamingPolicy {

    /**
     * Computes the output path for the given content.
     *
     * @param directory The output directory, not necessarily existing yet.
     * @param baseName The sanitized base name.
     * @param format The target format.
     * @param contentHash The short hash of the trimmed content.
     *
     * @return The path the artifact is, or would be, stored at.
     *
     * @throws ExportFileSystemException In case the output directory exists but cannot be listed.
     */
    PathCandidate computePath(Path directory, String baseName, ExportFormat format, String contentHash) throws ExportFileSystemException;

    /**
     * Decides whether rendering can be skipped because the artifact at {@code path} already represents the content.
     */
    boolean shouldSkip(Path path, String contentHash);

    /**
     * A computed path and, for versioned names, its sequence number.
     */
    @Value
    class PathCandidate {

        Path path;

        @Nullable
        Integer sequenceNumber;

    }

}
