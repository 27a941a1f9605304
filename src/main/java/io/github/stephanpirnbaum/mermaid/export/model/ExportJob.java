package io.github.stephanpirnbaum.mermaid.export.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.nio.file.Path;

/**
 * A single unit of work: one source exported to one format. Built per source and requested format, consumed once.
 *
 * @author Stephan Pirnbaum
 */
@Value
@Builder
public class ExportJob {

    /**
     * Position of the job within its run; failures and outputs are reported in this order.
     */
    int index;

    @NonNull
    DiagramSource source;

    /**
     * Sanitized base name all naming lookups operate on.
     */
    @NonNull
    String baseName;

    @NonNull
    ExportFormat format;

    @NonNull
    RenderOptions renderOptions;

    /**
     * The directory the artifact is written to, already including a per-format subdirectory if requested.
     */
    @NonNull
    Path outputDirectory;

    @NonNull
    NamingMode namingMode;

    public String getContent() {
        return source.getRawText();
    }

}
