package io.github.stephanpirnbaum.mermaid.export.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import org.jspecify.annotations.Nullable;

import java.nio.file.Path;

/**
 * One unit of diagram text to be rendered. Created during discovery and immutable afterwards.
 *
 * @author Stephan Pirnbaum
 */
@Value
@Builder
public class DiagramSource {

    @NonNull
    Path path;

    @NonNull
    String rawText;

    @NonNull
    SourceKind kind;

    /**
     * Zero based position of the block within its document, {@code null} for standalone sources.
     */
    @Nullable
    Integer blockIndex;

    /**
     * Number of diagram blocks found in the same document. Always {@code 1} for standalone sources.
     */
    @Builder.Default
    int documentBlockCount = 1;

    /**
     * Zero based line of the first diagram line within the document.
     */
    int startLine;

    @Builder.Default
    String diagramType = "unknown";

    public static DiagramSource standalone(Path path, String rawText) {
        return DiagramSource.builder()
                .path(path)
                .rawText(rawText)
                .kind(SourceKind.STANDALONE)
                .build();
    }

    /**
     * @return a short human-readable label, e.g. {@code docs/flow.md#2}.
     */
    public String describe() {
        return kind == SourceKind.EMBEDDED_BLOCK && blockIndex != null
                ? path + "#" + (blockIndex + 1)
                : path.toString();
    }

}
