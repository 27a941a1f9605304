package io.github.stephanpirnbaum.mermaid.export.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Options handed to a renderer backend together with the diagram text.
 *
 * @author Stephan Pirnbaum
 */
@Value
@Builder(toBuilder = true)
public class RenderOptions {

    public static final String TRANSPARENT = "transparent";

    @NonNull
    @Builder.Default
    ExportFormat format = ExportFormat.SVG;

    @NonNull
    @Builder.Default
    MermaidTheme theme = MermaidTheme.DEFAULT;

    @Builder.Default
    int width = 800;

    @Builder.Default
    int height = 600;

    /**
     * A CSS color or the literal {@value #TRANSPARENT}.
     */
    @NonNull
    @Builder.Default
    String backgroundColor = TRANSPARENT;

    public boolean isTransparent() {
        return TRANSPARENT.equalsIgnoreCase(backgroundColor.trim());
    }

    public static RenderOptions defaults() {
        return RenderOptions.builder().build();
    }

}
