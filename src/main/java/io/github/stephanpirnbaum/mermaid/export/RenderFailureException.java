package io.github.stephanpirnbaum.mermaid.export;

/**
 * Thrown when a backend accepted a diagram but failed to render it.
 *
 * @author Stephan Pirnbaum
 */
public class RenderFailureException extends MermaidExportException {

    public RenderFailureException(String message) {
        super(ExportErrorKind.RENDER_FAILURE, message);
    }

    public RenderFailureException(String message, Throwable cause) {
        super(ExportErrorKind.RENDER_FAILURE, message, cause);
    }

}
