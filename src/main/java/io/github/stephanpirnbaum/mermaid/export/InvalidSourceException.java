package io.github.stephanpirnbaum.mermaid.export;

/**
 * Thrown when a diagram source or the discovery root cannot be read.
 *
 * @author Stephan Pirnbaum
 */
public class InvalidSourceException extends MermaidExportException {

    public InvalidSourceException(String message) {
        super(ExportErrorKind.INVALID_SOURCE, message);
    }

    public InvalidSourceException(String message, Throwable cause) {
        super(ExportErrorKind.INVALID_SOURCE, message, cause);
    }

}
