package io.github.stephanpirnbaum.mermaid.export;

/**
 * Thrown when a batch run was cancelled before the job ran.
 *
 * @author Stephan Pirnbaum
 */
public class ExportCancelledException extends MermaidExportException {

    public ExportCancelledException(String message) {
        super(ExportErrorKind.CANCELLED, message);
    }

    public ExportCancelledException(String message, Throwable cause) {
        super(ExportErrorKind.CANCELLED, message, cause);
    }

}
