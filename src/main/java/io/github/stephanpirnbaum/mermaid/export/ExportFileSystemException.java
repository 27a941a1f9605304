package io.github.stephanpirnbaum.mermaid.export;

/**
 * Thrown when the output directory cannot be scanned or an artifact cannot be written.
 *
 * @author Stephan Pirnbaum
 */
public class ExportFileSystemException extends MermaidExportException {

    public ExportFileSystemException(String message) {
        super(ExportErrorKind.FILE_SYSTEM, message);
    }

    public ExportFileSystemException(String message, Throwable cause) {
        super(ExportErrorKind.FILE_SYSTEM, message, cause);
    }

}
