package io.github.stephanpirnbaum.mermaid.export;

import lombok.Getter;

/**
 * Base exception for issues during the export of a Mermaid diagram.
 *
 * @author Stephan Pirnbaum
 */
@Getter
public class MermaidExportException extends Exception {

    private final ExportErrorKind kind;

    public MermaidExportException(ExportErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public MermaidExportException(ExportErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

}
