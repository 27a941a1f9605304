package io.github.stephanpirnbaum.mermaid.export;

/**
 * Classification of the errors raised while exporting diagrams.
 *
 * @author Stephan Pirnbaum
 */
public enum ExportErrorKind {

    INVALID_SOURCE,
    STRATEGY_UNAVAILABLE,
    RENDER_FAILURE,
    FILE_SYSTEM,
    CANCELLED,
    UNEXPECTED

}
