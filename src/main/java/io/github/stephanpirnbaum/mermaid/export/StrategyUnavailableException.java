package io.github.stephanpirnbaum.mermaid.export;

/**
 * Thrown when no rendering backend is usable.
 *
 * @author Stephan Pirnbaum
 */
public class StrategyUnavailableException extends MermaidExportException {

    public StrategyUnavailableException(String message) {
        super(ExportErrorKind.STRATEGY_UNAVAILABLE, message);
    }

    public StrategyUnavailableException(String message, Throwable cause) {
        super(ExportErrorKind.STRATEGY_UNAVAILABLE, message, cause);
    }

}
