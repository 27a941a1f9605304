package io.github.stephanpirnbaum.mermaid.export.batch;

/**
 * Lifecycle of a batch run. A run never fails as a whole: it either completes, possibly with per-item failures,
 * or is cancelled.
 *
 * @author Stephan Pirnbaum
 */
public enum RunState {

    IDLE,
    DISCOVERING,
    PROCESSING,
    COMPLETED,
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == CANCELLED;
    }

}
