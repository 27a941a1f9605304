package io.github.stephanpirnbaum.mermaid.export.batch;

import lombok.Getter;

import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Handle of a single batch run, used to observe its state and to request cooperative cancellation.
 *
 * @author Stephan Pirnbaum
 */
public class BatchRun {

    @Getter
    private final String runId;

    private final AtomicBoolean cancellationRequested = new AtomicBoolean();

    private volatile RunState state = RunState.IDLE;

    public BatchRun() {
        this(UUID.randomUUID().toString());
    }

    public BatchRun(String runId) {
        this.runId = runId;
    }

    public RunState getState() {
        return state;
    }

    /**
     * Requests cancellation. Jobs already rendering finish, no further job starts.
     *
     * @return {@code true} if the run was still live and has been signalled.
     */
    public boolean cancel() {
        if (state.isTerminal()) {
            return false;
        }
        cancellationRequested.set(true);
        return true;
    }

    public boolean isCancellationRequested() {
        return cancellationRequested.get();
    }

    void transitionTo(RunState next) {
        this.state = next;
    }

}
