package com.docweaver.core.executor;

import java.util.concurrent.CompletableFuture;

/**
 * Result of a running stage, as returned by {@link StageExecutor#runStage}.
 *
 * <p>Besides {@link #cancel(boolean)}, which abandons every unit at once, a running stage can
 * be drained: agent calls already in flight may still finish or time out, but nothing is retried
 * and no unit starts a new attempt.
 */
public final class StageExecution extends CompletableFuture<StageResult> {

    private final Runnable onDrain;
    private volatile boolean draining;

    StageExecution(Runnable onDrain) {
        this.onDrain = onDrain;
    }

    static StageExecution completed(StageResult result) {
        var execution = new StageExecution(() -> { });
        execution.complete(result);
        return execution;
    }

    /** Stops further attempts. No-op once the stage has finished or was already drained. */
    public void drain() {
        if (isDone() || draining) {
            return;
        }
        draining = true;
        onDrain.run();
    }

    public boolean isDraining() {
        return draining;
    }
}
