package com.docweaver.core.executor;

import com.docweaver.core.gateway.AgentException;
import com.docweaver.core.gateway.AgentRequest;
import com.docweaver.core.gateway.AgentResponse;
import com.docweaver.core.graph.PlannedUnit;
import com.docweaver.core.model.ErrorKind;
import com.docweaver.core.model.TaskError;
import com.docweaver.core.model.UnitOutcome;
import com.docweaver.core.model.UnitTelemetry;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Future;

/**
 * One gateway invocation being driven to completion by the {@link StageExecutor}:
 * the request, its attempt history, and whatever the unit is currently waiting on
 * (a budget slot, an agent call, or a backoff timer) so it can be abandoned.
 */
final class UnitOfWork {

    private final String stageName;
    private final PlannedUnit unit;
    private final AgentRequest request;
    private final CompletableFuture<UnitOfWork> completion = new CompletableFuture<>();
    private final List<Long> backoffDelaysMs = new ArrayList<>();
    private final long startedMs = System.currentTimeMillis();

    private int attempts;
    private boolean calling;
    private Future<?> pending;
    private UnitOutcome outcome;
    private AgentResponse response;
    private Throwable lastError;
    private long finishedMs;

    UnitOfWork(String stageName, PlannedUnit unit, AgentRequest request) {
        this.stageName = stageName;
        this.unit = unit;
        this.request = request;
    }

    PlannedUnit unit() {
        return unit;
    }

    AgentRequest request() {
        return request;
    }

    String unitId() {
        return unit.unitId();
    }

    CompletableFuture<UnitOfWork> completion() {
        return completion;
    }

    boolean isDone() {
        return completion.isDone();
    }

    /** Starts an agent call. Returns 0 when the unit has already settled and must not call. */
    synchronized int beginAttempt() {
        if (outcome != null) {
            return 0;
        }
        calling = true;
        return ++attempts;
    }

    synchronized void endAttempt() {
        calling = false;
    }

    synchronized int attempts() {
        return attempts;
    }

    synchronized void recordBackoff(long delayMs) {
        backoffDelaysMs.add(delayMs);
    }

    /**
     * Remembers what the unit is waiting on. If the unit was abandoned meanwhile the
     * handle is cancelled straight away.
     */
    void track(Future<?> handle) {
        boolean abandoned;
        synchronized (this) {
            abandoned = outcome == UnitOutcome.CANCELLED;
            if (!abandoned) {
                pending = handle;
            }
        }
        if (abandoned) {
            handle.cancel(true);
        }
    }

    void succeed(AgentResponse agentResponse) {
        synchronized (this) {
            if (outcome != null) {
                return;
            }
            outcome = UnitOutcome.SUCCEEDED;
            response = agentResponse;
            finishedMs = System.currentTimeMillis();
            pending = null;
        }
        completion.complete(this);
    }

    void fail(Throwable error) {
        synchronized (this) {
            if (outcome != null) {
                return;
            }
            outcome = UnitOutcome.FAILED;
            lastError = error;
            finishedMs = System.currentTimeMillis();
            pending = null;
        }
        completion.complete(this);
    }

    /** Abandons the unit and whatever it is waiting on. No-op once the unit has finished. */
    void cancel(String reason) {
        settleCancelled(reason, true);
    }

    /**
     * Abandons the unit only while it has no agent call outstanding, i.e. it is waiting for a
     * budget slot or a backoff timer. Returns whether the unit was abandoned.
     */
    boolean cancelIfIdle(String reason) {
        return settleCancelled(reason, false);
    }

    private boolean settleCancelled(String reason, boolean evenIfCalling) {
        Future<?> toCancel;
        synchronized (this) {
            if (outcome != null || (calling && !evenIfCalling)) {
                return false;
            }
            outcome = UnitOutcome.CANCELLED;
            lastError = new CancelledUnitException(reason);
            finishedMs = System.currentTimeMillis();
            toCancel = pending;
            pending = null;
        }
        if (toCancel != null) {
            toCancel.cancel(true);
        }
        completion.complete(this);
        return true;
    }

    synchronized UnitOutcome outcome() {
        return outcome;
    }

    synchronized AgentResponse response() {
        return response;
    }

    synchronized Throwable lastError() {
        return lastError;
    }

    synchronized TaskError error() {
        if (lastError == null) {
            return null;
        }
        ErrorKind kind;
        if (lastError instanceof AgentException agentException) {
            kind = agentException.kind();
        } else if (lastError instanceof CancelledUnitException) {
            kind = ErrorKind.CANCELLED;
        } else {
            kind = ErrorKind.FATAL;
        }
        String message = lastError.getMessage() != null ? lastError.getMessage()
                : lastError.getClass().getSimpleName();
        return new TaskError(stageName, kind, message, unit.unitId());
    }

    synchronized UnitTelemetry telemetry() {
        return new UnitTelemetry(unit.unitId(), outcome, attempts, List.copyOf(backoffDelaysMs), error(),
                (finishedMs > 0 ? finishedMs : System.currentTimeMillis()) - startedMs);
    }

    /** Marks a unit abandoned by cancellation rather than failed by its agent. */
    static final class CancelledUnitException extends RuntimeException {
        CancelledUnitException(String reason) {
            super(reason);
        }
    }
}
