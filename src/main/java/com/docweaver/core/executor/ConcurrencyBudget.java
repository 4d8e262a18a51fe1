package com.docweaver.core.executor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Asynchronous counting semaphore bounding units of work in flight.
 *
 * <p>{@link #acquire()} returns a future that completes with a {@link Permit} once a slot is
 * free; waiting never parks a thread. Waiters are served first-in first-out. A waiter whose
 * future is cancelled before it is granted is discarded without consuming a slot.
 *
 * <p>One global instance is shared by every task; the executor additionally creates one per
 * task for the per-task ceiling.
 */
public class ConcurrencyBudget {

    private static final Logger log = LoggerFactory.getLogger(ConcurrencyBudget.class);

    private final String name;
    private final int limit;
    private final Deque<CompletableFuture<Permit>> waiters = new ArrayDeque<>();
    private int inFlight;
    private int peak;

    public ConcurrencyBudget(String name, int limit) {
        if (limit < 1) {
            throw new IllegalArgumentException("Budget " + name + " must allow at least one unit, got " + limit);
        }
        this.name = name;
        this.limit = limit;
    }

    public CompletableFuture<Permit> acquire() {
        var waiter = new CompletableFuture<Permit>();
        Permit granted = null;
        synchronized (this) {
            if (inFlight < limit) {
                granted = grant();
            } else {
                waiters.addLast(waiter);
                log.debug("Budget {} full ({}/{}), {} waiting", name, inFlight, limit, waiters.size());
            }
        }
        if (granted != null) {
            waiter.complete(granted);
        } else {
            waiter.whenComplete((permit, error) -> {
                if (waiter.isCancelled()) {
                    synchronized (this) {
                        waiters.remove(waiter);
                    }
                }
            });
        }
        return waiter;
    }

    public int limit() {
        return limit;
    }

    public synchronized int inFlight() {
        return inFlight;
    }

    /** Highest number of simultaneously held permits observed. */
    public synchronized int peak() {
        return peak;
    }

    public synchronized int waiting() {
        return waiters.size();
    }

    public String name() {
        return name;
    }

    private Permit grant() {
        inFlight++;
        peak = Math.max(peak, inFlight);
        return new Permit();
    }

    private void release() {
        while (true) {
            CompletableFuture<Permit> next;
            Permit handoff;
            synchronized (this) {
                next = waiters.pollFirst();
                if (next == null) {
                    inFlight--;
                    return;
                }
                if (next.isDone()) {
                    continue;
                }
                // The slot passes straight to the next waiter; inFlight is unchanged.
                handoff = new Permit();
            }
            if (next.complete(handoff)) {
                return;
            }
            // Waiter was cancelled between poll and complete; the slot is still ours.
        }
    }

    /**
     * A held slot. Releasing is idempotent.
     */
    public final class Permit implements AutoCloseable {

        private final AtomicBoolean released = new AtomicBoolean();

        private Permit() {
        }

        public void release() {
            if (released.compareAndSet(false, true)) {
                ConcurrencyBudget.this.release();
            }
        }

        @Override
        public void close() {
            release();
        }
    }
}
