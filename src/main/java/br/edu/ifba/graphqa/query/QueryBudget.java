package br.edu.ifba.graphqa.query;

import br.edu.ifba.graphqa.storage.TraversalBudget;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Per-query traversal budget: a deadline, a node-visit cap and a cancellation flag.
 * Shared by every traversal issued for one query.
 */
public final class QueryBudget implements TraversalBudget {

    private final long deadlineNanos;
    private final int maxVisits;
    private final AtomicInteger visits = new AtomicInteger();
    private final AtomicBoolean cancelled = new AtomicBoolean();
    private final AtomicBoolean exhausted = new AtomicBoolean();

    public QueryBudget(Duration timeout, int maxVisits) {
        this.deadlineNanos = System.nanoTime() + timeout.toNanos();
        this.maxVisits = maxVisits;
    }

    @Override
    public boolean tryVisit() {
        if (cancelled.get()) {
            return false;
        }
        if (System.nanoTime() - deadlineNanos >= 0) {
            exhausted.set(true);
            return false;
        }
        if (visits.incrementAndGet() > maxVisits) {
            exhausted.set(true);
            return false;
        }
        return true;
    }

    @Override
    public boolean isCancelled() {
        return cancelled.get();
    }

    public void cancel() {
        cancelled.set(true);
    }

    /**
     * True once a visit was refused because the deadline passed or the visit cap was hit.
     */
    public boolean isExhausted() {
        return exhausted.get();
    }

    public long remainingMillis() {
        return Math.max(0L, TimeUnit.NANOSECONDS.toMillis(deadlineNanos - System.nanoTime()));
    }

    public int visitedNodes() {
        return Math.min(visits.get(), maxVisits);
    }
}
