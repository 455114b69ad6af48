package com.example.videoenhance.ai.orchestrator;

import java.time.Duration;

/**
 * Wall-clock budget of one run. Work already in flight is allowed to finish;
 * callers check {@link #isExpired()} before starting anything new.
 */
public final class RunDeadline {

    private static final RunDeadline NONE = new RunDeadline(Long.MAX_VALUE, true);

    private final long deadlineNanos;
    private final boolean unbounded;

    private RunDeadline(long deadlineNanos, boolean unbounded) {
        this.deadlineNanos = deadlineNanos;
        this.unbounded = unbounded;
    }

    public static RunDeadline after(Duration budget) {
        return new RunDeadline(System.nanoTime() + budget.toNanos(), false);
    }

    public static RunDeadline none() {
        return NONE;
    }

    public boolean isExpired() {
        return !unbounded && System.nanoTime() - deadlineNanos >= 0;
    }

    public Duration remaining() {
        if (unbounded) {
            return Duration.ofNanos(Long.MAX_VALUE);
        }
        long left = deadlineNanos - System.nanoTime();
        return left > 0 ? Duration.ofNanos(left) : Duration.ZERO;
    }
}
