package no.cantara.accreditation;

import java.time.Duration;

/**
 * A deadline for bounded-time work such as corpus loads and crosswalks.
 */
public final class TimeBudget {

    private final long deadlineNanos;
    private final Duration total;

    public TimeBudget(Duration total) {
        this.total = total;
        this.deadlineNanos = System.nanoTime() + total.toNanos();
    }

    public static TimeBudget unlimited() {
        return new TimeBudget(Duration.ofDays(365));
    }

    public long remainingMs() {
        return Math.max(0, (deadlineNanos - System.nanoTime()) / 1_000_000);
    }

    public boolean exhausted() {
        return deadlineNanos - System.nanoTime() <= 0;
    }

    public Duration total() {
        return total;
    }
}
