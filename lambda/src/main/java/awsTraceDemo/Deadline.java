package awsTraceDemo;

import java.time.Clock;
import java.time.Duration;

/**
 * A point in time after which work must stop. Passed down the call chain and checked
 * cooperatively between steps.
 */
public final class Deadline {

    private final Clock clock;
    private final long expiresAtMillis;
    private final Duration budget;

    private Deadline(Clock clock, Duration budget) {
        this.clock = clock;
        this.budget = budget;
        this.expiresAtMillis = clock.millis() + budget.toMillis();
    }

    public static Deadline after(Duration budget, Clock clock) {
        if (budget.isNegative()) {
            throw new IllegalArgumentException("Deadline budget must not be negative: " + budget);
        }
        return new Deadline(clock, budget);
    }

    public boolean isExpired() {
        return clock.millis() >= expiresAtMillis;
    }

    public long remainingMillis() {
        return Math.max(0L, expiresAtMillis - clock.millis());
    }

    /**
     * Whole seconds left, rounded up and never below 1, for APIs such as
     * {@link java.sql.Statement#setQueryTimeout(int)} where 0 means "no limit".
     */
    public int remainingSecondsAtLeastOne() {
        long remaining = remainingMillis();
        return (int) Math.max(1L, (remaining + 999L) / 1000L);
    }

    /**
     * @param step what is about to run
     * @throws OperationTimeoutException when the deadline has passed
     */
    public void check(String step) {
        if (isExpired()) {
            throw new OperationTimeoutException("Operation exceeded " + budget.getSeconds() + "s deadline before " + step);
        }
    }

    public Duration getBudget() {
        return budget;
    }
}
