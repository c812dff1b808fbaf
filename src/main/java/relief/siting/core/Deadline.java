package relief.siting.core;

import java.time.Duration;
import java.util.function.BooleanSupplier;

/**
 * Wall-clock budget plus an optional stop flag. The allocator only consults it between
 * rounds, so a run is never cut off mid-round.
 */
public final class Deadline {

    private static final BooleanSupplier NEVER = () -> false;

    private final long deadlineNanos; // 0 = none
    private final BooleanSupplier stopRequested;

    private Deadline(long deadlineNanos, BooleanSupplier stopRequested) {
        this.deadlineNanos = deadlineNanos;
        this.stopRequested = stopRequested;
    }

    public static Deadline none() {
        return new Deadline(0L, NEVER);
    }

    public static Deadline after(Duration limit) {
        if (limit == null || limit.isZero() || limit.isNegative()) return none();
        return new Deadline(System.nanoTime() + limit.toNanos(), NEVER);
    }

    public Deadline orWhen(BooleanSupplier stop) {
        BooleanSupplier previous = stopRequested;
        return new Deadline(deadlineNanos, () -> previous.getAsBoolean() || stop.getAsBoolean());
    }

    public boolean timeExpired() {
        return deadlineNanos != 0L && System.nanoTime() - deadlineNanos >= 0;
    }

    public boolean stopRequested() {
        return stopRequested.getAsBoolean();
    }

    public boolean expired() {
        return timeExpired() || stopRequested();
    }
}
