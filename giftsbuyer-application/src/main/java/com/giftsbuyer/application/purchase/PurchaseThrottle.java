package com.giftsbuyer.application.purchase;

import java.time.Duration;
import java.util.Objects;
import java.util.function.LongSupplier;

/**
 * Minimum spacing between successive purchase calls (upstream rate limit).
 *
 * The gap is measured from the end of the previous call to the start of the next one and is
 * enforced even when the calling thread is interrupted; the interrupt flag is restored afterwards.
 */
public final class PurchaseThrottle {

    private final long minSpacingNanos;
    private final LongSupplier nanoClock;
    private final Sleeper sleeper;

    private long lastCallEndNanos;
    private boolean hasLastCall;

    public PurchaseThrottle(Duration minSpacing) {
        this(minSpacing, System::nanoTime, Sleeper.SYSTEM);
    }

    public PurchaseThrottle(Duration minSpacing, LongSupplier nanoClock, Sleeper sleeper) {
        Objects.requireNonNull(minSpacing, "minSpacing");
        if (minSpacing.isNegative()) throw new IllegalArgumentException("minSpacing must be >= 0");
        this.minSpacingNanos = minSpacing.toNanos();
        this.nanoClock = Objects.requireNonNull(nanoClock, "nanoClock");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
    }

    /** Blocks until a purchase call may start. */
    public synchronized void awaitTurn() {
        if (!hasLastCall) return;

        boolean interrupted = false;
        try {
            while (true) {
                long remaining = minSpacingNanos - (nanoClock.getAsLong() - lastCallEndNanos);
                if (remaining <= 0) return;
                try {
                    sleeper.sleep(Duration.ofNanos(remaining));
                } catch (InterruptedException e) {
                    interrupted = true;
                }
            }
        } finally {
            if (interrupted) Thread.currentThread().interrupt();
        }
    }

    /** Records the end of a purchase call (successful or not). */
    public synchronized void callFinished() {
        lastCallEndNanos = nanoClock.getAsLong();
        hasLastCall = true;
    }
}
