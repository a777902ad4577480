// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.coreworld.reduce;

/**
 * A budget of reduction steps. Each step a driver takes must first be
 * paid for with {@link #tryConsume()}; when that fails the driver stops
 * and reports that it ran out, which is how a possibly non-terminating
 * computation is made to yield.
 * <p>
 * A {@code Fuel} is mutable and belongs to a single call: it may be
 * handed to several drivers in turn (the two sides of an equivalence
 * check share one in lock step), but it is not for sharing between
 * threads.
 */
public final class Fuel {

    private final long budget;
    private long remaining;

    private Fuel(long budget) {
        this.budget = budget;
        this.remaining = budget;
    }

    /**
     * A fresh budget of {@code budget} steps.
     *
     * @param budget number of steps ({@code >= 0})
     * @return the fuel
     */
    public static Fuel of(long budget) {
        if (budget < 0) {
            throw new IllegalArgumentException("negative fuel budget");
        }
        return new Fuel(budget);
    }

    /**
     * Pay for one step, if any fuel remains.
     *
     * @return {@code true} if a step was paid for
     */
    public boolean tryConsume() {
        if (remaining == 0) { return false; }
        remaining -= 1;
        return true;
    }

    /** @return steps still available */
    public long remaining() { return remaining; }

    /** @return steps paid for so far */
    public long spent() { return budget - remaining; }

    /** @return whether no steps remain */
    public boolean isExhausted() { return remaining == 0; }

    @Override
    public String toString() {
        return String.format("Fuel[%d of %d]", remaining, budget);
    }
}
