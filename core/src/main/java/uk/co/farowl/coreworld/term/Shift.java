// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.coreworld.term;

import uk.co.farowl.coreworld.support.WellFormednessError;

/**
 * Index shifting: the adjustment of free variable references when a
 * term is moved under (or out from under) binders.
 * <p>
 * {@code shift(d, c, M)} adds {@code d} to every index in {@code M} that
 * is at least {@code c}, where on entering an abstraction the cutoff
 * {@code c} increases by one, so that variables bound inside {@code M}
 * are left alone.
 */
public final class Shift extends IndexRewrite {

    private final int amount;
    private final int cutoff;

    private Shift(int amount, int cutoff) {
        this.amount = amount;
        this.cutoff = cutoff;
    }

    /**
     * Shift the indices of {@code term} that are at or above
     * {@code cutoff} by {@code amount}. The operation is total for
     * {@code amount >= 0} (short of exceeding
     * {@link Variable#MAX_INDEX}). A negative amount is allowed, but it
     * is an error for it to make any index negative.
     *
     * @param amount to add to each affected index
     * @param cutoff lowest index affected at the root
     * @param term to shift
     * @return shifted term (the same object if nothing changes)
     * @throws WellFormednessError if an index would leave the valid
     *     range
     */
    public static Term shift(int amount, int cutoff, Term term)
            throws WellFormednessError {
        if (cutoff < 0) {
            throw new IllegalArgumentException("negative cutoff");
        } else if (amount == 0 || term.freeBound() <= cutoff) {
            return term;
        }
        return new Shift(amount, cutoff).apply(term);
    }

    /**
     * Lift the free variables of {@code term} by {@code amount}, as is
     * necessary when it is placed under {@code amount} new binders.
     *
     * @param amount number of binders ({@code >= 0})
     * @param term to lift
     * @return lifted term
     */
    public static Term lift(int amount, Term term) {
        if (amount < 0) {
            throw new IllegalArgumentException("negative lift");
        }
        return shift(amount, 0, term);
    }

    @Override
    boolean untouched(Term term, int depth) {
        return term.freeBound() <= cutoff + depth;
    }

    @Override
    Term variable(Variable v, int depth) {
        int n = v.index();
        if (n < cutoff + depth) { return v; }
        long shifted = (long)n + amount;
        if (shifted < 0 || shifted > Variable.MAX_INDEX) {
            throw new WellFormednessError(n, depth,
                    "shifting index %d by %d leaves the valid range", n,
                    amount);
        }
        return new Variable((int)shifted);
    }
}
