// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.coreworld.term;

import java.util.HashMap;
import java.util.Map;

/**
 * Capture-avoiding substitution of a term for a variable.
 * <p>
 * {@code substitute(M, k, N)} replaces occurrences of index {@code k}
 * in {@code M} with {@code N}, and removes the binder {@code k} denoted:
 * <ul>
 * <li>{@code k} itself becomes {@code N}, lifted by the number of
 * binders crossed to reach it, so that the free variables of {@code N}
 * are not captured;</li>
 * <li>an index {@code n > k} becomes {@code n-1};</li>
 * <li>an index {@code n < k} is unchanged;</li>
 * <li>under an abstraction the target becomes {@code k+1};</li>
 * <li>both sides of an application are substituted alike.</li>
 * </ul>
 * The replacement is shared, not copied: wherever it is needed at the
 * same binder depth, the same (lifted) instance is used.
 */
public final class Substitution extends IndexRewrite {

    private final int target;
    private final Term replacement;

    /** The replacement lifted to each binder depth met so far. */
    private final Map<Integer, Term> lifted = new HashMap<>();

    private Substitution(int target, Term replacement) {
        this.target = target;
        this.replacement = replacement;
    }

    /**
     * Substitute {@code replacement} for the variable
     * {@code targetIndex} in {@code term}.
     *
     * @param term in which to substitute
     * @param targetIndex the index replaced (at the root of
     *     {@code term})
     * @param replacement term to put in its place
     * @return the result (the same object if nothing changes)
     */
    public static Term substitute(Term term, int targetIndex,
            Term replacement) {
        if (targetIndex < 0) {
            throw new IllegalArgumentException("negative target index");
        } else if (term.freeBound() <= targetIndex) {
            return term;
        }
        return new Substitution(targetIndex, replacement).apply(term);
    }

    @Override
    boolean untouched(Term term, int depth) {
        return term.freeBound() <= target + depth;
    }

    @Override
    Term variable(Variable v, int depth) {
        int n = v.index(), k = target + depth;
        if (n == k) {
            return lifted.computeIfAbsent(depth,
                    d -> Shift.lift(d, replacement));
        } else if (n > k) {
            return new Variable(n - 1);
        } else {
            return v;
        }
    }
}
