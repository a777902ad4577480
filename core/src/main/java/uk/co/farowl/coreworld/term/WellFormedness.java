// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.coreworld.term;

import java.util.ArrayDeque;
import java.util.Deque;

import uk.co.farowl.coreworld.support.WellFormednessError;

/**
 * Validation of terms against a declared scope of free variables. Free
 * variables are pure indices: a term is well formed in a scope of
 * {@code k} free variables when every free index, counted from the
 * root, is less than {@code k}. A closed term is one well formed in an
 * empty scope.
 * <p>
 * The kernel does not repair ill-formed input. A caller that requires
 * a particular scope should check at the point terms enter from outside.
 */
public final class WellFormedness {

    private WellFormedness() {} // no instances

    /**
     * Check that a term is well formed in a scope of {@code scope} free
     * variables.
     *
     * @param term to check
     * @param scope number of free variables available
     * @throws WellFormednessError naming the first offending index, in
     *     left to right order, and its binder depth
     */
    public static void check(Term term, int scope)
            throws WellFormednessError {
        if (scope < 0) {
            throw new IllegalArgumentException("negative scope");
        } else if (term.freeBound() <= scope) {
            return;
        }

        // Something is out of scope: find the first occurrence to report.
        record Visit(Term term, int depth) {}
        Deque<Visit> work = new ArrayDeque<>();
        work.push(new Visit(term, 0));
        while (!work.isEmpty()) {
            Visit v = work.pop();
            // A sub-term that is in scope here can be skipped.
            if (v.term().freeBound() <= scope + v.depth()) {
                continue;
            } else if (v.term() instanceof Variable x) {
                throw new WellFormednessError(x.index(), v.depth(),
                        "free variable %d at binder depth %d "
                                + "is outside a scope of %d",
                        x.index(), v.depth(), scope);
            } else if (v.term() instanceof Abstraction a) {
                work.push(new Visit(a.body(), v.depth() + 1));
            } else if (v.term() instanceof Application p) {
                work.push(new Visit(p.argument(), v.depth()));
                work.push(new Visit(p.function(), v.depth()));
            }
        }
    }

    /**
     * Check that a term is closed.
     *
     * @param term to check
     * @throws WellFormednessError naming the first free index
     */
    public static void requireClosed(Term term) throws WellFormednessError {
        check(term, 0);
    }

    /**
     * Whether a term is well formed in a scope of {@code scope} free
     * variables. This is an O(1) test.
     *
     * @param term to test
     * @param scope number of free variables available
     * @return whether all free indices are less than {@code scope}
     */
    public static boolean isWellFormed(Term term, int scope) {
        return term.freeBound() <= scope;
    }
}
