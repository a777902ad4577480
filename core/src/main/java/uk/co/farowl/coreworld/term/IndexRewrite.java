// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.coreworld.term;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * A bottom-up rebuild of a term in which only variables change, and
 * where the change depends on the index and on the number of binders
 * crossed to reach it. Shifting and substitution are both of this
 * form.
 * <p>
 * The walk keeps its own stack, so the depth of the term is limited
 * only by the heap. A sub-term that a subclass declares
 * {@link #untouched(Term, int) untouched} is returned as the same
 * instance, and so is any node whose children all came back unchanged.
 */
abstract class IndexRewrite {

    /**
     * Whether the given sub-term, reached under {@code depth} binders,
     * is certainly unchanged by this rewrite.
     *
     * @param term sub-term
     * @param depth binders crossed to reach it
     * @return {@code true} if the rewrite may skip it
     */
    abstract boolean untouched(Term term, int depth);

    /**
     * The replacement for a variable reached under {@code depth}
     * binders.
     *
     * @param v variable
     * @param depth binders crossed to reach it
     * @return the variable or its replacement
     */
    abstract Term variable(Variable v, int depth);

    private record Visit(Term term, int depth) {}

    private record Rebuild(Term original) {}

    /**
     * Apply this rewrite to a whole term.
     *
     * @param root to rewrite
     * @return rewritten term
     */
    final Term apply(Term root) {
        Deque<Object> tasks = new ArrayDeque<>();
        Deque<Term> results = new ArrayDeque<>();
        tasks.push(new Visit(root, 0));

        while (!tasks.isEmpty()) {
            Object task = tasks.pop();
            if (task instanceof Visit visit) {
                Term t = visit.term();
                int d = visit.depth();
                if (untouched(t, d)) {
                    results.push(t);
                } else if (t instanceof Variable v) {
                    results.push(variable(v, d));
                } else if (t instanceof Abstraction a) {
                    tasks.push(new Rebuild(a));
                    tasks.push(new Visit(a.body(), d + 1));
                } else if (t instanceof Application p) {
                    // The function is visited first, so its result is
                    // deeper on the results stack than the argument's.
                    tasks.push(new Rebuild(p));
                    tasks.push(new Visit(p.argument(), d));
                    tasks.push(new Visit(p.function(), d));
                }
            } else {
                Term t = ((Rebuild)task).original();
                if (t instanceof Abstraction a) {
                    Term body = results.pop();
                    results.push(body == a.body() ? a : new Abstraction(body));
                } else {
                    Application p = (Application)t;
                    Term arg = results.pop();
                    Term fun = results.pop();
                    results.push(fun == p.function() && arg == p.argument()
                            ? p : new Application(fun, arg));
                }
            }
        }
        return results.pop();
    }
}
