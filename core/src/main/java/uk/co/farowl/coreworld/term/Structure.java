// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.coreworld.term;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Structural equality, hashing and printing of terms. These are the
 * implementations behind {@code equals}, {@code hashCode} and
 * {@code toString} in the term classes. None of them recurses on the
 * Java stack, so they are safe on arbitrarily deep terms.
 */
final class Structure {

    private Structure() {} // no instances

    static int variableHash(int index) { return index * 0x9E3779B1 + 17; }

    static int abstractionHash(int body) { return 31 * body + 0x5BD1E995; }

    static int applicationHash(int function, int argument) {
        return (961 * function) ^ (31 * argument + 0x27D4EB2D);
    }

    /**
     * Add node counts, saturating at {@code Long.MAX_VALUE} (which can
     * be reached by a term built with a lot of sharing).
     *
     * @param a count
     * @param b count
     * @return sum or {@code Long.MAX_VALUE}
     */
    static long addSize(long a, long b) {
        long s = a + b;
        return s < 0 ? Long.MAX_VALUE : s;
    }

    /**
     * Exact structural equality of two terms.
     *
     * @param a first term
     * @param b second term
     * @return whether they are the same tree
     */
    static boolean equal(Term a, Term b) {
        Deque<Term> work = new ArrayDeque<>();
        work.push(b);
        work.push(a);
        while (!work.isEmpty()) {
            Term x = work.pop(), y = work.pop();
            if (x == y) {
                continue;
            } else if (x.hashCode() != y.hashCode()) {
                return false;
            } else if (x instanceof Variable vx) {
                if (!vx.equals(y)) { return false; }
            } else if (x instanceof Abstraction ax) {
                if (!(y instanceof Abstraction ay)) { return false; }
                work.push(ay.body());
                work.push(ax.body());
            } else if (x instanceof Application px) {
                if (!(y instanceof Application py)) { return false; }
                work.push(py.argument());
                work.push(px.argument());
                work.push(py.function());
                work.push(px.function());
            }
        }
        return true;
    }

    /**
     * Render a term compactly, for example {@code (λ.0) λ.(1 0)}.
     * Applications associate to the left, and the body of an
     * abstraction extends as far right as possible.
     *
     * @param term to render
     * @return text form
     */
    static String print(Term term) {
        StringBuilder sb = new StringBuilder();
        // Each item is either a Term to print or a String to emit.
        Deque<Object> work = new ArrayDeque<>();
        work.push(term);
        while (!work.isEmpty()) {
            Object item = work.pop();
            if (item instanceof String s) {
                sb.append(s);
            } else if (item instanceof Variable v) {
                sb.append(v.index());
            } else if (item instanceof Abstraction a) {
                sb.append("λ.");
                pushWrapped(work, a.body(),
                        a.body() instanceof Application);
            } else if (item instanceof Application p) {
                // Pushed in reverse order of emission.
                pushWrapped(work, p.argument(),
                        !(p.argument() instanceof Variable));
                work.push(" ");
                pushWrapped(work, p.function(),
                        p.function() instanceof Abstraction);
            }
        }
        return sb.toString();
    }

    private static void pushWrapped(Deque<Object> work, Term t,
            boolean parens) {
        if (parens) {
            work.push(")");
            work.push(t);
            work.push("(");
        } else {
            work.push(t);
        }
    }
}
