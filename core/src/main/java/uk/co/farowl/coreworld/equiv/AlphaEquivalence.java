// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.coreworld.equiv;

import java.util.ArrayDeque;
import java.util.Deque;

import uk.co.farowl.coreworld.term.Abstraction;
import uk.co.farowl.coreworld.term.Application;
import uk.co.farowl.coreworld.term.Term;
import uk.co.farowl.coreworld.term.Variable;

/**
 * Alpha-equivalence: equality of terms up to consistent renaming of
 * bound variables. It never reduces, needs no fuel and always
 * terminates. The walk is iterative, so it is safe on deep terms.
 * <p>
 * The comparison carries an {@link Environment} relating the binders
 * of one term to those of the other. Two variables bound within the
 * terms compared are equivalent if the environment relates their
 * binders. Two variables free at the starting point are equivalent if
 * they are the same free reference. Abstractions are equivalent if
 * their bodies are, in the environment extended by relating their two
 * binders. Applications are equivalent if their parts are. Nothing else
 * is equivalent.
 */
public final class AlphaEquivalence {

    private AlphaEquivalence() {} // no instances

    /**
     * The correspondence between binders of the two terms under
     * comparison, at some point in the walk. It is created for a single
     * call and discarded afterwards. Each level records, for a binder
     * of the left term, the level of the binder in the right term it
     * was entered together with.
     */
    static final class Environment {

        /** The environment at the starting point of a comparison. */
        static final Environment EMPTY = new Environment(null, -1, -1, 0);

        private final Environment outer;
        private final int leftLevel;
        private final int rightLevel;
        private final int depth;

        private Environment(Environment outer, int leftLevel,
                int rightLevel, int depth) {
            this.outer = outer;
            this.leftLevel = leftLevel;
            this.rightLevel = rightLevel;
            this.depth = depth;
        }

        /** @return number of binder pairs entered */
        int depth() { return depth; }

        /**
         * Extend with a fresh pair of binders, one on each side.
         *
         * @return the extended environment
         */
        Environment extend() {
            return new Environment(this, depth, depth, depth + 1);
        }

        /**
         * Whether left index {@code i} and right index {@code j}, both
         * bound in this environment, refer to related binders.
         *
         * @param i index of a variable in the left term
         * @param j index of a variable in the right term
         * @return whether the binders correspond
         */
        boolean related(int i, int j) {
            // Binder for i is i levels out from the innermost.
            Environment e = this;
            for (int n = 0; n < i; n++) { e = e.outer; }
            return e.rightLevel == depth - 1 - j
                    && e.leftLevel == depth - 1 - i;
        }
    }

    private record Task(Term left, Term right, Environment env) {}

    /**
     * Whether two terms are alpha-equivalent.
     *
     * @param a one term
     * @param b the other term
     * @return whether they are equal up to renaming of bound variables
     */
    public static boolean equivalent(Term a, Term b) {
        Deque<Task> work = new ArrayDeque<>();
        work.push(new Task(a, b, Environment.EMPTY));

        while (!work.isEmpty()) {
            Task task = work.pop();
            Term x = task.left(), y = task.right();
            Environment env = task.env();

            if (x == y) {
                // Same sub-term at the same depth on both sides.
                continue;
            } else if (x instanceof Variable vx) {
                if (!(y instanceof Variable vy)
                        || !variables(vx.index(), vy.index(), env)) {
                    return false;
                }
            } else if (x instanceof Abstraction ax) {
                if (!(y instanceof Abstraction ay)) { return false; }
                work.push(new Task(ax.body(), ay.body(), env.extend()));
            } else if (x instanceof Application px) {
                if (!(y instanceof Application py)) { return false; }
                work.push(new Task(px.argument(), py.argument(), env));
                work.push(new Task(px.function(), py.function(), env));
            }
        }
        return true;
    }

    private static boolean variables(int i, int j, Environment env) {
        int depth = env.depth();
        boolean boundI = i < depth, boundJ = j < depth;
        if (boundI != boundJ) {
            return false;
        } else if (boundI) {
            return env.related(i, j);
        } else {
            // Free references, relative to the starting point.
            return i - depth == j - depth;
        }
    }
}
