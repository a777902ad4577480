// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.coreworld.reduce;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Optional;

import uk.co.farowl.coreworld.support.KernelError;
import uk.co.farowl.coreworld.term.Abstraction;
import uk.co.farowl.coreworld.term.Application;
import uk.co.farowl.coreworld.term.Path;
import uk.co.farowl.coreworld.term.Path.Move;
import uk.co.farowl.coreworld.term.Substitution;
import uk.co.farowl.coreworld.term.Term;

/**
 * Single-step beta reduction.
 * <p>
 * The evaluation contexts of the kernel are {@code E ::= [] | (E N)}:
 * the hole is only ever in function position. A term takes a step,
 * under {@link #step(Term)}, if and only if it has the form
 * {@code E[(λM) N]}, and the step replaces that redex with
 * {@code M[N/0]}. The argument {@code N} is substituted as it is,
 * unevaluated, and may be copied or discarded. Nothing is reduced
 * inside an abstraction or in argument position. A term with no such
 * step is in weak head normal form.
 * <p>
 * {@link #reduceOnce(Term)} extends this to the leftmost-outermost
 * redex anywhere in the term (normal order), which is the relation
 * needed to reach a full beta-normal form.
 */
public final class Reducer {

    private Reducer() {} // no instances

    /**
     * The weak head step from {@code term}, if it is not in weak head
     * normal form.
     *
     * @param term to reduce
     * @return the term after one step, or empty
     */
    public static Optional<Term> step(Term term) {
        return headStep(term).map(Step::result);
    }

    /**
     * The weak head step from {@code term}, with a description of the
     * redex contracted.
     *
     * @param term to reduce
     * @return the step taken, or empty
     */
    public static Optional<Step> headStep(Term term) {
        Spine spine = Spine.of(term);
        if (spine.head() instanceof Abstraction abs
                && !spine.arguments().isEmpty()) {
            Path path = Path.ROOT.then(Move.FUNCTION,
                    spine.arguments().size() - 1);
            Application redex = (Application)path.select(term);
            Term contractum = Substitution.substitute(abs.body(), 0,
                    spine.arguments().get(0));
            return Optional.of(new Step(path, redex, contractum,
                    spine.rebuild(contractum, 1)));
        }
        return Optional.empty();
    }

    /**
     * Whether {@code term} is in weak head normal form: it is an
     * abstraction, or its application spine has something other than
     * an abstraction at its head.
     *
     * @param term to test
     * @return whether no weak head step is possible
     */
    public static boolean isWhnf(Term term) {
        Term head = term;
        boolean applied = false;
        while (head instanceof Application p) {
            head = p.function();
            applied = true;
        }
        return !(applied && head instanceof Abstraction);
    }

    /**
     * The leftmost-outermost beta step anywhere in {@code term},
     * including under binders.
     *
     * @param term to reduce
     * @return the term after one step, or empty if it is in
     *     beta-normal form
     */
    public static Optional<Term> reduceOnce(Term term) {
        return reduceOnce(term, Strategy.NORMAL_ORDER);
    }

    /**
     * One step from {@code term} according to the given strategy.
     *
     * @param term to reduce
     * @param strategy choosing the redex
     * @return the term after one step, or empty
     */
    public static Optional<Term> reduceOnce(Term term, Strategy strategy) {
        return strategy.next(term).map(Step::result);
    }

    /**
     * One step from {@code term} according to the given strategy, with
     * a description of the redex contracted.
     *
     * @param term to reduce
     * @param strategy choosing the redex
     * @return the step taken, or empty
     */
    public static Optional<Step> nextStep(Term term, Strategy strategy) {
        return locate(term, strategy).map(path -> {
            Application redex = (Application)path.select(term);
            Term contractum = contract(redex);
            return new Step(path, redex, contractum,
                    path.replace(term, contractum));
        });
    }

    /**
     * Find the redex the given strategy would contract next.
     *
     * @param term to search
     * @param strategy choosing the redex
     * @return position of the redex or empty if there is none
     */
    public static Optional<Path> locate(Term term, Strategy strategy) {
        return switch (strategy) {
            case WEAK_HEAD -> Optional.ofNullable(headRedex(term));
            case NORMAL_ORDER -> Optional.ofNullable(outermost(term));
            case APPLICATIVE_ORDER -> Optional.ofNullable(innermost(term));
        };
    }

    /**
     * Contract a beta-redex {@code (λM) N} to {@code M[N/0]}.
     *
     * @param redex to contract
     * @return the contractum
     */
    public static Term contract(Application redex) {
        if (redex.function() instanceof Abstraction abs) {
            return Substitution.substitute(abs.body(), 0,
                    redex.argument());
        }
        throw new KernelError("contracting a non-redex %s", redex);
    }

    /** Position of the weak head redex, or null in weak head normal form. */
    private static Path headRedex(Term term) {
        int depth = 0;
        Term head = term;
        while (head instanceof Application p) {
            head = p.function();
            depth += 1;
        }
        if (depth > 0 && head instanceof Abstraction) {
            return Path.ROOT.then(Move.FUNCTION, depth - 1);
        }
        return null;
    }

    private record At(Term term, Path path) {}

    /** First redex in a pre-order, left to right walk, or null. */
    private static Path outermost(Term root) {
        Deque<At> work = new ArrayDeque<>();
        work.push(new At(root, Path.ROOT));
        while (!work.isEmpty()) {
            At at = work.pop();
            if (at.term() instanceof Application p) {
                if (p.isRedex()) { return at.path(); }
                work.push(new At(p.argument(), at.path().then(Move.ARGUMENT)));
                work.push(new At(p.function(), at.path().then(Move.FUNCTION)));
            } else if (at.term() instanceof Abstraction a) {
                work.push(new At(a.body(), at.path().then(Move.BODY)));
            }
        }
        return null;
    }

    private record Frame(Term term, Path path, boolean expanded) {}

    /** First redex in a post-order, left to right walk, or null. */
    private static Path innermost(Term root) {
        Deque<Frame> work = new ArrayDeque<>();
        work.push(new Frame(root, Path.ROOT, false));
        while (!work.isEmpty()) {
            Frame f = work.pop();
            if (f.expanded()) {
                // Children done and contained no redex.
                if (((Application)f.term()).isRedex()) { return f.path(); }
            } else if (f.term() instanceof Application p) {
                work.push(new Frame(p, f.path(), true));
                work.push(new Frame(p.argument(),
                        f.path().then(Move.ARGUMENT), false));
                work.push(new Frame(p.function(),
                        f.path().then(Move.FUNCTION), false));
            } else if (f.term() instanceof Abstraction a) {
                work.push(new Frame(a.body(), f.path().then(Move.BODY),
                        false));
            }
        }
        return null;
    }
}
