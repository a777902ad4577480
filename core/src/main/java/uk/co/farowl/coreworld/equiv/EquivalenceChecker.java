// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.coreworld.equiv;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import uk.co.farowl.coreworld.proof.Proof;
import uk.co.farowl.coreworld.proof.Side;
import uk.co.farowl.coreworld.proof.TraceStep;
import uk.co.farowl.coreworld.proof.Verdict;
import uk.co.farowl.coreworld.proof.Witness;
import uk.co.farowl.coreworld.reduce.Fuel;
import uk.co.farowl.coreworld.reduce.Reducer;
import uk.co.farowl.coreworld.reduce.Spine;
import uk.co.farowl.coreworld.reduce.Step;
import uk.co.farowl.coreworld.support.KernelError;
import uk.co.farowl.coreworld.term.Abstraction;
import uk.co.farowl.coreworld.term.Path;
import uk.co.farowl.coreworld.term.Path.Move;
import uk.co.farowl.coreworld.term.Term;
import uk.co.farowl.coreworld.term.Variable;

/**
 * Semantic (beta) equivalence of two terms under a fuel budget.
 * <p>
 * Terms that are alpha-equivalent are equivalent without any reduction.
 * Otherwise the checker works through pairs of corresponding positions,
 * starting with the two roots. At each pair it steps the two sides in
 * turn towards weak head normal form, paying from a single budget
 * shared by both, and stops as soon as they are alpha-equivalent.
 * Otherwise, once both are in weak head normal form, it compares the
 * heads. Two abstractions are compared by their
 * bodies; two applications of the same variable to the same number of
 * arguments are compared argument by argument. Anything else is a
 * difference no beta reduction can remove, and is reported as a
 * {@link Witness}.
 * <p>
 * So {@link Verdict.NotEquivalent} always rests on two finite weak head
 * normal forms, never on non-termination, and running out of fuel
 * always gives {@link Verdict.Inconclusive}. Pairs are taken in breadth
 * first order, so a difference near the roots is found before a
 * divergent sub-term deeper down uses up the budget.
 */
public final class EquivalenceChecker {

    /** Logger for equivalence checking. */
    static final Logger logger =
            LoggerFactory.getLogger(EquivalenceChecker.class);

    private final boolean recordTrace;

    /**
     * Create a checker.
     *
     * @param recordTrace whether proofs should carry the beta steps
     *     taken
     */
    public EquivalenceChecker(boolean recordTrace) {
        this.recordTrace = recordTrace;
    }

    private record Pair(Term left, Term right, Path path) {}

    /**
     * Decide whether two terms are beta-equivalent, taking at most
     * {@code fuel} reduction steps (counting both sides).
     *
     * @param a the first subject
     * @param b the second subject
     * @param fuel budget of steps
     * @return the proof artifact recording the verdict
     */
    public Proof verify(Term a, Term b, long fuel) {
        return verify(a, b, Fuel.of(fuel));
    }

    /**
     * Decide whether two terms are beta-equivalent, paying for
     * reduction steps from {@code fuel}.
     *
     * @param a the first subject
     * @param b the second subject
     * @param fuel budget shared by both sides
     * @return the proof artifact recording the verdict
     */
    public Proof verify(Term a, Term b, Fuel fuel) {
        logger.atDebug().setMessage("verify {} ≡? {} with {}")
                .addArgument(a).addArgument(b).addArgument(fuel).log();

        List<TraceStep> trace = new ArrayList<>();
        Deque<Pair> work = new ArrayDeque<>();
        work.add(new Pair(a, b, Path.ROOT));

        while (!work.isEmpty()) {
            Pair pair = work.remove();
            if (AlphaEquivalence.equivalent(pair.left(), pair.right())) {
                continue;
            }

            // Step the two sides alternately towards weak head normal form.
            Term l = pair.left(), r = pair.right();
            boolean met = false;
            while (!met && !(Reducer.isWhnf(l) && Reducer.isWhnf(r))) {
                if (!Reducer.isWhnf(l)) {
                    if (!fuel.tryConsume()) {
                        return inconclusive(a, b, fuel, trace);
                    }
                    l = step(l, Side.LEFT, pair.path(), trace);
                    met = AlphaEquivalence.equivalent(l, r);
                }
                if (!met && !Reducer.isWhnf(r)) {
                    if (!fuel.tryConsume()) {
                        return inconclusive(a, b, fuel, trace);
                    }
                    r = step(r, Side.RIGHT, pair.path(), trace);
                    met = AlphaEquivalence.equivalent(l, r);
                }
            }

            if (met) {
                continue;
            } else if (l instanceof Abstraction la
                    && r instanceof Abstraction ra) {
                work.add(new Pair(la.body(), ra.body(),
                        pair.path().then(Move.BODY)));
            } else if (!compareNeutral(l, r, pair.path(), work)) {
                Witness w = new Witness(pair.path(), l, r);
                logger.atDebug().setMessage("not equivalent at {}: {} ≢ {}")
                        .addArgument(w.path()).addArgument(l).addArgument(r)
                        .log();
                return new Proof(a, b, new Verdict.NotEquivalent(w), trace);
            }
        }

        logger.atDebug().setMessage("equivalent after {} steps")
                .addArgument(fuel.spent()).log();
        return new Proof(a, b, Verdict.EQUIVALENT, trace);
    }

    /**
     * If {@code l} and {@code r} are the same variable applied to the
     * same number of arguments, queue the pairs of arguments for
     * comparison and return {@code true}. Otherwise the heads differ
     * irreconcilably and we return {@code false}.
     */
    private static boolean compareNeutral(Term l, Term r, Path path,
            Deque<Pair> work) {
        Spine sl = Spine.of(l), sr = Spine.of(r);
        if (sl.head() instanceof Variable hl
                && sr.head() instanceof Variable hr
                && hl.index() == hr.index()
                && sl.arguments().size() == sr.arguments().size()) {
            for (int i = 0; i < sl.arguments().size(); i++) {
                work.add(new Pair(sl.arguments().get(i),
                        sr.arguments().get(i),
                        path.then(sl.argumentPath(i))));
            }
            return true;
        }
        return false;
    }

    /** One weak head step of a side already paid for. */
    private Term step(Term t, Side side, Path at, List<TraceStep> trace) {
        Step s = Reducer.headStep(t).orElseThrow(
                () -> new KernelError("no weak head step from %s", t));
        logger.atTrace().setMessage("{} {}").addArgument(side)
                .addArgument(s).log();
        if (recordTrace) {
            trace.add(new TraceStep(side, at.then(s.path()), s.redex(),
                    s.contractum()));
        }
        return s.result();
    }

    private static Proof inconclusive(Term a, Term b, Fuel fuel,
            List<TraceStep> trace) {
        logger.atDebug().setMessage("inconclusive after {} steps")
                .addArgument(fuel.spent()).log();
        return new Proof(a, b, new Verdict.Inconclusive(fuel.spent()),
                trace);
    }
}
