// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.coreworld.equiv;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import uk.co.farowl.coreworld.proof.Derivation;
import uk.co.farowl.coreworld.reduce.Fuel;
import uk.co.farowl.coreworld.reduce.Normalization;
import uk.co.farowl.coreworld.reduce.Normalizer;
import uk.co.farowl.coreworld.reduce.Reducer;
import uk.co.farowl.coreworld.reduce.Step;
import uk.co.farowl.coreworld.reduce.Strategy;
import uk.co.farowl.coreworld.support.DerivationError;
import uk.co.farowl.coreworld.support.DerivationError.Reason;
import uk.co.farowl.coreworld.term.Abstraction;
import uk.co.farowl.coreworld.term.Application;
import uk.co.farowl.coreworld.term.Path.Move;
import uk.co.farowl.coreworld.term.Term;

/**
 * Construction of {@link Derivation}s from the reductions the kernel
 * performs. A derivation built here always checks.
 */
public final class Derivations {

    private Derivations() {} // no instances

    /**
     * The one-rule derivation {@code (λM) N = M[N/0]}.
     *
     * @param redex to contract
     * @return the derivation
     * @throws DerivationError if {@code redex} is not a redex
     */
    public static Derivation proveBeta(Term redex) throws DerivationError {
        if (redex instanceof Application p && p.isRedex()) {
            return new Derivation.BetaStep(p, Reducer.contract(p));
        }
        throw new DerivationError(Reason.NOT_A_REDEX, "%s is not a redex",
                redex);
    }

    /**
     * A derivation of {@code before = step.result()}, in which the beta
     * step at the position of the redex is lifted to the whole term by
     * congruence.
     *
     * @param before the term the step was taken in
     * @param step taken
     * @return the derivation
     */
    public static Derivation fromStep(Term before, Step step) {
        List<Move> moves = step.path().moves();

        // Sub-terms of before along the path, from the root.
        List<Term> along = new ArrayList<>(moves.size());
        Term t = before;
        for (Move m : moves) {
            along.add(t);
            t = switch (m) {
                case FUNCTION -> ((Application)t).function();
                case ARGUMENT -> ((Application)t).argument();
                case BODY -> ((Abstraction)t).body();
            };
        }

        Derivation d =
                new Derivation.BetaStep(step.redex(), step.contractum());
        for (int i = moves.size(); --i >= 0;) {
            Term parent = along.get(i);
            d = switch (moves.get(i)) {
                case FUNCTION -> new Derivation.CongApp(d,
                        new Derivation.Refl(
                                ((Application)parent).argument()));
                case ARGUMENT -> new Derivation.CongApp(
                        new Derivation.Refl(
                                ((Application)parent).function()),
                        d);
                case BODY -> new Derivation.CongLam(d);
            };
        }
        return d;
    }

    /**
     * A derivation of {@code start = end}, where the steps are a
     * reduction sequence from {@code start} to {@code end}. The steps
     * are chained by transitivity in a balanced tree, so a long trace
     * does not make a deep derivation.
     *
     * @param start the first term of the sequence
     * @param steps the reduction sequence
     * @return the derivation ({@code Refl} if there are no steps)
     */
    public static Derivation fromTrace(Term start, List<Step> steps) {
        if (steps.isEmpty()) { return new Derivation.Refl(start); }

        List<Derivation> level = new ArrayList<>(steps.size());
        Term before = start;
        for (Step s : steps) {
            level.add(fromStep(before, s));
            before = s.result();
        }

        while (level.size() > 1) {
            List<Derivation> next = new ArrayList<>(level.size() / 2 + 1);
            for (int i = 0; i < level.size(); i += 2) {
                if (i + 1 < level.size()) {
                    next.add(new Derivation.Trans(level.get(i),
                            level.get(i + 1)));
                } else {
                    next.add(level.get(i));
                }
            }
            level = next;
        }
        return level.get(0);
    }

    /**
     * A derivation of {@code term = N} where {@code N} is the beta-normal
     * form of {@code term}, found by normal order reduction within the
     * budget.
     *
     * @param term to normalize
     * @param fuel maximum number of steps
     * @return the derivation, or empty if the fuel ran out
     */
    public static Optional<Derivation> proveNormalization(Term term,
            long fuel) {
        Normalization n = Normalizer.normalizeFully(term, Fuel.of(fuel),
                Strategy.NORMAL_ORDER, true);
        if (n.isNormalForm()) {
            return Optional.of(fromTrace(term, n.trace()));
        }
        return Optional.empty();
    }
}
