// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.coreworld.equiv;

import java.util.ArrayDeque;
import java.util.Deque;

import uk.co.farowl.coreworld.proof.Derivation;
import uk.co.farowl.coreworld.proof.Judgement;
import uk.co.farowl.coreworld.reduce.Reducer;
import uk.co.farowl.coreworld.support.DerivationError;
import uk.co.farowl.coreworld.support.DerivationError.Reason;
import uk.co.farowl.coreworld.support.KernelError;
import uk.co.farowl.coreworld.term.Abstraction;
import uk.co.farowl.coreworld.term.Application;
import uk.co.farowl.coreworld.term.Term;

/**
 * Checks a {@link Derivation} rule by rule and reports the equation it
 * proves. The check is iterative, so a derivation as deep as the terms
 * it concerns does not exhaust the stack.
 */
public final class DerivationChecker {

    private DerivationChecker() {} // no instances

    /** Marks a node whose premises are already on the result stack. */
    private record Conclude(Derivation node) {}

    /**
     * Check a derivation and return its conclusion.
     *
     * @param derivation to check
     * @return the equation it proves
     * @throws DerivationError if any rule is misapplied
     */
    public static Judgement verify(Derivation derivation)
            throws DerivationError {
        Deque<Object> work = new ArrayDeque<>();
        Deque<Judgement> results = new ArrayDeque<>();
        work.push(derivation);

        while (!work.isEmpty()) {
            Object item = work.pop();
            if (item instanceof Conclude c) {
                results.push(conclude(c.node(), results));
            } else if (item instanceof Derivation.Refl r) {
                results.push(new Judgement(r.term(), r.term()));
            } else if (item instanceof Derivation.BetaStep b) {
                results.push(beta(b));
            } else if (item instanceof Derivation.Sym s) {
                work.push(new Conclude(s));
                work.push(s.of());
            } else if (item instanceof Derivation.Trans t) {
                work.push(new Conclude(t));
                work.push(t.second());
                work.push(t.first());
            } else if (item instanceof Derivation.CongApp a) {
                work.push(new Conclude(a));
                work.push(a.argument());
                work.push(a.function());
            } else if (item instanceof Derivation.CongLam l) {
                work.push(new Conclude(l));
                work.push(l.body());
            } else {
                throw new KernelError("unexpected work item %s", item);
            }
        }
        return results.pop();
    }

    private static Judgement beta(Derivation.BetaStep b) {
        if (!(b.redex() instanceof Application p
                && p.function() instanceof Abstraction)) {
            throw new DerivationError(Reason.NOT_A_REDEX,
                    "beta step on %s, which is not a redex", b.redex());
        }
        Term expected = Reducer.contract(p);
        if (!AlphaEquivalence.equivalent(expected, b.contractum())) {
            throw new DerivationError(Reason.WRONG_CONTRACTUM,
                    "beta step claims %s → %s but the contractum is %s",
                    b.redex(), b.contractum(), expected);
        }
        return new Judgement(b.redex(), b.contractum());
    }

    /** Combine the judgements of the premises of {@code node}. */
    private static Judgement conclude(Derivation node,
            Deque<Judgement> results) {
        if (node instanceof Derivation.Sym) {
            Judgement j = results.pop();
            return new Judgement(j.right(), j.left());
        } else if (node instanceof Derivation.Trans) {
            Judgement second = results.pop(), first = results.pop();
            if (!AlphaEquivalence.equivalent(first.right(),
                    second.left())) {
                throw new DerivationError(Reason.TRANSITIVITY_GAP,
                        "cannot chain %s with %s", first, second);
            }
            return new Judgement(first.left(), second.right());
        } else if (node instanceof Derivation.CongApp) {
            Judgement a = results.pop(), f = results.pop();
            return new Judgement(new Application(f.left(), a.left()),
                    new Application(f.right(), a.right()));
        } else {
            Judgement b = results.pop();
            return new Judgement(new Abstraction(b.left()),
                    new Abstraction(b.right()));
        }
    }
}
