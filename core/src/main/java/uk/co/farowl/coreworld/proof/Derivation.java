// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.coreworld.proof;

import java.util.Objects;

import uk.co.farowl.coreworld.term.Term;

/**
 * A derivation in the equational theory of beta: a tree of rule
 * applications that, if it checks, proves a {@link Judgement}. Nothing
 * about a {@code Derivation} is trusted until it has been checked; it
 * may be constructed, encoded and decoded freely whether it is valid or
 * not.
 * <p>
 * The rules are those of an equivalence relation (reflexivity, symmetry,
 * transitivity), the beta axiom, and congruence with the two term
 * constructors. There is no eta rule.
 */
public sealed interface Derivation permits Derivation.Refl,
        Derivation.Sym, Derivation.Trans, Derivation.BetaStep,
        Derivation.CongApp, Derivation.CongLam {

    /**
     * {@code M = M}.
     *
     * @param term {@code M}
     */
    record Refl(Term term) implements Derivation {
        /**
         * Validate the component.
         *
         * @param term {@code M}
         */
        public Refl {
            Objects.requireNonNull(term, "term");
        }
    }

    /**
     * From {@code M = N} conclude {@code N = M}.
     *
     * @param of the derivation reversed
     */
    record Sym(Derivation of) implements Derivation {
        /**
         * Validate the component.
         *
         * @param of the derivation reversed
         */
        public Sym {
            Objects.requireNonNull(of, "of");
        }
    }

    /**
     * From {@code L = M} and {@code M = N} conclude {@code L = N}. The
     * two occurrences of {@code M} need only be alpha-equivalent.
     *
     * @param first derivation of {@code L = M}
     * @param second derivation of {@code M = N}
     */
    record Trans(Derivation first, Derivation second) implements Derivation {
        /**
         * Validate the components.
         *
         * @param first derivation of {@code L = M}
         * @param second derivation of {@code M = N}
         */
        public Trans {
            Objects.requireNonNull(first, "first");
            Objects.requireNonNull(second, "second");
        }
    }

    /**
     * {@code (λM) N = M[N/0]}: the redex and the claimed contractum.
     *
     * @param redex claimed to be a redex
     * @param contractum claimed to be its contraction
     */
    record BetaStep(Term redex, Term contractum) implements Derivation {
        /**
         * Validate the components.
         *
         * @param redex claimed to be a redex
         * @param contractum claimed to be its contraction
         */
        public BetaStep {
            Objects.requireNonNull(redex, "redex");
            Objects.requireNonNull(contractum, "contractum");
        }
    }

    /**
     * From {@code F = G} and {@code A = B} conclude {@code F A = G B}.
     *
     * @param function derivation of {@code F = G}
     * @param argument derivation of {@code A = B}
     */
    record CongApp(Derivation function, Derivation argument)
            implements Derivation {
        /**
         * Validate the components.
         *
         * @param function derivation of {@code F = G}
         * @param argument derivation of {@code A = B}
         */
        public CongApp {
            Objects.requireNonNull(function, "function");
            Objects.requireNonNull(argument, "argument");
        }
    }

    /**
     * From {@code M = N} conclude {@code λM = λN}.
     *
     * @param body derivation of {@code M = N}
     */
    record CongLam(Derivation body) implements Derivation {
        /**
         * Validate the component.
         *
         * @param body derivation of {@code M = N}
         */
        public CongLam {
            Objects.requireNonNull(body, "body");
        }
    }
}
