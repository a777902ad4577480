// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.coreworld.proof;

import java.util.Objects;

/**
 * The conclusion recorded in a {@link Proof}. This is a closed set of
 * cases and a client is expected to deal with each: in particular
 * {@link Inconclusive} is neither a proof of equivalence nor of
 * difference, and must be escalated (with more fuel, or to a weaker
 * tier of trust), not read as either.
 */
public sealed interface Verdict permits Verdict.Equivalent,
        Verdict.NotEquivalent, Verdict.Inconclusive, Verdict.Inconsistent {

    /** The only instance of {@link Equivalent}. */
    Equivalent EQUIVALENT = new Equivalent();

    /** The subjects are beta-equivalent. */
    record Equivalent() implements Verdict {
        @Override
        public String toString() { return "Equivalent"; }
    }

    /**
     * The subjects are not beta-equivalent, as shown by a finite
     * counterexample.
     *
     * @param witness the counterexample
     */
    record NotEquivalent(Witness witness) implements Verdict {
        /**
         * Validate the component.
         *
         * @param witness the counterexample
         */
        public NotEquivalent {
            Objects.requireNonNull(witness, "witness");
        }
    }

    /**
     * The fuel ran out before the question was settled.
     *
     * @param fuelSpent steps taken before giving up
     */
    record Inconclusive(long fuelSpent) implements Verdict {}

    /**
     * A purported proof was found to contradict itself.
     *
     * @param certificate the evidence of contradiction
     */
    record Inconsistent(Consistency.InconsistencyCertificate certificate)
            implements Verdict {
        /**
         * Validate the component.
         *
         * @param certificate the evidence of contradiction
         */
        public Inconsistent {
            Objects.requireNonNull(certificate, "certificate");
        }
    }
}
