// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.coreworld.proof;

import java.util.Objects;

import uk.co.farowl.coreworld.reduce.Normalization;
import uk.co.farowl.coreworld.reduce.Normalization.NormalForm;
import uk.co.farowl.coreworld.term.Term;

/**
 * The result of looking for a contradiction in a term or derivation.
 * The calculus is confluent, so a contradiction always points to a
 * defect in whatever built or reduced the object examined, never to a
 * property of the calculus.
 */
public sealed interface Consistency permits Consistency.Consistent,
        Consistency.InconsistencyCertificate {

    /** @return whether no contradiction was found */
    default boolean isConsistent() { return this instanceof Consistent; }

    /**
     * No contradiction was found. If {@code outcome} is a normal form,
     * it is the beta-normal form of the subject by normal order reduction.
     * If the fuel ran out, the check was only as thorough as the budget
     * allowed.
     *
     * @param subject the term examined
     * @param outcome of reducing it in normal order
     */
    record Consistent(Term subject, Normalization outcome)
            implements Consistency {
        /**
         * Validate the components.
         *
         * @param subject the term examined
         * @param outcome of reducing it in normal order
         */
        public Consistent {
            Objects.requireNonNull(subject, "subject");
            Objects.requireNonNull(outcome, "outcome");
        }
    }

    /** Where the two reductions of a certificate came from. */
    enum Origin {
        /** Two reduction orders applied to the same term. */
        REDUCTION_PATHS,
        /** The two sides of an equation a derivation claims. */
        DERIVATION
    }

    /**
     * Two terms that ought to have the same normal form, reduced to
     * normal forms that are not alpha-equivalent.
     *
     * @param origin what the two reductions were
     * @param left the first term (the subject itself for
     *     {@link Origin#REDUCTION_PATHS})
     * @param right the second term (also the subject for
     *     {@link Origin#REDUCTION_PATHS})
     * @param leftNormalForm reduction of {@code left}
     * @param rightNormalForm reduction of {@code right}
     */
    record InconsistencyCertificate(Origin origin, Term left, Term right,
            NormalForm leftNormalForm, NormalForm rightNormalForm)
            implements Consistency {
        /**
         * Validate the components.
         *
         * @param origin what the two reductions were
         * @param left the first term
         * @param right the second term
         * @param leftNormalForm reduction of {@code left}
         * @param rightNormalForm reduction of {@code right}
         */
        public InconsistencyCertificate {
            Objects.requireNonNull(origin, "origin");
            Objects.requireNonNull(left, "left");
            Objects.requireNonNull(right, "right");
            Objects.requireNonNull(leftNormalForm, "leftNormalForm");
            Objects.requireNonNull(rightNormalForm, "rightNormalForm");
        }
    }
}
