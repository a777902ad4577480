// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.coreworld.reduce;

import java.util.List;
import java.util.Objects;

import uk.co.farowl.coreworld.term.Term;

/**
 * The outcome of driving a term towards a normal form under a fuel
 * budget. Running out of fuel is an outcome like any other: it says
 * nothing about whether more fuel would have been enough.
 */
public sealed interface Normalization
        permits Normalization.NormalForm, Normalization.OutOfFuel {

    /**
     * The normal form, if one was reached, otherwise the last term
     * reached (from which normalization may be resumed).
     *
     * @return the term
     */
    Term term();

    /** @return the number of steps taken */
    long steps();

    /** @return the steps taken, if they were recorded, else empty */
    List<Step> trace();

    /** @return whether a normal form was reached */
    default boolean isNormalForm() { return this instanceof NormalForm; }

    /**
     * A normal form was reached.
     *
     * @param term the normal form
     * @param steps number of steps taken
     * @param trace the steps, if recorded, else empty
     */
    record NormalForm(Term term, long steps, List<Step> trace)
            implements Normalization {
        /**
         * Validate and copy the components.
         *
         * @param term the normal form
         * @param steps number of steps taken
         * @param trace the steps, if recorded, else empty
         */
        public NormalForm {
            Objects.requireNonNull(term, "term");
            trace = List.copyOf(trace);
        }

        @Override
        public String toString() {
            return String.format("NormalForm[%s after %d steps]", term,
                    steps);
        }
    }

    /**
     * The budget ran out first.
     *
     * @param term the last term reached
     * @param steps number of steps taken
     * @param trace the steps, if recorded, else empty
     */
    record OutOfFuel(Term term, long steps, List<Step> trace)
            implements Normalization {
        /**
         * Validate and copy the components.
         *
         * @param term the last term reached
         * @param steps number of steps taken
         * @param trace the steps, if recorded, else empty
         */
        public OutOfFuel {
            Objects.requireNonNull(term, "term");
            trace = List.copyOf(trace);
        }

        @Override
        public String toString() {
            return String.format("OutOfFuel[after %d steps]", steps);
        }
    }
}
