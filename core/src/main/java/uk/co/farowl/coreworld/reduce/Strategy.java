// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.coreworld.reduce;

import java.util.Optional;

import uk.co.farowl.coreworld.term.Term;

/** The reduction orders the kernel knows. */
public enum Strategy implements Stepper {

    /**
     * Call-by-name to weak head normal form: only the redex at the head
     * of the application spine is ever contracted, never one under a
     * binder or in an argument.
     */
    WEAK_HEAD {
        @Override
        public Optional<Step> next(Term term) {
            return Reducer.headStep(term);
        }
    },

    /**
     * The leftmost-outermost redex anywhere in the term. Whenever the
     * term is not in weak head normal form this is the same step as
     * {@link #WEAK_HEAD} takes. It reaches the beta-normal form of every
     * term that has one.
     */
    NORMAL_ORDER {
        @Override
        public Optional<Step> next(Term term) {
            return Reducer.nextStep(term, this);
        }
    },

    /**
     * The leftmost-innermost redex: a redex none of whose sub-terms is
     * a redex. It may fail to terminate where {@link #NORMAL_ORDER}
     * would.
     */
    APPLICATIVE_ORDER {
        @Override
        public Optional<Step> next(Term term) {
            return Reducer.nextStep(term, this);
        }
    };

    @Override
    public boolean hasStep(Term term) {
        return Reducer.locate(term, this).isPresent();
    }
}
