// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.coreworld.reduce;

import java.util.Optional;

import uk.co.farowl.coreworld.term.Term;

/**
 * A one-step reduction relation, choosing at most one redex in a term
 * to contract. The standard choices are the members of
 * {@link Strategy}.
 */
@FunctionalInterface
public interface Stepper {

    /**
     * Take one step from {@code term}, if this stepper finds a redex.
     *
     * @param term to reduce
     * @return the step taken, or empty if {@code term} is irreducible
     *     under this stepper
     */
    Optional<Step> next(Term term);

    /**
     * Whether {@link #next(Term)} would take a step from {@code term}.
     * A driver asks this before it pays for a step, so a stepper that
     * can find its redex without contracting it should say so more
     * cheaply than by taking the step.
     *
     * @param term to examine
     * @return whether {@code term} is reducible under this stepper
     */
    default boolean hasStep(Term term) { return next(term).isPresent(); }
}
