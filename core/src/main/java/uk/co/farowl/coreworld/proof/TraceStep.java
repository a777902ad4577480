// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.coreworld.proof;

import java.util.Objects;

import uk.co.farowl.coreworld.term.Path;
import uk.co.farowl.coreworld.term.Term;

/**
 * One beta step in the derivation behind a verdict: on which subject, at
 * what position in it (as that subject stood when the step was taken),
 * and the redex and contractum.
 *
 * @param side subject stepped
 * @param path position of the redex from the root of the subject
 * @param before the redex
 * @param after the contractum
 */
public record TraceStep(Side side, Path path, Term before, Term after) {

    /**
     * Validate the components.
     *
     * @param side subject stepped
     * @param path position of the redex from the root of the subject
     * @param before the redex
     * @param after the contractum
     */
    public TraceStep {
        Objects.requireNonNull(side, "side");
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(before, "before");
        Objects.requireNonNull(after, "after");
    }

    @Override
    public String toString() {
        return String.format("%s at %s: %s → %s", side, path, before,
                after);
    }
}
