// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.coreworld.proof;

import java.util.Objects;

import uk.co.farowl.coreworld.term.Term;

/**
 * What a derivation proves: that {@code left} and {@code right} are
 * beta-equivalent.
 *
 * @param left one side of the equation
 * @param right the other side
 */
public record Judgement(Term left, Term right) {

    /**
     * Validate the components.
     *
     * @param left one side of the equation
     * @param right the other side
     */
    public Judgement {
        Objects.requireNonNull(left, "left");
        Objects.requireNonNull(right, "right");
    }

    @Override
    public String toString() { return left + " = " + right; }
}
