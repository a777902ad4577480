// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.coreworld.proof;

import java.util.Objects;

import uk.co.farowl.coreworld.term.Path;
import uk.co.farowl.coreworld.term.Term;

/**
 * The evidence that two terms are not beta-equivalent: a position at
 * which both have been reduced to weak head normal forms that no further
 * reduction can make agree. Typically the heads differ: one is an
 * abstraction and the other is not, or they are different variables, or
 * the same variable applied to different numbers of arguments.
 *
 * @param path position of the difference in both subjects
 * @param left weak head normal form found there in the left subject
 * @param right weak head normal form found there in the right subject
 */
public record Witness(Path path, Term left, Term right) {

    /**
     * Validate the components.
     *
     * @param path position of the difference in both subjects
     * @param left weak head normal form on the left
     * @param right weak head normal form on the right
     */
    public Witness {
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(left, "left");
        Objects.requireNonNull(right, "right");
    }
}
