// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.coreworld.reduce;

import java.util.Objects;

import uk.co.farowl.coreworld.term.Application;
import uk.co.farowl.coreworld.term.Path;
import uk.co.farowl.coreworld.term.Term;

/**
 * One beta step: the redex contracted, where it was, what replaced it,
 * and the whole term that resulted.
 *
 * @param path position of the redex in the term stepped
 * @param redex the application contracted
 * @param contractum what replaced it
 * @param result the whole term after the step
 */
public record Step(Path path, Application redex, Term contractum,
        Term result) {

    /**
     * Validate the components.
     *
     * @param path position of the redex in the term stepped
     * @param redex the application contracted
     * @param contractum what replaced it
     * @param result the whole term after the step
     */
    public Step {
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(redex, "redex");
        Objects.requireNonNull(contractum, "contractum");
        Objects.requireNonNull(result, "result");
    }

    @Override
    public String toString() {
        return String.format("at %s: %s → %s", path, redex, contractum);
    }
}
