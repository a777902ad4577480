// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.coreworld.term;

import java.util.Objects;

/** The application of one term (the function) to another (the argument). */
public final class Application implements Term {

    private final Term function;
    private final Term argument;
    private final int freeBound;
    private final long size;
    private final int hash;

    /**
     * Create the application of {@code function} to {@code argument}.
     *
     * @param function in function position
     * @param argument in argument position
     */
    public Application(Term function, Term argument) {
        this.function = Objects.requireNonNull(function, "function");
        this.argument = Objects.requireNonNull(argument, "argument");
        this.freeBound =
                Math.max(function.freeBound(), argument.freeBound());
        this.size = Structure.addSize(
                Structure.addSize(1L, function.size()), argument.size());
        this.hash = Structure.applicationHash(function.hashCode(),
                argument.hashCode());
    }

    /** @return the term in function position */
    public Term function() { return function; }

    /** @return the term in argument position */
    public Term argument() { return argument; }

    /**
     * Whether this application is a beta-redex, that is, has an
     * abstraction in function position.
     *
     * @return {@code true} if this is a redex
     */
    public boolean isRedex() { return function instanceof Abstraction; }

    @Override
    public int freeBound() { return freeBound; }

    @Override
    public long size() { return size; }

    @Override
    public int hashCode() { return hash; }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof Term t && Structure.equal(this, t);
    }

    @Override
    public String toString() { return Structure.print(this); }
}
