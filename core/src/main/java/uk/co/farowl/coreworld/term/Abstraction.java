// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.coreworld.term;

import java.util.Objects;

/** A lambda abstraction, introducing exactly one binder over its body. */
public final class Abstraction implements Term {

    private final Term body;
    private final int freeBound;
    private final long size;
    private final int hash;

    /**
     * Create an abstraction over the given body.
     *
     * @param body of the abstraction
     */
    public Abstraction(Term body) {
        this.body = Objects.requireNonNull(body, "body");
        this.freeBound = Math.max(0, body.freeBound() - 1);
        this.size = Structure.addSize(1L, body.size());
        this.hash = Structure.abstractionHash(body.hashCode());
    }

    /** @return the body of the abstraction */
    public Term body() { return body; }

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
