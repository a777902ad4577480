// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.coreworld.term;

import uk.co.farowl.coreworld.support.WellFormednessError;

/** A reference to a binder, by its de Bruijn index. */
public final class Variable implements Term {

    /**
     * The largest index a variable may have. (One less than the
     * largest {@code int}, so that {@link #freeBound()} is always
     * representable.)
     */
    public static final int MAX_INDEX = Integer.MAX_VALUE - 1;

    private final int index;

    /**
     * Create a variable with the given index.
     *
     * @param index counting enclosing binders outwards from 0
     * @throws WellFormednessError if the index is negative or exceeds
     *     {@link #MAX_INDEX}
     */
    public Variable(int index) throws WellFormednessError {
        if (index < 0) {
            throw new WellFormednessError(index,
                    "variable index %d is negative", index);
        } else if (index > MAX_INDEX) {
            throw new WellFormednessError(index,
                    "variable index %d is too large", index);
        }
        this.index = index;
    }

    /** @return the de Bruijn index */
    public int index() { return index; }

    @Override
    public int freeBound() { return index + 1; }

    @Override
    public long size() { return 1L; }

    @Override
    public int hashCode() { return Structure.variableHash(index); }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof Variable v && v.index == index;
    }

    @Override
    public String toString() { return Integer.toString(index); }
}
