// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.coreworld.support;

/**
 * A term presented to the kernel violates the indexing convention: a
 * variable index is negative, or a free index falls outside the scope
 * the caller declared. The offending index is reported, together with
 * the number of binders enclosing it where that is known.
 */
public class WellFormednessError extends RuntimeException {
    private static final long serialVersionUID = 1L;

    /** Depth reported when the error is not about an occurrence. */
    public static final int NO_DEPTH = -1;

    private final int index;
    private final int depth;

    /**
     * Create an error about a variable index found at a given binder
     * depth.
     *
     * @param index the offending index
     * @param depth number of abstractions enclosing the occurrence
     * @param msg a Java format string for the message
     * @param args to insert in the format string
     */
    public WellFormednessError(int index, int depth, String msg,
            Object... args) {
        super(String.format(msg, args));
        this.index = index;
        this.depth = depth;
    }

    /**
     * Create an error about a variable index where no binder depth
     * applies (for example, at construction of the variable).
     *
     * @param index the offending index
     * @param msg a Java format string for the message
     * @param args to insert in the format string
     */
    public WellFormednessError(int index, String msg, Object... args) {
        this(index, NO_DEPTH, msg, args);
    }

    /** @return the offending index */
    public int index() { return index; }

    /**
     * @return the number of binders enclosing the offending occurrence,
     *     or {@link #NO_DEPTH}
     */
    public int depth() { return depth; }
}
