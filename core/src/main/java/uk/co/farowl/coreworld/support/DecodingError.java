// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.coreworld.support;

/**
 * Bytes presented for decoding are not a valid encoding of a term, a
 * derivation or a proof.
 */
public class DecodingError extends RuntimeException {
    private static final long serialVersionUID = 1L;

    /** The kind of defect found in the input. */
    public enum Reason {
        /** There were no bytes at all. */
        EMPTY_INPUT,
        /** The input ended inside an item. */
        INCOMPLETE_DATA,
        /** A tag byte is not one the format defines. */
        INVALID_TAG,
        /** A variable index or count does not fit the kernel's range. */
        INDEX_OVERFLOW,
        /** A complete item was read but bytes remain. */
        TRAILING_DATA,
        /** The magic number or version of a proof is wrong. */
        BAD_HEADER
    }

    private final Reason reason;
    private final int offset;

    /**
     * Create an error for a defect at the given offset.
     *
     * @param reason kind of defect
     * @param offset position in the input where it was detected
     * @param msg a Java format string for the message
     * @param args to insert in the format string
     */
    public DecodingError(Reason reason, int offset, String msg,
            Object... args) {
        super(String.format(msg, args) + " at offset " + offset);
        this.reason = reason;
        this.offset = offset;
    }

    /** @return the kind of defect */
    public Reason reason() { return reason; }

    /** @return position in the input where it was detected */
    public int offset() { return offset; }
}
