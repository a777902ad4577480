// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.coreworld.support;

/**
 * A derivation offered to the kernel does not check: one of its rule
 * applications is not an instance of the rule it claims to be.
 */
public class DerivationError extends RuntimeException {
    private static final long serialVersionUID = 1L;

    /** The way in which a rule application failed. */
    public enum Reason {
        /** A beta step names a term that is not a redex. */
        NOT_A_REDEX,
        /** A beta step names the wrong result for its redex. */
        WRONG_CONTRACTUM,
        /** The two halves of a transitive step do not meet. */
        TRANSITIVITY_GAP
    }

    private final Reason reason;

    /**
     * Create an error for a rule application that fails to check.
     *
     * @param reason the way the rule failed
     * @param msg a Java format string for the message
     * @param args to insert in the format string
     */
    public DerivationError(Reason reason, String msg, Object... args) {
        super(String.format(msg, args));
        this.reason = reason;
    }

    /** @return the way the rule failed */
    public Reason reason() { return reason; }
}
