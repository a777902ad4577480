// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.coreworld.support;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Internal error thrown when the kernel cannot be relied on to work: an
 * invariant that the algebra guarantees has been found broken. Callers
 * should not catch this to carry on. It is not a verdict, and it is not
 * the way malformed input is reported (see
 * {@link WellFormednessError}).
 */
public class KernelError extends RuntimeException {
    private static final long serialVersionUID = 1L;

    /**
     * Logger for kernel errors. A verification result built on a broken
     * kernel is worthless, so we want a record even where a caller
     * converts the exception into some softer outcome.
     */
    static final Logger logger = LoggerFactory.getLogger(KernelError.class);

    /**
     * Constructor specifying a message.
     *
     * @param msg a Java format string for the message
     * @param args to insert in the format string
     */
    public KernelError(String msg, Object... args) {
        super(String.format(msg, args));
        logger.atInfo().log(getMessage());
    }
}
