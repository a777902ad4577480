// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.coreworld.proof;

/** Which of the two subjects of a comparison a fact concerns. */
public enum Side {
    /** The first subject. */
    LEFT,
    /** The second subject. */
    RIGHT
}
