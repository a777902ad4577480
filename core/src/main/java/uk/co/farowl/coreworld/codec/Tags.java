// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.coreworld.codec;

/** Type codes used in the encoded forms. */
final class Tags {

    private Tags() {} // no instances

    // Terms
    static final int VARIABLE = 0x01;
    static final int ABSTRACTION = 0x02;
    static final int APPLICATION = 0x03;

    // Derivation rules
    static final int BETA = 0x01;
    /** Reserved for an eta rule, which the kernel does not admit. */
    static final int ETA = 0x02;
    static final int REFL = 0x03;
    static final int SYM = 0x04;
    static final int TRANS = 0x05;
    static final int CONG_APP = 0x06;
    static final int CONG_LAM = 0x07;

    // Verdicts
    static final int EQUIVALENT = 0x01;
    static final int NOT_EQUIVALENT = 0x02;
    static final int INCONCLUSIVE = 0x03;
    static final int INCONSISTENT = 0x04;

    /** Leads an encoded proof. */
    static final byte[] PROOF_MAGIC = {'C', 'W', 'P', 'F'};

    /** The only proof format version written or read. */
    static final int PROOF_VERSION = 1;
}
