// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.coreworld.codec;

import uk.co.farowl.coreworld.support.DecodingError;
import uk.co.farowl.coreworld.term.Term;

/**
 * Binary form of a single term. A variable is {@code 0x01} followed by
 * its index as 8 bytes, an abstraction is {@code 0x02} followed by its
 * body and an application is {@code 0x03} followed by its function and
 * its argument. Multi-byte values are little-endian.
 */
public final class TermCodec {

    private TermCodec() {} // no instances

    /**
     * Encode a term.
     *
     * @param term to encode
     * @return its binary form
     */
    public static byte[] encode(Term term) {
        // A variable takes 9 bytes, a constructor 1.
        Writer w = new Writer((int)Math.min(term.size() * 4, 1 << 20));
        w.writeTerm(term);
        return w.toByteArray();
    }

    /**
     * Decode a term. The input must contain exactly one term.
     *
     * @param bytes to decode
     * @return the term
     * @throws DecodingError if the input is not exactly one valid term
     */
    public static Term decode(byte[] bytes) throws DecodingError {
        Reader r = new Reader(bytes);
        Term term = r.readTerm();
        r.expectEnd();
        return term;
    }
}
