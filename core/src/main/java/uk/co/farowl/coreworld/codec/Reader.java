// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.coreworld.codec;

import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

import uk.co.farowl.coreworld.support.DecodingError;
import uk.co.farowl.coreworld.support.DecodingError.Reason;
import uk.co.farowl.coreworld.term.Abstraction;
import uk.co.farowl.coreworld.term.Application;
import uk.co.farowl.coreworld.term.Path;
import uk.co.farowl.coreworld.term.Path.Move;
import uk.co.farowl.coreworld.term.Term;
import uk.co.farowl.coreworld.term.Variable;

/**
 * Reads the little-endian encoding of kernel objects from a
 * {@code ByteBuffer}. Every failure is reported as a
 * {@link DecodingError} carrying the offset of the faulty item.
 */
class Reader {

    /**
     * The source as a little-endian {@code ByteBuffer} on which we
     * shall call {@code getInt()} etc. to read items.
     */
    private final ByteBuffer buf;

    /**
     * Form a {@link Reader} on a byte array.
     *
     * @param bytes input
     * @throws DecodingError if {@code bytes} is empty
     */
    Reader(byte[] bytes) throws DecodingError {
        if (bytes.length == 0) {
            throw new DecodingError(Reason.EMPTY_INPUT, 0, "no data");
        }
        this.buf = ByteBuffer.wrap(bytes).order(ByteOrder.LITTLE_ENDIAN);
    }

    /** @return offset of the next byte to be read */
    int offset() { return buf.position(); }

    /**
     * Read one {@code byte} (as an unsigned integer).
     *
     * @return byte read unsigned
     */
    int readByte() {
        try {
            return buf.get() & 0xff;
        } catch (BufferUnderflowException bue) {
            throw endOfData();
        }
    }

    /**
     * Read one {@code int} from 4 bytes.
     *
     * @return value read
     */
    int readInt() {
        try {
            return buf.getInt();
        } catch (BufferUnderflowException bue) {
            throw endOfData();
        }
    }

    /**
     * Read one {@code long} from 8 bytes.
     *
     * @return value read
     */
    long readLong() {
        try {
            return buf.getLong();
        } catch (BufferUnderflowException bue) {
            throw endOfData();
        }
    }

    /**
     * Read a count of items that follow, each at least
     * {@code minimumSize} bytes long. A count that the remaining input
     * could not possibly satisfy is treated as truncation.
     *
     * @param minimumSize of each item in bytes
     * @return the count
     */
    int readCount(int minimumSize) {
        int at = offset();
        int n = readInt();
        if (n < 0 || (long)n * minimumSize > buf.remaining()) {
            throw new DecodingError(Reason.INCOMPLETE_DATA, at,
                    "count %d exceeds the data remaining",
                    Integer.toUnsignedLong(n));
        }
        return n;
    }

    /** A constructor waiting for its sub-terms. */
    private record Pending(boolean abstraction, Term function) {}

    /**
     * Read one term written by {@link Writer#writeTerm(Term)}.
     *
     * @return the term
     */
    Term readTerm() {
        Deque<Pending> stack = new ArrayDeque<>();
        while (true) {
            int at = offset();
            int tag = readByte();
            Term done;
            switch (tag) {
                case Tags.VARIABLE:
                    long n = readLong();
                    if (n < 0 || n > Variable.MAX_INDEX) {
                        throw new DecodingError(Reason.INDEX_OVERFLOW, at,
                                "variable index %s out of range",
                                Long.toUnsignedString(n));
                    }
                    done = new Variable((int)n);
                    break;
                case Tags.ABSTRACTION:
                    stack.push(new Pending(true, null));
                    continue;
                case Tags.APPLICATION:
                    stack.push(new Pending(false, null));
                    continue;
                default:
                    throw invalidTag(at, tag, "term");
            }

            // done is complete: give it to the constructors waiting.
            while (true) {
                if (stack.isEmpty()) { return done; }
                Pending p = stack.pop();
                if (p.abstraction()) {
                    done = new Abstraction(done);
                } else if (p.function() == null) {
                    stack.push(new Pending(false, done));
                    break;
                } else {
                    done = new Application(p.function(), done);
                }
            }
        }
    }

    /**
     * Read a path written by {@link Writer#writePath(Path)}.
     *
     * @return the path
     */
    Path readPath() {
        int n = readCount(1);
        List<Move> moves = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            int at = offset();
            int b = readByte();
            Move m = Move.fromOrdinal(b);
            if (m == null) { throw invalidTag(at, b, "path move"); }
            moves.add(m);
        }
        return Path.of(moves);
    }

    /**
     * Check that the whole input has been consumed.
     *
     * @throws DecodingError if it has not
     */
    void expectEnd() throws DecodingError {
        if (buf.hasRemaining()) {
            throw new DecodingError(Reason.TRAILING_DATA, offset(),
                    "%d bytes follow the encoded value", buf.remaining());
        }
    }

    /**
     * Create an error reporting an unrecognised type code.
     *
     * @param at offset of the code
     * @param tag the code read
     * @param what kind of item was expected
     * @return the error to throw
     */
    static DecodingError invalidTag(int at, int tag, String what) {
        return new DecodingError(Reason.INVALID_TAG, at,
                "invalid %s tag 0x%02x", what, tag);
    }

    private DecodingError endOfData() {
        return new DecodingError(Reason.INCOMPLETE_DATA, offset(),
                "unexpected end of data");
    }
}
