// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.coreworld.codec;

import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Deque;

import uk.co.farowl.coreworld.term.Abstraction;
import uk.co.farowl.coreworld.term.Application;
import uk.co.farowl.coreworld.term.Path;
import uk.co.farowl.coreworld.term.Path.Move;
import uk.co.farowl.coreworld.term.Term;
import uk.co.farowl.coreworld.term.Variable;

/**
 * Accumulates the little-endian encoding of kernel objects in a
 * growable array. The composite encoders in this package are built on
 * the elementary {@code write*} methods.
 */
class Writer {

    private byte[] buf;
    private int count;

    /**
     * Create with a given initial capacity.
     *
     * @param capacity initial size of the buffer
     */
    Writer(int capacity) { this.buf = new byte[Math.max(capacity, 16)]; }

    /**
     * Write one {@code byte}. The parameter is an {@code int} because
     * it may be the result of a calculation, but only the low 8 bits
     * are used.
     *
     * @param v to write
     */
    void writeByte(int v) {
        ensure(1);
        buf[count++] = (byte)v;
    }

    /**
     * Write one {@code int} as 4 bytes, least significant first.
     *
     * @param v to write
     */
    void writeInt(int v) {
        ensure(4);
        for (int i = 0; i < 4; i++, v >>>= 8) { buf[count++] = (byte)v; }
    }

    /**
     * Write one {@code long} as 8 bytes, least significant first.
     *
     * @param v to write
     */
    void writeLong(long v) {
        ensure(8);
        for (int i = 0; i < 8; i++, v >>>= 8) { buf[count++] = (byte)v; }
    }

    /**
     * Write a term in pre-order: {@code 0x01 n} for a variable,
     * {@code 0x02 body} for an abstraction and {@code 0x03 f a} for an
     * application.
     *
     * @param term to write
     */
    void writeTerm(Term term) {
        Deque<Term> work = new ArrayDeque<>();
        work.push(term);
        while (!work.isEmpty()) {
            Term t = work.pop();
            if (t instanceof Variable v) {
                writeByte(Tags.VARIABLE);
                writeLong(v.index());
            } else if (t instanceof Abstraction a) {
                writeByte(Tags.ABSTRACTION);
                work.push(a.body());
            } else if (t instanceof Application p) {
                writeByte(Tags.APPLICATION);
                work.push(p.argument());
                work.push(p.function());
            }
        }
    }

    /**
     * Write a path as its length then one byte per move.
     *
     * @param path to write
     */
    void writePath(Path path) {
        writeInt(path.length());
        for (Move m : path.moves()) { writeByte(m.ordinal()); }
    }

    /** @return a copy of the bytes written so far */
    byte[] toByteArray() { return Arrays.copyOf(buf, count); }

    private void ensure(int n) {
        if (count + n > buf.length) {
            buf = Arrays.copyOf(buf, Math.max(buf.length * 2, count + n));
        }
    }
}
