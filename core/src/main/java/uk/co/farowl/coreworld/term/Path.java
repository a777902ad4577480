// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.coreworld.term;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.StringJoiner;

/**
 * A position within a term, as the sequence of moves that lead to it
 * from the root. Paths are immutable, and extending one with
 * {@link #then(Move)} is a constant time operation that shares the
 * existing prefix.
 */
public final class Path {

    /** One step down from a node to a child. */
    public enum Move {
        /** From an application to its function. */
        FUNCTION,
        /** From an application to its argument. */
        ARGUMENT,
        /** From an abstraction to its body. */
        BODY;

        private static final Move[] VALUES = values();

        /**
         * Move corresponding to the given ordinal (used in decoding).
         *
         * @param ordinal of the move
         * @return the move or {@code null} if out of range
         */
        public static Move fromOrdinal(int ordinal) {
            return ordinal >= 0 && ordinal < VALUES.length
                    ? VALUES[ordinal] : null;
        }
    }

    /** The empty path, designating the whole term. */
    public static final Path ROOT = new Path(null, null, 0);

    private final Path parent;
    private final Move last;
    private final int length;

    private Path(Path parent, Move last, int length) {
        this.parent = parent;
        this.last = last;
        this.length = length;
    }

    /**
     * Create a path from a sequence of moves.
     *
     * @param moves from the root
     * @return the path
     */
    public static Path of(Move... moves) { return of(Arrays.asList(moves)); }

    /**
     * Create a path from a sequence of moves.
     *
     * @param moves from the root
     * @return the path
     */
    public static Path of(List<Move> moves) {
        Path p = ROOT;
        for (Move m : moves) { p = p.then(m); }
        return p;
    }

    /**
     * This path extended by one move.
     *
     * @param move to append
     * @return extended path
     */
    public Path then(Move move) {
        if (move == null) { throw new NullPointerException("move"); }
        return new Path(this, move, length + 1);
    }

    /**
     * This path extended by the same move {@code n} times.
     *
     * @param move to append
     * @param n number of times
     * @return extended path
     */
    public Path then(Move move, int n) {
        Path p = this;
        for (int i = 0; i < n; i++) { p = p.then(move); }
        return p;
    }

    /**
     * This path extended by another.
     *
     * @param suffix to append
     * @return the concatenation
     */
    public Path then(Path suffix) {
        Path p = this;
        for (Move m : suffix.moves()) { p = p.then(m); }
        return p;
    }

    /** @return the number of moves */
    public int length() { return length; }

    /** @return whether this is {@link #ROOT} */
    public boolean isRoot() { return length == 0; }

    /** @return the moves from the root, in order */
    public List<Move> moves() {
        Move[] m = new Move[length];
        Path p = this;
        for (int i = length - 1; i >= 0; i--) {
            m[i] = p.last;
            p = p.parent;
        }
        return Collections.unmodifiableList(Arrays.asList(m));
    }

    /**
     * The sub-term found at this position in a term.
     *
     * @param root term to navigate
     * @return the sub-term
     * @throws IllegalArgumentException if the path does not exist in
     *     {@code root}
     */
    public Term select(Term root) throws IllegalArgumentException {
        Term t = root;
        for (Move m : moves()) { t = child(t, m); }
        return t;
    }

    /**
     * A copy of {@code root} in which the sub-term at this position is
     * replaced. Nodes not on the path are shared with {@code root}.
     *
     * @param root term to rebuild
     * @param replacement for the sub-term at this position
     * @return the new term
     * @throws IllegalArgumentException if the path does not exist in
     *     {@code root}
     */
    public Term replace(Term root, Term replacement)
            throws IllegalArgumentException {
        List<Move> moves = moves();
        List<Term> nodes = new ArrayList<>(moves.size());
        Term t = root;
        for (Move m : moves) {
            nodes.add(t);
            t = child(t, m);
        }
        Term result = replacement;
        for (int i = moves.size() - 1; i >= 0; i--) {
            Term node = nodes.get(i);
            result = switch (moves.get(i)) {
                case FUNCTION -> new Application(result,
                        ((Application)node).argument());
                case ARGUMENT -> new Application(
                        ((Application)node).function(), result);
                case BODY -> new Abstraction(result);
            };
        }
        return result;
    }

    private static Term child(Term t, Move m) {
        if (m == Move.BODY && t instanceof Abstraction a) {
            return a.body();
        } else if (t instanceof Application p) {
            if (m == Move.FUNCTION) {
                return p.function();
            } else if (m == Move.ARGUMENT) { return p.argument(); }
        }
        throw new IllegalArgumentException(
                String.format("no %s child in %s", m, t));
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) { return true; }
        if (!(obj instanceof Path other) || other.length != length) {
            return false;
        }
        Path a = this, b = other;
        while (a.length > 0) {
            if (a == b) { return true; }
            if (a.last != b.last) { return false; }
            a = a.parent;
            b = b.parent;
        }
        return true;
    }

    @Override
    public int hashCode() {
        int h = length;
        for (Path p = this; p.length > 0; p = p.parent) {
            h = 31 * h + p.last.ordinal();
        }
        return h;
    }

    @Override
    public String toString() {
        if (length == 0) { return "root"; }
        StringJoiner sj = new StringJoiner(".");
        for (Move m : moves()) { sj.add(m.name().toLowerCase()); }
        return sj.toString();
    }
}
