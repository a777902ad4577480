// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.coreworld.term;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static uk.co.farowl.coreworld.term.Terms.app;
import static uk.co.farowl.coreworld.term.Terms.lam;
import static uk.co.farowl.coreworld.term.Terms.var;

import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import uk.co.farowl.coreworld.term.Path.Move;

/** Tests of positions within a term. */
@DisplayName("A Path")
class PathTest {

    /** {@code λ.(0 (1 λ.2))} */
    static final Term T = lam(app(var(0), app(var(1), lam(var(2)))));

    @Test
    @DisplayName("at the root is empty")
    void root() {
        assertTrue(Path.ROOT.isRoot());
        assertEquals(0, Path.ROOT.length());
        assertEquals(List.of(), Path.ROOT.moves());
        assertSame(T, Path.ROOT.select(T));
        assertEquals("root", Path.ROOT.toString());
    }

    @Test
    @DisplayName("is built by extension")
    void extension() {
        Path p = Path.of(Move.BODY, Move.ARGUMENT, Move.FUNCTION);
        assertEquals(p, Path.ROOT.then(Move.BODY).then(Move.ARGUMENT)
                .then(Move.FUNCTION));
        assertEquals(p, Path.of(Move.BODY).then(
                Path.of(Move.ARGUMENT, Move.FUNCTION)));
        assertEquals(p.hashCode(), Path.of(p.moves()).hashCode());
        assertEquals(3, p.length());
        assertEquals("body.argument.function", p.toString());
        assertEquals(Path.of(Move.FUNCTION, Move.FUNCTION, Move.FUNCTION),
                Path.ROOT.then(Move.FUNCTION, 3));
        assertNotEquals(p, Path.of(Move.BODY, Move.ARGUMENT));
    }

    @Test
    @DisplayName("selects a sub-term")
    void select() {
        assertEquals(var(1), Path.of(Move.BODY, Move.ARGUMENT,
                Move.FUNCTION).select(T));
        assertEquals(var(2), Path.of(Move.BODY, Move.ARGUMENT,
                Move.ARGUMENT, Move.BODY).select(T));
    }

    @Test
    @DisplayName("replaces a sub-term")
    void replace() {
        Path p = Path.of(Move.BODY, Move.ARGUMENT, Move.FUNCTION);
        Term r = p.replace(T, var(7));
        assertEquals(lam(app(var(0), app(var(7), lam(var(2))))), r);
        // The argument of the application 0 (...) is rebuilt but its
        // function is shared.
        Application body = (Application)((Abstraction)r).body();
        assertSame(((Application)((Abstraction)T).body()).function(),
                body.function());
    }

    @Test
    @DisplayName("that does not exist in a term is an error")
    void missing() {
        assertThrows(IllegalArgumentException.class,
                () -> Path.of(Move.FUNCTION).select(T));
        assertThrows(IllegalArgumentException.class,
                () -> Path.of(Move.BODY, Move.BODY).replace(T, var(0)));
    }

    @Test
    @DisplayName("moves are decoded by ordinal")
    void fromOrdinal() {
        assertEquals(Move.ARGUMENT, Move.fromOrdinal(1));
        assertNull(Move.fromOrdinal(3));
        assertNull(Move.fromOrdinal(-1));
    }
}
