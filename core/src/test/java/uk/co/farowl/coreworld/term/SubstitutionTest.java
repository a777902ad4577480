// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.coreworld.term;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.params.provider.Arguments.arguments;
import static uk.co.farowl.coreworld.term.Terms.app;
import static uk.co.farowl.coreworld.term.Terms.lam;
import static uk.co.farowl.coreworld.term.Terms.var;

import java.util.stream.Stream;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import uk.co.farowl.coreworld.UnitTestSupport;

/** Tests of capture-avoiding substitution. */
@DisplayName("Substitution")
class SubstitutionTest extends UnitTestSupport {

    /** A replacement with free variables, to make capture visible. */
    static final Term N = app(var(0), lam(var(1)));

    @Nested
    @DisplayName("of a variable")
    class OfVariable {

        @Test
        @DisplayName("replaces the target index")
        void target() {
            assertEquals(N, Substitution.substitute(var(1), 1, N));
        }

        @Test
        @DisplayName("lowers an index above the target")
        void above() {
            assertEquals(var(1), Substitution.substitute(var(2), 1, N));
        }

        @Test
        @DisplayName("leaves an index below the target")
        void below() {
            assertEquals(var(0), Substitution.substitute(var(0), 1, N));
        }
    }

    /**
     * Examples of substitution: term, target, replacement and result.
     *
     * @return the examples
     */
    static Stream<Arguments> binderExamples() {
        return Stream.of( //
                // The target seen under one binder is index 1
                arguments(lam(var(1)), 0, var(5), lam(var(6))),
                // A replacement free variable is not captured
                arguments(lam(var(1)), 0, var(0), lam(var(1))),
                // Bound variables are untouched
                arguments(lam(var(0)), 0, var(3), lam(var(0))),
                // Free variables beyond the target move down
                arguments(lam(var(2)), 0, I, lam(var(1))),
                arguments(lam(app(var(1), var(0))), 0, N,
                        lam(app(app(var(1), lam(var(2))), var(0)))),
                arguments(app(var(0), lam(2, var(2))), 0, I,
                        app(I, lam(2, I))));
    }

    @DisplayName("under binders")
    @ParameterizedTest(name = "{0}[{2}/{1}] = {3}")
    @MethodSource("binderExamples")
    void underBinders(Term t, int k, Term n, Term expected) {
        assertEquals(expected, Substitution.substitute(t, k, n));
    }

    @Test
    @DisplayName("returns the same object when the target is absent")
    void absent() {
        assertSame(S, Substitution.substitute(S, 0, N));
        Term t = app(var(0), var(1));
        assertSame(t, Substitution.substitute(t, 2, N));
    }

    @Test
    @DisplayName("shares the lifted replacement at each depth")
    void sharing() {
        Application r = (Application)Substitution
                .substitute(app(var(0), var(0)), 0, N);
        assertSame(r.function(), r.argument());
    }

    @Test
    @DisplayName("refuses a negative target")
    void negativeTarget() {
        assertThrows(IllegalArgumentException.class,
                () -> Substitution.substitute(var(0), -1, N));
    }

    @Test
    @DisplayName("is iterative on a deep term")
    void deep() {
        int n = 50_000;
        Term r = Substitution.substitute(lam(n, var(n)), 0, var(0));
        assertEquals(lam(n, var(n)), r);
    }
}
