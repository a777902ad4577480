// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.coreworld.reduce;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.junit.jupiter.params.provider.Arguments.arguments;
import static uk.co.farowl.coreworld.term.Terms.app;
import static uk.co.farowl.coreworld.term.Terms.lam;
import static uk.co.farowl.coreworld.term.Terms.var;

import java.util.Optional;
import java.util.stream.Stream;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import uk.co.farowl.coreworld.UnitTestSupport;
import uk.co.farowl.coreworld.reduce.Normalization.NormalForm;
import uk.co.farowl.coreworld.reduce.Normalization.OutOfFuel;
import uk.co.farowl.coreworld.term.Term;

/** Tests of the fuel-bounded normalization driver. */
@DisplayName("Normalizer")
class NormalizerTest extends UnitTestSupport {

    @Nested
    @DisplayName("to weak head normal form")
    class WeakHead {

        @Test
        @DisplayName("discards a divergent argument in one step")
        void discardOmega() {
            Normalization n =
                    Normalizer.normalize(app(lam(lam(var(0))), OMEGA), 10);
            NormalForm nf = assertInstanceOf(NormalForm.class, n);
            assertEquals(1, nf.steps());
            assertEquals(lam(var(0)), nf.term());
        }

        @Test
        @DisplayName("leaves an abstraction unchanged")
        void abstraction() {
            Term t = lam(app(lam(var(0)), var(5)));
            Normalization n = Normalizer.normalize(t, 10);
            assertTrue(n.isNormalForm());
            assertSame(t, n.term());
            assertEquals(0, n.steps());
        }

        @Test
        @DisplayName("runs out of fuel on Ω")
        void omega() {
            Normalization n = Normalizer.normalize(OMEGA, 25);
            OutOfFuel o = assertInstanceOf(OutOfFuel.class, n);
            assertEquals(25, o.steps());
            assertEquals(OMEGA, o.term());
        }

        @Test
        @DisplayName("with no fuel returns a term already in WHNF")
        void zeroFuel() {
            assertTrue(Normalizer.normalize(I, 0).isNormalForm());
            assertFalse(Normalizer.normalize(app(I, I), 0).isNormalForm());
        }

        @Test
        @DisplayName("pays from a shared budget")
        void sharedFuel() {
            Fuel fuel = Fuel.of(3);
            Normalization a =
                    Normalizer.normalize(app(I, I, I), fuel, false);
            assertTrue(a.isNormalForm());
            assertEquals(2, fuel.spent());
            Normalization b = Normalizer.normalize(OMEGA, fuel, false);
            assertFalse(b.isNormalForm());
            assertEquals(1, b.steps());
            assertTrue(fuel.isExhausted());
        }

        @Test
        @DisplayName("records the trace only when asked")
        void trace() {
            Term t = app(K, I, OMEGA);
            Normalization quiet = Normalizer.normalize(t, Fuel.of(10), false);
            assertTrue(quiet.trace().isEmpty());
            Normalization loud = Normalizer.normalize(t, Fuel.of(10), true);
            assertEquals(2, loud.trace().size());
            assertEquals(loud.term(), loud.trace().get(1).result());
        }

        @Test
        @DisplayName("is iterative over a long reduction")
        void longReduction() {
            int n = 20_000;
            Normalization r = Normalizer.normalize(nestedIdentity(n),
                    Fuel.of(n), false);
            // Each step exposes the next I.
            assertTrue(r.isNormalForm());
            assertEquals(n, r.steps());
            assertEquals(var(0), r.term());
        }
    }

    /**
     * Terms for the idempotence of normalization.
     *
     * @return the examples
     */
    static Stream<Arguments> idempotenceExamples() {
        return Stream.of( //
                arguments(app(K, I, OMEGA)), //
                arguments(app(S, K, K, var(0))), //
                arguments(app(PLUS, church(2), church(3))), //
                arguments(lam(app(I, var(0)))), //
                arguments(app(var(0), OMEGA)));
    }

    @DisplayName("is idempotent")
    @ParameterizedTest(name = "on {0}")
    @MethodSource("idempotenceExamples")
    void idempotent(Term t) {
        Normalization once = Normalizer.normalize(t, 1000);
        assertTrue(once.isNormalForm());
        Normalization twice = Normalizer.normalize(once.term(), 1000);
        assertTrue(twice.isNormalForm());
        assertEquals(0, twice.steps());
        assertEquals(once.term(), twice.term());
    }

    /**
     * Church arithmetic: the expression and the expected numeral. The
     * last has a divergent argument that normal order never reduces.
     *
     * @return the examples
     */
    static Stream<Arguments> arithmetic() {
        return Stream.of( //
                arguments(app(SUCC, church(0)), 1), //
                arguments(app(PLUS, church(2), church(3)), 5), //
                arguments(app(TIMES, church(3), church(4)), 12), //
                arguments(app(TIMES, church(0), OMEGA), 0));
    }

    @Nested
    @DisplayName("to full normal form")
    class Full {

        @DisplayName("computes Church arithmetic in normal order")
        @ParameterizedTest(name = "{0} ⇒ {1}")
        @MethodSource(
                "uk.co.farowl.coreworld.reduce.NormalizerTest#arithmetic")
        void churchNormalOrder(Term t, int expected) {
            Normalization n = Normalizer.normalizeFully(t, Fuel.of(10_000),
                    Strategy.NORMAL_ORDER, false);
            assertTrue(n.isNormalForm());
            assertEquals(church(expected), n.term());
        }

        @Test
        @DisplayName("agrees in both orders where both terminate")
        void bothOrders() {
            Term t = app(PLUS, app(TIMES, church(2), church(2)), church(1));
            Normalization a = Normalizer.normalizeFully(t, Fuel.of(10_000),
                    Strategy.NORMAL_ORDER, false);
            Normalization b = Normalizer.normalizeFully(t, Fuel.of(10_000),
                    Strategy.APPLICATIVE_ORDER, false);
            assertEquals(church(5), a.term());
            assertEquals(a.term(), b.term());
        }

        @Test
        @DisplayName("takes no step it cannot pay for")
        void noUnpaidStep() {
            int[] taken = {0};
            Stepper counting = new Stepper() {
                @Override
                public Optional<Step> next(Term term) {
                    taken[0] += 1;
                    return Strategy.NORMAL_ORDER.next(term);
                }

                @Override
                public boolean hasStep(Term term) {
                    return Strategy.NORMAL_ORDER.hasStep(term);
                }
            };
            Normalization n = Normalizer.normalizeFully(OMEGA, Fuel.of(3),
                    counting, false);
            assertFalse(n.isNormalForm());
            assertEquals(3, n.steps());
            assertEquals(3, taken[0]);

            // Fuel spent exactly as the normal form is reached
            taken[0] = 0;
            Normalization m = Normalizer.normalizeFully(app(I, var(0)),
                    Fuel.of(1), counting, false);
            assertTrue(m.isNormalForm());
            assertEquals(var(0), m.term());
            assertEquals(1, taken[0]);
        }

        @Test
        @DisplayName("in applicative order may not terminate")
        void applicativeDiverges() {
            Normalization n = Normalizer.normalizeFully(app(KI, OMEGA),
                    Fuel.of(50), Strategy.APPLICATIVE_ORDER, false);
            assertFalse(n.isNormalForm());
            assertEquals(50, n.steps());
        }
    }

    @Test
    @DisplayName("refuses a negative budget")
    void negativeFuel() {
        assertThrows(IllegalArgumentException.class,
                () -> Normalizer.normalize(I, -1));
    }
}
