// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.coreworld.equiv;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static uk.co.farowl.coreworld.term.Terms.app;
import static uk.co.farowl.coreworld.term.Terms.var;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import uk.co.farowl.coreworld.UnitTestSupport;
import uk.co.farowl.coreworld.proof.Consistency;
import uk.co.farowl.coreworld.proof.Consistency.InconsistencyCertificate;
import uk.co.farowl.coreworld.proof.Consistency.Origin;
import uk.co.farowl.coreworld.proof.Derivation;
import uk.co.farowl.coreworld.proof.Proof;
import uk.co.farowl.coreworld.proof.Side;
import uk.co.farowl.coreworld.proof.Verdict;
import uk.co.farowl.coreworld.reduce.Reducer;
import uk.co.farowl.coreworld.reduce.Step;
import uk.co.farowl.coreworld.reduce.Stepper;
import uk.co.farowl.coreworld.reduce.Strategy;
import uk.co.farowl.coreworld.support.DerivationError;
import uk.co.farowl.coreworld.term.Abstraction;
import uk.co.farowl.coreworld.term.Application;
import uk.co.farowl.coreworld.term.Substitution;
import uk.co.farowl.coreworld.term.Term;

/**
 * Tests of the inconsistency detector. A correct reducer never yields a
 * certificate, so to see one we supply a defective stepper that
 * substitutes {@code I} for every argument.
 */
@DisplayName("InconsistencyDetector")
class InconsistencyDetectorTest extends UnitTestSupport {

    /** Normal order, but contracting {@code (λM) N} to {@code M[I/0]}. */
    static final Stepper IGNORES_ARGUMENT =
            term -> Reducer.locate(term, Strategy.NORMAL_ORDER).map(path -> {
                Application redex = (Application)path.select(term);
                Term body = ((Abstraction)redex.function()).body();
                Term wrong = Substitution.substitute(body, 0, I);
                return new Step(path, redex, wrong,
                        path.replace(term, wrong));
            });

    @Nested
    @DisplayName("with correct reduction")
    class Correct {

        final InconsistencyDetector detector =
                new InconsistencyDetector(true);

        @Test
        @DisplayName("finds Church arithmetic consistent")
        void arithmetic() {
            Consistency c = detector.check(
                    app(PLUS, church(2), app(TIMES, church(2), church(3))),
                    10_000);
            Consistency.Consistent ok =
                    assertInstanceOf(Consistency.Consistent.class, c);
            assertTrue(ok.outcome().isNormalForm());
            assertEquals(church(8), ok.outcome().term());
        }

        @Test
        @DisplayName("is consistent when only one order terminates")
        void oneOrderDiverges() {
            Consistency c = detector.check(app(K, I, OMEGA), 100);
            assertTrue(c.isConsistent());
            assertEquals(I,
                    ((Consistency.Consistent)c).outcome().term());
        }

        @Test
        @DisplayName("is consistent (but unproven) when fuel runs out")
        void outOfFuel() {
            Consistency.Consistent c = assertInstanceOf(
                    Consistency.Consistent.class, detector.check(OMEGA, 20));
            assertFalse(c.outcome().isNormalForm());
            assertEquals(OMEGA, c.subject());
        }

        @Test
        @DisplayName("finds a checked derivation consistent")
        void derivation() {
            Derivation d = Derivations
                    .proveNormalization(app(PLUS, church(1), church(1)), 100)
                    .orElseThrow();
            assertTrue(detector.check(d, 100).isConsistent());
        }

        @Test
        @DisplayName("refuses a derivation that does not check")
        void badDerivation() {
            Derivation d = new Derivation.BetaStep(app(I, var(0)), var(1));
            assertThrows(DerivationError.class, () -> detector.check(d, 10));
        }
    }

    @Nested
    @DisplayName("with a defective reducer")
    class Defective {

        @Test
        @DisplayName("certifies the disagreement of two orders")
        void reductionPaths() {
            InconsistencyDetector detector = new InconsistencyDetector(
                    Strategy.NORMAL_ORDER, IGNORES_ARGUMENT, true);
            Term t = app(I, var(5));
            InconsistencyCertificate c = assertInstanceOf(
                    InconsistencyCertificate.class, detector.check(t, 10));
            assertEquals(Origin.REDUCTION_PATHS, c.origin());
            assertEquals(t, c.left());
            assertEquals(t, c.right());
            assertEquals(var(5), c.leftNormalForm().term());
            assertEquals(I, c.rightNormalForm().term());
            assertFalse(c.isConsistent());
        }

        @Test
        @DisplayName("certifies a derivation its reducer contradicts")
        void derivation() {
            InconsistencyDetector detector = new InconsistencyDetector(
                    IGNORES_ARGUMENT, Strategy.NORMAL_ORDER, true);
            Derivation d = Derivations.proveBeta(app(I, var(5)));
            InconsistencyCertificate c = assertInstanceOf(
                    InconsistencyCertificate.class, detector.check(d, 10));
            assertEquals(Origin.DERIVATION, c.origin());
            assertEquals(app(I, var(5)), c.left());
            assertEquals(var(5), c.right());
            assertEquals(I, c.leftNormalForm().term());
            assertEquals(var(5), c.rightNormalForm().term());
        }

        @Test
        @DisplayName("presents a certificate as a proof")
        void asProof() {
            InconsistencyDetector detector = new InconsistencyDetector(
                    Strategy.NORMAL_ORDER, IGNORES_ARGUMENT, true);
            InconsistencyCertificate c = (InconsistencyCertificate)detector
                    .check(app(I, var(5)), 10);
            Proof p = Proof.inconsistent(c);
            assertInstanceOf(Verdict.Inconsistent.class, p.verdict());
            assertFalse(p.isEquivalent());
            assertEquals(2, p.trace().size());
            assertEquals(Side.LEFT, p.trace().get(0).side());
            assertEquals(Side.RIGHT, p.trace().get(1).side());
            assertEquals(I, p.trace().get(1).after());
        }
    }
}
