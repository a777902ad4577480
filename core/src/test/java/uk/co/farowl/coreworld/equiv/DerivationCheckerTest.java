// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.coreworld.equiv;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static uk.co.farowl.coreworld.term.Terms.app;
import static uk.co.farowl.coreworld.term.Terms.lam;
import static uk.co.farowl.coreworld.term.Terms.var;

import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import uk.co.farowl.coreworld.UnitTestSupport;
import uk.co.farowl.coreworld.proof.Derivation;
import uk.co.farowl.coreworld.proof.Derivation.BetaStep;
import uk.co.farowl.coreworld.proof.Derivation.CongApp;
import uk.co.farowl.coreworld.proof.Derivation.CongLam;
import uk.co.farowl.coreworld.proof.Derivation.Refl;
import uk.co.farowl.coreworld.proof.Derivation.Sym;
import uk.co.farowl.coreworld.proof.Derivation.Trans;
import uk.co.farowl.coreworld.proof.Judgement;
import uk.co.farowl.coreworld.reduce.Fuel;
import uk.co.farowl.coreworld.reduce.Normalization;
import uk.co.farowl.coreworld.reduce.Normalizer;
import uk.co.farowl.coreworld.reduce.Step;
import uk.co.farowl.coreworld.reduce.Strategy;
import uk.co.farowl.coreworld.support.DerivationError;
import uk.co.farowl.coreworld.support.DerivationError.Reason;
import uk.co.farowl.coreworld.term.Term;

/** Tests of checking and building derivations. */
@DisplayName("Derivations")
class DerivationCheckerTest extends UnitTestSupport {

    /** {@code (λ.0) 5} */
    static final Term R = app(I, var(5));

    @Nested
    @DisplayName("are checked")
    class Checking {

        @Test
        @DisplayName("by reflexivity")
        void refl() {
            assertEquals(new Judgement(S, S),
                    DerivationChecker.verify(new Refl(S)));
        }

        @Test
        @DisplayName("by the beta axiom")
        void beta() {
            assertEquals(new Judgement(R, var(5)),
                    DerivationChecker.verify(new BetaStep(R, var(5))));
        }

        @Test
        @DisplayName("by symmetry")
        void sym() {
            assertEquals(new Judgement(var(5), R), DerivationChecker
                    .verify(new Sym(new BetaStep(R, var(5)))));
        }

        @Test
        @DisplayName("by transitivity")
        void trans() {
            // K I Ω = (λ.I) Ω = I
            Term t = app(K, I, OMEGA);
            Term mid = app(lam(I), OMEGA);
            Derivation d = new Trans(
                    new CongApp(new BetaStep(app(K, I), lam(I)),
                            new Refl(OMEGA)),
                    new BetaStep(mid, I));
            assertEquals(new Judgement(t, I), DerivationChecker.verify(d));
        }

        @Test
        @DisplayName("by congruence")
        void congruence() {
            Derivation d = new CongLam(new CongApp(new Refl(var(0)),
                    new BetaStep(R, var(5))));
            assertEquals(
                    new Judgement(lam(app(var(0), R)),
                            lam(app(var(0), var(5)))),
                    DerivationChecker.verify(d));
        }
    }

    @Nested
    @DisplayName("are refused")
    class Refusal {

        @Test
        @DisplayName("for a beta step on a non-redex")
        void notARedex() {
            DerivationError e = assertThrows(DerivationError.class,
                    () -> DerivationChecker.verify(
                            new BetaStep(app(var(0), var(1)), var(0))));
            assertEquals(Reason.NOT_A_REDEX, e.reason());
            e = assertThrows(DerivationError.class,
                    () -> Derivations.proveBeta(I));
            assertEquals(Reason.NOT_A_REDEX, e.reason());
        }

        @Test
        @DisplayName("for a beta step with the wrong result")
        void wrongContractum() {
            DerivationError e = assertThrows(DerivationError.class,
                    () -> DerivationChecker
                            .verify(new BetaStep(R, var(4))));
            assertEquals(Reason.WRONG_CONTRACTUM, e.reason());
        }

        @Test
        @DisplayName("for a transitive step that does not meet")
        void gap() {
            Derivation d = new Trans(new BetaStep(R, var(5)), new Refl(I));
            DerivationError e = assertThrows(DerivationError.class,
                    () -> DerivationChecker.verify(d));
            assertEquals(Reason.TRANSITIVITY_GAP, e.reason());
        }

        @Test
        @DisplayName("for an error deep inside a valid context")
        void nested() {
            Derivation d = new CongLam(new Sym(new CongApp(
                    new Refl(var(0)), new BetaStep(R, var(6)))));
            assertThrows(DerivationError.class,
                    () -> DerivationChecker.verify(d));
        }
    }

    @Nested
    @DisplayName("are built")
    class Building {

        @Test
        @DisplayName("from a step below the root")
        void fromStep() {
            // λ.(0 ((λ.0) 5)): the redex is at body.argument
            Term t = lam(app(var(0), app(I, var(6))));
            Step s = Strategy.NORMAL_ORDER.next(t).orElseThrow();
            Derivation d = Derivations.fromStep(t, s);
            assertInstanceOf(CongLam.class, d);
            assertEquals(new Judgement(t, s.result()),
                    DerivationChecker.verify(d));
        }

        @Test
        @DisplayName("from a reduction sequence")
        void fromTrace() {
            Term t = app(PLUS, church(2), church(2));
            Normalization n = Normalizer.normalizeFully(t, Fuel.of(1000),
                    Strategy.NORMAL_ORDER, true);
            Derivation d = Derivations.fromTrace(t, n.trace());
            assertEquals(new Judgement(t, church(4)),
                    DerivationChecker.verify(d));
        }

        @Test
        @DisplayName("as reflexivity from no steps")
        void empty() {
            assertEquals(new Refl(S), Derivations.fromTrace(S, List.of()));
        }

        @Test
        @DisplayName("for normalization when it terminates")
        void normalization() {
            Optional<Derivation> d = Derivations
                    .proveNormalization(app(TIMES, church(2), church(2)), 500);
            assertTrue(d.isPresent());
            assertEquals(church(4), DerivationChecker.verify(d.get()).right());
            assertEquals(Optional.empty(),
                    Derivations.proveNormalization(OMEGA, 50));
        }

        @Test
        @DisplayName("and checked iteratively when deep")
        void deep() {
            int n = 20_000;
            Term t = lam(n, app(I, var(0)));
            Step s = Strategy.NORMAL_ORDER.next(t).orElseThrow();
            Derivation d = Derivations.fromStep(t, s);
            Judgement j = DerivationChecker.verify(d);
            assertEquals(lam(n, var(0)), j.right());
        }

        @Test
        @DisplayName("with a long trace as a shallow tree")
        void longTrace() {
            int n = 5_000;
            Term t = nestedIdentity(n);
            Normalization r = Normalizer.normalizeFully(t, Fuel.of(n),
                    Strategy.NORMAL_ORDER, true);
            Derivation d = Derivations.fromTrace(t, r.trace());
            assertEquals(new Judgement(t, var(0)),
                    DerivationChecker.verify(d));
        }
    }
}
