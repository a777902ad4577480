// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.coreworld;

import static uk.co.farowl.coreworld.term.Terms.app;
import static uk.co.farowl.coreworld.term.Terms.lam;
import static uk.co.farowl.coreworld.term.Terms.var;

import uk.co.farowl.coreworld.term.Term;

/**
 * A base class for unit tests that defines some terms for which the
 * need recurs: the standard combinators, Church numerals and their
 * arithmetic, and terms deep enough to overflow a recursive traversal.
 */
public class UnitTestSupport {

    /** {@code I = λx.x} */
    public static final Term I = lam(var(0));

    /** {@code K = λx.λy.x} */
    public static final Term K = lam(2, var(1));

    /** {@code K* = λx.λy.y} (also Church 0 and false) */
    public static final Term KI = lam(2, var(0));

    /** {@code S = λx.λy.λz.x z (y z)} */
    public static final Term S =
            lam(3, app(var(2), var(0), app(var(1), var(0))));

    /** {@code ω = λx.x x} */
    public static final Term OMEGA_HALF = lam(app(var(0), var(0)));

    /** {@code Ω = ω ω}, which reduces only to itself. */
    public static final Term OMEGA = app(OMEGA_HALF, OMEGA_HALF);

    /** {@code succ = λn.λf.λx.f (n f x)} */
    public static final Term SUCC =
            lam(3, app(var(1), app(var(2), var(1), var(0))));

    /** {@code plus = λm.λn.λf.λx.m f (n f x)} */
    public static final Term PLUS = lam(4,
            app(var(3), var(1), app(var(2), var(1), var(0))));

    /** {@code times = λm.λn.λf.m (n f)} */
    public static final Term TIMES =
            lam(3, app(var(2), app(var(1), var(0))));

    /**
     * The Church numeral {@code λf.λx.f (f ... (f x))}.
     *
     * @param n number of applications of {@code f}
     * @return the numeral
     */
    public static Term church(int n) {
        Term body = var(0);
        for (int i = 0; i < n; i++) { body = app(var(1), body); }
        return lam(2, body);
    }

    /**
     * {@code n} binders around a variable referring to the outermost.
     *
     * @param n depth (at least 1)
     * @return {@code λ.λ. ... λ.(n-1)}
     */
    public static Term deepLambda(int n) { return lam(n, var(n - 1)); }

    /**
     * A left-leaning chain of {@code n} applications of {@code I} to
     * the variable {@code 0}, which takes {@code n} head steps.
     *
     * @param n number of applications
     * @return {@code I (I (... (I 0)))} built rightwards
     */
    public static Term nestedIdentity(int n) {
        Term t = var(0);
        for (int i = 0; i < n; i++) { t = app(I, t); }
        return t;
    }
}
