// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.coreworld.term;

/**
 * Shorthand factories for terms, suitable for static import, so that a
 * term may be written {@code app(lam(app(var(0), var(0))), var(1))}.
 */
public final class Terms {

    private Terms() {} // no instances

    /**
     * A variable.
     *
     * @param index de Bruijn index
     * @return {@code new Variable(index)}
     */
    public static Variable var(int index) { return new Variable(index); }

    /**
     * An abstraction.
     *
     * @param body of the abstraction
     * @return {@code new Abstraction(body)}
     */
    public static Abstraction lam(Term body) {
        return new Abstraction(body);
    }

    /**
     * A body under {@code n} nested abstractions.
     *
     * @param n number of binders ({@code n > 0})
     * @param body innermost body
     * @return the nested abstraction
     */
    public static Abstraction lam(int n, Term body) {
        if (n < 1) {
            throw new IllegalArgumentException(
                    "at least one binder is needed");
        }
        Term t = body;
        for (int i = 0; i < n; i++) { t = new Abstraction(t); }
        return (Abstraction)t;
    }

    /**
     * An application, or a chain of them associating to the left:
     * {@code app(f, a, b)} is {@code app(app(f, a), b)}.
     *
     * @param function in function position
     * @param argument first argument
     * @param more further arguments
     * @return the application
     */
    public static Application app(Term function, Term argument,
            Term... more) {
        Application t = new Application(function, argument);
        for (Term a : more) { t = new Application(t, a); }
        return t;
    }
}
