// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.coreworld.term;

/**
 * A term of the lambda calculus in de Bruijn form. A term is one of
 * {@link Variable}, {@link Abstraction} or {@link Application}, and is
 * immutable. A sub-term may be shared by any number of parents.
 * <p>
 * A variable index counts enclosing binders outwards from the
 * occurrence, 0 denoting the nearest. An index equal to or greater than
 * the number of abstractions enclosing the occurrence is a free
 * reference, counted relative to the outermost scope of the whole term.
 * <p>
 * Each node computes a few facts about itself when it is constructed,
 * from the same facts about its children, so that they cost nothing to
 * consult afterwards. In particular {@link #freeBound()} lets shifting
 * and substitution skip sub-terms they cannot change. {@code equals}
 * is exact structural equality (which, for de Bruijn terms, coincides
 * with alpha-equivalence), and is computed without recursion, as is
 * {@code toString()}.
 */
public sealed interface Term permits Variable, Abstraction, Application {

    /**
     * One more than the largest index free at the root of this term,
     * or zero if the term is closed. A term is well formed in a scope
     * of {@code k} free variables if and only if
     * {@code freeBound() <= k}.
     *
     * @return the bound on free indices
     */
    int freeBound();

    /**
     * The number of nodes in the tree this term denotes, counting a
     * shared sub-term once for every place it appears. This saturates
     * at {@code Long.MAX_VALUE}.
     *
     * @return the number of nodes
     */
    long size();

    /**
     * Whether this term has no free variables.
     *
     * @return {@code freeBound() == 0}
     */
    default boolean isClosed() { return freeBound() == 0; }
}
