/**
 * A small rewriting kernel for the lambda calculus with de Bruijn
 * indices. Clients enter through {@link uk.co.farowl.coreworld.Kernel}.
 * <p>
 * The kernel reduces terms, decides equivalence under a fuel budget
 * and produces {@link uk.co.farowl.coreworld.proof.Proof} objects
 * recording its conclusions. Divergence is never an error: running out
 * of fuel is one of the outcomes of every bounded operation.
 */
package uk.co.farowl.coreworld;
