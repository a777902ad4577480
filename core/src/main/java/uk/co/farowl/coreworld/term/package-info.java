/**
 * The {@code term} package defines the terms of the kernel, lambda
 * terms with variables named by de Bruijn index, together with the
 * operations on indices (shifting and substitution) on which reduction
 * is built, and {@link uk.co.farowl.coreworld.term.Path}s that name
 * positions within a term.
 * <p>
 * Terms are immutable and cache their size, hash and the bound on
 * their free indices. Every traversal in this package is iterative, so
 * terms may be far deeper than the Java stack.
 */
package uk.co.farowl.coreworld.term;
