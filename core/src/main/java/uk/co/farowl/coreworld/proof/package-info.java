/**
 * The {@code proof} package contains the immutable artifacts the kernel
 * hands to its clients: {@link uk.co.farowl.coreworld.proof.Proof} and
 * its {@link uk.co.farowl.coreworld.proof.Verdict}, the
 * {@link uk.co.farowl.coreworld.proof.Consistency} of a term, and the
 * {@link uk.co.farowl.coreworld.proof.Derivation} trees a client may
 * offer for checking.
 * <p>
 * Nothing here computes anything. The algorithms that produce these
 * values are in {@code uk.co.farowl.coreworld.equiv}.
 */
package uk.co.farowl.coreworld.proof;
