/**
 * The {@code equiv} package decides questions of equality between
 * terms: alpha-equivalence, beta-equivalence within a budget, the
 * consistency of reduction, and the checking of derivations.
 */
package uk.co.farowl.coreworld.equiv;
