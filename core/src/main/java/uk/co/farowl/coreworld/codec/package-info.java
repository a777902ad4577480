/**
 * Binary encodings of terms, derivations and proofs.
 */
package uk.co.farowl.coreworld.codec;
