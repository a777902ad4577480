// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.coreworld;

import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import uk.co.farowl.coreworld.codec.ProofCodec;
import uk.co.farowl.coreworld.codec.TermCodec;
import uk.co.farowl.coreworld.equiv.AlphaEquivalence;
import uk.co.farowl.coreworld.equiv.DerivationChecker;
import uk.co.farowl.coreworld.equiv.EquivalenceChecker;
import uk.co.farowl.coreworld.equiv.InconsistencyDetector;
import uk.co.farowl.coreworld.proof.Consistency;
import uk.co.farowl.coreworld.proof.Derivation;
import uk.co.farowl.coreworld.proof.Judgement;
import uk.co.farowl.coreworld.proof.Proof;
import uk.co.farowl.coreworld.reduce.Fuel;
import uk.co.farowl.coreworld.reduce.Normalization;
import uk.co.farowl.coreworld.reduce.Normalizer;
import uk.co.farowl.coreworld.support.DecodingError;
import uk.co.farowl.coreworld.support.DerivationError;
import uk.co.farowl.coreworld.term.Term;

/**
 * The entry point through which clients use the rewriting kernel. A
 * {@code Kernel} holds only its {@link Options}: every operation is a
 * function of its arguments, and one instance may be shared between
 * threads.
 */
public final class Kernel {

    /** Logger for the kernel facade. */
    static final Logger logger = LoggerFactory.getLogger(Kernel.class);

    /**
     * The settings of a {@link Kernel}. Nothing is read from the
     * environment: a client that wants settings from a file or the
     * command line reads them and builds an {@code Options}.
     *
     * @param defaultFuel budget of steps where an operation is not
     *     given one
     * @param recordTrace whether results carry the steps taken
     */
    public record Options(long defaultFuel, boolean recordTrace) {

        /** Fuel 10 000, trace recorded. */
        public static final Options DEFAULT = new Options(10_000, true);

        /**
         * Validate the components.
         *
         * @param defaultFuel budget of steps (not negative)
         * @param recordTrace whether results carry the steps taken
         */
        public Options {
            if (defaultFuel < 0) {
                throw new IllegalArgumentException(
                        "defaultFuel must not be negative");
            }
        }

        /**
         * Copy with a different default fuel.
         *
         * @param fuel new default
         * @return the new options
         */
        public Options withDefaultFuel(long fuel) {
            return new Options(fuel, recordTrace);
        }

        /**
         * Copy with a different trace setting.
         *
         * @param record whether results carry the steps taken
         * @return the new options
         */
        public Options withRecordTrace(boolean record) {
            return new Options(defaultFuel, record);
        }
    }

    private final Options options;
    private final EquivalenceChecker checker;
    private final InconsistencyDetector detector;

    private Kernel(Options options) {
        this.options = Objects.requireNonNull(options, "options");
        this.checker = new EquivalenceChecker(options.recordTrace());
        this.detector = new InconsistencyDetector(options.recordTrace());
        logger.atDebug().setMessage("Kernel created with {}")
                .addArgument(options).log();
    }

    /**
     * Create a kernel with {@link Options#DEFAULT}.
     *
     * @return the kernel
     */
    public static Kernel create() { return new Kernel(Options.DEFAULT); }

    /**
     * Create a kernel with the given options.
     *
     * @param options to apply
     * @return the kernel
     */
    public static Kernel create(Options options) {
        return new Kernel(options);
    }

    /** @return the options of this kernel */
    public Options options() { return options; }

    /**
     * Reduce a term to weak head normal form by call-by-name.
     *
     * @param term to reduce
     * @param fuel maximum number of steps
     * @return the normal form or notice that the fuel ran out
     */
    public Normalization normalize(Term term, long fuel) {
        return Normalizer.normalize(term, Fuel.of(fuel),
                options.recordTrace());
    }

    /**
     * Reduce a term to weak head normal form within the default fuel.
     *
     * @param term to reduce
     * @return the normal form or notice that the fuel ran out
     */
    public Normalization normalize(Term term) {
        return normalize(term, options.defaultFuel());
    }

    /**
     * Decide whether two terms are beta-equivalent.
     *
     * @param a the first subject
     * @param b the second subject
     * @param fuel budget shared by both sides
     * @return the proof recording the verdict
     */
    public Proof verifyEquiv(Term a, Term b, long fuel) {
        return checker.verify(a, b, fuel);
    }

    /**
     * Decide whether two terms are beta-equivalent within the default
     * fuel.
     *
     * @param a the first subject
     * @param b the second subject
     * @return the proof recording the verdict
     */
    public Proof verifyEquiv(Term a, Term b) {
        return verifyEquiv(a, b, options.defaultFuel());
    }

    /**
     * Look for a contradiction between reduction orders within the
     * default fuel.
     *
     * @param term to examine
     * @return the outcome
     */
    public Consistency checkInconsistency(Term term) {
        return checkInconsistency(term, options.defaultFuel());
    }

    /**
     * Look for a contradiction between reduction orders.
     *
     * @param term to examine
     * @param fuel budget for each reduction
     * @return the outcome
     */
    public Consistency checkInconsistency(Term term, long fuel) {
        return detector.check(term, fuel);
    }

    /**
     * Check a derivation and look for a contradiction between the
     * normal forms of the two sides of its conclusion.
     *
     * @param derivation to examine
     * @param fuel budget for each side
     * @return the outcome
     * @throws DerivationError if the derivation does not check
     */
    public Consistency checkInconsistency(Derivation derivation, long fuel)
            throws DerivationError {
        return detector.check(derivation, fuel);
    }

    /**
     * Check a derivation.
     *
     * @param derivation to check
     * @return the equation it proves
     * @throws DerivationError if the derivation does not check
     */
    public Judgement checkDerivation(Derivation derivation)
            throws DerivationError {
        return DerivationChecker.verify(derivation);
    }

    /**
     * Whether two terms are alpha-equivalent.
     *
     * @param a one term
     * @param b the other
     * @return whether they are equal up to renaming of bound variables
     */
    public boolean alphaEquiv(Term a, Term b) {
        return AlphaEquivalence.equivalent(a, b);
    }

    /**
     * Encode a term.
     *
     * @param term to encode
     * @return its binary form
     */
    public byte[] encode(Term term) { return TermCodec.encode(term); }

    /**
     * Decode a term.
     *
     * @param bytes to decode
     * @return the term
     * @throws DecodingError if the input is not exactly one valid term
     */
    public Term decodeTerm(byte[] bytes) throws DecodingError {
        return TermCodec.decode(bytes);
    }

    /**
     * Encode a proof.
     *
     * @param proof to encode
     * @return its binary form
     */
    public byte[] encode(Proof proof) { return ProofCodec.encode(proof); }

    /**
     * Decode a proof.
     *
     * @param bytes to decode
     * @return the proof
     * @throws DecodingError if the input is not exactly one valid proof
     */
    public Proof decodeProof(byte[] bytes) throws DecodingError {
        return ProofCodec.decode(bytes);
    }
}
