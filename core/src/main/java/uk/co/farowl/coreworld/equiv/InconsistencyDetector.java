// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.coreworld.equiv;

import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import uk.co.farowl.coreworld.proof.Consistency;
import uk.co.farowl.coreworld.proof.Consistency.InconsistencyCertificate;
import uk.co.farowl.coreworld.proof.Consistency.Origin;
import uk.co.farowl.coreworld.proof.Derivation;
import uk.co.farowl.coreworld.proof.Judgement;
import uk.co.farowl.coreworld.reduce.Fuel;
import uk.co.farowl.coreworld.reduce.Normalization;
import uk.co.farowl.coreworld.reduce.Normalization.NormalForm;
import uk.co.farowl.coreworld.reduce.Normalizer;
import uk.co.farowl.coreworld.reduce.Stepper;
import uk.co.farowl.coreworld.reduce.Strategy;
import uk.co.farowl.coreworld.support.DerivationError;
import uk.co.farowl.coreworld.term.Term;

/**
 * Looks for a contradiction: two reductions that ought to agree,
 * reaching normal forms that are not alpha-equivalent. By confluence
 * this cannot happen with a correct reducer, so a certificate is
 * evidence of a defect in the reducer (or in whatever produced a
 * derivation that checks yet contradicts itself).
 * <p>
 * A term is reduced to full beta-normal form along two reduction
 * orders, by default normal order and applicative order, each with its
 * own copy of the budget.
 */
public final class InconsistencyDetector {

    /** Logger for the detector. */
    static final Logger logger =
            LoggerFactory.getLogger(InconsistencyDetector.class);

    private final Stepper first;
    private final Stepper second;
    private final boolean recordTrace;

    /**
     * Create a detector comparing normal order with applicative order.
     *
     * @param recordTrace whether certificates should carry the steps of
     *     each reduction
     */
    public InconsistencyDetector(boolean recordTrace) {
        this(Strategy.NORMAL_ORDER, Strategy.APPLICATIVE_ORDER,
                recordTrace);
    }

    /**
     * Create a detector comparing two given steppers. The first is also
     * the one used to normalize the sides of a derivation.
     *
     * @param first stepper
     * @param second stepper
     * @param recordTrace whether certificates should carry the steps of
     *     each reduction
     */
    public InconsistencyDetector(Stepper first, Stepper second,
            boolean recordTrace) {
        this.first = Objects.requireNonNull(first, "first");
        this.second = Objects.requireNonNull(second, "second");
        this.recordTrace = recordTrace;
    }

    /**
     * Reduce {@code term} by both steppers and compare the normal forms.
     *
     * @param term to examine
     * @param fuel budget for each reduction separately
     * @return a certificate if the normal forms differ, else
     *     {@link Consistency.Consistent}
     */
    public Consistency check(Term term, long fuel) {
        Normalization a = Normalizer.normalizeFully(term, Fuel.of(fuel),
                first, recordTrace);
        if (a instanceof NormalForm na) {
            Normalization b = Normalizer.normalizeFully(term,
                    Fuel.of(fuel), second, recordTrace);
            if (b instanceof NormalForm nb
                    && !AlphaEquivalence.equivalent(na.term(), nb.term())) {
                return certificate(new InconsistencyCertificate(
                        Origin.REDUCTION_PATHS, term, term, na, nb));
            }
        }
        logger.atDebug().setMessage("{} consistent: {}").addArgument(term)
                .addArgument(a).log();
        return new Consistency.Consistent(term, a);
    }

    /**
     * Check a derivation, then normalize both sides of the equation it
     * proves with the first stepper and compare the normal forms.
     *
     * @param derivation to examine
     * @param fuel budget for each side separately
     * @return a certificate if the normal forms differ, else
     *     {@link Consistency.Consistent} about the left side
     * @throws DerivationError if the derivation does not check
     */
    public Consistency check(Derivation derivation, long fuel)
            throws DerivationError {
        Judgement j = DerivationChecker.verify(derivation);
        Normalization a = Normalizer.normalizeFully(j.left(),
                Fuel.of(fuel), first, recordTrace);
        if (a instanceof NormalForm na) {
            Normalization b = Normalizer.normalizeFully(j.right(),
                    Fuel.of(fuel), first, recordTrace);
            if (b instanceof NormalForm nb
                    && !AlphaEquivalence.equivalent(na.term(), nb.term())) {
                return certificate(new InconsistencyCertificate(
                        Origin.DERIVATION, j.left(), j.right(), na, nb));
            }
        }
        return new Consistency.Consistent(j.left(), a);
    }

    private static InconsistencyCertificate certificate(
            InconsistencyCertificate c) {
        logger.atWarn().setMessage("Inconsistency ({}): {} ⇒ {} but {} ⇒ {}")
                .addArgument(c.origin()).addArgument(c.left())
                .addArgument(c.leftNormalForm().term())
                .addArgument(c.right())
                .addArgument(c.rightNormalForm().term()).log();
        return c;
    }
}
