// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.coreworld.reduce;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import uk.co.farowl.coreworld.term.Term;

/**
 * The normalization driver: take steps until there is no redex the
 * stepper will contract, or until the fuel runs out.
 * <p>
 * {@link #normalize(Term, long)} reduces to weak head normal form by
 * call-by-name. {@link #normalizeFully(Term, Fuel, Stepper, boolean)}
 * is the same loop over any stepper, and with
 * {@link Strategy#NORMAL_ORDER} it reaches the beta-normal form of any
 * term that has one, given enough fuel.
 */
public final class Normalizer {

    /** Logger for the normalization driver. */
    static final Logger logger = LoggerFactory.getLogger(Normalizer.class);

    private Normalizer() {} // no instances

    /**
     * Reduce a term to weak head normal form, taking at most
     * {@code fuel} steps.
     *
     * @param term to reduce
     * @param fuel maximum number of steps
     * @return the normal form or notice that the fuel ran out
     */
    public static Normalization normalize(Term term, long fuel) {
        return normalize(term, Fuel.of(fuel), false);
    }

    /**
     * Reduce a term to weak head normal form, paying for each step from
     * {@code fuel}.
     *
     * @param term to reduce
     * @param fuel budget shared with the caller
     * @param record whether to keep the steps in the result
     * @return the normal form or notice that the fuel ran out
     */
    public static Normalization normalize(Term term, Fuel fuel,
            boolean record) {
        return drive(term, fuel, Strategy.WEAK_HEAD, record);
    }

    /**
     * Reduce a term with the given stepper until it will take no more
     * steps, paying for each step from {@code fuel}.
     *
     * @param term to reduce
     * @param fuel budget shared with the caller
     * @param stepper choosing each redex
     * @param record whether to keep the steps in the result
     * @return the normal form or notice that the fuel ran out
     */
    public static Normalization normalizeFully(Term term, Fuel fuel,
            Stepper stepper, boolean record) {
        return drive(term, fuel, stepper, record);
    }

    private static Normalization drive(Term term, Fuel fuel,
            Stepper stepper, boolean record) {
        List<Step> trace = record ? new ArrayList<>() : List.of();
        Term current = term;
        long steps = 0;

        while (true) {
            if (fuel.isExhausted()) {
                if (!stepper.hasStep(current)) {
                    return new Normalization.NormalForm(current, steps,
                            trace);
                }
                logger.atDebug()
                        .setMessage("Out of fuel after {} steps with {}")
                        .addArgument(steps).addArgument(stepper).log();
                return new Normalization.OutOfFuel(current, steps, trace);
            }
            Optional<Step> next = stepper.next(current);
            if (next.isEmpty()) {
                return new Normalization.NormalForm(current, steps, trace);
            }
            fuel.tryConsume();
            Step step = next.get();
            logger.atTrace().setMessage("{}").addArgument(step).log();
            if (record) { trace.add(step); }
            current = step.result();
            steps += 1;
        }
    }
}
