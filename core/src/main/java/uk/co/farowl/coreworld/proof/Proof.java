// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.coreworld.proof;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import uk.co.farowl.coreworld.reduce.Normalization;
import uk.co.farowl.coreworld.reduce.Step;
import uk.co.farowl.coreworld.term.Term;

/**
 * The record of one verification: the two subjects, the verdict reached
 * and the beta steps taken to reach it. A {@code Proof} is immutable,
 * and is created only by the equivalence checker, or from an
 * inconsistency certificate. Trust-tier logic downstream consumes it as
 * it is, and may encode it for an audit log.
 * <p>
 * The trace may be empty even where steps were taken, if the kernel was
 * configured not to record them.
 *
 * @param subjectA the first term compared
 * @param subjectB the second term compared
 * @param verdict the conclusion
 * @param trace the beta steps taken, in order
 */
public record Proof(Term subjectA, Term subjectB, Verdict verdict,
        List<TraceStep> trace) {

    /**
     * Validate and copy the components.
     *
     * @param subjectA the first term compared
     * @param subjectB the second term compared
     * @param verdict the conclusion
     * @param trace the beta steps taken, in order
     */
    public Proof {
        Objects.requireNonNull(subjectA, "subjectA");
        Objects.requireNonNull(subjectB, "subjectB");
        Objects.requireNonNull(verdict, "verdict");
        trace = List.copyOf(trace);
    }

    /**
     * Present an inconsistency certificate as a proof with the verdict
     * {@link Verdict.Inconsistent}, for clients that log every outcome
     * in the same form. The trace is the reduction of each side.
     *
     * @param certificate to present
     * @return the proof
     */
    public static Proof inconsistent(
            Consistency.InconsistencyCertificate certificate) {
        List<TraceStep> trace = new ArrayList<>();
        addSteps(trace, Side.LEFT, certificate.leftNormalForm());
        addSteps(trace, Side.RIGHT, certificate.rightNormalForm());
        return new Proof(certificate.left(), certificate.right(),
                new Verdict.Inconsistent(certificate), trace);
    }

    private static void addSteps(List<TraceStep> trace, Side side,
            Normalization n) {
        for (Step s : n.trace()) {
            trace.add(new TraceStep(side, s.path(), s.redex(),
                    s.contractum()));
        }
    }

    /** @return whether the verdict is {@link Verdict.Equivalent} */
    public boolean isEquivalent() {
        return verdict instanceof Verdict.Equivalent;
    }

    @Override
    public String toString() {
        return String.format("Proof[%s ≡? %s: %s, %d steps]", subjectA,
                subjectB, verdict, trace.size());
    }
}
