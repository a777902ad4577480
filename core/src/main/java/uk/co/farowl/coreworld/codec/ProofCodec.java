// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.coreworld.codec;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

import uk.co.farowl.coreworld.proof.Consistency.InconsistencyCertificate;
import uk.co.farowl.coreworld.proof.Consistency.Origin;
import uk.co.farowl.coreworld.proof.Derivation;
import uk.co.farowl.coreworld.proof.Proof;
import uk.co.farowl.coreworld.proof.Side;
import uk.co.farowl.coreworld.proof.TraceStep;
import uk.co.farowl.coreworld.proof.Verdict;
import uk.co.farowl.coreworld.proof.Witness;
import uk.co.farowl.coreworld.reduce.Normalization.NormalForm;
import uk.co.farowl.coreworld.reduce.Step;
import uk.co.farowl.coreworld.support.DecodingError;
import uk.co.farowl.coreworld.support.DecodingError.Reason;
import uk.co.farowl.coreworld.term.Application;
import uk.co.farowl.coreworld.term.Path;
import uk.co.farowl.coreworld.term.Term;

/**
 * Binary form of a {@link Proof}, for audit logs, and of a
 * {@link Derivation}.
 * <p>
 * A proof is the magic {@code "CWPF"} and a version byte, the two
 * subjects, the verdict (a tag and its contents) and the trace (a
 * 4-byte count then, for each step, the side, the path, the term before
 * and the term after). A path is a 4-byte length and one byte per move.
 * Terms are encoded as by {@link TermCodec}.
 * <p>
 * A derivation is a tag per rule, in pre-order, followed by the terms or
 * sub-derivations of that rule. The tag reserved for eta is refused.
 */
public final class ProofCodec {

    private ProofCodec() {} // no instances

    /**
     * Encode a proof.
     *
     * @param proof to encode
     * @return its binary form
     */
    public static byte[] encode(Proof proof) {
        Writer w = new Writer(256);
        for (byte b : Tags.PROOF_MAGIC) { w.writeByte(b); }
        w.writeByte(Tags.PROOF_VERSION);
        w.writeTerm(proof.subjectA());
        w.writeTerm(proof.subjectB());
        writeVerdict(w, proof.verdict());
        w.writeInt(proof.trace().size());
        for (TraceStep s : proof.trace()) {
            w.writeByte(s.side().ordinal());
            w.writePath(s.path());
            w.writeTerm(s.before());
            w.writeTerm(s.after());
        }
        return w.toByteArray();
    }

    /**
     * Decode a proof. The input must contain exactly one proof.
     *
     * @param bytes to decode
     * @return the proof
     * @throws DecodingError if the input is not exactly one valid proof
     */
    public static Proof decode(byte[] bytes) throws DecodingError {
        Reader r = new Reader(bytes);
        for (byte b : Tags.PROOF_MAGIC) {
            int at = r.offset();
            if (r.readByte() != b) {
                throw new DecodingError(Reason.BAD_HEADER, at,
                        "not an encoded proof");
            }
        }
        int at = r.offset();
        int version = r.readByte();
        if (version != Tags.PROOF_VERSION) {
            throw new DecodingError(Reason.BAD_HEADER, at,
                    "unsupported proof version %d", version);
        }

        Term a = r.readTerm();
        Term b = r.readTerm();
        Verdict verdict = readVerdict(r);

        // Each step is at least side, path length and two 1-byte terms.
        int n = r.readCount(7);
        List<TraceStep> trace = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            Side side = readSide(r);
            Path path = r.readPath();
            Term before = r.readTerm();
            trace.add(new TraceStep(side, path, before, r.readTerm()));
        }
        r.expectEnd();
        return new Proof(a, b, verdict, trace);
    }

    /**
     * Encode a derivation.
     *
     * @param derivation to encode
     * @return its binary form
     */
    public static byte[] encode(Derivation derivation) {
        Writer w = new Writer(256);
        Deque<Derivation> work = new ArrayDeque<>();
        work.push(derivation);
        while (!work.isEmpty()) {
            Derivation d = work.pop();
            if (d instanceof Derivation.BetaStep s) {
                w.writeByte(Tags.BETA);
                w.writeTerm(s.redex());
                w.writeTerm(s.contractum());
            } else if (d instanceof Derivation.Refl s) {
                w.writeByte(Tags.REFL);
                w.writeTerm(s.term());
            } else if (d instanceof Derivation.Sym s) {
                w.writeByte(Tags.SYM);
                work.push(s.of());
            } else if (d instanceof Derivation.Trans s) {
                w.writeByte(Tags.TRANS);
                work.push(s.second());
                work.push(s.first());
            } else if (d instanceof Derivation.CongApp s) {
                w.writeByte(Tags.CONG_APP);
                work.push(s.argument());
                work.push(s.function());
            } else if (d instanceof Derivation.CongLam s) {
                w.writeByte(Tags.CONG_LAM);
                work.push(s.body());
            }
        }
        return w.toByteArray();
    }

    /** A rule waiting for its sub-derivations. */
    private record Pending(int tag, List<Derivation> parts) {
        int arity() {
            return tag == Tags.TRANS || tag == Tags.CONG_APP ? 2 : 1;
        }
    }

    /**
     * Decode a derivation. The input must contain exactly one
     * derivation. Decoding does not check the derivation.
     *
     * @param bytes to decode
     * @return the derivation
     * @throws DecodingError if the input is not exactly one encoded
     *     derivation, or uses the eta rule
     */
    public static Derivation decodeDerivation(byte[] bytes)
            throws DecodingError {
        Reader r = new Reader(bytes);
        Deque<Pending> stack = new ArrayDeque<>();

        while (true) {
            int at = r.offset();
            int tag = r.readByte();
            Derivation done;
            switch (tag) {
                case Tags.BETA:
                    Term redex = r.readTerm();
                    done = new Derivation.BetaStep(redex, r.readTerm());
                    break;
                case Tags.REFL:
                    done = new Derivation.Refl(r.readTerm());
                    break;
                case Tags.SYM:
                case Tags.TRANS:
                case Tags.CONG_APP:
                case Tags.CONG_LAM:
                    stack.push(new Pending(tag, new ArrayList<>(2)));
                    continue;
                case Tags.ETA:
                    throw new DecodingError(Reason.INVALID_TAG, at,
                            "eta is not a rule of this kernel");
                default:
                    throw Reader.invalidTag(at, tag, "derivation");
            }

            // done is complete: give it to the rules waiting.
            while (true) {
                if (stack.isEmpty()) {
                    r.expectEnd();
                    return done;
                }
                Pending p = stack.peek();
                p.parts().add(done);
                if (p.parts().size() < p.arity()) { break; }
                stack.pop();
                done = build(p);
            }
        }
    }

    private static Derivation build(Pending p) {
        List<Derivation> d = p.parts();
        return switch (p.tag()) {
            case Tags.SYM -> new Derivation.Sym(d.get(0));
            case Tags.TRANS -> new Derivation.Trans(d.get(0), d.get(1));
            case Tags.CONG_APP -> new Derivation.CongApp(d.get(0), d.get(1));
            default -> new Derivation.CongLam(d.get(0));
        };
    }

    private static void writeVerdict(Writer w, Verdict verdict) {
        if (verdict instanceof Verdict.Equivalent) {
            w.writeByte(Tags.EQUIVALENT);
        } else if (verdict instanceof Verdict.NotEquivalent v) {
            w.writeByte(Tags.NOT_EQUIVALENT);
            Witness x = v.witness();
            w.writePath(x.path());
            w.writeTerm(x.left());
            w.writeTerm(x.right());
        } else if (verdict instanceof Verdict.Inconclusive v) {
            w.writeByte(Tags.INCONCLUSIVE);
            w.writeLong(v.fuelSpent());
        } else if (verdict instanceof Verdict.Inconsistent v) {
            w.writeByte(Tags.INCONSISTENT);
            InconsistencyCertificate c = v.certificate();
            w.writeByte(c.origin().ordinal());
            w.writeTerm(c.left());
            w.writeTerm(c.right());
            writeNormalForm(w, c.leftNormalForm());
            writeNormalForm(w, c.rightNormalForm());
        }
    }

    private static Verdict readVerdict(Reader r) {
        int at = r.offset();
        int tag = r.readByte();
        switch (tag) {
            case Tags.EQUIVALENT:
                return Verdict.EQUIVALENT;
            case Tags.NOT_EQUIVALENT:
                Path path = r.readPath();
                Term left = r.readTerm();
                return new Verdict.NotEquivalent(
                        new Witness(path, left, r.readTerm()));
            case Tags.INCONCLUSIVE:
                return new Verdict.Inconclusive(r.readLong());
            case Tags.INCONSISTENT:
                return new Verdict.Inconsistent(readCertificate(r));
            default:
                throw Reader.invalidTag(at, tag, "verdict");
        }
    }

    private static InconsistencyCertificate readCertificate(Reader r) {
        int at = r.offset();
        int o = r.readByte();
        Origin[] origins = Origin.values();
        if (o >= origins.length) {
            throw Reader.invalidTag(at, o, "certificate origin");
        }
        Term left = r.readTerm();
        Term right = r.readTerm();
        NormalForm lnf = readNormalForm(r);
        return new InconsistencyCertificate(origins[o], left, right, lnf,
                readNormalForm(r));
    }

    private static void writeNormalForm(Writer w, NormalForm nf) {
        w.writeTerm(nf.term());
        w.writeLong(nf.steps());
        w.writeInt(nf.trace().size());
        for (Step s : nf.trace()) {
            w.writePath(s.path());
            w.writeTerm(s.redex());
            w.writeTerm(s.contractum());
            w.writeTerm(s.result());
        }
    }

    private static NormalForm readNormalForm(Reader r) {
        Term term = r.readTerm();
        long steps = r.readLong();
        // Each step is at least a path length and three terms.
        int n = r.readCount(7);
        List<Step> trace = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            Path path = r.readPath();
            int at = r.offset();
            Term redex = r.readTerm();
            if (!(redex instanceof Application p && p.isRedex())) {
                throw new DecodingError(Reason.INVALID_TAG, at,
                        "recorded step on %s, which is not a redex", redex);
            }
            Term contractum = r.readTerm();
            trace.add(new Step(path, p, contractum, r.readTerm()));
        }
        return new NormalForm(term, steps, trace);
    }

    private static Side readSide(Reader r) {
        int at = r.offset();
        int s = r.readByte();
        Side[] sides = Side.values();
        if (s >= sides.length) { throw Reader.invalidTag(at, s, "side"); }
        return sides[s];
    }
}
