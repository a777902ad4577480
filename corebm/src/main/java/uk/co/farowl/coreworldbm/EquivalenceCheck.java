// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.coreworldbm;

import static uk.co.farowl.coreworld.term.Terms.app;
import static uk.co.farowl.coreworld.term.Terms.lam;
import static uk.co.farowl.coreworld.term.Terms.var;

import java.util.concurrent.TimeUnit;

import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.BenchmarkMode;
import org.openjdk.jmh.annotations.Fork;
import org.openjdk.jmh.annotations.Measurement;
import org.openjdk.jmh.annotations.Mode;
import org.openjdk.jmh.annotations.OutputTimeUnit;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.State;
import org.openjdk.jmh.annotations.Warmup;

import uk.co.farowl.coreworld.Kernel;
import uk.co.farowl.coreworld.proof.Proof;
import uk.co.farowl.coreworld.term.Term;

/**
 * This is a JMH benchmark for equivalence checking through the
 * {@link Kernel}, and for the binary form of the proofs it produces.
 * Comparison is with alpha equivalence of the normal forms, which is
 * the least the checker has to do.
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.MICROSECONDS)

@Fork(2)
@Warmup(iterations = 20, time = 1, timeUnit = TimeUnit.SECONDS)
@Measurement(iterations = 10, time = 1, timeUnit = TimeUnit.SECONDS)

@State(Scope.Thread)
public class EquivalenceCheck {

    static final Term SUCC =
            lam(3, app(var(1), app(var(2), var(1), var(0))));
    static final Term TIMES = lam(3, app(var(2), app(var(1), var(0))));

    static Term church(int n) {
        Term body = var(0);
        for (int i = 0; i < n; i++) { body = app(var(1), body); }
        return lam(2, body);
    }

    Kernel kernel = Kernel.create();
    Kernel quiet =
            Kernel.create(Kernel.Options.DEFAULT.withRecordTrace(false));

    /** {@code 6 * 6} against {@code succ (5 * 7)} */
    Term left = app(TIMES, church(6), church(6));
    Term right = app(SUCC, app(TIMES, church(5), church(7)));

    Term nf = church(36);
    Term nf2 = church(36);

    byte[] encoded = kernel.encode(kernel.verifyEquiv(left, right));

    @Benchmark
    public boolean alpha_only() { return kernel.alphaEquiv(nf, nf2); }

    @Benchmark
    public Proof verify() { return kernel.verifyEquiv(left, right); }

    @Benchmark
    public Proof verify_quiet() { return quiet.verifyEquiv(left, right); }

    @Benchmark
    public byte[] encodeProof() {
        return kernel.encode(kernel.verifyEquiv(left, right));
    }

    @Benchmark
    public Proof decodeProof() { return kernel.decodeProof(encoded); }

    /*
     * main() is useful for following the code path in the debugger, but
     * is not material to the benchmark.
     */
    public static void main(String[] args) {
        EquivalenceCheck b = new EquivalenceCheck();
        System.out.println(b.verify());
        System.out.println(b.decodeProof().verdict());
    }
}
