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

import uk.co.farowl.coreworld.reduce.Fuel;
import uk.co.farowl.coreworld.reduce.Normalization;
import uk.co.farowl.coreworld.reduce.Normalizer;
import uk.co.farowl.coreworld.reduce.Strategy;
import uk.co.farowl.coreworld.term.Term;

/**
 * This is a JMH benchmark for reduction of Church numeral arithmetic
 * to normal form, in each order, with and without a trace. The weak
 * head case stops at the first binder and so measures little more than
 * the cost of the spine walk.
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.MICROSECONDS)

@Fork(2)
@Warmup(iterations = 20, time = 1, timeUnit = TimeUnit.SECONDS)
@Measurement(iterations = 10, time = 1, timeUnit = TimeUnit.SECONDS)

@State(Scope.Thread)
public class ChurchReduction {

    static final Term PLUS = lam(4,
            app(var(3), var(1), app(var(2), var(1), var(0))));
    static final Term TIMES = lam(3, app(var(2), app(var(1), var(0))));

    static Term church(int n) {
        Term body = var(0);
        for (int i = 0; i < n; i++) { body = app(var(1), body); }
        return lam(2, body);
    }

    /** {@code 3 * (4 + 5)} */
    Term sum = app(TIMES, church(3), app(PLUS, church(4), church(5)));

    /** {@code 10 * 10} */
    Term product = app(TIMES, church(10), church(10));

    static final long FUEL = 100_000;

    @Benchmark
    public Normalization weakHead() {
        return Normalizer.normalize(product, Fuel.of(FUEL), false);
    }

    @Benchmark
    public Normalization normalOrder() {
        return Normalizer.normalizeFully(sum, Fuel.of(FUEL),
                Strategy.NORMAL_ORDER, false);
    }

    @Benchmark
    public Normalization normalOrder_traced() {
        return Normalizer.normalizeFully(sum, Fuel.of(FUEL),
                Strategy.NORMAL_ORDER, true);
    }

    @Benchmark
    public Normalization applicativeOrder() {
        return Normalizer.normalizeFully(sum, Fuel.of(FUEL),
                Strategy.APPLICATIVE_ORDER, false);
    }

    @Benchmark
    public Normalization normalOrder_big() {
        return Normalizer.normalizeFully(product, Fuel.of(FUEL),
                Strategy.NORMAL_ORDER, false);
    }

    /*
     * main() is useful for following the code path in the debugger, but
     * is not material to the benchmark.
     */
    public static void main(String[] args) {
        ChurchReduction b = new ChurchReduction();
        System.out.println(b.normalOrder_traced());
        System.out.println(b.applicativeOrder());
    }
}
