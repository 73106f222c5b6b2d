package com.enumerant.benchmark;

import com.enumerant.core.Description;
import com.enumerant.core.ValueSet;
import com.enumerant.format.Selector;
import com.enumerant.types.IntegralType;
import org.openjdk.jmh.annotations.*;
import org.openjdk.jmh.infra.Blackhole;

import java.util.concurrent.TimeUnit;

/**
 * Benchmarks for text to value resolution across the selector chain.
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.NANOSECONDS)
@State(Scope.Benchmark)
@Warmup(iterations = 5, time = 1, timeUnit = TimeUnit.SECONDS)
@Measurement(iterations = 10, time = 1, timeUnit = TimeUnit.SECONDS)
@Fork(1)
public class ParseBenchmark {

    private ValueSet<Integer> statuses;
    private String[] names;
    private String[] upperNames;
    private String[] decimals;
    private String[] descriptions;

    @Setup
    public void setup() throws Exception {
        var builder = ValueSet.builder("Status", IntegralType.INT32);
        int count = 64;
        names = new String[count];
        upperNames = new String[count];
        decimals = new String[count];
        descriptions = new String[count];
        for (int i = 0; i < count; i++) {
            names[i] = "Status" + i;
            upperNames[i] = names[i].toUpperCase();
            decimals[i] = Integer.toString(i * 10);
            descriptions[i] = "status number " + i;
            builder.member(names[i], i * 10L, new Description(descriptions[i]));
        }
        statuses = builder.build();

        // Build the lazy indexes outside the measurement
        statuses.parse(upperNames[0], true);
        statuses.parse(descriptions[0], false, Selector.DESCRIPTION);
    }

    // ===== BUILT-IN SELECTORS =====

    @Benchmark
    public void parseByName(Blackhole bh) throws Exception {
        for (var name : names) {
            bh.consume(statuses.parse(name));
        }
    }

    @Benchmark
    public void parseByNameIgnoringCase(Blackhole bh) throws Exception {
        for (var name : upperNames) {
            bh.consume(statuses.parse(name, true));
        }
    }

    @Benchmark
    public void parseDecimal(Blackhole bh) throws Exception {
        for (var text : decimals) {
            bh.consume(statuses.parse(text));
        }
    }

    @Benchmark
    public void parseByDescription(Blackhole bh) throws Exception {
        for (var text : descriptions) {
            bh.consume(statuses.parse(text, false, Selector.DESCRIPTION));
        }
    }

    // ===== FAILURES =====

    @Benchmark
    public void tryParseMiss(Blackhole bh) {
        bh.consume(statuses.tryParse("NoSuchStatus", false));
    }
}
