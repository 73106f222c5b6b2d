package com.enumerant.benchmark;

import com.enumerant.core.ValueSet;
import com.enumerant.ops.FlagOperations;
import com.enumerant.types.IntegralType;
import org.openjdk.jmh.annotations.*;
import org.openjdk.jmh.infra.Blackhole;

import java.util.concurrent.TimeUnit;

/**
 * Benchmarks for flag decomposition, formatting and parsing on a 32-flag domain.
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.NANOSECONDS)
@State(Scope.Benchmark)
@Warmup(iterations = 5, time = 1, timeUnit = TimeUnit.SECONDS)
@Measurement(iterations = 10, time = 1, timeUnit = TimeUnit.SECONDS)
@Fork(1)
public class FlagBenchmark {

    private ValueSet<Integer> permissions;
    private FlagOperations<Integer> flags;
    private int sparse;
    private int dense;
    private String denseText;

    @Setup
    public void setup() throws Exception {
        var builder = ValueSet.builder("Permission", IntegralType.INT32).flags();
        for (int bit = 0; bit < 32; bit++) {
            builder.member("P" + bit, 1 << bit);
        }
        permissions = builder.build();
        flags = permissions.flags();
        sparse = (1 << 3) | (1 << 17);
        dense = 0x0F0F0F0F;
        denseText = flags.formatFlags(dense);
    }

    @Benchmark
    public void getFlagsSparse(Blackhole bh) throws Exception {
        for (var flag : flags.getFlags(sparse)) {
            bh.consume(flag);
        }
    }

    @Benchmark
    public void getFlagsDense(Blackhole bh) throws Exception {
        for (var flag : flags.getFlags(dense)) {
            bh.consume(flag);
        }
    }

    @Benchmark
    public void hasAnyFlags(Blackhole bh) throws Exception {
        bh.consume(flags.hasAnyFlags(dense, sparse));
    }

    @Benchmark
    public void isDefined(Blackhole bh) {
        bh.consume(permissions.isDefined(1 << 12));
    }

    @Benchmark
    public void formatFlagsDense(Blackhole bh) throws Exception {
        bh.consume(flags.formatFlags(dense));
    }

    @Benchmark
    public void parseFlagsDense(Blackhole bh) throws Exception {
        bh.consume(flags.parseFlags(denseText, false));
    }
}
