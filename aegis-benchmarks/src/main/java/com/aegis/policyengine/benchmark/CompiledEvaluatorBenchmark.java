package com.aegis.policyengine.benchmark;

import com.aegis.policyengine.api.ICompiledEvaluator;
import com.aegis.policyengine.api.model.Constraint;
import com.aegis.policyengine.api.model.ConstraintSet;
import com.aegis.policyengine.api.model.Document;
import com.aegis.policyengine.api.model.ElementConstraint;
import com.aegis.policyengine.cache.CacheConfig;
import com.aegis.policyengine.cache.CompiledEvaluatorCache;
import com.aegis.policyengine.compiler.CompilerConfig;
import com.aegis.policyengine.compiler.PolicyCompiler;
import com.aegis.policyengine.infra.metrics.MetricsRegistry;
import com.aegis.policyengine.infra.registry.InMemoryOperatorRegistry;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Tracer;
import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.BenchmarkMode;
import org.openjdk.jmh.annotations.Fork;
import org.openjdk.jmh.annotations.Level;
import org.openjdk.jmh.annotations.Measurement;
import org.openjdk.jmh.annotations.Mode;
import org.openjdk.jmh.annotations.OutputTimeUnit;
import org.openjdk.jmh.annotations.Param;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;
import org.openjdk.jmh.annotations.Warmup;
import org.openjdk.jmh.infra.Blackhole;
import org.openjdk.jmh.runner.Runner;
import org.openjdk.jmh.runner.RunnerException;
import org.openjdk.jmh.runner.options.Options;
import org.openjdk.jmh.runner.options.OptionsBuilder;
import org.openjdk.jmh.runner.options.TimeValue;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Evaluation cost of compiled policies, cache lookup cost, and cold compilation cost.
 * <p>
 * USAGE:
 * mvn clean package -pl aegis-benchmarks -am -DskipTests
 * java -cp aegis-benchmarks/target/classes:... com.aegis.policyengine.benchmark.CompiledEvaluatorBenchmark
 * <p>
 * CONFIGURATION:
 * -Dbench.quick : fewer, shorter iterations
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.NANOSECONDS)
@State(Scope.Benchmark)
@Fork(value = 1, jvmArgs = {"-Xms1g", "-Xmx1g"})
@Warmup(iterations = 5, time = 1)
@Measurement(iterations = 10, time = 2)
public class CompiledEvaluatorBenchmark {

    private static final boolean QUICK_MODE = Boolean.getBoolean("bench.quick");

    @Param({"4", "16", "64"})
    private int pathCount;

    private ConstraintSet constraintSet;
    private ICompiledEvaluator evaluator;
    private CompiledEvaluatorCache cache;
    private PolicyCompiler compiler;

    private Document satisfying;
    private Document conflicting;
    private Document partial;

    @Setup(Level.Trial)
    public void setup() {
        InMemoryOperatorRegistry registry = new InMemoryOperatorRegistry();
        Tracer tracer = OpenTelemetry.noop().getTracer("benchmark");
        compiler = new PolicyCompiler(registry, CompilerConfig.builder().quantifierCompilation(true).build(),
                tracer, MetricsRegistry.noop());
        cache = new CompiledEvaluatorCache(compiler, registry, CacheConfig.defaults(), MetricsRegistry.noop(), tracer);

        ConstraintSet.Builder builder = ConstraintSet.builder();
        Map<String, Object> good = new HashMap<>();
        for (int i = 0; i < pathCount; i++) {
            String field = "field" + i;
            switch (i % 4) {
                case 0 -> {
                    builder.require(field, Constraint.eq("value-" + i));
                    good.put(field, "value-" + i);
                }
                case 1 -> {
                    builder.require(field, Constraint.gte(10), Constraint.lt(1_000));
                    good.put(field, 500);
                }
                case 2 -> {
                    builder.require(field, Constraint.in("red", "green", "blue"));
                    good.put(field, "green");
                }
                default -> {
                    builder.require(field, Constraint.matches("[a-z]+-\\d+"));
                    good.put(field, "item-" + i);
                }
            }
        }
        builder.forall("items", ElementConstraint.of("qty", Constraint.lte(5)));
        List<Map<String, Object>> items = new ArrayList<>();
        for (int i = 0; i < 8; i++) {
            items.add(Map.of("qty", i % 5));
        }
        good.put("items", items);
        constraintSet = builder.build();

        Map<String, Object> bad = new HashMap<>(good);
        bad.put("field" + (pathCount - 1), 1);
        Map<String, Object> missing = new HashMap<>(good);
        missing.remove("field" + (pathCount / 2));

        satisfying = Document.of(good);
        conflicting = Document.of(bad);
        partial = Document.of(missing);
        evaluator = cache.getOrCompile(constraintSet);
    }

    @Benchmark
    public void evaluateSatisfied(Blackhole bh) {
        bh.consume(evaluator.evaluate(satisfying));
    }

    @Benchmark
    public void evaluateConflict(Blackhole bh) {
        bh.consume(evaluator.evaluate(conflicting));
    }

    @Benchmark
    public void evaluateOpen(Blackhole bh) {
        bh.consume(evaluator.evaluate(partial));
    }

    @Benchmark
    public void cacheHit(Blackhole bh) {
        bh.consume(cache.getOrCompile(constraintSet));
    }

    @Benchmark
    public void compileCold(Blackhole bh) {
        bh.consume(compiler.compile(constraintSet));
    }

    public static void main(String[] args) throws RunnerException {
        Options options = new OptionsBuilder()
                .include(CompiledEvaluatorBenchmark.class.getSimpleName())
                .warmupIterations(QUICK_MODE ? 2 : 5)
                .warmupTime(TimeValue.seconds(1))
                .measurementIterations(QUICK_MODE ? 3 : 10)
                .measurementTime(TimeValue.seconds(QUICK_MODE ? 1 : 2))
                .shouldFailOnError(true)
                .build();
        new Runner(options).run();
    }
}
