package com.aegis.policyengine.infra.metrics.impl.inmemory;

import com.aegis.policyengine.infra.metrics.Counter;
import com.aegis.policyengine.infra.metrics.Gauge;
import com.aegis.policyengine.infra.metrics.MetricsRegistry;
import com.aegis.policyengine.infra.metrics.Timer;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.LongAdder;

/**
 * In-memory metrics registry for tests and embedded use. Tags are ignored; instruments are
 * keyed by name only.
 *
 * <pre>{@code
 * InMemoryMetricsRegistry metrics = new InMemoryMetricsRegistry();
 * CompiledEvaluatorCache cache = new CompiledEvaluatorCache(compiler, registry, config, metrics, tracer);
 * cache.getOrCompile(set);
 * assertThat(metrics.getCounterValue("compiled_evaluator_cache_misses")).isEqualTo(1L);
 * }</pre>
 */
public final class InMemoryMetricsRegistry implements MetricsRegistry {

    private final Map<String, InMemoryCounter> counters = new ConcurrentHashMap<>();
    private final Map<String, InMemoryGauge> gauges = new ConcurrentHashMap<>();
    private final Map<String, InMemoryTimer> timers = new ConcurrentHashMap<>();

    @Override
    public Counter counter(String name, String... tags) {
        return counters.computeIfAbsent(name, n -> new InMemoryCounter());
    }

    @Override
    public Gauge gauge(String name, String... tags) {
        return gauges.computeIfAbsent(name, n -> new InMemoryGauge());
    }

    @Override
    public Timer timer(String name, String... tags) {
        return timers.computeIfAbsent(name, n -> new InMemoryTimer());
    }

    // Test helper methods

    public long getCounterValue(String name) {
        InMemoryCounter counter = counters.get(name);
        return counter != null ? counter.count() : 0L;
    }

    public double getGaugeValue(String name) {
        InMemoryGauge gauge = gauges.get(name);
        return gauge != null ? gauge.value() : 0.0;
    }

    public List<Duration> getTimerRecordings(String name) {
        InMemoryTimer timer = timers.get(name);
        return timer != null ? Collections.unmodifiableList(new ArrayList<>(timer.recordings)) : List.of();
    }

    public void reset() {
        counters.clear();
        gauges.clear();
        timers.clear();
    }

    private static final class InMemoryCounter implements Counter {
        private final LongAdder count = new LongAdder();

        @Override
        public void increment() {
            count.increment();
        }

        @Override
        public void increment(long amount) {
            if (amount < 0) {
                throw new IllegalArgumentException("Counter increment must be non-negative: " + amount);
            }
            count.add(amount);
        }

        @Override
        public long count() {
            return count.sum();
        }
    }

    private static final class InMemoryGauge implements Gauge {
        private final AtomicLong bits = new AtomicLong(Double.doubleToLongBits(0.0));

        @Override
        public void set(double value) {
            bits.set(Double.doubleToLongBits(value));
        }

        @Override
        public double value() {
            return Double.longBitsToDouble(bits.get());
        }
    }

    private static final class InMemoryTimer implements Timer {
        private final List<Duration> recordings = new CopyOnWriteArrayList<>();

        @Override
        public <T> T record(Callable<T> callable) throws Exception {
            long start = System.nanoTime();
            try {
                return callable.call();
            } finally {
                recordings.add(Duration.ofNanos(System.nanoTime() - start));
            }
        }

        @Override
        public void record(Duration duration) {
            if (duration.isNegative()) {
                throw new IllegalArgumentException("Cannot record negative duration: " + duration);
            }
            recordings.add(duration);
        }
    }
}
