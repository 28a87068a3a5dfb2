package com.aegis.policyengine.infra.metrics.impl.prometheus;

import com.aegis.policyengine.infra.metrics.Counter;
import com.aegis.policyengine.infra.metrics.Gauge;
import com.aegis.policyengine.infra.metrics.MetricsRegistry;
import com.aegis.policyengine.infra.metrics.Timer;
import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.Histogram;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Prometheus simpleclient implementation of {@link MetricsRegistry}.
 *
 * <p>Timers are exported as histograms named {@code <name>_seconds} with buckets tuned for
 * sub-millisecond compilation and lookup latencies. Tags are alternating label names and
 * values; the first registration of a name fixes its label names.
 */
public final class PrometheusMetricsRegistry implements MetricsRegistry {

    private static final double[] LATENCY_BUCKETS = {
            0.00001, 0.00005, 0.0001, 0.0005, 0.001, 0.005, 0.01, 0.05, 0.1, 0.5
    };

    private final CollectorRegistry registry;
    private final Map<String, io.prometheus.client.Counter> counters = new ConcurrentHashMap<>();
    private final Map<String, io.prometheus.client.Gauge> gauges = new ConcurrentHashMap<>();
    private final Map<String, Histogram> histograms = new ConcurrentHashMap<>();

    public PrometheusMetricsRegistry() {
        this(CollectorRegistry.defaultRegistry);
    }

    public PrometheusMetricsRegistry(CollectorRegistry registry) {
        this.registry = registry;
    }

    @Override
    public Counter counter(String name, String... tags) {
        io.prometheus.client.Counter counter = counters.computeIfAbsent(name, n ->
                io.prometheus.client.Counter.build()
                        .name(sanitizeName(n))
                        .help("Counter " + n)
                        .labelNames(labelNames(tags))
                        .register(registry));
        return new CounterAdapter(counter.labels(labelValues(tags)));
    }

    @Override
    public Gauge gauge(String name, String... tags) {
        io.prometheus.client.Gauge gauge = gauges.computeIfAbsent(name, n ->
                io.prometheus.client.Gauge.build()
                        .name(sanitizeName(n))
                        .help("Gauge " + n)
                        .labelNames(labelNames(tags))
                        .register(registry));
        return new GaugeAdapter(gauge.labels(labelValues(tags)));
    }

    @Override
    public Timer timer(String name, String... tags) {
        Histogram histogram = histograms.computeIfAbsent(name, n ->
                Histogram.build()
                        .name(sanitizeName(n) + "_seconds")
                        .help("Latency of " + n)
                        .buckets(LATENCY_BUCKETS)
                        .labelNames(labelNames(tags))
                        .register(registry));
        return new TimerAdapter(histogram.labels(labelValues(tags)));
    }

    static String sanitizeName(String name) {
        return name.toLowerCase()
                .replaceAll("[^a-z0-9_:]", "_")
                .replaceAll("_{2,}", "_");
    }

    private static String[] labelNames(String[] tags) {
        requireEven(tags);
        String[] labels = new String[tags.length / 2];
        for (int i = 0; i < labels.length; i++) {
            labels[i] = tags[i * 2];
        }
        return labels;
    }

    private static String[] labelValues(String[] tags) {
        requireEven(tags);
        String[] values = new String[tags.length / 2];
        for (int i = 0; i < values.length; i++) {
            values[i] = tags[i * 2 + 1];
        }
        return values;
    }

    private static void requireEven(String[] tags) {
        if (tags.length % 2 != 0) {
            throw new IllegalArgumentException("Tags must be key-value pairs, got " + tags.length + " elements");
        }
    }

    private record CounterAdapter(io.prometheus.client.Counter.Child child) implements Counter {
        @Override
        public void increment() {
            child.inc();
        }

        @Override
        public void increment(long amount) {
            child.inc(amount);
        }

        @Override
        public long count() {
            return (long) child.get();
        }
    }

    private record GaugeAdapter(io.prometheus.client.Gauge.Child child) implements Gauge {
        @Override
        public void set(double value) {
            child.set(value);
        }

        @Override
        public double value() {
            return child.get();
        }
    }

    private record TimerAdapter(Histogram.Child child) implements Timer {
        @Override
        public <T> T record(Callable<T> callable) throws Exception {
            Histogram.Timer timer = child.startTimer();
            try {
                return callable.call();
            } finally {
                timer.observeDuration();
            }
        }

        @Override
        public void record(Duration duration) {
            if (duration.isNegative()) {
                throw new IllegalArgumentException("Duration cannot be negative: " + duration);
            }
            child.observe(duration.toNanos() / 1_000_000_000.0);
        }
    }
}
