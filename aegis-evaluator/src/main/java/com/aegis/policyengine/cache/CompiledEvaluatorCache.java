/*
 * Copyright (c) 2025 Aegis Policy Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.aegis.policyengine.cache;

import com.aegis.policyengine.api.ICompiledEvaluator;
import com.aegis.policyengine.api.IOperatorRegistry;
import com.aegis.policyengine.api.IPolicyCompiler;
import com.aegis.policyengine.api.exceptions.PolicyNotCompilableException;
import com.aegis.policyengine.api.model.CacheStats;
import com.aegis.policyengine.api.model.ConstraintSet;
import com.aegis.policyengine.api.model.EligibilityReport;
import com.aegis.policyengine.infra.metrics.Counter;
import com.aegis.policyengine.infra.metrics.Gauge;
import com.aegis.policyengine.infra.metrics.MetricsRegistry;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Bounded LRU cache of compiled evaluators keyed by {@link PolicySignature}.
 *
 * <p>Lookup, insertion and eviction happen under a single lock; analysis and compilation run
 * outside it, on the calling thread. Two threads missing on the same signature may both
 * compile; the first insertion wins and both callers receive that instance.
 *
 * <p>The registry version is part of the key, so bumping the operator registry makes every
 * later lookup miss. Entries compiled against older versions are never served again and age
 * out through LRU eviction.
 *
 * <h2>Metrics</h2>
 * <ul>
 *   <li>compiled_evaluator_cache_hits / compiled_evaluator_cache_misses</li>
 *   <li>compiled_evaluator_cache_evictions</li>
 *   <li>compiled_evaluator_cache_size (gauge)</li>
 * </ul>
 */
public class CompiledEvaluatorCache {

    private static final Logger logger = Logger.getLogger(CompiledEvaluatorCache.class.getName());

    private final IPolicyCompiler compiler;
    private final IOperatorRegistry registry;
    private final int capacity;
    private final Tracer tracer;

    private final ReentrantLock lock = new ReentrantLock();
    private final LinkedHashMap<PolicySignature, ICompiledEvaluator> entries;

    // guarded by lock
    private long hits;
    private long misses;
    private long evictions;

    private final Counter hitCounter;
    private final Counter missCounter;
    private final Counter evictionCounter;
    private final Gauge sizeGauge;

    public CompiledEvaluatorCache(IPolicyCompiler compiler, IOperatorRegistry registry) {
        this(compiler, registry, CacheConfig.defaults(), MetricsRegistry.getInstance(),
                OpenTelemetry.noop().getTracer("aegis-cache"));
    }

    public CompiledEvaluatorCache(IPolicyCompiler compiler, IOperatorRegistry registry, CacheConfig config,
                                  MetricsRegistry metrics, Tracer tracer) {
        this.compiler = Objects.requireNonNull(compiler, "compiler must not be null");
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.capacity = config.capacity();
        this.tracer = tracer;

        MetricsRegistry effective = config.recordMetrics() ? metrics : MetricsRegistry.noop();
        this.hitCounter = effective.counter("compiled_evaluator_cache_hits");
        this.missCounter = effective.counter("compiled_evaluator_cache_misses");
        this.evictionCounter = effective.counter("compiled_evaluator_cache_evictions");
        this.sizeGauge = effective.gauge("compiled_evaluator_cache_size");

        this.entries = new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<PolicySignature, ICompiledEvaluator> eldest) {
                if (size() > capacity) {
                    evictions++;
                    evictionCounter.increment();
                    if (logger.isLoggable(Level.FINE)) {
                        logger.fine("Evicted LRU evaluator: " + eldest.getKey());
                    }
                    return true;
                }
                return false;
            }
        };

        logger.info(String.format("CompiledEvaluatorCache initialized: capacity=%d, metrics=%s",
                capacity, config.recordMetrics() ? "enabled" : "disabled"));
    }

    /**
     * Returns the cached evaluator for {@code constraintSet} at the current registry version,
     * compiling and caching it on a miss.
     *
     * @throws PolicyNotCompilableException if the set fails eligibility analysis; nothing is
     *                                      cached and the compiler is not invoked
     */
    public ICompiledEvaluator getOrCompile(ConstraintSet constraintSet) {
        PolicySignature signature = PolicySignature.of(constraintSet, registry.currentVersion());

        lock.lock();
        try {
            ICompiledEvaluator cached = entries.get(signature);
            if (cached != null) {
                hits++;
                hitCounter.increment();
                return cached;
            }
        } finally {
            lock.unlock();
        }

        EligibilityReport report = compiler.analyze(constraintSet);
        if (!report.eligible()) {
            lock.lock();
            try {
                misses++;
                missCounter.increment();
            } finally {
                lock.unlock();
            }
            throw new PolicyNotCompilableException(report);
        }

        ICompiledEvaluator compiled = compiler.compile(constraintSet);
        PolicySignature key = compiled.registryVersion() == signature.registryVersion()
                ? signature
                : PolicySignature.of(constraintSet, compiled.registryVersion());

        lock.lock();
        try {
            misses++;
            missCounter.increment();
            ICompiledEvaluator existing = entries.get(key);
            if (existing != null) {
                return existing;
            }
            entries.put(key, compiled);
            sizeGauge.set(entries.size());
            return compiled;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Compiles every set that is not cached yet.
     *
     * @throws PolicyNotCompilableException for the first ineligible set; sets before it stay cached
     */
    public void warm(Collection<ConstraintSet> constraintSets) {
        Span span = tracer.spanBuilder("warm-cache").startSpan();
        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("setCount", constraintSets.size());
            long start = System.nanoTime();
            for (ConstraintSet constraintSet : constraintSets) {
                getOrCompile(constraintSet);
            }
            long elapsedMicros = (System.nanoTime() - start) / 1_000;
            span.setAttribute("cacheSize", size());
            logger.info(String.format("Warmed evaluator cache with %d constraint set(s) in %d us, size=%d",
                    constraintSets.size(), elapsedMicros, size()));
        } catch (PolicyNotCompilableException e) {
            span.recordException(e);
            span.setStatus(StatusCode.ERROR, "ineligible constraint set");
            logger.warning("Cache warm-up aborted: " + e.getMessage());
            throw e;
        } finally {
            span.end();
        }
    }

    public CacheStats stats() {
        lock.lock();
        try {
            return CacheStats.of(hits, misses, entries.size());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Drops every entry and resets the hit and miss counters.
     */
    public void clear() {
        int removed;
        lock.lock();
        try {
            removed = entries.size();
            entries.clear();
            hits = 0;
            misses = 0;
            evictions = 0;
            sizeGauge.set(0);
        } finally {
            lock.unlock();
        }
        logger.info("Evaluator cache cleared: " + removed + " entries removed");
    }

    public int size() {
        lock.lock();
        try {
            return entries.size();
        } finally {
            lock.unlock();
        }
    }

    public int capacity() {
        return capacity;
    }

    /**
     * Evictions since construction or the last {@link #clear()}.
     */
    public long evictions() {
        lock.lock();
        try {
            return evictions;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Whether an evaluator for {@code constraintSet} at the current registry version is
     * cached. Does not count as a use.
     */
    public boolean contains(ConstraintSet constraintSet) {
        PolicySignature signature = PolicySignature.of(constraintSet, registry.currentVersion());
        lock.lock();
        try {
            return entries.containsKey(signature);
        } finally {
            lock.unlock();
        }
    }
}
