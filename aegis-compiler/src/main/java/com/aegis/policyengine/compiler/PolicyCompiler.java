/*
 * Copyright (c) 2025 Aegis Policy Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.aegis.policyengine.compiler;

import com.aegis.policyengine.api.CompilationListener;
import com.aegis.policyengine.api.ICompiledEvaluator;
import com.aegis.policyengine.api.IOperatorRegistry;
import com.aegis.policyengine.api.IPolicyCompiler;
import com.aegis.policyengine.api.IPolicyInterpreter;
import com.aegis.policyengine.api.exceptions.CompilationException;
import com.aegis.policyengine.api.exceptions.PolicyNotCompilableException;
import com.aegis.policyengine.api.model.ConstraintSet;
import com.aegis.policyengine.api.model.EligibilityReport;
import com.aegis.policyengine.api.model.PathConstraints;
import com.aegis.policyengine.api.model.PolicyClause;
import com.aegis.policyengine.api.model.Quantifier;
import com.aegis.policyengine.compiler.codegen.CodeFragment;
import com.aegis.policyengine.compiler.codegen.ConstraintCheckFactory;
import com.aegis.policyengine.compiler.codegen.PatternCache;
import com.aegis.policyengine.compiler.codegen.QuantifierCompiler;
import com.aegis.policyengine.compiler.codegen.ScalarPathCompiler;
import com.aegis.policyengine.compiler.runtime.CompiledPolicy;
import com.aegis.policyengine.compiler.runtime.GuardedEvaluator;
import com.aegis.policyengine.compiler.template.TemplateExtractor;
import com.aegis.policyengine.compiler.template.Templates;
import com.aegis.policyengine.infra.metrics.MetricsRegistry;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Compiles constraint sets into {@link CompiledPolicy} evaluators.
 *
 * <p>Pipeline: eligibility analysis, template extraction, then code generation of one
 * fragment per clause. The registry version is read once, before analysis, and stamped on the
 * result. Compilation is synchronous and runs on the calling thread; a compiler instance may
 * be shared between threads.
 */
public class PolicyCompiler implements IPolicyCompiler {

    private static final Logger logger = Logger.getLogger(PolicyCompiler.class.getName());

    private final IOperatorRegistry registry;
    private final EligibilityAnalyzer analyzer;
    private final TemplateExtractor templateExtractor;
    private final ScalarPathCompiler scalarPathCompiler;
    private final QuantifierCompiler quantifierCompiler;
    private final PatternCache patternCache;
    private final Tracer tracer;
    private final MetricsRegistry metrics;
    private volatile CompilationListener listener;

    public PolicyCompiler(IOperatorRegistry registry) {
        this(registry, CompilerConfig.defaults(), OpenTelemetry.noop().getTracer("aegis-compiler"),
                MetricsRegistry.getInstance());
    }

    public PolicyCompiler(IOperatorRegistry registry, CompilerConfig config, Tracer tracer, MetricsRegistry metrics) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.analyzer = EligibilityAnalyzer.forConfig(config);
        this.templateExtractor = new TemplateExtractor();
        this.patternCache = new PatternCache(config.patternCacheSize());
        ConstraintCheckFactory checkFactory = new ConstraintCheckFactory(patternCache);
        this.scalarPathCompiler = new ScalarPathCompiler(checkFactory);
        this.quantifierCompiler = new QuantifierCompiler(checkFactory);
        this.tracer = tracer;
        this.metrics = metrics;
    }

    @Override
    public EligibilityReport analyze(ConstraintSet constraintSet) {
        return analyzer.analyze(constraintSet);
    }

    @Override
    public CompiledPolicy compile(ConstraintSet constraintSet) {
        Objects.requireNonNull(constraintSet, "constraintSet must not be null");
        Span span = tracer.spanBuilder("compile-policy").startSpan();
        try (Scope scope = span.makeCurrent()) {
            long startTime = System.nanoTime();
            long version = registry.currentVersion();
            span.setAttribute("clauseCount", constraintSet.size());
            span.setAttribute("registryVersion", version);

            runStage(CompilationListener.ANALYSIS, 1, () -> {
                EligibilityReport report = analyzer.analyze(constraintSet);
                if (!report.eligible()) {
                    metrics.counter("policy_compilation_failures", "reason", "ineligible").increment();
                    throw new PolicyNotCompilableException(report);
                }
                return report;
            }, report -> Map.of("eligible", report.eligible()));

            Templates templates = runStage(CompilationListener.TEMPLATE_EXTRACTION, 2,
                    () -> templateExtractor.extract(constraintSet),
                    t -> Map.of("pathCount", t.info().pathCount(), "totalConstraints", t.info().totalConstraints()));

            List<CodeFragment> fragments = runStage(CompilationListener.CODE_GENERATION, 3, () -> {
                List<PolicyClause> clauses = constraintSet.clauses();
                List<CodeFragment> generated = new ArrayList<>(clauses.size());
                for (int i = 0; i < clauses.size(); i++) {
                    generated.add(generate(clauses.get(i), templates, i));
                }
                return generated;
            }, generated -> Map.of("fragmentCount", generated.size()));

            CompiledPolicy policy = new CompiledPolicy(fragments, constraintSet, version, templates.info());
            long compilationTime = System.nanoTime() - startTime;
            metrics.timer("policy_compilation").recordNanos(compilationTime);
            metrics.gauge("policy_pattern_cache_size").set(patternCache.estimatedSize());
            metrics.gauge("policy_pattern_cache_hit_rate").set(patternCache.stats().hitRate());
            span.setAttribute("fragmentCount", policy.fragmentCount());
            span.setAttribute("compilationTimeMicros", compilationTime / 1_000);

            if (logger.isLoggable(Level.FINE)) {
                logger.fine(String.format("Compiled %d clause(s) at registry version %d in %d us: %s",
                        constraintSet.size(), version, compilationTime / 1_000, policy.templateInfo().paths()));
            }
            return policy;
        } catch (RuntimeException e) {
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    @Override
    public ICompiledEvaluator compileGuarded(ConstraintSet constraintSet, IPolicyInterpreter fallback) {
        Objects.requireNonNull(fallback, "fallback must not be null");
        return new GuardedEvaluator(compile(constraintSet), registry, fallback);
    }

    @Override
    public void setCompilationListener(CompilationListener listener) {
        this.listener = listener;
    }

    public EligibilityAnalyzer getAnalyzer() {
        return analyzer;
    }

    private CodeFragment generate(PolicyClause clause, Templates templates, int clauseIndex) {
        if (clause instanceof PathConstraints scalar) {
            return scalarPathCompiler.compile(scalar.path(), scalar.constraints(), templates.forClause(clauseIndex));
        }
        if (clause instanceof Quantifier quantifier) {
            if (!analyzer.supportsQuantifiers()) {
                throw new CompilationException("Quantifier compilation is disabled: " + quantifier.collectionPath());
            }
            return quantifierCompiler.compile(quantifier, templates.forClause(clauseIndex));
        }
        throw new CompilationException("Unsupported clause type: " + clause.getClass().getName());
    }

    private <T> T runStage(String stageName, int stageNumber, Supplier<T> body,
                           Function<T, Map<String, Object>> stageMetrics) {
        CompilationListener current = listener;
        if (current != null) {
            current.onStageStart(stageName, stageNumber, CompilationListener.TOTAL_STAGES);
        }
        Span span = tracer.spanBuilder(stageName.toLowerCase().replace('_', '-')).startSpan();
        long start = System.nanoTime();
        try (Scope scope = span.makeCurrent()) {
            T result = body.get();
            if (current != null) {
                current.onStageComplete(stageName, new CompilationListener.StageResult(
                        stageName, System.nanoTime() - start, stageMetrics.apply(result)));
            }
            return result;
        } catch (RuntimeException e) {
            span.recordException(e);
            if (current != null) {
                current.onError(stageName, e);
            }
            throw e;
        } finally {
            span.end();
        }
    }
}
