/*
 * Copyright (c) 2025 Aegis Policy Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.aegis.policyengine.runtime.evaluation;

import com.aegis.policyengine.api.ICompiledEvaluator;
import com.aegis.policyengine.api.IPolicyCompiler;
import com.aegis.policyengine.api.IPolicyInterpreter;
import com.aegis.policyengine.api.model.CompilationTier;
import com.aegis.policyengine.api.model.ConstraintSet;
import com.aegis.policyengine.api.model.Document;
import com.aegis.policyengine.api.model.EligibilityReport;
import com.aegis.policyengine.cache.CompiledEvaluatorCache;

import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Single entry point for evaluating a constraint set against a document.
 *
 * <p>Eligible sets are served by the compiled-evaluator cache. Ineligible sets (custom
 * operators, or quantifiers when quantifier compilation is off) go to the interpreter and
 * are reported as {@link CompilationTier#INTERPRETED}. Both paths return residuals of the
 * same shape.
 */
public class TieredPolicyEvaluator {

    private static final Logger logger = Logger.getLogger(TieredPolicyEvaluator.class.getName());

    private final CompiledEvaluatorCache cache;
    private final IPolicyCompiler compiler;
    private final IPolicyInterpreter interpreter;

    public TieredPolicyEvaluator(CompiledEvaluatorCache cache, IPolicyCompiler compiler,
                                 IPolicyInterpreter interpreter) {
        this.cache = Objects.requireNonNull(cache, "cache must not be null");
        this.compiler = Objects.requireNonNull(compiler, "compiler must not be null");
        this.interpreter = Objects.requireNonNull(interpreter, "interpreter must not be null");
    }

    public Evaluation evaluate(ConstraintSet constraintSet, Document document) {
        if (!cache.contains(constraintSet)) {
            EligibilityReport report = compiler.analyze(constraintSet);
            if (!report.eligible()) {
                if (logger.isLoggable(Level.FINE)) {
                    logger.fine("Interpreting ineligible constraint set: " + report.reasons());
                }
                return new Evaluation(interpreter.interpret(constraintSet, document), CompilationTier.INTERPRETED);
            }
        }
        ICompiledEvaluator evaluator = cache.getOrCompile(constraintSet);
        return new Evaluation(evaluator.evaluate(document), evaluator.tier());
    }

    public Evaluation evaluate(ConstraintSet constraintSet, Map<String, ?> document) {
        return evaluate(constraintSet, Document.of(document));
    }

    public CompiledEvaluatorCache cache() {
        return cache;
    }
}
