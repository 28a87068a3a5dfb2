/*
 * Copyright (c) 2025 Aegis Policy Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.aegis.policyengine.api;

import com.aegis.policyengine.api.model.CompilationTier;
import com.aegis.policyengine.api.model.Document;
import com.aegis.policyengine.api.model.Residual;

import java.util.Map;

/**
 * Executable evaluator specialized for one constraint set.
 *
 * <p>Implementations are immutable and safe to call from any number of threads. Evaluation
 * never throws for well-formed documents: missing data yields {@link Residual.Open} and
 * violating data yields {@link Residual.Conflict}.
 */
public interface ICompiledEvaluator {

    Residual evaluate(Document document);

    default Residual evaluate(Map<String, ?> document) {
        return evaluate(Document.of(document));
    }

    CompilationTier tier();

    /**
     * The operator registry version this evaluator was compiled against.
     */
    long registryVersion();
}
