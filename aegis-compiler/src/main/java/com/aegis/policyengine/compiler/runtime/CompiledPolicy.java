/*
 * Copyright (c) 2025 Aegis Policy Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.aegis.policyengine.compiler.runtime;

import com.aegis.policyengine.api.ICompiledEvaluator;
import com.aegis.policyengine.api.model.CompilationTier;
import com.aegis.policyengine.api.model.ConstraintSet;
import com.aegis.policyengine.api.model.Document;
import com.aegis.policyengine.api.model.Residual;
import com.aegis.policyengine.compiler.codegen.CodeFragment;
import com.aegis.policyengine.compiler.template.TemplateInfo;

import java.util.List;

/**
 * Inlined evaluator: the fragments of every clause, run in declaration order until one of
 * them short-circuits.
 *
 * <p>Immutable after construction. Evaluation allocates nothing except the Conflict residual
 * that carries a witness.
 */
public final class CompiledPolicy implements ICompiledEvaluator {

    private final CodeFragment[] fragments;
    private final ConstraintSet constraintSet;
    private final long registryVersion;
    private final TemplateInfo templateInfo;

    public CompiledPolicy(List<CodeFragment> fragments, ConstraintSet constraintSet,
                          long registryVersion, TemplateInfo templateInfo) {
        this.fragments = fragments.toArray(new CodeFragment[0]);
        this.constraintSet = constraintSet;
        this.registryVersion = registryVersion;
        this.templateInfo = templateInfo;
    }

    @Override
    public Residual evaluate(Document document) {
        for (CodeFragment fragment : fragments) {
            Residual residual = fragment.execute(document);
            if (residual != Residual.satisfied()) {
                return residual;
            }
        }
        return Residual.satisfied();
    }

    @Override
    public CompilationTier tier() {
        return CompilationTier.INLINED;
    }

    @Override
    public long registryVersion() {
        return registryVersion;
    }

    public ConstraintSet constraintSet() {
        return constraintSet;
    }

    public TemplateInfo templateInfo() {
        return templateInfo;
    }

    public int fragmentCount() {
        return fragments.length;
    }

    @Override
    public String toString() {
        return String.format("CompiledPolicy{fragments=%d, registryVersion=%d, paths=%s}",
                fragments.length, registryVersion, templateInfo.paths());
    }
}
