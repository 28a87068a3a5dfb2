/*
 * Copyright (c) 2025 Aegis Policy Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.aegis.policyengine.api;

import com.aegis.policyengine.api.model.ConstraintSet;
import com.aegis.policyengine.api.model.EligibilityReport;

/**
 * Contract for turning constraint sets into specialized evaluators.
 */
public interface IPolicyCompiler {

    /**
     * Decides whether {@code constraintSet} can be compiled. Pure.
     */
    EligibilityReport analyze(ConstraintSet constraintSet);

    /**
     * Compiles an eligible constraint set into an inlined evaluator.
     *
     * @throws com.aegis.policyengine.api.exceptions.PolicyNotCompilableException if the set is ineligible
     * @throws com.aegis.policyengine.api.exceptions.CompilationException if code generation fails
     */
    ICompiledEvaluator compile(ConstraintSet constraintSet);

    /**
     * Compiles an evaluator that re-checks the registry version on every call and delegates
     * to {@code fallback} once the registry has moved on.
     */
    ICompiledEvaluator compileGuarded(ConstraintSet constraintSet, IPolicyInterpreter fallback);

    /**
     * Sets a compilation listener for tracking compilation progress.
     *
     * @param listener the compilation listener (null to disable)
     */
    default void setCompilationListener(CompilationListener listener) {
    }
}
