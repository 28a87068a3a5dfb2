/*
 * Copyright (c) 2025 Aegis Policy Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.aegis.policyengine.api;

import com.aegis.policyengine.api.model.ConstraintSet;
import com.aegis.policyengine.api.model.Document;
import com.aegis.policyengine.api.model.Residual;

/**
 * Generic tree-walking evaluator used for constraint sets that cannot be compiled, and as
 * the fallback of guarded evaluators. Produces residuals of the same shape as compiled code.
 */
@FunctionalInterface
public interface IPolicyInterpreter {

    Residual interpret(ConstraintSet constraintSet, Document document);
}
