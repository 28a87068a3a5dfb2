/*
 * Copyright (c) 2025 Aegis Policy Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.aegis.policyengine.api.model;

/**
 * How an evaluator was produced.
 */
public enum CompilationTier {
    /** Evaluated by the generic interpreter; no compiled artifact exists. */
    INTERPRETED,
    /** Compiled, but re-checks the operator registry version on every call. */
    GUARDED,
    /** Fully specialized for one constraint set and registry version. */
    INLINED
}
