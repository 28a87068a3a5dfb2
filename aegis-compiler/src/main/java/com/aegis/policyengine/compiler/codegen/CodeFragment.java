/*
 * Copyright (c) 2025 Aegis Policy Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.aegis.policyengine.compiler.codegen;

import com.aegis.policyengine.api.model.Residual;

/**
 * Compiled form of one clause.
 *
 * <p>{@link #execute(Object)} returns {@link Residual#satisfied()} to let evaluation fall
 * through to the next clause, or the short-circuiting Open or Conflict residual.
 */
public sealed interface CodeFragment
        permits SingleCheckFragment, ScalarPathFragment, ForallFragment, ExistsFragment {

    Residual execute(Object document);
}
