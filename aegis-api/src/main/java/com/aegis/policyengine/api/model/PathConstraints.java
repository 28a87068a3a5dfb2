/*
 * Copyright (c) 2025 Aegis Policy Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.aegis.policyengine.api.model;

import java.util.List;
import java.util.Objects;

/**
 * Ordered constraints on the value found at a single path.
 */
public record PathConstraints(FieldPath path, List<Constraint> constraints) implements PolicyClause {

    public PathConstraints {
        Objects.requireNonNull(path, "path must not be null");
        constraints = List.copyOf(constraints);
    }
}
