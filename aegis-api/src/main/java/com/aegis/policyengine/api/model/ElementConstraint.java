/*
 * Copyright (c) 2025 Aegis Policy Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.aegis.policyengine.api.model;

import java.util.Objects;

/**
 * A constraint applied to each element of a quantified collection, addressed by a path
 * relative to the element. The root path addresses the element itself.
 */
public record ElementConstraint(FieldPath relativePath, Constraint constraint) {

    public ElementConstraint {
        Objects.requireNonNull(relativePath, "relativePath must not be null");
        Objects.requireNonNull(constraint, "constraint must not be null");
    }

    public static ElementConstraint of(String relativePath, Constraint constraint) {
        return new ElementConstraint(FieldPath.parse(relativePath), constraint);
    }
}
