/*
 * Copyright (c) 2025 Aegis Policy Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.aegis.policyengine.api.model;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of evaluating a constraint set against a document.
 *
 * <ul>
 *   <li>{@link Satisfied}: every constraint holds (single canonical instance)</li>
 *   <li>{@link Open}: the document lacks the value at {@code path}; the listed constraints
 *       remain to be decided once it is supplied</li>
 *   <li>{@link Conflict}: the value at {@code path} (the witness) violates {@code constraint}</li>
 * </ul>
 */
public sealed interface Residual permits Residual.Satisfied, Residual.Open, Residual.Conflict {

    static Residual satisfied() {
        return Satisfied.INSTANCE;
    }

    default boolean isSatisfied() {
        return this == Satisfied.INSTANCE;
    }

    default boolean isOpen() {
        return this instanceof Open;
    }

    default boolean isConflict() {
        return this instanceof Conflict;
    }

    enum Satisfied implements Residual {
        INSTANCE;

        @Override
        public String toString() {
            return "Satisfied";
        }
    }

    record Open(FieldPath path, List<Constraint> constraints) implements Residual {
        public Open {
            Objects.requireNonNull(path, "path must not be null");
            constraints = List.copyOf(constraints);
        }
    }

    record Conflict(FieldPath path, Constraint constraint, Object witness) implements Residual {
        public Conflict {
            Objects.requireNonNull(path, "path must not be null");
            Objects.requireNonNull(constraint, "constraint must not be null");
        }
    }
}
