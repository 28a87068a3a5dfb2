/*
 * Copyright (c) 2025 Aegis Policy Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.aegis.policyengine.api.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Conjunction of clauses evaluated in declaration order.
 *
 * <p>Scalar paths are unique within a set; constraints declared twice for the same path
 * through the {@link Builder} are appended to the first declaration. The set is immutable
 * and compares structurally, which makes it usable as part of a cache key.
 *
 * <p>Sets with empty paths, clauses without constraints or custom operators can be built;
 * they are rejected later by eligibility analysis.
 */
public record ConstraintSet(List<PolicyClause> clauses) {

    public ConstraintSet {
        clauses = List.copyOf(clauses);
        Set<FieldPath> scalarPaths = new HashSet<>();
        for (PolicyClause clause : clauses) {
            if (clause instanceof PathConstraints && !scalarPaths.add(clause.path())) {
                throw new IllegalArgumentException("Duplicate path in constraint set: " + clause.path());
            }
        }
    }

    public static ConstraintSet of(PolicyClause... clauses) {
        return new ConstraintSet(Arrays.asList(clauses));
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean isEmpty() {
        return clauses.isEmpty();
    }

    public int size() {
        return clauses.size();
    }

    public boolean hasQuantifiers() {
        return clauses.stream().anyMatch(Quantifier.class::isInstance);
    }

    public List<PathConstraints> pathConstraints() {
        return clauses.stream()
                .filter(PathConstraints.class::isInstance)
                .map(PathConstraints.class::cast)
                .toList();
    }

    public List<Quantifier> quantifiers() {
        return clauses.stream()
                .filter(Quantifier.class::isInstance)
                .map(Quantifier.class::cast)
                .toList();
    }

    public int totalConstraints() {
        return clauses.stream().mapToInt(c -> c.constraints().size()).sum();
    }

    public static final class Builder {

        private final Map<FieldPath, List<Constraint>> pathConstraints = new HashMap<>();
        // FieldPath for scalar clauses, Quantifier otherwise; list order is declaration order
        private final List<Object> order = new ArrayList<>();

        private Builder() {
        }

        public Builder require(String path, Constraint... constraints) {
            return require(FieldPath.parse(path), constraints);
        }

        public Builder require(FieldPath path, Constraint... constraints) {
            return path(path, Arrays.asList(constraints));
        }

        /**
         * Declares constraints for a path. An empty list is accepted and recorded as is.
         */
        public Builder path(FieldPath path, List<Constraint> constraints) {
            Objects.requireNonNull(path, "path must not be null");
            List<Constraint> existing = pathConstraints.get(path);
            if (existing == null) {
                existing = new ArrayList<>();
                pathConstraints.put(path, existing);
                order.add(path);
            }
            existing.addAll(constraints);
            return this;
        }

        public Builder forall(String collectionPath, ElementConstraint... elementConstraints) {
            return clause(Quantifier.forall(FieldPath.parse(collectionPath), elementConstraints));
        }

        public Builder exists(String collectionPath, ElementConstraint... elementConstraints) {
            return clause(Quantifier.exists(FieldPath.parse(collectionPath), elementConstraints));
        }

        public Builder clause(PolicyClause clause) {
            Objects.requireNonNull(clause, "clause must not be null");
            if (clause instanceof PathConstraints pc) {
                return path(pc.path(), pc.constraints());
            }
            order.add(clause);
            return this;
        }

        public ConstraintSet build() {
            List<PolicyClause> result = new ArrayList<>(order.size());
            for (Object entry : order) {
                if (entry instanceof FieldPath path) {
                    result.add(new PathConstraints(path, pathConstraints.get(path)));
                } else {
                    result.add((PolicyClause) entry);
                }
            }
            return new ConstraintSet(result);
        }
    }
}
