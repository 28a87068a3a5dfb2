/*
 * Copyright (c) 2025 Aegis Policy Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.aegis.policyengine.api.model;

import java.util.List;
import java.util.Objects;

/**
 * A universal or existential requirement over the elements of a collection.
 *
 * <p>{@code forall} holds when every element satisfies every element constraint;
 * {@code exists} holds when at least one element does.
 */
public record Quantifier(Kind kind, FieldPath collectionPath, List<ElementConstraint> elementConstraints)
        implements PolicyClause {

    public enum Kind {
        FORALL("forall"),
        EXISTS("exists");

        private final String symbol;

        Kind(String symbol) {
            this.symbol = symbol;
        }

        public String symbol() {
            return symbol;
        }

        public static Kind fromSymbol(String symbol) {
            for (Kind kind : values()) {
                if (kind.symbol.equalsIgnoreCase(symbol)) {
                    return kind;
                }
            }
            throw new IllegalArgumentException("Unknown quantifier: " + symbol);
        }
    }

    public Quantifier {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(collectionPath, "collectionPath must not be null");
        elementConstraints = List.copyOf(elementConstraints);
    }

    public static Quantifier forall(FieldPath collectionPath, ElementConstraint... elementConstraints) {
        return new Quantifier(Kind.FORALL, collectionPath, List.of(elementConstraints));
    }

    public static Quantifier exists(FieldPath collectionPath, ElementConstraint... elementConstraints) {
        return new Quantifier(Kind.EXISTS, collectionPath, List.of(elementConstraints));
    }

    @Override
    public FieldPath path() {
        return collectionPath;
    }

    @Override
    public List<Constraint> constraints() {
        return elementConstraints.stream().map(ElementConstraint::constraint).toList();
    }
}
