/*
 * Copyright (c) 2025 Aegis Policy Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.aegis.policyengine.api.model;

import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Built-in constraint operators understood by the compiler.
 *
 * <p>Operators registered at runtime by users are referenced by symbol only (see
 * {@link Constraint#custom(String, Object)}) and never appear here.
 */
public enum Operator {
    EQ("eq"),
    NEQ("neq"),
    GT("gt"),
    LT("lt"),
    GTE("gte"),
    LTE("lte"),
    IN("in"),
    NOT_IN("not-in"),
    MATCHES("matches"),
    NOT_MATCHES("not-matches");

    private static final Map<String, Operator> BY_SYMBOL = Stream.of(values())
            .collect(Collectors.toUnmodifiableMap(Operator::symbol, Function.identity()));

    private final String symbol;

    Operator(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }

    /** Ordering operators; their operand is an integer. */
    public boolean isOrdering() {
        return this == GT || this == LT || this == GTE || this == LTE;
    }

    public boolean isMembership() {
        return this == IN || this == NOT_IN;
    }

    public boolean isPattern() {
        return this == MATCHES || this == NOT_MATCHES;
    }

    public static Optional<Operator> fromSymbol(String symbol) {
        return Optional.ofNullable(symbol == null ? null : BY_SYMBOL.get(symbol));
    }

    public static boolean isBuiltIn(String symbol) {
        return symbol != null && BY_SYMBOL.containsKey(symbol);
    }
}
