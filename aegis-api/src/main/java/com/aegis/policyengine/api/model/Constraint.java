/*
 * Copyright (c) 2025 Aegis Policy Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.aegis.policyengine.api.model;

import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * A single {@code {operator, value}} requirement on one field.
 *
 * <p>Operands of built-in operators are validated and normalized on construction:
 * <ul>
 *   <li>ordering operators ({@code gt lt gte lte}) take an integer, stored as {@link Long}</li>
 *   <li>{@code in} / {@code not-in} take a finite collection of scalars, stored as an
 *       unmodifiable set of their {@link Scalars#normalize normalized} forms</li>
 *   <li>{@code matches} / {@code not-matches} take a regular expression, stored as its source
 *       string (a {@link Pattern} is accepted and unwrapped)</li>
 *   <li>{@code eq} / {@code neq} take a single scalar, normalized</li>
 * </ul>
 * Collections, maps and arrays are rejected as equality or membership operands.
 * Operators outside the built-in set are kept verbatim with an opaque operand.
 */
public record Constraint(String operator, Object value) {

    public Constraint {
        Objects.requireNonNull(operator, "operator must not be null");
        if (operator.isBlank()) {
            throw new IllegalArgumentException("operator must not be blank");
        }
        Optional<Operator> builtin = Operator.fromSymbol(operator);
        if (builtin.isPresent()) {
            value = normalizeOperand(builtin.get(), value);
        }
    }

    public static Constraint of(Operator operator, Object value) {
        return new Constraint(operator.symbol(), value);
    }

    public static Constraint eq(Object value) {
        return of(Operator.EQ, value);
    }

    public static Constraint neq(Object value) {
        return of(Operator.NEQ, value);
    }

    public static Constraint gt(long bound) {
        return of(Operator.GT, bound);
    }

    public static Constraint lt(long bound) {
        return of(Operator.LT, bound);
    }

    public static Constraint gte(long bound) {
        return of(Operator.GTE, bound);
    }

    public static Constraint lte(long bound) {
        return of(Operator.LTE, bound);
    }

    public static Constraint in(Object... members) {
        return of(Operator.IN, Arrays.asList(members));
    }

    public static Constraint notIn(Object... members) {
        return of(Operator.NOT_IN, Arrays.asList(members));
    }

    public static Constraint matches(String regex) {
        return of(Operator.MATCHES, regex);
    }

    public static Constraint notMatches(String regex) {
        return of(Operator.NOT_MATCHES, regex);
    }

    /**
     * A constraint over a user-registered operator. Such constraints make a set
     * ineligible for compilation.
     */
    public static Constraint custom(String operator, Object value) {
        return new Constraint(operator, value);
    }

    public Optional<Operator> builtin() {
        return Operator.fromSymbol(operator);
    }

    public boolean isBuiltIn() {
        return Operator.isBuiltIn(operator);
    }

    @SuppressWarnings("unchecked")
    public Set<Object> members() {
        if (!(value instanceof Set)) {
            throw new IllegalStateException("Operator '" + operator + "' has no member set");
        }
        return (Set<Object>) value;
    }

    public long bound() {
        if (!(value instanceof Long)) {
            throw new IllegalStateException("Operator '" + operator + "' has no integer bound");
        }
        return (Long) value;
    }

    @Override
    public String toString() {
        return value instanceof String ? operator + " \"" + value + "\"" : operator + " " + value;
    }

    private static Object normalizeOperand(Operator op, Object value) {
        if (op.isOrdering()) {
            if (!Scalars.isIntegral(value)) {
                throw new IllegalArgumentException(
                        "Operator '" + op.symbol() + "' requires an integer operand, got: " + value);
            }
            return Scalars.normalize(value);
        }
        if (op.isMembership()) {
            if (!(value instanceof Collection<?> members)) {
                throw new IllegalArgumentException(
                        "Operator '" + op.symbol() + "' requires a collection operand, got: " + value);
            }
            Set<Object> normalized = new LinkedHashSet<>();
            for (Object member : members) {
                if (member == null) {
                    throw new IllegalArgumentException(
                            "Operator '" + op.symbol() + "' does not accept null members");
                }
                normalized.add(Scalars.normalize(requireScalar(op, member)));
            }
            return Set.copyOf(normalized);
        }
        if (op.isPattern()) {
            String regex;
            if (value instanceof Pattern pattern) {
                regex = pattern.pattern();
            } else if (value instanceof String s) {
                regex = s;
            } else {
                throw new IllegalArgumentException(
                        "Operator '" + op.symbol() + "' requires a regular expression, got: " + value);
            }
            try {
                Pattern.compile(regex);
            } catch (PatternSyntaxException e) {
                throw new IllegalArgumentException("Invalid regular expression: " + regex, e);
            }
            return regex;
        }
        Objects.requireNonNull(value, () -> "Operator '" + op.symbol() + "' requires a value");
        return Scalars.normalize(requireScalar(op, value));
    }

    private static Object requireScalar(Operator op, Object value) {
        if (!Scalars.isScalar(value)) {
            throw new IllegalArgumentException(
                    "Operator '" + op.symbol() + "' requires scalar operands, got "
                            + value.getClass().getSimpleName() + ": " + value);
        }
        return value;
    }
}
