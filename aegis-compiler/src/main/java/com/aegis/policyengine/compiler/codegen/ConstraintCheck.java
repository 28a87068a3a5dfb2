/*
 * Copyright (c) 2025 Aegis Policy Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.aegis.policyengine.compiler.codegen;

import com.aegis.policyengine.api.model.Scalars;
import it.unimi.dsi.fastutil.longs.LongSet;

import java.util.Set;
import java.util.regex.Pattern;

/**
 * A single constraint specialized to its operator and operand.
 *
 * <p>One variant per operator and operand shape. Integer operands are held as primitive
 * {@code long}s and compared without boxing; membership over integer-only sets uses a
 * primitive {@link LongSet}. A document value of the wrong type fails the check (and so
 * becomes the witness of a conflict), except for the negated forms, which pass.
 */
public sealed interface ConstraintCheck {

    boolean test(Object value);

    // Integral document values compare as long, floating ones as double. Value variants
    // compare normalized forms, so 1.0 meets an operand of 1.

    record LongEquals(long expected) implements ConstraintCheck {
        @Override
        public boolean test(Object value) {
            if (Scalars.isIntegral(value)) {
                return ((Number) value).longValue() == expected;
            }
            return Scalars.isFloating(value) && ((Number) value).doubleValue() == expected;
        }
    }

    record LongNotEquals(long expected) implements ConstraintCheck {
        @Override
        public boolean test(Object value) {
            if (Scalars.isIntegral(value)) {
                return ((Number) value).longValue() != expected;
            }
            return !Scalars.isFloating(value) || ((Number) value).doubleValue() != expected;
        }
    }

    record ValueEquals(Object expected) implements ConstraintCheck {
        @Override
        public boolean test(Object value) {
            return expected.equals(Scalars.normalize(value));
        }
    }

    record ValueNotEquals(Object expected) implements ConstraintCheck {
        @Override
        public boolean test(Object value) {
            return !expected.equals(Scalars.normalize(value));
        }
    }

    record GreaterThan(long bound) implements ConstraintCheck {
        @Override
        public boolean test(Object value) {
            if (Scalars.isIntegral(value)) {
                return ((Number) value).longValue() > bound;
            }
            return Scalars.isFloating(value) && ((Number) value).doubleValue() > bound;
        }
    }

    record LessThan(long bound) implements ConstraintCheck {
        @Override
        public boolean test(Object value) {
            if (Scalars.isIntegral(value)) {
                return ((Number) value).longValue() < bound;
            }
            return Scalars.isFloating(value) && ((Number) value).doubleValue() < bound;
        }
    }

    record AtLeast(long bound) implements ConstraintCheck {
        @Override
        public boolean test(Object value) {
            if (Scalars.isIntegral(value)) {
                return ((Number) value).longValue() >= bound;
            }
            return Scalars.isFloating(value) && ((Number) value).doubleValue() >= bound;
        }
    }

    record AtMost(long bound) implements ConstraintCheck {
        @Override
        public boolean test(Object value) {
            if (Scalars.isIntegral(value)) {
                return ((Number) value).longValue() <= bound;
            }
            return Scalars.isFloating(value) && ((Number) value).doubleValue() <= bound;
        }
    }

    record LongIn(LongSet members) implements ConstraintCheck {
        @Override
        public boolean test(Object value) {
            return containsNumber(members, value);
        }
    }

    record LongNotIn(LongSet members) implements ConstraintCheck {
        @Override
        public boolean test(Object value) {
            return !containsNumber(members, value);
        }
    }

    record ValueIn(Set<Object> members) implements ConstraintCheck {
        @Override
        public boolean test(Object value) {
            return members.contains(Scalars.normalize(value));
        }
    }

    record ValueNotIn(Set<Object> members) implements ConstraintCheck {
        @Override
        public boolean test(Object value) {
            return !members.contains(Scalars.normalize(value));
        }
    }

    record Matches(Pattern pattern) implements ConstraintCheck {
        @Override
        public boolean test(Object value) {
            return pattern.matcher(asText(value)).matches();
        }
    }

    record NotMatches(Pattern pattern) implements ConstraintCheck {
        @Override
        public boolean test(Object value) {
            return !pattern.matcher(asText(value)).matches();
        }
    }

    private static boolean containsNumber(LongSet members, Object value) {
        if (Scalars.isIntegral(value)) {
            return members.contains(((Number) value).longValue());
        }
        if (Scalars.isFloating(value)) {
            double d = ((Number) value).doubleValue();
            return d == (long) d && members.contains((long) d);
        }
        return false;
    }

    private static CharSequence asText(Object value) {
        return value instanceof CharSequence cs ? cs : String.valueOf(value);
    }
}
