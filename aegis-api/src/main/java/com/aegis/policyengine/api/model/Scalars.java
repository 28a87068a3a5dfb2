package com.aegis.policyengine.api.model;

import java.math.BigDecimal;
import java.math.BigInteger;

/**
 * Canonical forms for scalar operands and document values.
 *
 * <p>Integral numbers of every width collapse to {@link Long} so that {@code 5},
 * {@code 5L} and {@code (short) 5} are the same operand. Floating values with no fractional
 * part collapse to {@link Long} as well ({@code 2.0} is {@code 2}); other floats widen to
 * {@link Double}.
 */
public final class Scalars {

    private static final double LONG_UPPER_EXCLUSIVE = 0x1p63;

    private Scalars() {
        throw new AssertionError("No instances");
    }

    public static boolean isIntegral(Object value) {
        return value instanceof Long
                || value instanceof Integer
                || value instanceof Short
                || value instanceof Byte;
    }

    public static boolean isFloating(Object value) {
        return value instanceof Double || value instanceof Float;
    }

    /**
     * Immutable values usable as equality or membership operands.
     */
    public static boolean isScalar(Object value) {
        return value instanceof String
                || value instanceof Boolean
                || value instanceof Character
                || isIntegral(value)
                || isFloating(value)
                || value instanceof BigInteger
                || value instanceof BigDecimal
                || value instanceof Enum<?>;
    }

    public static Object normalize(Object value) {
        if (value instanceof Long) {
            return value;
        }
        if (isIntegral(value)) {
            return ((Number) value).longValue();
        }
        if (isFloating(value)) {
            double d = ((Number) value).doubleValue();
            if (d == Math.rint(d) && d >= Long.MIN_VALUE && d < LONG_UPPER_EXCLUSIVE) {
                return (long) d;
            }
            return d;
        }
        return value;
    }
}
