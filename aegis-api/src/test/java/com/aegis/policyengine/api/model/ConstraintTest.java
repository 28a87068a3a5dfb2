package com.aegis.policyengine.api.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConstraintTest {

    @Test
    @DisplayName("Integral operands of any width normalize to Long")
    void integralOperandsNormalizeToLong() {
        assertThat(Constraint.of(Operator.GT, 18).value()).isEqualTo(18L);
        assertThat(Constraint.of(Operator.EQ, (short) 3).value()).isEqualTo(3L);
        assertThat(Constraint.of(Operator.GT, 18)).isEqualTo(Constraint.gt(18L));
    }

    @Test
    @DisplayName("Ordering operators reject non-integer operands")
    void orderingRejectsNonInteger() {
        assertThatThrownBy(() -> Constraint.of(Operator.LTE, "five"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("lte");
        assertThatThrownBy(() -> Constraint.of(Operator.GT, 1.5))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Membership operands become an immutable normalized set")
    void membershipOperandsBecomeSet() {
        Constraint c = Constraint.of(Operator.IN, List.of(1, 2, "x"));

        assertThat(c.members()).containsExactlyInAnyOrder(1L, 2L, "x");
        assertThat(c.members()).isInstanceOf(Set.class);
        assertThatThrownBy(() -> c.members().add("y")).isInstanceOf(UnsupportedOperationException.class);
        assertThat(Constraint.in("a", "b")).isEqualTo(Constraint.in("b", "a"));
    }

    @Test
    @DisplayName("Integral-valued floats normalize to Long, other floats to Double")
    void floatingOperandsNormalize() {
        assertThat(Constraint.eq(2.0).value()).isEqualTo(2L);
        assertThat(Constraint.eq(2.0)).isEqualTo(Constraint.eq(2));
        assertThat(Constraint.eq(2.5f).value()).isEqualTo(2.5d);
        assertThat(Constraint.in(1.0, "x").members()).containsExactlyInAnyOrder(1L, "x");
    }

    @Test
    @DisplayName("Equality and membership reject mutable operands")
    void equalityRejectsNonScalarOperands() {
        List<String> tags = new ArrayList<>(List.of("a"));

        assertThatThrownBy(() -> Constraint.eq(tags))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("eq");
        assertThatThrownBy(() -> Constraint.neq(Map.of("k", "v")))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Constraint.eq(new String[]{"a"}))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Constraint.in(tags, "b"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("in");
    }

    @Test
    @DisplayName("Pattern operands are validated and stored as source text")
    void patternOperands() {
        assertThat(Constraint.of(Operator.MATCHES, Pattern.compile("^a.*")).value()).isEqualTo("^a.*");
        assertThatThrownBy(() -> Constraint.matches("(unclosed"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Invalid regular expression");
    }

    @Test
    @DisplayName("Custom operators keep their operand verbatim")
    void customOperatorKeepsOperand() {
        Object operand = new Object();
        Constraint c = Constraint.custom("within-radius", operand);

        assertThat(c.isBuiltIn()).isFalse();
        assertThat(c.builtin()).isEmpty();
        assertThat(c.value()).isSameAs(operand);
    }

    @Test
    void toStringQuotesStrings() {
        assertThat(Constraint.eq("admin")).hasToString("eq \"admin\"");
        assertThat(Constraint.gt(5)).hasToString("gt 5");
    }
}
