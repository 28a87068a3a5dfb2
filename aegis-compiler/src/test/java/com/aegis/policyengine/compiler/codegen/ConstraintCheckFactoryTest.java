package com.aegis.policyengine.compiler.codegen;

import com.aegis.policyengine.api.exceptions.CompilationException;
import com.aegis.policyengine.api.model.Constraint;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.List;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConstraintCheckFactoryTest {

    private final PatternCache patternCache = new PatternCache(16);
    private final ConstraintCheckFactory factory = new ConstraintCheckFactory(patternCache);

    static Stream<Arguments> checks() {
        return Stream.of(
                Arguments.of(Constraint.eq("admin"), "admin", true),
                Arguments.of(Constraint.eq("admin"), "guest", false),
                Arguments.of(Constraint.eq(5), 5, true),
                Arguments.of(Constraint.eq(5), 5.0, true),
                Arguments.of(Constraint.eq(5), "5", false),
                Arguments.of(Constraint.eq(2.0), 2, true),
                Arguments.of(Constraint.eq(2.5), 2.5, true),
                Arguments.of(Constraint.eq(2.5), 2.5f, true),
                Arguments.of(Constraint.eq(2.5), 2, false),
                Arguments.of(Constraint.neq(2.0), 2L, false),
                Arguments.of(Constraint.neq("admin"), "guest", true),
                Arguments.of(Constraint.neq(5), "5", true),
                Arguments.of(Constraint.neq(5), 5L, false),
                Arguments.of(Constraint.gt(18), 25, true),
                Arguments.of(Constraint.gt(18), 18, false),
                Arguments.of(Constraint.gt(18), 18.5, true),
                Arguments.of(Constraint.gt(18), "25", false),
                Arguments.of(Constraint.lt(10), 9, true),
                Arguments.of(Constraint.lt(10), 10, false),
                Arguments.of(Constraint.gte(5), 5, true),
                Arguments.of(Constraint.gte(5), 4, false),
                Arguments.of(Constraint.lte(5), 5, true),
                Arguments.of(Constraint.lte(5), 6, false),
                Arguments.of(Constraint.in("active", "pending"), "pending", true),
                Arguments.of(Constraint.in("active", "pending"), "closed", false),
                Arguments.of(Constraint.in(1, 2, 3), 2, true),
                Arguments.of(Constraint.in(1, 2, 3), 2.0, true),
                Arguments.of(Constraint.in(1, 2, 3), 2.5, false),
                Arguments.of(Constraint.in(1, 2, 3), "2", false),
                Arguments.of(Constraint.in(1, "x"), 1.0, true),
                Arguments.of(Constraint.in(1, "x"), 1.5, false),
                Arguments.of(Constraint.in(1.5, "x"), 1.5, true),
                Arguments.of(Constraint.in(2.0, 3.0), 3, true),
                Arguments.of(Constraint.notIn("guest", "banned"), "user", true),
                Arguments.of(Constraint.notIn("guest", "banned"), "banned", false),
                Arguments.of(Constraint.notIn(7, 8), 7L, false),
                Arguments.of(Constraint.notIn(7, 8), true, true),
                Arguments.of(Constraint.notIn(7, "x"), 7.0, false),
                Arguments.of(Constraint.matches(".*@example\\.com"), "ann@example.com", true),
                Arguments.of(Constraint.matches(".*@example\\.com"), "ann@example.org", false),
                Arguments.of(Constraint.matches("\\d+"), 42, true),
                Arguments.of(Constraint.notMatches("^admin.*"), "ann", true),
                Arguments.of(Constraint.notMatches("^admin.*"), "admin-1", false)
        );
    }

    @ParameterizedTest(name = "{0} against {1} -> {2}")
    @MethodSource("checks")
    void evaluatesConstraint(Constraint constraint, Object value, boolean expected) {
        assertThat(factory.create(constraint).test(value)).isEqualTo(expected);
    }

    @Test
    @DisplayName("Integer-only membership uses a primitive set")
    void integerMembershipIsPrimitive() {
        assertThat(factory.create(Constraint.in(1, 2, 3))).isInstanceOf(ConstraintCheck.LongIn.class);
        assertThat(factory.create(Constraint.notIn(1, 2))).isInstanceOf(ConstraintCheck.LongNotIn.class);
        assertThat(factory.create(Constraint.in(1, "two"))).isInstanceOf(ConstraintCheck.ValueIn.class);
    }

    @Test
    void integerEqualityIsPrimitive() {
        assertThat(factory.create(Constraint.eq(5))).isEqualTo(new ConstraintCheck.LongEquals(5));
        assertThat(factory.create(Constraint.eq(5.0))).isEqualTo(new ConstraintCheck.LongEquals(5));
        assertThat(factory.create(Constraint.neq(5))).isEqualTo(new ConstraintCheck.LongNotEquals(5));
    }

    @Test
    @DisplayName("Custom operators have no compiled form")
    void customOperatorRejected() {
        assertThatThrownBy(() -> factory.create(Constraint.custom("within-radius", 10)))
                .isInstanceOf(CompilationException.class)
                .hasMessageContaining("within-radius");
    }

    @Test
    @DisplayName("Repeated patterns share one compiled Pattern")
    void patternsAreShared() {
        ConstraintCheck.Matches first = (ConstraintCheck.Matches) factory.create(Constraint.matches("[a-z]+"));
        ConstraintCheck.NotMatches second = (ConstraintCheck.NotMatches) factory.create(Constraint.notMatches("[a-z]+"));

        assertThat(second.pattern()).isSameAs(first.pattern());
        assertThat(patternCache.estimatedSize()).isEqualTo(1L);
    }

    @Test
    void checksAreReusableAcrossValues() {
        ConstraintCheck check = factory.create(Constraint.in("a", "b"));

        List<Boolean> results = Stream.of("a", "b", "c", "a").map(check::test).toList();

        assertThat(results).containsExactly(true, true, false, true);
    }
}
