package com.aegis.policyengine.cache;

import com.aegis.policyengine.api.model.Constraint;
import com.aegis.policyengine.api.model.ConstraintSet;
import com.aegis.policyengine.api.model.ElementConstraint;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class PolicySignatureTest {

    private static ConstraintSet sample() {
        return ConstraintSet.builder()
                .require("user.role", Constraint.in("admin", "buyer", "auditor"))
                .require("age", Constraint.gte(18))
                .forall("items", ElementConstraint.of("qty", Constraint.lte(5)))
                .build();
    }

    @Test
    void equalSetsProduceEqualSignatures() {
        PolicySignature a = PolicySignature.of(sample(), 3);
        PolicySignature b = PolicySignature.of(sample(), 3);

        assertThat(a).isEqualTo(b);
        assertThat(a.hashCode()).isEqualTo(b.hashCode());
        assertThat(a.fingerprint()).isEqualTo(b.fingerprint());
    }

    @Test
    void membershipOrderDoesNotMatter() {
        ConstraintSet forward = ConstraintSet.builder().require("tier", Constraint.in(1, 2, 3, 4, 5)).build();
        ConstraintSet backward = ConstraintSet.builder().require("tier", Constraint.in(5, 4, 3, 2, 1)).build();

        assertThat(PolicySignature.of(forward, 1)).isEqualTo(PolicySignature.of(backward, 1));
    }

    @Test
    void registryVersionIsPartOfTheKey() {
        assertThat(PolicySignature.of(sample(), 1)).isNotEqualTo(PolicySignature.of(sample(), 2));
    }

    @Test
    void clauseOrderIsPartOfTheKey() {
        ConstraintSet ab = ConstraintSet.builder()
                .require("a", Constraint.eq(1))
                .require("b", Constraint.eq(2))
                .build();
        ConstraintSet ba = ConstraintSet.builder()
                .require("b", Constraint.eq(2))
                .require("a", Constraint.eq(1))
                .build();

        assertThat(PolicySignature.of(ab, 1)).isNotEqualTo(PolicySignature.of(ba, 1));
    }

    @Test
    void operandTypeIsPartOfTheKey() {
        ConstraintSet number = ConstraintSet.builder().require("code", Constraint.eq(7)).build();
        ConstraintSet text = ConstraintSet.builder().require("code", Constraint.eq("7")).build();

        assertThat(PolicySignature.of(number, 1).fingerprint())
                .isNotEqualTo(PolicySignature.of(text, 1).fingerprint());
    }
}
