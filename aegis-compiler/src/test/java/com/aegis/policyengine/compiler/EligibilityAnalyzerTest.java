package com.aegis.policyengine.compiler;

import com.aegis.policyengine.api.model.Constraint;
import com.aegis.policyengine.api.model.ConstraintSet;
import com.aegis.policyengine.api.model.EligibilityReport;
import com.aegis.policyengine.api.model.EligibilityReport.Reason;
import com.aegis.policyengine.api.model.ElementConstraint;
import com.aegis.policyengine.api.model.FieldPath;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class EligibilityAnalyzerTest {

    private final EligibilityAnalyzer baseline = EligibilityAnalyzer.baseline();

    @Test
    @DisplayName("Simple built-in constraint sets are eligible")
    void simpleSetIsEligible() {
        ConstraintSet set = ConstraintSet.builder()
                .require("role", Constraint.eq("admin"))
                .require("user.level", Constraint.gte(5), Constraint.lt(10))
                .build();

        EligibilityReport report = baseline.analyze(set);

        assertThat(report.eligible()).isTrue();
        assertThat(report.findings()).isEmpty();
    }

    @Test
    void emptySetIsIneligible() {
        EligibilityReport report = baseline.analyze(ConstraintSet.builder().build());

        assertThat(report.eligible()).isFalse();
        assertThat(report.hasReason(Reason.EMPTY_CONSTRAINT_SET)).isTrue();
    }

    @Test
    void emptyPathAndEmptyConstraintsAreIneligible() {
        ConstraintSet set = ConstraintSet.builder()
                .path(FieldPath.root(), List.of(Constraint.eq(1)))
                .path(FieldPath.of("x"), List.of())
                .build();

        EligibilityReport report = baseline.analyze(set);

        assertThat(report.eligible()).isFalse();
        assertThat(report.findings()).extracting(EligibilityReport.Finding::reason)
                .containsExactly(Reason.EMPTY_PATH, Reason.EMPTY_CONSTRAINTS);
    }

    @Test
    @DisplayName("A user-registered operator makes the set ineligible")
    void customOperatorIsIneligible() {
        ConstraintSet set = ConstraintSet.builder()
                .require("role", Constraint.eq("admin"))
                .require("location", Constraint.custom("within-radius", List.of(1.0, 2.0, 10)))
                .build();

        EligibilityReport report = baseline.analyze(set);

        assertThat(report.eligible()).isFalse();
        assertThat(report.hasReason(Reason.CUSTOM_OPERATOR)).isTrue();
        assertThat(report.reasons()).singleElement().asString().contains("within-radius");
    }

    @Test
    @DisplayName("Quantifiers are rejected by the baseline analyzer only")
    void quantifierRouting() {
        ConstraintSet set = ConstraintSet.builder()
                .forall("items", ElementConstraint.of("qty", Constraint.lte(5)))
                .build();

        assertThat(baseline.analyze(set).hasReason(Reason.QUANTIFIER_NOT_SUPPORTED)).isTrue();
        assertThat(EligibilityAnalyzer.withQuantifiers().analyze(set).eligible()).isTrue();
    }

    @Test
    void customOperatorInsideQuantifierIsIneligible() {
        ConstraintSet set = ConstraintSet.builder()
                .exists("items", ElementConstraint.of("sku", Constraint.custom("luhn", true)))
                .build();

        EligibilityReport report = EligibilityAnalyzer.withQuantifiers().analyze(set);

        assertThat(report.eligible()).isFalse();
        assertThat(report.findings()).singleElement()
                .satisfies(f -> assertThat(f.path()).isEqualTo(FieldPath.parse("items.sku")));
    }

    @Test
    void analysisIsPure() {
        ConstraintSet set = ConstraintSet.builder().require("role", Constraint.custom("x", 1)).build();

        assertThat(baseline.analyze(set)).isEqualTo(baseline.analyze(set));
    }

    @Test
    void analyzerFollowsConfig() {
        assertThat(EligibilityAnalyzer.forConfig(CompilerConfig.defaults()).supportsQuantifiers()).isFalse();
        assertThat(EligibilityAnalyzer.forConfig(CompilerConfig.builder().quantifierCompilation(true).build())
                .supportsQuantifiers()).isTrue();
    }
}
