/*
 * Copyright (c) 2025 Aegis Policy Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.aegis.policyengine.compiler;

import com.aegis.policyengine.api.model.Constraint;
import com.aegis.policyengine.api.model.ConstraintSet;
import com.aegis.policyengine.api.model.EligibilityReport;
import com.aegis.policyengine.api.model.EligibilityReport.Finding;
import com.aegis.policyengine.api.model.EligibilityReport.Reason;
import com.aegis.policyengine.api.model.ElementConstraint;
import com.aegis.policyengine.api.model.FieldPath;
import com.aegis.policyengine.api.model.PathConstraints;
import com.aegis.policyengine.api.model.PolicyClause;
import com.aegis.policyengine.api.model.Quantifier;

import java.util.ArrayList;
import java.util.List;

/**
 * Decides whether a constraint set can be handed to the code generator.
 *
 * <p>A set is eligible when:
 * <ul>
 *   <li>it has at least one clause</li>
 *   <li>every clause path is non-empty and carries at least one constraint</li>
 *   <li>every operator is built-in</li>
 *   <li>it has no quantifiers, unless this analyzer was created with
 *       {@link #withQuantifiers()}</li>
 * </ul>
 * All violations are reported, not just the first. The analyzer holds no state.
 */
public final class EligibilityAnalyzer {

    private static final EligibilityAnalyzer BASELINE = new EligibilityAnalyzer(false);
    private static final EligibilityAnalyzer WITH_QUANTIFIERS = new EligibilityAnalyzer(true);

    private final boolean quantifiersSupported;

    private EligibilityAnalyzer(boolean quantifiersSupported) {
        this.quantifiersSupported = quantifiersSupported;
    }

    public static EligibilityAnalyzer baseline() {
        return BASELINE;
    }

    public static EligibilityAnalyzer withQuantifiers() {
        return WITH_QUANTIFIERS;
    }

    public static EligibilityAnalyzer forConfig(CompilerConfig config) {
        return config.quantifierCompilation() ? WITH_QUANTIFIERS : BASELINE;
    }

    public boolean supportsQuantifiers() {
        return quantifiersSupported;
    }

    public EligibilityReport analyze(ConstraintSet constraintSet) {
        List<Finding> findings = new ArrayList<>();
        if (constraintSet.isEmpty()) {
            findings.add(new Finding(Reason.EMPTY_CONSTRAINT_SET, FieldPath.root(),
                    "constraint set has no clauses"));
            return EligibilityReport.ineligible(findings);
        }

        for (PolicyClause clause : constraintSet.clauses()) {
            if (clause.path().isEmpty()) {
                findings.add(new Finding(Reason.EMPTY_PATH, clause.path(), "clause path is empty"));
            }
            if (clause instanceof PathConstraints scalar) {
                checkConstraints(scalar.path(), scalar.constraints(), findings);
            } else if (clause instanceof Quantifier quantifier) {
                checkQuantifier(quantifier, findings);
            }
        }
        return findings.isEmpty() ? EligibilityReport.eligibleReport() : EligibilityReport.ineligible(findings);
    }

    private void checkQuantifier(Quantifier quantifier, List<Finding> findings) {
        if (!quantifiersSupported) {
            findings.add(new Finding(Reason.QUANTIFIER_NOT_SUPPORTED, quantifier.collectionPath(),
                    quantifier.kind().symbol() + " quantifiers are not compiled by this analyzer"));
        }
        if (quantifier.elementConstraints().isEmpty()) {
            findings.add(new Finding(Reason.EMPTY_CONSTRAINTS, quantifier.collectionPath(),
                    "quantifier has no element constraints"));
        }
        for (ElementConstraint element : quantifier.elementConstraints()) {
            checkOperator(quantifier.collectionPath().concat(element.relativePath()), element.constraint(), findings);
        }
    }

    private static void checkConstraints(FieldPath path, List<Constraint> constraints, List<Finding> findings) {
        if (constraints.isEmpty()) {
            findings.add(new Finding(Reason.EMPTY_CONSTRAINTS, path, "path has no constraints"));
        }
        for (Constraint constraint : constraints) {
            checkOperator(path, constraint, findings);
        }
    }

    private static void checkOperator(FieldPath path, Constraint constraint, List<Finding> findings) {
        if (!constraint.isBuiltIn()) {
            findings.add(new Finding(Reason.CUSTOM_OPERATOR, path,
                    "operator '" + constraint.operator() + "' is not built-in"));
        }
    }
}
