/*
 * Copyright (c) 2025 Aegis Policy Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.aegis.policyengine.api.model;

import java.util.List;

/**
 * Result of eligibility analysis. An eligible report carries no findings.
 */
public record EligibilityReport(boolean eligible, List<Finding> findings) {

    private static final EligibilityReport ELIGIBLE = new EligibilityReport(true, List.of());

    public enum Reason {
        EMPTY_CONSTRAINT_SET,
        EMPTY_PATH,
        EMPTY_CONSTRAINTS,
        CUSTOM_OPERATOR,
        QUANTIFIER_NOT_SUPPORTED
    }

    public record Finding(Reason reason, FieldPath path, String detail) {
        @Override
        public String toString() {
            return reason + " at " + path + ": " + detail;
        }
    }

    public EligibilityReport {
        findings = List.copyOf(findings);
        if (eligible && !findings.isEmpty()) {
            throw new IllegalArgumentException("An eligible report cannot carry findings");
        }
    }

    public static EligibilityReport eligibleReport() {
        return ELIGIBLE;
    }

    public static EligibilityReport ineligible(List<Finding> findings) {
        if (findings.isEmpty()) {
            throw new IllegalArgumentException("An ineligible report needs at least one finding");
        }
        return new EligibilityReport(false, findings);
    }

    public boolean hasReason(Reason reason) {
        return findings.stream().anyMatch(f -> f.reason() == reason);
    }

    public List<String> reasons() {
        return findings.stream().map(Finding::toString).toList();
    }
}
