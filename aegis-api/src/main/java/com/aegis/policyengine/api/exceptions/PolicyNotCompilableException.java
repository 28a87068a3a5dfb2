package com.aegis.policyengine.api.exceptions;

import com.aegis.policyengine.api.model.EligibilityReport;

/**
 * The constraint set failed eligibility analysis and must be evaluated by the interpreter.
 */
public class PolicyNotCompilableException extends CompilationException {

    private final transient EligibilityReport report;

    public PolicyNotCompilableException(EligibilityReport report) {
        super("Constraint set is not eligible for compilation: " + String.join("; ", report.reasons()));
        this.report = report;
    }

    public EligibilityReport getReport() {
        return report;
    }
}
