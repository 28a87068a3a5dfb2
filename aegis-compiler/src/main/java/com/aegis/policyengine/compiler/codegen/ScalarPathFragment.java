package com.aegis.policyengine.compiler.codegen;

import com.aegis.policyengine.api.model.Residual;
import com.aegis.policyengine.compiler.template.ConflictTemplate;

import java.util.Arrays;

/**
 * Scalar path carrying several constraints, checked in declaration order against a single
 * resolution of the path.
 */
final class ScalarPathFragment implements CodeFragment {

    private final String[] segments;
    private final ConstraintCheck[] checks;
    private final Residual.Open open;
    private final ConflictTemplate[] conflicts;

    ScalarPathFragment(String[] segments, ConstraintCheck[] checks, Residual.Open open, ConflictTemplate[] conflicts) {
        if (checks.length != conflicts.length) {
            throw new IllegalArgumentException("Expected one conflict template per check");
        }
        this.segments = segments;
        this.checks = checks;
        this.open = open;
        this.conflicts = conflicts;
    }

    @Override
    public Residual execute(Object document) {
        Object value = DocumentNavigator.resolve(document, segments);
        if (value == null) {
            return open;
        }
        for (int i = 0; i < checks.length; i++) {
            if (!checks[i].test(value)) {
                return conflicts[i].withWitness(value);
            }
        }
        return Residual.satisfied();
    }

    @Override
    public String toString() {
        return "ScalarPathFragment" + open.path() + " " + Arrays.toString(checks);
    }
}
