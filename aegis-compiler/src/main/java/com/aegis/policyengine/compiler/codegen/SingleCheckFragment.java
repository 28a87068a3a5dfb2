package com.aegis.policyengine.compiler.codegen;

import com.aegis.policyengine.api.model.Residual;
import com.aegis.policyengine.compiler.template.ConflictTemplate;

/**
 * Scalar path carrying exactly one constraint.
 */
final class SingleCheckFragment implements CodeFragment {

    private final String[] segments;
    private final ConstraintCheck check;
    private final Residual.Open open;
    private final ConflictTemplate conflict;

    SingleCheckFragment(String[] segments, ConstraintCheck check, Residual.Open open, ConflictTemplate conflict) {
        this.segments = segments;
        this.check = check;
        this.open = open;
        this.conflict = conflict;
    }

    @Override
    public Residual execute(Object document) {
        Object value = DocumentNavigator.resolve(document, segments);
        if (value == null) {
            return open;
        }
        return check.test(value) ? Residual.satisfied() : conflict.withWitness(value);
    }

    @Override
    public String toString() {
        return "SingleCheckFragment" + open.path() + " " + check;
    }
}
