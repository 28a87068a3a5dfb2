package com.aegis.policyengine.compiler.codegen;

import com.aegis.policyengine.compiler.template.ConflictTemplate;

/**
 * One element constraint of a quantifier: where to look inside the element, what to check,
 * and what to report when the check fails.
 */
record ElementStep(String[] relativeSegments, ConstraintCheck check, ConflictTemplate conflict) {

    Object resolve(Object element) {
        return DocumentNavigator.resolve(element, relativeSegments);
    }
}
