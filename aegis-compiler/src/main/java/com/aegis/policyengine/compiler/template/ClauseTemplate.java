package com.aegis.policyengine.compiler.template;

import com.aegis.policyengine.api.model.FieldPath;
import com.aegis.policyengine.api.model.Residual;

import java.util.List;

/**
 * Residual data pre-computed for one clause.
 *
 * @param path      the clause path (the collection path for quantifiers)
 * @param open      returned verbatim when the value at {@code path} is absent
 * @param conflicts one template per constraint, in declaration order
 */
public record ClauseTemplate(FieldPath path, Residual.Open open, List<ConflictTemplate> conflicts) {

    public ClauseTemplate {
        conflicts = List.copyOf(conflicts);
    }

    public ConflictTemplate conflict(int constraintIndex) {
        return conflicts.get(constraintIndex);
    }
}
