package com.aegis.policyengine.compiler.template;

import com.aegis.policyengine.api.model.Constraint;
import com.aegis.policyengine.api.model.FieldPath;
import com.aegis.policyengine.api.model.Residual;

/**
 * Pre-bound half of a {@link Residual.Conflict}: everything except the witness.
 */
public record ConflictTemplate(FieldPath path, Constraint constraint) {

    public Residual.Conflict withWitness(Object witness) {
        return new Residual.Conflict(path, constraint, witness);
    }
}
