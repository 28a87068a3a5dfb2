package com.aegis.policyengine.runtime.evaluation;

import com.aegis.policyengine.api.model.CompilationTier;
import com.aegis.policyengine.api.model.Residual;

/**
 * Residual of one evaluation together with the tier that produced it.
 */
public record Evaluation(Residual residual, CompilationTier tier) {

    public boolean isSatisfied() {
        return residual.isSatisfied();
    }
}
