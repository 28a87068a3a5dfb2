/*
 * Copyright (c) 2025 Aegis Policy Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.aegis.policyengine.compiler.template;

import com.aegis.policyengine.api.model.Constraint;
import com.aegis.policyengine.api.model.ConstraintSet;
import com.aegis.policyengine.api.model.ElementConstraint;
import com.aegis.policyengine.api.model.PathConstraints;
import com.aegis.policyengine.api.model.PolicyClause;
import com.aegis.policyengine.api.model.Quantifier;
import com.aegis.policyengine.api.model.Residual;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds the residual values a compiled evaluator returns, once per compilation, so that
 * evaluation only allocates the witness-carrying {@link Residual.Conflict}.
 *
 * <p>For a scalar clause the Open residual names the path and restates all of its
 * constraints, and each conflict template names the path and one constraint. For a
 * quantifier the Open residual names the collection path and restates the element
 * constraints, while conflict templates name {@code collectionPath + relativePath}.
 */
public final class TemplateExtractor {

    public Templates extract(ConstraintSet constraintSet) {
        List<ClauseTemplate> templates = new ArrayList<>(constraintSet.size());
        for (PolicyClause clause : constraintSet.clauses()) {
            if (clause instanceof PathConstraints scalar) {
                templates.add(scalarTemplate(scalar));
            } else {
                templates.add(quantifierTemplate((Quantifier) clause));
            }
        }
        return new Templates(templates);
    }

    private static ClauseTemplate scalarTemplate(PathConstraints clause) {
        List<ConflictTemplate> conflicts = new ArrayList<>(clause.constraints().size());
        for (Constraint constraint : clause.constraints()) {
            conflicts.add(new ConflictTemplate(clause.path(), constraint));
        }
        return new ClauseTemplate(clause.path(), new Residual.Open(clause.path(), clause.constraints()), conflicts);
    }

    private static ClauseTemplate quantifierTemplate(Quantifier quantifier) {
        List<ConflictTemplate> conflicts = new ArrayList<>(quantifier.elementConstraints().size());
        for (ElementConstraint element : quantifier.elementConstraints()) {
            conflicts.add(new ConflictTemplate(
                    quantifier.collectionPath().concat(element.relativePath()), element.constraint()));
        }
        Residual.Open open = new Residual.Open(quantifier.collectionPath(), quantifier.constraints());
        return new ClauseTemplate(quantifier.collectionPath(), open, conflicts);
    }
}
