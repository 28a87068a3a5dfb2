/*
 * Copyright (c) 2025 Aegis Policy Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.aegis.policyengine.compiler.codegen;

import com.aegis.policyengine.api.exceptions.CompilationException;
import com.aegis.policyengine.api.model.ElementConstraint;
import com.aegis.policyengine.api.model.Quantifier;
import com.aegis.policyengine.compiler.template.ClauseTemplate;
import com.aegis.policyengine.compiler.template.ConflictTemplate;

import java.util.List;

/**
 * Emits the loop for a {@code forall} or {@code exists} clause.
 *
 * <p>Elements are visited one at a time through the collection's own iterator; nothing is
 * materialized per element. Conflicts that concern the collection as a whole (exists found no
 * match, or the value is not a collection) name the collection path and the first element
 * constraint.
 */
public final class QuantifierCompiler {

    private final ConstraintCheckFactory checkFactory;

    public QuantifierCompiler(ConstraintCheckFactory checkFactory) {
        this.checkFactory = checkFactory;
    }

    public CodeFragment compile(Quantifier quantifier, ClauseTemplate template) {
        List<ElementConstraint> elements = quantifier.elementConstraints();
        if (elements.isEmpty()) {
            throw new CompilationException("Quantifier over " + quantifier.collectionPath() + " has no element constraints");
        }
        if (template.conflicts().size() != elements.size()) {
            throw new CompilationException("Template does not match quantifier at " + quantifier.collectionPath());
        }

        ElementStep[] steps = new ElementStep[elements.size()];
        for (int i = 0; i < steps.length; i++) {
            ElementConstraint element = elements.get(i);
            steps[i] = new ElementStep(element.relativePath().toArray(),
                    checkFactory.create(element.constraint()), template.conflict(i));
        }
        ConflictTemplate collectionConflict = new ConflictTemplate(
                quantifier.collectionPath(), elements.get(0).constraint());
        String[] segments = quantifier.collectionPath().toArray();

        return switch (quantifier.kind()) {
            case FORALL -> new ForallFragment(segments, steps, template.open(), collectionConflict);
            case EXISTS -> new ExistsFragment(segments, steps, template.open(), collectionConflict);
        };
    }
}
