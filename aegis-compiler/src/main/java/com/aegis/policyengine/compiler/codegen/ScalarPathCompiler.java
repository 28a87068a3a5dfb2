/*
 * Copyright (c) 2025 Aegis Policy Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.aegis.policyengine.compiler.codegen;

import com.aegis.policyengine.api.exceptions.CompilationException;
import com.aegis.policyengine.api.model.Constraint;
import com.aegis.policyengine.api.model.FieldPath;
import com.aegis.policyengine.compiler.template.ClauseTemplate;
import com.aegis.policyengine.compiler.template.ConflictTemplate;

import java.util.List;

/**
 * Emits the fragment for one scalar path.
 *
 * <p>The fragment resolves the path once, returns the pre-built Open residual if any
 * segment or the value is absent, and otherwise runs the specialized checks in declaration
 * order, returning the first failing constraint's conflict with the resolved value as
 * witness.
 */
public final class ScalarPathCompiler {

    private final ConstraintCheckFactory checkFactory;

    public ScalarPathCompiler(ConstraintCheckFactory checkFactory) {
        this.checkFactory = checkFactory;
    }

    public CodeFragment compile(FieldPath path, List<Constraint> constraints, ClauseTemplate template) {
        if (constraints.isEmpty()) {
            throw new CompilationException("Path " + path + " has no constraints to compile");
        }
        if (!template.path().equals(path) || template.conflicts().size() != constraints.size()) {
            throw new CompilationException("Template does not match clause at " + path);
        }
        String[] segments = path.toArray();
        if (constraints.size() == 1) {
            return new SingleCheckFragment(segments, checkFactory.create(constraints.get(0)),
                    template.open(), template.conflict(0));
        }
        ConstraintCheck[] checks = new ConstraintCheck[constraints.size()];
        for (int i = 0; i < checks.length; i++) {
            checks[i] = checkFactory.create(constraints.get(i));
        }
        return new ScalarPathFragment(segments, checks, template.open(),
                template.conflicts().toArray(new ConflictTemplate[0]));
    }
}
