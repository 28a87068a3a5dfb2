/*
 * Copyright (c) 2025 Aegis Policy Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.aegis.policyengine.api.model;

import java.util.List;

/**
 * One conjunct of a {@link ConstraintSet}: either constraints on a scalar path or a
 * quantifier over a collection path.
 */
public sealed interface PolicyClause permits PathConstraints, Quantifier {

    /** The document path this clause inspects. */
    FieldPath path();

    /** The constraints of this clause, in declaration order. */
    List<Constraint> constraints();
}
