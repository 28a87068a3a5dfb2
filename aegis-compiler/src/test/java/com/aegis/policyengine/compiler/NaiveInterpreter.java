package com.aegis.policyengine.compiler;

import com.aegis.policyengine.api.IPolicyInterpreter;
import com.aegis.policyengine.api.model.Constraint;
import com.aegis.policyengine.api.model.ConstraintSet;
import com.aegis.policyengine.api.model.Document;
import com.aegis.policyengine.api.model.ElementConstraint;
import com.aegis.policyengine.api.model.FieldPath;
import com.aegis.policyengine.api.model.PolicyClause;
import com.aegis.policyengine.api.model.Quantifier;
import com.aegis.policyengine.api.model.Residual;
import com.aegis.policyengine.api.model.Scalars;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Straightforward tree-walking evaluator used as the reference for compiled output.
 */
class NaiveInterpreter implements IPolicyInterpreter {

    @Override
    public Residual interpret(ConstraintSet constraintSet, Document document) {
        for (PolicyClause clause : constraintSet.clauses()) {
            Residual residual = clause instanceof Quantifier q
                    ? quantifier(q, document)
                    : scalar(clause.path(), clause.constraints(), document);
            if (!residual.isSatisfied()) {
                return residual;
            }
        }
        return Residual.satisfied();
    }

    private Residual scalar(FieldPath path, List<Constraint> constraints, Object document) {
        Object value = resolve(document, path);
        if (value == null) {
            return new Residual.Open(path, constraints);
        }
        for (Constraint c : constraints) {
            if (!holds(c, value)) {
                return new Residual.Conflict(path, c, value);
            }
        }
        return Residual.satisfied();
    }

    private Residual quantifier(Quantifier q, Object document) {
        Object collection = resolve(document, q.collectionPath());
        Residual.Open open = new Residual.Open(q.collectionPath(), q.constraints());
        if (collection == null) {
            return open;
        }
        Residual.Conflict whole = new Residual.Conflict(
                q.collectionPath(), q.elementConstraints().get(0).constraint(), collection);
        List<?> elements;
        if (collection instanceof List<?> list) {
            elements = list;
        } else if (collection instanceof Object[] array) {
            elements = Arrays.asList(array);
        } else {
            return whole;
        }
        for (Object element : elements) {
            boolean allHold = true;
            for (ElementConstraint ec : q.elementConstraints()) {
                Object value = resolve(element, ec.relativePath());
                if (q.kind() == Quantifier.Kind.FORALL) {
                    if (value == null) {
                        return open;
                    }
                    if (!holds(ec.constraint(), value)) {
                        return new Residual.Conflict(
                                q.collectionPath().concat(ec.relativePath()), ec.constraint(), value);
                    }
                } else if (value == null || !holds(ec.constraint(), value)) {
                    allHold = false;
                    break;
                }
            }
            if (q.kind() == Quantifier.Kind.EXISTS && allHold) {
                return Residual.satisfied();
            }
        }
        return q.kind() == Quantifier.Kind.FORALL ? Residual.satisfied() : whole;
    }

    private static Object resolve(Object node, FieldPath path) {
        Object current = node;
        for (String segment : path.segments()) {
            if (current instanceof Document d) {
                current = d.get(segment);
            } else if (current instanceof Map<?, ?> m) {
                current = m.get(segment);
            } else {
                return null;
            }
        }
        return current;
    }

    private static boolean holds(Constraint c, Object value) {
        Object v = Scalars.normalize(value);
        switch (c.operator()) {
            case "eq":
                return numericEquals(c.value(), v);
            case "neq":
                return !numericEquals(c.value(), v);
            case "gt":
                return v instanceof Number n && n.doubleValue() > c.bound();
            case "lt":
                return v instanceof Number n && n.doubleValue() < c.bound();
            case "gte":
                return v instanceof Number n && n.doubleValue() >= c.bound();
            case "lte":
                return v instanceof Number n && n.doubleValue() <= c.bound();
            case "in":
                return c.members().stream().anyMatch(m -> numericEquals(m, v));
            case "not-in":
                return c.members().stream().noneMatch(m -> numericEquals(m, v));
            case "matches":
                return Pattern.compile((String) c.value()).matcher(String.valueOf(value)).matches();
            case "not-matches":
                return !Pattern.compile((String) c.value()).matcher(String.valueOf(value)).matches();
            default:
                throw new IllegalStateException("Unknown operator " + c.operator());
        }
    }

    private static boolean numericEquals(Object expected, Object value) {
        if (expected instanceof Long l && value instanceof Number n) {
            return n.doubleValue() == l;
        }
        return expected.equals(value);
    }
}
