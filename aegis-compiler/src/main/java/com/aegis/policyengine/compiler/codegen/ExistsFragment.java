package com.aegis.policyengine.compiler.codegen;

import com.aegis.policyengine.api.model.Residual;
import com.aegis.policyengine.compiler.template.ConflictTemplate;

/**
 * Existential quantifier: some element must satisfy every element constraint.
 *
 * <ul>
 *   <li>collection absent: Open</li>
 *   <li>first fully matching element: falls through</li>
 *   <li>an element with an absent field or a failing check does not match; iteration moves on</li>
 *   <li>collection exhausted (including empty), or value is not a collection: Conflict on the
 *       collection path, with the collection value as witness</li>
 * </ul>
 */
final class ExistsFragment implements CodeFragment {

    private final String[] collectionSegments;
    private final ElementStep[] steps;
    private final Residual.Open open;
    private final ConflictTemplate noMatch;

    ExistsFragment(String[] collectionSegments, ElementStep[] steps, Residual.Open open, ConflictTemplate noMatch) {
        this.collectionSegments = collectionSegments;
        this.steps = steps;
        this.open = open;
        this.noMatch = noMatch;
    }

    @Override
    public Residual execute(Object document) {
        Object collection = DocumentNavigator.resolve(document, collectionSegments);
        if (collection == null) {
            return open;
        }
        if (collection instanceof Iterable<?> elements) {
            for (Object element : elements) {
                if (matches(element)) {
                    return Residual.satisfied();
                }
            }
        } else if (collection instanceof Object[] elements) {
            for (Object element : elements) {
                if (matches(element)) {
                    return Residual.satisfied();
                }
            }
        }
        return noMatch.withWitness(collection);
    }

    private boolean matches(Object element) {
        for (ElementStep step : steps) {
            Object value = step.resolve(element);
            if (value == null || !step.check().test(value)) {
                return false;
            }
        }
        return true;
    }

    @Override
    public String toString() {
        return "ExistsFragment" + open.path();
    }
}
