package com.aegis.policyengine.compiler.codegen;

import com.aegis.policyengine.api.model.Residual;
import com.aegis.policyengine.compiler.template.ConflictTemplate;

/**
 * Universal quantifier: every element must satisfy every element constraint.
 *
 * <ul>
 *   <li>collection absent, or an element field absent: Open</li>
 *   <li>first failing element constraint: Conflict with the element's value as witness</li>
 *   <li>collection exhausted (including empty): falls through</li>
 *   <li>value is not a collection: Conflict on the collection path with the value as witness</li>
 * </ul>
 */
final class ForallFragment implements CodeFragment {

    private final String[] collectionSegments;
    private final ElementStep[] steps;
    private final Residual.Open open;
    private final ConflictTemplate notACollection;

    ForallFragment(String[] collectionSegments, ElementStep[] steps, Residual.Open open,
                   ConflictTemplate notACollection) {
        this.collectionSegments = collectionSegments;
        this.steps = steps;
        this.open = open;
        this.notACollection = notACollection;
    }

    @Override
    public Residual execute(Object document) {
        Object collection = DocumentNavigator.resolve(document, collectionSegments);
        if (collection == null) {
            return open;
        }
        if (collection instanceof Iterable<?> elements) {
            for (Object element : elements) {
                Residual residual = checkElement(element);
                if (residual != Residual.satisfied()) {
                    return residual;
                }
            }
            return Residual.satisfied();
        }
        if (collection instanceof Object[] elements) {
            for (Object element : elements) {
                Residual residual = checkElement(element);
                if (residual != Residual.satisfied()) {
                    return residual;
                }
            }
            return Residual.satisfied();
        }
        return notACollection.withWitness(collection);
    }

    private Residual checkElement(Object element) {
        for (ElementStep step : steps) {
            Object value = step.resolve(element);
            if (value == null) {
                return open;
            }
            if (!step.check().test(value)) {
                return step.conflict().withWitness(value);
            }
        }
        return Residual.satisfied();
    }

    @Override
    public String toString() {
        return "ForallFragment" + open.path();
    }
}
