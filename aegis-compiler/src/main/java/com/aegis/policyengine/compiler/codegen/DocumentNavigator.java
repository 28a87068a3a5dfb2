package com.aegis.policyengine.compiler.codegen;

import com.aegis.policyengine.api.model.Document;

import java.util.Map;

/**
 * Path resolution over nested {@link Document}s and {@link Map}s.
 *
 * <p>Returns {@code null} when any segment is missing, or when an intermediate node is not
 * a map-like structure. An empty segment array resolves to the node itself.
 */
final class DocumentNavigator {

    private DocumentNavigator() {
        throw new AssertionError("No instances");
    }

    static Object resolve(Object node, String[] segments) {
        Object current = node;
        for (String segment : segments) {
            if (current == null) {
                return null;
            }
            current = lookup(current, segment);
        }
        return current;
    }

    static Object lookup(Object node, String key) {
        if (node instanceof Document document) {
            return document.get(key);
        }
        if (node instanceof Map<?, ?> map) {
            return map.get(key);
        }
        return null;
    }
}
