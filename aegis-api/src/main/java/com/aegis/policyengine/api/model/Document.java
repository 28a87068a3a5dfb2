/*
 * Copyright (c) 2025 Aegis Policy Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.aegis.policyengine.api.model;

import java.util.Map;
import java.util.Objects;

/**
 * Read-only view of a nested document.
 *
 * <p>Nested values may themselves be {@code Document}s or plain {@link Map}s; collections
 * may be any {@link Iterable} or an object array. A {@code null} result means the field is
 * absent.
 */
public interface Document {

    Object get(String key);

    static Document of(Map<String, ?> fields) {
        return new MapDocument(fields);
    }

    static Document empty() {
        return MapDocument.EMPTY;
    }

    record MapDocument(Map<String, ?> fields) implements Document {

        static final MapDocument EMPTY = new MapDocument(Map.of());

        public MapDocument {
            Objects.requireNonNull(fields, "fields must not be null");
        }

        @Override
        public Object get(String key) {
            return fields.get(key);
        }
    }
}
