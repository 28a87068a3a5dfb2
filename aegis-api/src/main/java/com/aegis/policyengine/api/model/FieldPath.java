/*
 * Copyright (c) 2025 Aegis Policy Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.aegis.policyengine.api.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Ordered sequence of field selectors addressing a value inside a document.
 *
 * <p>Paths compare structurally. The empty path is representable so that malformed
 * constraint sets can be described and rejected by eligibility analysis; inside a
 * quantifier it addresses the collection element itself.
 */
public record FieldPath(List<String> segments) {

    private static final FieldPath ROOT = new FieldPath(List.of());

    public FieldPath {
        Objects.requireNonNull(segments, "segments must not be null");
        for (String segment : segments) {
            if (segment == null || segment.isEmpty()) {
                throw new IllegalArgumentException("Path segments must be non-empty: " + segments);
            }
        }
        segments = List.copyOf(segments);
    }

    public static FieldPath of(String... segments) {
        return segments.length == 0 ? ROOT : new FieldPath(Arrays.asList(segments));
    }

    /**
     * Parses a dotted path such as {@code user.role}. A blank string yields the root path.
     */
    public static FieldPath parse(String dotted) {
        Objects.requireNonNull(dotted, "dotted path must not be null");
        if (dotted.isBlank()) {
            return ROOT;
        }
        return new FieldPath(Arrays.asList(dotted.trim().split("\\.")));
    }

    public static FieldPath root() {
        return ROOT;
    }

    public boolean isEmpty() {
        return segments.isEmpty();
    }

    public int size() {
        return segments.size();
    }

    public String segment(int index) {
        return segments.get(index);
    }

    public FieldPath concat(FieldPath suffix) {
        if (suffix.isEmpty()) {
            return this;
        }
        if (isEmpty()) {
            return suffix;
        }
        List<String> joined = new ArrayList<>(segments.size() + suffix.size());
        joined.addAll(segments);
        joined.addAll(suffix.segments);
        return new FieldPath(joined);
    }

    public String[] toArray() {
        return segments.toArray(new String[0]);
    }

    public String dotted() {
        return String.join(".", segments);
    }

    @Override
    public String toString() {
        return segments.toString();
    }
}
