/*
 * Copyright (c) 2025 Aegis Policy Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.aegis.policyengine.api.model;

import java.io.Serializable;

/**
 * Point-in-time counters of a compiled-evaluator cache.
 *
 * @param hits     lookups served from the cache
 * @param misses   lookups that compiled, or failed eligibility
 * @param total    {@code hits + misses}
 * @param hitRate  {@code hits / total}, or {@code 0.0} before the first lookup
 * @param size     entries currently held
 */
public record CacheStats(
        long hits,
        long misses,
        long total,
        double hitRate,
        int size
) implements Serializable {

    public static CacheStats of(long hits, long misses, int size) {
        long total = hits + misses;
        double hitRate = total == 0 ? 0.0 : (double) hits / total;
        return new CacheStats(hits, misses, total, hitRate, size);
    }
}
