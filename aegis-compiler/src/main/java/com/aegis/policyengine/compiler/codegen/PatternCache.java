package com.aegis.policyengine.compiler.codegen;

import com.aegis.policyengine.api.exceptions.CompilationException;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.stats.CacheStats;

import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Bounded cache of compiled regular expressions shared by every policy a compiler builds,
 * so that policies repeating a pattern share one immutable {@link Pattern}.
 */
public final class PatternCache {

    private final Cache<String, Pattern> patterns;

    public PatternCache(int maximumSize) {
        this.patterns = Caffeine.newBuilder()
                .maximumSize(maximumSize)
                .recordStats()
                .build();
    }

    public Pattern get(String regex) {
        try {
            return patterns.get(regex, Pattern::compile);
        } catch (PatternSyntaxException e) {
            throw new CompilationException("Invalid regular expression: " + regex, e);
        }
    }

    public long estimatedSize() {
        return patterns.estimatedSize();
    }

    public CacheStats stats() {
        return patterns.stats();
    }
}
