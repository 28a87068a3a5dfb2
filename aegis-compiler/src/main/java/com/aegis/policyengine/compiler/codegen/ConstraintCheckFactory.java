package com.aegis.policyengine.compiler.codegen;

import com.aegis.policyengine.api.exceptions.CompilationException;
import com.aegis.policyengine.api.model.Constraint;
import com.aegis.policyengine.api.model.Operator;
import it.unimi.dsi.fastutil.longs.LongOpenHashSet;
import it.unimi.dsi.fastutil.longs.LongSet;
import it.unimi.dsi.fastutil.longs.LongSets;

import java.util.Set;

/**
 * Selects the {@link ConstraintCheck} variant for a constraint and pre-computes its operand.
 */
public final class ConstraintCheckFactory {

    private final PatternCache patternCache;

    public ConstraintCheckFactory(PatternCache patternCache) {
        this.patternCache = patternCache;
    }

    /**
     * @throws CompilationException if the operator has no compiled form
     */
    public ConstraintCheck create(Constraint constraint) {
        Operator op = constraint.builtin().orElseThrow(() -> new CompilationException(
                "Unsupported operator for compilation: " + constraint.operator()));

        return switch (op) {
            case EQ -> constraint.value() instanceof Long l
                    ? new ConstraintCheck.LongEquals(l)
                    : new ConstraintCheck.ValueEquals(constraint.value());
            case NEQ -> constraint.value() instanceof Long l
                    ? new ConstraintCheck.LongNotEquals(l)
                    : new ConstraintCheck.ValueNotEquals(constraint.value());
            case GT -> new ConstraintCheck.GreaterThan(constraint.bound());
            case LT -> new ConstraintCheck.LessThan(constraint.bound());
            case GTE -> new ConstraintCheck.AtLeast(constraint.bound());
            case LTE -> new ConstraintCheck.AtMost(constraint.bound());
            case IN -> {
                LongSet longs = asLongSet(constraint.members());
                yield longs != null ? new ConstraintCheck.LongIn(longs) : new ConstraintCheck.ValueIn(constraint.members());
            }
            case NOT_IN -> {
                LongSet longs = asLongSet(constraint.members());
                yield longs != null ? new ConstraintCheck.LongNotIn(longs) : new ConstraintCheck.ValueNotIn(constraint.members());
            }
            case MATCHES -> new ConstraintCheck.Matches(patternCache.get((String) constraint.value()));
            case NOT_MATCHES -> new ConstraintCheck.NotMatches(patternCache.get((String) constraint.value()));
        };
    }

    /**
     * Primitive copy of {@code members} if every member is a Long, otherwise {@code null}.
     */
    private static LongSet asLongSet(Set<Object> members) {
        if (members.isEmpty()) {
            return null;
        }
        LongOpenHashSet longs = new LongOpenHashSet(members.size());
        for (Object member : members) {
            if (!(member instanceof Long l)) {
                return null;
            }
            longs.add(l.longValue());
        }
        longs.trim();
        return LongSets.unmodifiable(longs);
    }
}
