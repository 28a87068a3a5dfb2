package com.aegis.policyengine.cache;

import com.aegis.policyengine.api.model.Constraint;
import com.aegis.policyengine.api.model.ConstraintSet;
import com.aegis.policyengine.api.model.ElementConstraint;
import com.aegis.policyengine.api.model.FieldPath;
import com.aegis.policyengine.api.model.PolicyClause;
import com.aegis.policyengine.api.model.Quantifier;
import com.google.common.hash.HashCode;
import com.google.common.hash.HashFunction;
import com.google.common.hash.Hasher;
import com.google.common.hash.Hashing;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Cache key of a compiled evaluator: the constraint set, structurally, plus the operator
 * registry version it was compiled against.
 *
 * <p>A 128-bit murmur3 fingerprint is computed once at construction and used as the hash
 * code. Member sets are hashed in sorted order so equal sets fingerprint equally regardless
 * of iteration order. Equality falls back to a structural comparison of the sets, so a
 * fingerprint collision never returns the wrong evaluator.
 */
public final class PolicySignature {

    private static final HashFunction FINGERPRINT = Hashing.murmur3_128();

    private final ConstraintSet constraintSet;
    private final long registryVersion;
    private final HashCode fingerprint;

    private PolicySignature(ConstraintSet constraintSet, long registryVersion, HashCode fingerprint) {
        this.constraintSet = constraintSet;
        this.registryVersion = registryVersion;
        this.fingerprint = fingerprint;
    }

    public static PolicySignature of(ConstraintSet constraintSet, long registryVersion) {
        Objects.requireNonNull(constraintSet, "constraintSet must not be null");
        Hasher hasher = FINGERPRINT.newHasher().putLong(registryVersion);
        for (PolicyClause clause : constraintSet.clauses()) {
            if (clause instanceof Quantifier quantifier) {
                hasher.putString(quantifier.kind().symbol(), StandardCharsets.UTF_8);
                putPath(hasher, quantifier.collectionPath());
                for (ElementConstraint element : quantifier.elementConstraints()) {
                    putPath(hasher, element.relativePath());
                    putConstraint(hasher, element.constraint());
                }
            } else {
                hasher.putChar('p');
                putPath(hasher, clause.path());
                for (Constraint constraint : clause.constraints()) {
                    putConstraint(hasher, constraint);
                }
            }
            hasher.putChar(';');
        }
        return new PolicySignature(constraintSet, registryVersion, hasher.hash());
    }

    public ConstraintSet constraintSet() {
        return constraintSet;
    }

    public long registryVersion() {
        return registryVersion;
    }

    public HashCode fingerprint() {
        return fingerprint;
    }

    private static void putPath(Hasher hasher, FieldPath path) {
        hasher.putInt(path.size());
        for (String segment : path.segments()) {
            hasher.putString(segment, StandardCharsets.UTF_8).putChar('.');
        }
    }

    private static void putConstraint(Hasher hasher, Constraint constraint) {
        hasher.putString(constraint.operator(), StandardCharsets.UTF_8).putChar('=');
        Object value = constraint.value();
        if (value instanceof Collection<?> members) {
            List<String> canonical = new ArrayList<>(members.size());
            for (Object member : members) {
                canonical.add(canonical(member));
            }
            canonical.sort(null);
            hasher.putInt(canonical.size());
            for (String member : canonical) {
                hasher.putString(member, StandardCharsets.UTF_8).putChar(',');
            }
        } else {
            hasher.putString(canonical(value), StandardCharsets.UTF_8);
        }
    }

    private static String canonical(Object value) {
        return value == null ? "null" : value.getClass().getName() + ':' + value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof PolicySignature other)) {
            return false;
        }
        return registryVersion == other.registryVersion
                && fingerprint.equals(other.fingerprint)
                && constraintSet.equals(other.constraintSet);
    }

    @Override
    public int hashCode() {
        return fingerprint.asInt();
    }

    @Override
    public String toString() {
        return "PolicySignature{" + fingerprint + "@v" + registryVersion + "}";
    }
}
