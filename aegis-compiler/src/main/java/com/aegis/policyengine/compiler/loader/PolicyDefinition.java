package com.aegis.policyengine.compiler.loader;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * JSON representation of a named constraint set.
 * This is a simple Data Transfer Object (DTO) used only for loading.
 *
 * <pre>{@code
 * {
 *   "policy_id": "bulk-order",
 *   "clauses": [
 *     {"path": "user.role", "constraints": [{"op": "in", "value": ["buyer", "admin"]}]},
 *     {"quantifier": "forall", "path": "items",
 *      "element_constraints": [{"path": "qty", "op": "lte", "value": 5}]}
 *   ]
 * }
 * }</pre>
 */
public record PolicyDefinition(
        @JsonProperty("policy_id") String policyId,
        @JsonProperty("clauses") List<Clause> clauses,
        @JsonProperty("enabled") Boolean enabled
) {
    /**
     * A scalar clause when {@code quantifier} is absent, otherwise a quantifier over the
     * collection at {@code path}.
     */
    public record Clause(
            @JsonProperty("path") String path,
            @JsonProperty("quantifier") String quantifier,
            @JsonProperty("constraints") List<ConstraintEntry> constraints,
            @JsonProperty("element_constraints") List<ElementEntry> elementConstraints
    ) {}

    public record ConstraintEntry(
            @JsonProperty("op") String op,
            @JsonProperty("value") Object value
    ) {}

    public record ElementEntry(
            @JsonProperty("path") String path,
            @JsonProperty("op") String op,
            @JsonProperty("value") Object value
    ) {}

    public Boolean enabled() {
        return enabled != null ? enabled : true;
    }

    public List<Clause> clauses() {
        return clauses != null ? clauses : List.of();
    }
}
