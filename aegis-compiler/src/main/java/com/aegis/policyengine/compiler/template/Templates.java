package com.aegis.policyengine.compiler.template;

import com.aegis.policyengine.api.model.FieldPath;

import java.util.List;
import java.util.Optional;

/**
 * Templates for every clause of a constraint set, indexed by clause position.
 */
public final class Templates {

    private final List<ClauseTemplate> clauses;

    Templates(List<ClauseTemplate> clauses) {
        this.clauses = List.copyOf(clauses);
    }

    public ClauseTemplate forClause(int clauseIndex) {
        return clauses.get(clauseIndex);
    }

    /**
     * First template declared for {@code path}; scalar paths are unique, quantifiers may share a
     * collection path.
     */
    public Optional<ClauseTemplate> forPath(FieldPath path) {
        return clauses.stream().filter(t -> t.path().equals(path)).findFirst();
    }

    public int size() {
        return clauses.size();
    }

    public TemplateInfo info() {
        int totalConstraints = clauses.stream().mapToInt(t -> t.conflicts().size()).sum();
        return new TemplateInfo(clauses.size(), clauses.stream().map(ClauseTemplate::path).toList(), totalConstraints);
    }
}
