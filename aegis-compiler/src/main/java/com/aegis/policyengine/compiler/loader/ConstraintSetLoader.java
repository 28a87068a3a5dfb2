package com.aegis.policyengine.compiler.loader;

import com.aegis.policyengine.api.exceptions.CompilationException;
import com.aegis.policyengine.api.model.Constraint;
import com.aegis.policyengine.api.model.ConstraintSet;
import com.aegis.policyengine.api.model.ElementConstraint;
import com.aegis.policyengine.api.model.FieldPath;
import com.aegis.policyengine.api.model.Quantifier;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Reads constraint sets from a JSON array of {@link PolicyDefinition}s.
 *
 * <p>Disabled policies are skipped. The result preserves file order, which makes it suitable
 * for cache warm-up. Operand validation errors and duplicate policy ids are reported as
 * {@link CompilationException}s naming the offending policy.
 */
public class ConstraintSetLoader {

    private static final Logger logger = Logger.getLogger(ConstraintSetLoader.class.getName());

    private final ObjectMapper objectMapper;

    public ConstraintSetLoader() {
        this(new ObjectMapper());
    }

    public ConstraintSetLoader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public Map<String, ConstraintSet> load(Path file) throws IOException {
        Map<String, ConstraintSet> sets = parse(Files.readString(file));
        logger.info(String.format("Loaded %d constraint set(s) from %s", sets.size(), file));
        return sets;
    }

    public Map<String, ConstraintSet> parse(String json) {
        List<PolicyDefinition> definitions;
        try {
            definitions = objectMapper.readValue(json,
                    objectMapper.getTypeFactory().constructCollectionType(List.class, PolicyDefinition.class));
        } catch (JsonProcessingException e) {
            throw new CompilationException("Malformed policy JSON: " + e.getOriginalMessage(), e);
        }

        Map<String, ConstraintSet> sets = new LinkedHashMap<>();
        for (PolicyDefinition definition : definitions) {
            if (definition.policyId() == null || definition.policyId().isBlank()) {
                throw new CompilationException("Policy definition without policy_id");
            }
            if (!definition.enabled()) {
                logger.fine("Skipping disabled policy " + definition.policyId());
                continue;
            }
            if (sets.containsKey(definition.policyId())) {
                throw new CompilationException("Duplicate policy_id: " + definition.policyId());
            }
            try {
                sets.put(definition.policyId(), toConstraintSet(definition));
            } catch (IllegalArgumentException | NullPointerException e) {
                throw new CompilationException(
                        "Invalid policy '" + definition.policyId() + "': " + e.getMessage(), e);
            }
        }
        return sets;
    }

    private static ConstraintSet toConstraintSet(PolicyDefinition definition) {
        ConstraintSet.Builder builder = ConstraintSet.builder();
        for (PolicyDefinition.Clause clause : definition.clauses()) {
            FieldPath path = FieldPath.parse(clause.path() == null ? "" : clause.path());
            if (clause.quantifier() == null) {
                List<Constraint> constraints = new ArrayList<>();
                if (clause.constraints() != null) {
                    for (PolicyDefinition.ConstraintEntry entry : clause.constraints()) {
                        constraints.add(new Constraint(entry.op(), entry.value()));
                    }
                }
                builder.path(path, constraints);
            } else {
                List<ElementConstraint> elements = new ArrayList<>();
                if (clause.elementConstraints() != null) {
                    for (PolicyDefinition.ElementEntry entry : clause.elementConstraints()) {
                        elements.add(new ElementConstraint(
                                FieldPath.parse(entry.path() == null ? "" : entry.path()),
                                new Constraint(entry.op(), entry.value())));
                    }
                }
                builder.clause(new Quantifier(Quantifier.Kind.fromSymbol(clause.quantifier()), path, elements));
            }
        }
        return builder.build();
    }
}
