package com.aegis.policyengine.runtime;

import com.aegis.policyengine.api.model.CompilationTier;
import com.aegis.policyengine.api.model.Constraint;
import com.aegis.policyengine.api.model.ConstraintSet;
import com.aegis.policyengine.api.model.ElementConstraint;
import com.aegis.policyengine.api.model.Residual;
import com.aegis.policyengine.cache.CacheConfig;
import com.aegis.policyengine.compiler.CompilerConfig;
import com.aegis.policyengine.infra.metrics.impl.inmemory.InMemoryMetricsRegistry;
import com.aegis.policyengine.infra.registry.InMemoryOperatorRegistry;
import com.aegis.policyengine.runtime.evaluation.Evaluation;
import com.aegis.policyengine.runtime.evaluation.TieredPolicyEvaluator;
import io.opentelemetry.api.OpenTelemetry;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class PolicyEngineFactoryTest {

    @Test
    void wiresConfiguredEngine() {
        InMemoryMetricsRegistry metrics = new InMemoryMetricsRegistry();
        TieredPolicyEvaluator engine = PolicyEngineFactory.create(
                new InMemoryOperatorRegistry(),
                (set, document) -> Residual.satisfied(),
                CompilerConfig.builder().quantifierCompilation(true).build(),
                CacheConfig.builder().capacity(4).build(),
                OpenTelemetry.noop().getTracer("test"),
                metrics);
        ConstraintSet set = ConstraintSet.builder()
                .require("user.role", Constraint.eq("buyer"))
                .forall("items", ElementConstraint.of("qty", Constraint.lte(5)))
                .build();

        Evaluation evaluation = engine.evaluate(set, Map.of(
                "user", Map.of("role", "buyer"),
                "items", List.of(Map.of("qty", 2), Map.of("qty", 5))));

        assertThat(evaluation.tier()).isEqualTo(CompilationTier.INLINED);
        assertThat(evaluation.isSatisfied()).isTrue();
        assertThat(engine.cache().capacity()).isEqualTo(4);
        assertThat(metrics.getTimerRecordings("policy_compilation")).hasSize(1);
    }
}
