package com.aegis.policyengine.runtime.evaluation;

import com.aegis.policyengine.api.IPolicyInterpreter;
import com.aegis.policyengine.api.model.CompilationTier;
import com.aegis.policyengine.api.model.Constraint;
import com.aegis.policyengine.api.model.ConstraintSet;
import com.aegis.policyengine.api.model.Document;
import com.aegis.policyengine.api.model.ElementConstraint;
import com.aegis.policyengine.api.model.FieldPath;
import com.aegis.policyengine.api.model.Residual;
import com.aegis.policyengine.cache.CacheConfig;
import com.aegis.policyengine.cache.CompiledEvaluatorCache;
import com.aegis.policyengine.compiler.CompilerConfig;
import com.aegis.policyengine.compiler.PolicyCompiler;
import com.aegis.policyengine.infra.metrics.impl.inmemory.InMemoryMetricsRegistry;
import com.aegis.policyengine.infra.registry.InMemoryOperatorRegistry;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Tracer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class TieredPolicyEvaluatorTest {

    private static final Tracer TRACER = OpenTelemetry.noop().getTracer("test");

    @Mock
    private IPolicyInterpreter interpreter;

    private InMemoryOperatorRegistry registry;
    private TieredPolicyEvaluator evaluator;

    @BeforeEach
    void setUp() {
        registry = new InMemoryOperatorRegistry();
        InMemoryMetricsRegistry metrics = new InMemoryMetricsRegistry();
        PolicyCompiler compiler = new PolicyCompiler(registry, CompilerConfig.defaults(), TRACER, metrics);
        CompiledEvaluatorCache cache = new CompiledEvaluatorCache(
                compiler, registry, CacheConfig.defaults(), metrics, TRACER);
        evaluator = new TieredPolicyEvaluator(cache, compiler, interpreter);
    }

    @Test
    @DisplayName("Eligible sets are served by inlined code through the cache")
    void eligibleSetIsCompiled() {
        ConstraintSet set = ConstraintSet.builder().require("role", Constraint.eq("admin")).build();

        Evaluation first = evaluator.evaluate(set, Map.of("role", "admin"));
        Evaluation second = evaluator.evaluate(set, Map.of("role", "guest"));

        assertThat(first.tier()).isEqualTo(CompilationTier.INLINED);
        assertThat(first.isSatisfied()).isTrue();
        assertThat(second.residual())
                .isEqualTo(new Residual.Conflict(FieldPath.of("role"), Constraint.eq("admin"), "guest"));
        assertThat(evaluator.cache().stats().hits()).isEqualTo(1);
        verify(interpreter, never()).interpret(any(), any());
    }

    @Test
    @DisplayName("Custom operators are routed to the interpreter")
    void customOperatorIsInterpreted() {
        ConstraintSet set = ConstraintSet.builder()
                .require("location", Constraint.custom("within-radius", 10))
                .build();
        Document document = Document.of(Map.of("location", "here"));
        when(interpreter.interpret(set, document)).thenReturn(Residual.satisfied());

        Evaluation evaluation = evaluator.evaluate(set, document);

        assertThat(evaluation).isEqualTo(new Evaluation(Residual.satisfied(), CompilationTier.INTERPRETED));
        assertThat(evaluator.cache().size()).isZero();
    }

    @Test
    @DisplayName("Quantifiers are interpreted while quantifier compilation is off")
    void quantifierIsInterpreted() {
        ConstraintSet set = ConstraintSet.builder()
                .exists("items", ElementConstraint.of("qty", Constraint.gt(5)))
                .build();
        Residual.Open open = new Residual.Open(FieldPath.of("items"), List.of(Constraint.gt(5)));
        when(interpreter.interpret(any(), any())).thenReturn(open);

        Evaluation evaluation = evaluator.evaluate(set, Map.of());

        assertThat(evaluation.tier()).isEqualTo(CompilationTier.INTERPRETED);
        assertThat(evaluation.residual()).isEqualTo(open);
    }

    @Test
    @DisplayName("A registry change is picked up on the next evaluation")
    void registryChangeRecompiles() {
        ConstraintSet set = ConstraintSet.builder().require("age", Constraint.gte(18)).build();
        evaluator.evaluate(set, Map.of("age", 20));

        registry.bumpVersion();
        Evaluation evaluation = evaluator.evaluate(set, Map.of("age", 10));

        assertThat(evaluation.residual().isConflict()).isTrue();
        assertThat(evaluator.cache().stats().misses()).isEqualTo(2);
    }
}
