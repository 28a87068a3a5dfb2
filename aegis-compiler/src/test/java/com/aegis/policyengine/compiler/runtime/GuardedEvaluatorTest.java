package com.aegis.policyengine.compiler.runtime;

import com.aegis.policyengine.api.IPolicyInterpreter;
import com.aegis.policyengine.api.model.CompilationTier;
import com.aegis.policyengine.api.model.Constraint;
import com.aegis.policyengine.api.model.ConstraintSet;
import com.aegis.policyengine.api.model.Document;
import com.aegis.policyengine.api.model.FieldPath;
import com.aegis.policyengine.api.model.Residual;
import com.aegis.policyengine.compiler.PolicyCompiler;
import com.aegis.policyengine.infra.registry.InMemoryOperatorRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class GuardedEvaluatorTest {

    private static final ConstraintSet SET = ConstraintSet.builder()
            .require("role", Constraint.eq("admin"))
            .build();

    @Mock
    private IPolicyInterpreter interpreter;

    private InMemoryOperatorRegistry registry;
    private GuardedEvaluator evaluator;

    @BeforeEach
    void setUp() {
        registry = new InMemoryOperatorRegistry();
        CompiledPolicy compiled = new PolicyCompiler(registry).compile(SET);
        evaluator = new GuardedEvaluator(compiled, registry, interpreter);
    }

    @Test
    @DisplayName("Runs compiled code while the registry version is unchanged")
    void runsCompiledCode() {
        Residual residual = evaluator.evaluate(Map.of("role", "guest"));

        assertThat(residual).isEqualTo(new Residual.Conflict(FieldPath.of("role"), Constraint.eq("admin"), "guest"));
        assertThat(evaluator.isStale()).isFalse();
        assertThat(evaluator.tier()).isEqualTo(CompilationTier.GUARDED);
        verify(interpreter, never()).interpret(any(), any());
    }

    @Test
    @DisplayName("Delegates to the interpreter once the registry version moves")
    void delegatesWhenStale() {
        Document document = Document.of(Map.of("role", "guest"));
        when(interpreter.interpret(eq(SET), eq(document))).thenReturn(Residual.satisfied());

        registry.bumpVersion();

        assertThat(evaluator.isStale()).isTrue();
        assertThat(evaluator.evaluate(document)).isSameAs(Residual.satisfied());
        verify(interpreter).interpret(SET, document);
    }

    @Test
    void reportsCompiledVersion() {
        long compiledAt = evaluator.registryVersion();

        registry.register("within-radius", (value, operand) -> false);

        assertThat(evaluator.registryVersion()).isEqualTo(compiledAt);
        assertThat(evaluator.compiled().registryVersion()).isEqualTo(compiledAt);
        assertThat(registry.currentVersion()).isGreaterThan(compiledAt);
    }
}
