package com.aegis.policyengine.runtime;

import com.aegis.policyengine.api.IOperatorRegistry;
import com.aegis.policyengine.api.IPolicyInterpreter;
import com.aegis.policyengine.cache.CacheConfig;
import com.aegis.policyengine.cache.CompiledEvaluatorCache;
import com.aegis.policyengine.compiler.CompilerConfig;
import com.aegis.policyengine.compiler.PolicyCompiler;
import com.aegis.policyengine.infra.metrics.MetricsRegistry;
import com.aegis.policyengine.infra.telemetry.TracingService;
import com.aegis.policyengine.runtime.evaluation.TieredPolicyEvaluator;
import io.opentelemetry.api.trace.Tracer;

import java.util.logging.Logger;

/**
 * Wires compiler, cache and tiered evaluator.
 *
 * <pre>{@code
 * InMemoryOperatorRegistry registry = new InMemoryOperatorRegistry();
 * TieredPolicyEvaluator engine = PolicyEngineFactory.create(registry, interpreter);
 * engine.cache().warm(new ConstraintSetLoader().load(Path.of("policies.json")).values());
 * Evaluation result = engine.evaluate(set, Map.of("role", "admin"));
 * }</pre>
 */
public final class PolicyEngineFactory {

    private static final Logger logger = Logger.getLogger(PolicyEngineFactory.class.getName());

    private PolicyEngineFactory() {
    }

    /**
     * Engine configured from {@code aegis.properties} and the environment, tracing through
     * {@link TracingService} and recording metrics in the discovered registry.
     */
    public static TieredPolicyEvaluator create(IOperatorRegistry registry, IPolicyInterpreter interpreter) {
        return create(registry, interpreter, CompilerConfig.fromEnvironment(), CacheConfig.load(),
                TracingService.getInstance().getTracer(), MetricsRegistry.getInstance());
    }

    public static TieredPolicyEvaluator create(IOperatorRegistry registry, IPolicyInterpreter interpreter,
                                               CompilerConfig compilerConfig, CacheConfig cacheConfig,
                                               Tracer tracer, MetricsRegistry metrics) {
        PolicyCompiler compiler = new PolicyCompiler(registry, compilerConfig, tracer, metrics);
        CompiledEvaluatorCache cache = new CompiledEvaluatorCache(compiler, registry, cacheConfig, metrics, tracer);
        logger.info(String.format("Policy engine created: %s, %s, registryVersion=%d",
                compilerConfig, cacheConfig, registry.currentVersion()));
        return new TieredPolicyEvaluator(cache, compiler, interpreter);
    }
}
