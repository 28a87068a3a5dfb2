package com.aegis.policyengine.compiler.runtime;

import com.aegis.policyengine.api.ICompiledEvaluator;
import com.aegis.policyengine.api.IOperatorRegistry;
import com.aegis.policyengine.api.IPolicyInterpreter;
import com.aegis.policyengine.api.model.CompilationTier;
import com.aegis.policyengine.api.model.Document;
import com.aegis.policyengine.api.model.Residual;

/**
 * Compiled evaluator that stays correct across operator registry changes: while the
 * registry is at the compiled version it runs the inlined code, afterwards every call is
 * delegated to the interpreter.
 */
public final class GuardedEvaluator implements ICompiledEvaluator {

    private final CompiledPolicy compiled;
    private final IOperatorRegistry registry;
    private final IPolicyInterpreter fallback;

    public GuardedEvaluator(CompiledPolicy compiled, IOperatorRegistry registry, IPolicyInterpreter fallback) {
        this.compiled = compiled;
        this.registry = registry;
        this.fallback = fallback;
    }

    @Override
    public Residual evaluate(Document document) {
        if (registry.currentVersion() == compiled.registryVersion()) {
            return compiled.evaluate(document);
        }
        return fallback.interpret(compiled.constraintSet(), document);
    }

    @Override
    public CompilationTier tier() {
        return CompilationTier.GUARDED;
    }

    @Override
    public long registryVersion() {
        return compiled.registryVersion();
    }

    public boolean isStale() {
        return registry.currentVersion() != compiled.registryVersion();
    }

    public CompiledPolicy compiled() {
        return compiled;
    }
}
