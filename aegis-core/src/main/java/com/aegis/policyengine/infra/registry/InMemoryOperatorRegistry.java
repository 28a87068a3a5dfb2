package com.aegis.policyengine.infra.registry;

import com.aegis.policyengine.api.IOperatorRegistry;
import com.aegis.policyengine.api.model.Operator;

import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.BiPredicate;
import java.util.logging.Logger;

/**
 * Thread-safe operator registry.
 *
 * <p>Built-in operators are always registered. User operators are stored as
 * {@code (documentValue, operand) -> boolean} predicates for the interpreter. Every change
 * to the set of definitions increments {@link #currentVersion()}, which invalidates compiled
 * evaluators keyed on the previous version.
 */
public class InMemoryOperatorRegistry implements IOperatorRegistry {

    private static final Logger logger = Logger.getLogger(InMemoryOperatorRegistry.class.getName());

    private final Map<String, BiPredicate<Object, Object>> userOperators = new ConcurrentHashMap<>();
    private final AtomicLong version;

    public InMemoryOperatorRegistry() {
        this(1L);
    }

    public InMemoryOperatorRegistry(long initialVersion) {
        this.version = new AtomicLong(initialVersion);
    }

    @Override
    public long currentVersion() {
        return version.get();
    }

    public boolean isRegistered(String operator) {
        return Operator.isBuiltIn(operator) || userOperators.containsKey(operator);
    }

    /**
     * Registers or replaces a user operator.
     *
     * @return the new registry version
     * @throws IllegalArgumentException if {@code symbol} names a built-in operator
     */
    public long register(String symbol, BiPredicate<Object, Object> predicate) {
        if (Operator.isBuiltIn(symbol)) {
            throw new IllegalArgumentException("Cannot redefine built-in operator: " + symbol);
        }
        userOperators.put(symbol, predicate);
        long newVersion = version.incrementAndGet();
        logger.info(String.format("Registered operator '%s', registry version %d", symbol, newVersion));
        return newVersion;
    }

    /**
     * @return the new registry version, or the current one if nothing was removed
     */
    public long unregister(String symbol) {
        if (userOperators.remove(symbol) == null) {
            return version.get();
        }
        long newVersion = version.incrementAndGet();
        logger.info(String.format("Unregistered operator '%s', registry version %d", symbol, newVersion));
        return newVersion;
    }

    /**
     * Signals a semantic change not visible through registration, e.g. a reloaded
     * operator library.
     */
    public long bumpVersion() {
        return version.incrementAndGet();
    }

    public Optional<BiPredicate<Object, Object>> userOperator(String symbol) {
        return Optional.ofNullable(userOperators.get(symbol));
    }

    public Set<String> registeredOperators() {
        Set<String> all = new TreeSet<>(userOperators.keySet());
        for (Operator op : Operator.values()) {
            all.add(op.symbol());
        }
        return all;
    }
}
