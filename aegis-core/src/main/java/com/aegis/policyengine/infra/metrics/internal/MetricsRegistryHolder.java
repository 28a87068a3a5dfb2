package com.aegis.policyengine.infra.metrics.internal;

import com.aegis.policyengine.infra.metrics.MetricsRegistry;
import com.aegis.policyengine.infra.metrics.api.MetricsRegistryProvider;

import java.util.Comparator;
import java.util.Optional;
import java.util.ServiceLoader;
import java.util.logging.Logger;
import java.util.stream.StreamSupport;

/**
 * Lazy holder for the process-wide {@link MetricsRegistry}.
 *
 * <p><b>INTERNAL USE ONLY</b> - API may change without notice.
 */
public final class MetricsRegistryHolder {

    private static final Logger logger = Logger.getLogger(MetricsRegistryHolder.class.getName());

    public static final MetricsRegistry NOOP = new NoOpMetricsRegistry();
    public static final MetricsRegistry INSTANCE = discover();

    private MetricsRegistryHolder() {
        throw new AssertionError("No instances");
    }

    private static MetricsRegistry discover() {
        Optional<MetricsRegistryProvider> provider = StreamSupport.stream(
                        ServiceLoader.load(MetricsRegistryProvider.class).spliterator(), false)
                .max(Comparator.comparingInt(MetricsRegistryProvider::priority));

        if (provider.isEmpty()) {
            logger.info("No metrics provider found, using no-op registry");
            return NOOP;
        }
        logger.info(String.format("Using metrics provider: %s (priority: %d)",
                provider.get().name(), provider.get().priority()));
        return provider.get().create();
    }
}
