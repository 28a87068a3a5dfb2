package com.aegis.policyengine.infra.metrics.impl.inmemory;

import com.aegis.policyengine.infra.metrics.MetricsRegistry;
import com.aegis.policyengine.infra.metrics.api.MetricsRegistryProvider;

/**
 * Provider for tests. Registered from test resources with a priority above the Prometheus
 * provider so that assertions can read back recorded values.
 */
public class InMemoryMetricsRegistryProvider implements MetricsRegistryProvider {

    @Override
    public MetricsRegistry create() {
        return new InMemoryMetricsRegistry();
    }

    @Override
    public int priority() {
        return 1000;
    }
}
