package com.aegis.policyengine.infra.metrics.impl.prometheus;

import com.aegis.policyengine.infra.metrics.MetricsRegistry;
import com.aegis.policyengine.infra.metrics.api.MetricsRegistryProvider;

/**
 * Default production provider, exporting to the Prometheus default collector registry.
 */
public class PrometheusMetricsRegistryProvider implements MetricsRegistryProvider {

    @Override
    public MetricsRegistry create() {
        return new PrometheusMetricsRegistry();
    }

    @Override
    public int priority() {
        return 100;
    }

    @Override
    public String name() {
        return "Prometheus";
    }
}
