package com.aegis.policyengine.infra.metrics;

/**
 * Point-in-time value that can go up and down.
 * Thread-safe.
 */
public interface Gauge {
    void set(double value);
    double value();
}
