package com.aegis.policyengine.infra.metrics;

import java.time.Duration;
import java.util.concurrent.Callable;

/**
 * Latency histogram.
 * Thread-safe.
 */
public interface Timer {

    /**
     * Times execution of callable. The duration is recorded even if it throws.
     *
     * @return callable result
     * @throws Exception if callable throws
     */
    <T> T record(Callable<T> callable) throws Exception;

    /**
     * Records a pre-measured duration.
     */
    void record(Duration duration);

    default void recordNanos(long nanos) {
        record(Duration.ofNanos(nanos));
    }
}
