package io.pacer.spi.metrics;

import io.micrometer.core.instrument.Tags;

/**
 * Counters reported by the scheduler. Names are snake_case.
 */
public interface PacerMetrics
{
    void increment(String metricName, Tags tags);

    default void increment(String metricName)
    {
        increment(metricName, Tags.empty());
    }
}
