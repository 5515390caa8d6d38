package io.pacer.core.metrics;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.pacer.spi.metrics.PacerMetrics;

public class StdPacerMetrics implements PacerMetrics
{
    private final MeterRegistry registry;

    public StdPacerMetrics(MeterRegistry registry)
    {
        this.registry = registry;
    }

    @Override
    public void increment(String metricName, Tags tags)
    {
        registry.counter(metricName, tags).increment();
    }

    public double getCount(String metricName)
    {
        return registry.counter(metricName).count();
    }

    public static StdPacerMetrics empty()
    {
        return new StdPacerMetrics(new SimpleMeterRegistry());
    }
}
