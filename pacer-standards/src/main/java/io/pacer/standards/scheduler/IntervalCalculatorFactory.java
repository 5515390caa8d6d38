package io.pacer.standards.scheduler;

import java.time.Instant;
import java.time.ZoneId;
import com.google.common.base.Optional;
import io.pacer.commons.config.Config;
import io.pacer.commons.config.ConfigException;
import io.pacer.spi.DueTimeCalculator;
import io.pacer.spi.DueTimeCalculatorFactory;

public class IntervalCalculatorFactory
        implements DueTimeCalculatorFactory
{
    // 100 years. Keeps lastRunAt + interval far inside the range of Instant.
    static final long MAX_INTERVAL_SECONDS = 100L * 366 * 24 * 60 * 60;

    @Override
    public String getType()
    {
        return "interval";
    }

    @Override
    public DueTimeCalculator newCalculator(Config rule, ZoneId timeZone)
    {
        long interval = rule.get("interval_seconds", long.class);
        if (interval <= 0) {
            throw new ConfigException("interval_seconds must be a positive integer but got " + interval);
        }
        if (interval > MAX_INTERVAL_SECONDS) {
            throw new ConfigException("interval_seconds must be at most " + MAX_INTERVAL_SECONDS + " but got " + interval);
        }
        return new IntervalCalculator(interval);
    }

    static class IntervalCalculator
            implements DueTimeCalculator
    {
        private final long intervalSeconds;

        IntervalCalculator(long intervalSeconds)
        {
            this.intervalSeconds = intervalSeconds;
        }

        // Never runs ahead of lastRunAt by more than one interval: a schedule that missed
        // several periods is due once, immediately, instead of once per missed period.
        @Override
        public Instant nextDueTime(Optional<Instant> lastRunAt, Instant referenceTime)
        {
            if (lastRunAt.isPresent()) {
                return lastRunAt.get().plusSeconds(intervalSeconds);
            }
            return referenceTime;
        }

        @Override
        public String toString()
        {
            return "interval(" + intervalSeconds + "s)";
        }
    }
}
