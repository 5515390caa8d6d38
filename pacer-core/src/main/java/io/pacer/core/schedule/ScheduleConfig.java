package io.pacer.core.schedule;

import java.time.DateTimeException;
import java.time.Duration;
import java.time.ZoneId;
import io.pacer.commons.config.Config;
import io.pacer.commons.config.ConfigException;
import org.immutables.value.Value;

@Value.Immutable
public interface ScheduleConfig
{
    boolean getEnabled();

    long getSyncEverySeconds();

    long getMaxIntervalSeconds();

    int getDispatchThreads();

    ZoneId getTimeZone();

    long getBookkeepingFlushIntervalSeconds();

    long getDispatchRetrySeconds();

    default Duration getSyncEvery()
    {
        return Duration.ofSeconds(getSyncEverySeconds());
    }

    default Duration getMaxInterval()
    {
        return Duration.ofSeconds(getMaxIntervalSeconds());
    }

    default Duration getDispatchRetryDelay()
    {
        return Duration.ofSeconds(getDispatchRetrySeconds());
    }

    @Value.Check
    default void check()
    {
        checkPositive("scheduler.sync_every_seconds", getSyncEverySeconds());
        checkPositive("scheduler.max_interval_seconds", getMaxIntervalSeconds());
        checkPositive("scheduler.dispatch_threads", getDispatchThreads());
        checkPositive("scheduler.bookkeeping_flush_interval_seconds", getBookkeepingFlushIntervalSeconds());
        checkPositive("scheduler.dispatch_retry_seconds", getDispatchRetrySeconds());
    }

    static void checkPositive(String key, long value)
    {
        if (value <= 0) {
            throw new ConfigException(key + " must be a positive integer but got " + value);
        }
    }

    static ImmutableScheduleConfig.Builder defaultBuilder()
    {
        return ImmutableScheduleConfig.builder()
            .enabled(true)
            .syncEverySeconds(60)
            .maxIntervalSeconds(300)
            .dispatchThreads(4)
            .timeZone(ZoneId.of("UTC"))
            .bookkeepingFlushIntervalSeconds(1)
            .dispatchRetrySeconds(5);
    }

    static ScheduleConfig convertFrom(Config config)
    {
        String timeZone = config.get("scheduler.time_zone", String.class, "UTC");
        ZoneId zone;
        try {
            zone = ZoneId.of(timeZone);
        }
        catch (DateTimeException ex) {
            throw new ConfigException("Invalid scheduler.time_zone: " + timeZone, ex);
        }

        return defaultBuilder()
            .enabled(config.get("scheduler.enabled", boolean.class, true))
            .syncEverySeconds(config.get("scheduler.sync_every_seconds", long.class, 60L))
            .maxIntervalSeconds(config.get("scheduler.max_interval_seconds", long.class, 300L))
            .dispatchThreads(config.get("scheduler.dispatch_threads", int.class, 4))
            .timeZone(zone)
            .bookkeepingFlushIntervalSeconds(config.get("scheduler.bookkeeping_flush_interval_seconds", long.class, 1L))
            .dispatchRetrySeconds(config.get("scheduler.dispatch_retry_seconds", long.class, 5L))
            .build();
    }
}
