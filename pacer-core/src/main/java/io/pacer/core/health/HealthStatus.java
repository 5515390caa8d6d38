package io.pacer.core.health;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import org.immutables.value.Value;

@Value.Immutable
@JsonSerialize(as = ImmutableHealthStatus.class)
@JsonDeserialize(as = ImmutableHealthStatus.class)
public interface HealthStatus
{
    String OK = "ok";
    String DEGRADED = "degraded";

    String DATABASE_UP = "up";
    String DATABASE_DOWN = "down";

    String SCHEDULER_RUNNING = "running";
    String SCHEDULER_STOPPED = "stopped";
    String SCHEDULER_DISABLED = "disabled";

    String getStatus();

    String getDatabase();

    String getScheduler();

    @JsonIgnore
    default boolean isReady()
    {
        return OK.equals(getStatus());
    }

    static HealthStatus of(boolean databaseUp, String scheduler)
    {
        boolean ok = databaseUp && !SCHEDULER_STOPPED.equals(scheduler);
        return ImmutableHealthStatus.builder()
            .status(ok ? OK : DEGRADED)
            .database(databaseUp ? DATABASE_UP : DATABASE_DOWN)
            .scheduler(scheduler)
            .build();
    }
}
