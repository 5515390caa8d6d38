package io.pacer.core.schedule;

import java.time.Instant;
import com.google.common.base.Optional;
import org.immutables.value.Value;

/**
 * One row of the schedules table as stored. Rule fields and payloads are not validated
 * here; {@link ScheduleCache} validates them when it builds the snapshot.
 */
@Value.Immutable
public interface StoredSchedule
{
    int getId();

    String getName();

    String getKind();

    Optional<Long> getIntervalSeconds();

    Optional<String> getCronMinute();

    Optional<String> getCronHour();

    Optional<String> getCronDayOfMonth();

    Optional<String> getCronMonthOfYear();

    Optional<String> getCronDayOfWeek();

    String getTask();

    // raw JSON text
    Optional<String> getArgs();

    // raw JSON text
    Optional<String> getKwargs();

    boolean getEnabled();

    Optional<Instant> getLastRunAt();

    long getTotalRunCount();

    Instant getCreatedAt();

    Instant getUpdatedAt();

    static ImmutableStoredSchedule.Builder builder()
    {
        return ImmutableStoredSchedule.builder();
    }
}
