package io.pacer.core.schedule;

import java.time.Instant;
import com.google.common.base.Optional;
import org.immutables.value.Value;

@Value.Immutable
public interface SchedulerStatus
{
    boolean isEnabled();

    boolean isRunning();

    Optional<Instant> getLastSyncAttemptAt();

    Optional<Instant> getLastSuccessfulSyncAt();

    Optional<String> getLastSyncError();

    int getScheduleCount();

    int getMalformedCount();

    Optional<Instant> getEarliestDueAt();

    long getTotalDispatches();

    long getTotalDispatchFailures();

    int getPendingBookkeeping();
}
