package io.pacer.core.schedule;

import java.time.Instant;
import java.util.List;
import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.base.Optional;
import io.pacer.commons.config.Config;
import io.pacer.spi.DueTimeCalculator;
import org.immutables.value.Value;

/**
 * A validated schedule definition with its computed due time. Entries are never
 * modified; a dispatch produces a new entry that replaces the old one in the next
 * snapshot.
 */
@Value.Immutable
public interface ScheduleEntry
{
    String getName();

    ScheduleKind getKind();

    /**
     * Rule in its text form, such as {@code every 30s} or {@code 0 9 * * *}.
     */
    String getRule();

    String getTask();

    List<JsonNode> getArgs();

    Config getKwargs();

    @Value.Auxiliary
    DueTimeCalculator getCalculator();

    Optional<Instant> getLastRunAt();

    long getTotalRunCount();

    Instant getNextDueAt();

    default boolean isDueAt(Instant now)
    {
        return !getNextDueAt().isAfter(now);
    }

    /**
     * Returns the entry as it is after a successful hand-off at {@code runAt}.
     */
    default ScheduleEntry dispatchedAt(Instant runAt)
    {
        return ImmutableScheduleEntry.builder()
            .from(this)
            .lastRunAt(runAt)
            .totalRunCount(getTotalRunCount() + 1)
            .nextDueAt(getCalculator().nextDueTime(Optional.of(runAt), runAt))
            .build();
    }

    static ImmutableScheduleEntry.Builder builder()
    {
        return ImmutableScheduleEntry.builder();
    }
}
