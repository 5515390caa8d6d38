package io.pacer.spi;

import java.time.Instant;
import com.google.common.base.Optional;

/**
 * Recurrence rule of one schedule. Implementations are pure and thread-safe.
 */
public interface DueTimeCalculator
{
    /**
     * Returns the next time the schedule is due.
     *
     * @param lastRunAt the last successful dispatch, absent if the schedule never ran
     * @param referenceTime the time the calculation is made at
     * @return the due time, possibly earlier than referenceTime if the schedule is overdue
     */
    Instant nextDueTime(Optional<Instant> lastRunAt, Instant referenceTime);
}
