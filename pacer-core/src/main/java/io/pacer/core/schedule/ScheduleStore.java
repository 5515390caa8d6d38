package io.pacer.core.schedule;

import java.time.Instant;
import java.util.List;
import com.google.common.base.Optional;
import io.pacer.core.repository.ResourceNotFoundException;

/**
 * Durable set of schedule definitions and their run bookkeeping. Methods run in the
 * transaction of the caller (see {@link io.pacer.core.database.TransactionManager}).
 */
public interface ScheduleStore
{
    /**
     * Enabled schedules ordered by name.
     */
    List<StoredSchedule> listEnabledSchedules();

    Optional<StoredSchedule> getScheduleByName(String name);

    /**
     * Increments total_run_count and moves last_run_at forward to runAt in one statement.
     * last_run_at never moves backward when records arrive out of order.
     *
     * @throws ResourceNotFoundException if no schedule has the name
     */
    void recordRun(String name, Instant runAt)
        throws ResourceNotFoundException;
}
