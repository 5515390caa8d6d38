package io.pacer.core.database;

import java.time.Instant;
import java.util.List;
import java.sql.ResultSet;
import java.sql.SQLException;
import com.google.common.base.Optional;
import com.google.inject.Inject;
import io.pacer.core.repository.ResourceNotFoundException;
import io.pacer.core.schedule.ScheduleStore;
import io.pacer.core.schedule.StoredSchedule;
import org.jdbi.v3.core.mapper.RowMapper;
import org.jdbi.v3.core.statement.StatementContext;
import org.jdbi.v3.sqlobject.customizer.Bind;
import org.jdbi.v3.sqlobject.statement.SqlQuery;
import org.jdbi.v3.sqlobject.statement.SqlUpdate;

public class DatabaseScheduleStore
        extends BasicDatabaseStoreManager<DatabaseScheduleStore.Dao>
        implements ScheduleStore
{
    @Inject
    public DatabaseScheduleStore(TransactionManager tm, ConfigMapper cfm)
    {
        super(Dao.class, tm, cfm);
    }

    @Override
    public List<StoredSchedule> listEnabledSchedules()
    {
        return inTransaction((handle, dao) -> dao.listEnabledSchedules());
    }

    @Override
    public Optional<StoredSchedule> getScheduleByName(String name)
    {
        return Optional.fromNullable(inTransaction((handle, dao) -> dao.getScheduleByName(name)));
    }

    @Override
    public void recordRun(String name, Instant runAt)
        throws ResourceNotFoundException
    {
        int n = inTransaction((handle, dao) -> dao.recordRun(name, runAt.getEpochSecond()));
        if (n == 0) {
            throw new ResourceNotFoundException("Schedule does not exist: name=" + name);
        }
    }

    public interface Dao
    {
        @SqlQuery("select * from schedules" +
                " where enabled = true" +
                " order by name")
        List<StoredSchedule> listEnabledSchedules();

        @SqlQuery("select * from schedules" +
                " where name = :name" +
                " limit 1")
        StoredSchedule getScheduleByName(@Bind("name") String name);

        // Concurrent writers never lose an increment, and last_run_at only moves forward.
        @SqlUpdate("update schedules" +
                " set total_run_count = total_run_count + 1," +
                " last_run_at = greatest(coalesce(last_run_at, :runAt), :runAt)," +
                " updated_at = current_timestamp" +
                " where name = :name")
        int recordRun(@Bind("name") String name, @Bind("runAt") long runAt);
    }

    static class StoredScheduleMapper
            implements RowMapper<StoredSchedule>
    {
        @Override
        public StoredSchedule map(ResultSet r, StatementContext ctx)
                throws SQLException
        {
            return StoredSchedule.builder()
                .id(r.getInt("id"))
                .name(r.getString("name"))
                .kind(r.getString("kind"))
                .intervalSeconds(getOptionalLong(r, "interval_seconds"))
                .cronMinute(getOptionalString(r, "cron_minute"))
                .cronHour(getOptionalString(r, "cron_hour"))
                .cronDayOfMonth(getOptionalString(r, "cron_day_of_month"))
                .cronMonthOfYear(getOptionalString(r, "cron_month_of_year"))
                .cronDayOfWeek(getOptionalString(r, "cron_day_of_week"))
                .task(r.getString("task"))
                .args(getOptionalString(r, "args"))
                .kwargs(getOptionalString(r, "kwargs"))
                .enabled(r.getBoolean("enabled"))
                .lastRunAt(getOptionalEpochSecond(r, "last_run_at"))
                .totalRunCount(r.getLong("total_run_count"))
                .createdAt(getInstant(r, "created_at"))
                .updatedAt(getInstant(r, "updated_at"))
                .build();
        }
    }
}
