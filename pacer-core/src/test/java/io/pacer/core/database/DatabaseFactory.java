package io.pacer.core.database;

import java.time.Instant;
import com.google.inject.Provider;
import io.pacer.commons.guava.ThrowablesUtil;
import io.pacer.core.database.DatabaseTestingUtils.ScheduleRow;
import org.jdbi.v3.core.Handle;
import org.jdbi.v3.core.Jdbi;

import static io.pacer.commons.ObjectMappers.objectMapper;
import static io.pacer.core.database.DatabaseTestingUtils.createConfigMapper;

public class DatabaseFactory
        implements AutoCloseable, Provider<TransactionManager>
{
    private final TransactionManager tm;
    private final Jdbi dbi;
    private final AutoCloseable closeable;
    private final DatabaseConfig config;

    public DatabaseFactory(TransactionManager tm, Jdbi dbi, AutoCloseable closeable, DatabaseConfig config)
    {
        this.tm = tm;
        this.dbi = dbi;
        this.closeable = closeable;
        this.config = config;
    }

    @Override
    public TransactionManager get()
    {
        return tm;
    }

    public <T> T begin(TransactionManager.SupplierInTransaction<T, Exception> func)
            throws Exception
    {
        return tm.begin(func, Exception.class);
    }

    public void begin(ThrowableRunnable func)
            throws Exception
    {
        begin(() -> {
            func.run();
            return null;
        });
    }

    @FunctionalInterface
    public interface ThrowableRunnable
    {
        void run() throws Exception;
    }

    public DatabaseConfig getConfig()
    {
        return config;
    }

    public Jdbi getJdbi()
    {
        return dbi;
    }

    public DatabaseScheduleStore getScheduleStore()
    {
        return new DatabaseScheduleStore(tm, createConfigMapper());
    }

    public DatabaseJobQueue getJobQueue()
    {
        return new DatabaseJobQueue(tm, createConfigMapper(), objectMapper());
    }

    /**
     * Writes a schedule row directly, as the management API would.
     */
    public void insertSchedule(ScheduleRow row)
    {
        try (Handle handle = dbi.open()) {
            handle.createUpdate("insert into schedules" +
                    " (name, kind, interval_seconds, cron_minute, cron_hour, cron_day_of_month, cron_month_of_year, cron_day_of_week," +
                    " task, args, kwargs, enabled, last_run_at, total_run_count, created_at, updated_at)" +
                    " values (:name, :kind, :intervalSeconds, :minute, :hour, :dayOfMonth, :monthOfYear, :dayOfWeek," +
                    " :task, :args, :kwargs, :enabled, :lastRunAt, :totalRunCount, current_timestamp, current_timestamp)")
                .bind("name", row.name)
                .bind("kind", row.kind)
                .bind("intervalSeconds", row.intervalSeconds)
                .bind("minute", row.cron[0])
                .bind("hour", row.cron[1])
                .bind("dayOfMonth", row.cron[2])
                .bind("monthOfYear", row.cron[3])
                .bind("dayOfWeek", row.cron[4])
                .bind("task", row.task)
                .bind("args", row.args)
                .bind("kwargs", row.kwargs)
                .bind("enabled", row.enabled)
                .bind("lastRunAt", row.lastRunAt == null ? null : row.lastRunAt.getEpochSecond())
                .bind("totalRunCount", row.totalRunCount)
                .execute();
        }
    }

    public void setEnabled(String name, boolean enabled)
    {
        try (Handle handle = dbi.open()) {
            handle.createUpdate("update schedules set enabled = :enabled where name = :name")
                .bind("enabled", enabled)
                .bind("name", name)
                .execute();
        }
    }

    public void deleteSchedule(String name)
    {
        try (Handle handle = dbi.open()) {
            handle.createUpdate("delete from schedules where name = :name")
                .bind("name", name)
                .execute();
        }
    }

    public void setLastRunAt(String name, Instant lastRunAt)
    {
        try (Handle handle = dbi.open()) {
            handle.createUpdate("update schedules set last_run_at = :lastRunAt where name = :name")
                .bind("lastRunAt", lastRunAt.getEpochSecond())
                .bind("name", name)
                .execute();
        }
    }

    @Override
    public void close()
    {
        try {
            closeable.close();
        }
        catch (Exception ex) {
            throw ThrowablesUtil.propagate(ex);
        }
    }
}
