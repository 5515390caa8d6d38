package io.pacer.core.database;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.base.Optional;
import com.google.inject.Inject;
import io.pacer.commons.config.Config;
import io.pacer.core.repository.ResourceConflictException;
import io.pacer.spi.EnqueueException;
import io.pacer.spi.JobQueue;
import io.pacer.spi.JobRequest;
import org.immutables.value.Value;
import org.jdbi.v3.core.mapper.RowMapper;
import org.jdbi.v3.core.statement.StatementContext;
import org.jdbi.v3.sqlobject.customizer.Bind;
import org.jdbi.v3.sqlobject.statement.SqlQuery;
import org.jdbi.v3.sqlobject.statement.SqlUpdate;

/**
 * Queue hand-off that stores jobs in the queued_jobs table for workers to pick up.
 * Each enqueue commits on its own so that an accepted job is durable before the
 * scheduler records the run.
 */
public class DatabaseJobQueue
        extends BasicDatabaseStoreManager<DatabaseJobQueue.Dao>
        implements JobQueue
{
    private final TransactionManager tm;
    private final ObjectMapper mapper;

    @Inject
    public DatabaseJobQueue(TransactionManager tm, ConfigMapper cfm, ObjectMapper mapper)
    {
        super(Dao.class, tm, cfm);
        this.tm = tm;
        this.mapper = mapper;
    }

    @Override
    public void enqueue(JobRequest request)
        throws EnqueueException
    {
        String args;
        try {
            args = mapper.writeValueAsString(request.getArgs());
        }
        catch (JsonProcessingException ex) {
            throw new EnqueueException("Failed to serialize args of job " + request.getCorrelationId(), ex);
        }

        try {
            tm.begin(() -> insertUnique((handle, dao) -> dao.insertJob(
                                request.getCorrelationId().toString(),
                                request.getScheduleName(),
                                request.getTaskIdentifier(),
                                args,
                                request.getKwargs(),
                                request.getScheduledAt()),
                        "queued job correlation_id=" + request.getCorrelationId()),
                    ResourceConflictException.class);
        }
        catch (ResourceConflictException ex) {
            // the same job was handed off before
            logger.debug("Job {} is already queued", request.getCorrelationId());
        }
        catch (RuntimeException ex) {
            throw new EnqueueException("Failed to enqueue job " + request.getCorrelationId()
                    + " of schedule " + request.getScheduleName(), ex);
        }
    }

    public Optional<QueuedJob> getJobByCorrelationId(UUID correlationId)
    {
        return Optional.fromNullable(tm.begin(() -> inTransaction((handle, dao) ->
                    handle.createQuery("select * from queued_jobs where correlation_id = :correlationId")
                    .bind("correlationId", correlationId.toString())
                    .map(new QueuedJobMapper(configMapper))
                    .findFirst()
                    .orElse(null))));
    }

    public List<QueuedJob> getJobsOfSchedule(String scheduleName)
    {
        return tm.begin(() -> inTransaction((handle, dao) ->
                handle.createQuery("select * from queued_jobs where schedule_name = :name order by id")
                .bind("name", scheduleName)
                .map(new QueuedJobMapper(configMapper))
                .list()));
    }

    @Value.Immutable
    public interface QueuedJob
    {
        long getId();

        UUID getCorrelationId();

        String getScheduleName();

        String getTask();

        String getArgs();

        Config getKwargs();

        Instant getScheduledAt();

        Instant getCreatedAt();
    }

    public interface Dao
    {
        @SqlUpdate("insert into queued_jobs" +
                " (correlation_id, schedule_name, task, args, kwargs, scheduled_at, created_at)" +
                " values (:correlationId, :scheduleName, :task, :args, :kwargs, :scheduledAt, current_timestamp)")
        int insertJob(@Bind("correlationId") String correlationId,
                @Bind("scheduleName") String scheduleName,
                @Bind("task") String task,
                @Bind("args") String args,
                @Bind("kwargs") Config kwargs,
                @Bind("scheduledAt") Instant scheduledAt);
    }

    static class QueuedJobMapper
            implements RowMapper<QueuedJob>
    {
        private final ConfigMapper cfm;

        QueuedJobMapper(ConfigMapper cfm)
        {
            this.cfm = cfm;
        }

        @Override
        public QueuedJob map(ResultSet r, StatementContext ctx)
                throws SQLException
        {
            return ImmutableQueuedJob.builder()
                .id(r.getLong("id"))
                .correlationId(getUuid(r, "correlation_id"))
                .scheduleName(r.getString("schedule_name"))
                .task(r.getString("task"))
                .args(r.getString("args"))
                .kwargs(cfm.fromResultSetOrEmpty(r, "kwargs"))
                .scheduledAt(getInstant(r, "scheduled_at"))
                .createdAt(getInstant(r, "created_at"))
                .build();
        }
    }
}
