package io.pacer.core;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Properties;
import com.google.common.base.Optional;
import com.google.inject.ProvisionException;
import io.pacer.core.config.PropertyUtils;
import io.pacer.core.database.DatabaseJobQueue;
import io.pacer.core.database.TransactionManager;
import io.pacer.core.health.HealthStatus;
import io.pacer.core.schedule.ScheduleConfig;
import io.pacer.core.schedule.ScheduleExecutor;
import io.pacer.core.schedule.ScheduleStore;
import io.pacer.core.schedule.StoredSchedule;
import io.pacer.spi.JobQueue;
import org.jdbi.v3.core.Jdbi;
import org.junit.After;
import org.junit.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.is;
import static org.junit.Assert.fail;

public class PacerEmbedTest
{
    private PacerEmbed embed;

    @After
    public void destroy()
    {
        if (embed != null) {
            embed.close();
        }
    }

    private static PacerEmbed.Bootstrap bootstrap()
    {
        Properties props = new Properties();
        props.setProperty("database.type", "memory");
        props.setProperty("scheduler.dispatch_threads", "1");
        return new PacerEmbed.Bootstrap()
            .setSystemConfig(PropertyUtils.toConfigElement(props));
    }

    private void insertIntervalSchedule(String name, long seconds)
    {
        embed.getInjector().getInstance(Jdbi.class).useHandle(handle ->
                handle.createUpdate("insert into schedules" +
                    " (name, kind, interval_seconds, task, args, kwargs, enabled, total_run_count, created_at, updated_at)" +
                    " values (:name, 'interval', :seconds, :task, '[\"daily\"]', '{}', true, 0, current_timestamp, current_timestamp)")
                .bind("name", name)
                .bind("seconds", seconds)
                .bind("task", "tasks." + name)
                .execute());
    }

    private List<DatabaseJobQueue.QueuedJob> waitForJobs(String scheduleName)
        throws InterruptedException
    {
        DatabaseJobQueue queue = (DatabaseJobQueue) embed.getInjector().getInstance(JobQueue.class);
        long deadline = System.currentTimeMillis() + 10000;
        while (true) {
            List<DatabaseJobQueue.QueuedJob> jobs = queue.getJobsOfSchedule(scheduleName);
            if (!jobs.isEmpty() || System.currentTimeMillis() > deadline) {
                return jobs;
            }
            Thread.sleep(100);
        }
    }

    @Test
    public void initializeAppliesMigrations()
    {
        embed = bootstrap().initialize();

        TransactionManager tm = embed.getTransactionManager();
        ScheduleStore store = embed.getInjector().getInstance(ScheduleStore.class);
        assertThat(tm.begin(store::listEnabledSchedules), hasSize(0));
    }

    @Test
    public void schedulerHandsOffDueScheduleAndRecordsRun()
        throws Exception
    {
        embed = bootstrap().initialize();
        insertIntervalSchedule("report", 3600);

        ScheduleExecutor executor = embed.getScheduleExecutor();
        executor.start();

        List<DatabaseJobQueue.QueuedJob> jobs = waitForJobs("report");
        assertThat(jobs, hasSize(1));
        assertThat(jobs.get(0).getTask(), is("tasks.report"));
        assertThat(jobs.get(0).getArgs(), is("[\"daily\"]"));

        executor.shutdown();

        ScheduleStore store = embed.getInjector().getInstance(ScheduleStore.class);
        Optional<StoredSchedule> stored = embed.getTransactionManager().begin(() -> store.getScheduleByName("report"));
        assertThat(stored.get().getTotalRunCount(), is(1L));
        assertThat(stored.get().getLastRunAt().get(), is(jobs.get(0).getScheduledAt()));
    }

    @Test
    public void healthReportsRunningScheduler()
    {
        embed = bootstrap().initialize();
        embed.getScheduleExecutor().start();

        HealthStatus status = embed.getHealthChecker().check();
        assertThat(status.getStatus(), is(HealthStatus.OK));
        assertThat(status.getDatabase(), is(HealthStatus.DATABASE_UP));
        assertThat(status.getScheduler(), is(HealthStatus.SCHEDULER_RUNNING));
        assertThat(status.isReady(), is(true));
    }

    @Test
    public void healthReportsStoppedSchedulerAsDegraded()
    {
        embed = bootstrap().initialize();

        HealthStatus status = embed.getHealthChecker().check();
        assertThat(status.getStatus(), is(HealthStatus.DEGRADED));
        assertThat(status.getScheduler(), is(HealthStatus.SCHEDULER_STOPPED));
    }

    @Test
    public void healthWithoutSchedulerChecksDatabaseOnly()
    {
        embed = bootstrap()
            .withScheduleExecutor(false)
            .initialize();

        HealthStatus status = embed.getHealthChecker().check();
        assertThat(status.getStatus(), is(HealthStatus.OK));
        assertThat(status.getScheduler(), is(HealthStatus.SCHEDULER_DISABLED));
    }

    @Test
    public void healthOfDisabledScheduler()
    {
        Properties props = new Properties();
        props.setProperty("scheduler.enabled", "false");
        embed = new PacerEmbed.Bootstrap()
            .setSystemConfig(PropertyUtils.toConfigElement(props))
            .initialize();
        embed.getScheduleExecutor().start();

        assertThat(embed.getHealthChecker().check().getScheduler(), is(HealthStatus.SCHEDULER_DISABLED));
    }

    @Test
    public void invalidSchedulerConfigIsRejected()
    {
        Properties props = new Properties();
        props.setProperty("scheduler.max_interval_seconds", "0");
        embed = new PacerEmbed.Bootstrap()
            .setSystemConfig(PropertyUtils.toConfigElement(props))
            .withScheduleExecutor(false)
            .initialize();
        try {
            embed.getInjector().getInstance(ScheduleConfig.class);
            fail();
        }
        catch (ProvisionException ex) {
            assertThat(ex.getMessage(), containsString("scheduler.max_interval_seconds"));
        }
    }

    @Test
    public void overridingModuleReplacesStandardBinding()
    {
        Clock fixed = Clock.fixed(Instant.parse("2024-03-01T00:00:00Z"), ZoneOffset.UTC);
        embed = bootstrap()
            .withScheduleExecutor(false)
            .overrideModulesWith(binder -> binder.bind(Clock.class).toInstance(fixed))
            .initialize();

        assertThat(embed.getInjector().getInstance(Clock.class), is(fixed));
    }
}
