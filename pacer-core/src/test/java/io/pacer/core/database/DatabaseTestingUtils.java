package io.pacer.core.database;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Instant;
import java.util.Properties;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import io.pacer.commons.config.Config;
import io.pacer.commons.config.ConfigFactory;
import io.pacer.core.config.PropertyUtils;
import io.pacer.core.repository.ResourceNotFoundException;
import org.jdbi.v3.core.Jdbi;

import static io.pacer.commons.ObjectMappers.objectMapper;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.junit.Assert.fail;

public class DatabaseTestingUtils
{
    private DatabaseTestingUtils() { }

    // PACER_TEST_POSTGRESQL holds database.* properties without the prefix, e.g. "host=localhost\ndatabase=pacer_test"
    private static DatabaseConfig environmentDatabaseConfig()
    {
        String pg = System.getenv("PACER_TEST_POSTGRESQL");
        if (Strings.isNullOrEmpty(pg)) {
            return DatabaseConfig.builder().type("h2").build();
        }
        Properties props;
        try {
            props = PropertyUtils.loadString(pg);
        }
        catch (IOException ex) {
            throw new UncheckedIOException(ex);
        }
        Config config = createConfig().set("database.type", "postgresql");
        props.stringPropertyNames().forEach(key -> config.set("database." + key, props.getProperty(key)));
        return DatabaseConfig.convertFrom(config);
    }

    public static DatabaseFactory setupDatabase()
    {
        DatabaseConfig config = environmentDatabaseConfig();
        DataSourceProvider dsp = new DataSourceProvider(config);

        Jdbi dbi = Jdbi.create(dsp.get());
        new DatabaseMigrator(dbi, config).migrate();
        // a PostgreSQL test database keeps rows of earlier runs
        dbi.useHandle(handle -> {
            for (String table : ImmutableList.of("queued_jobs", "schedules")) {
                handle.execute(config.isPostgres()
                        ? "TRUNCATE " + table + " RESTART IDENTITY CASCADE"
                        : "TRUNCATE TABLE " + table + " RESTART IDENTITY");
            }
        });

        return new DatabaseFactory(new ThreadLocalTransactionManager(dsp.get()), dbi, dsp, config);
    }

    public static ConfigFactory createConfigFactory()
    {
        return new ConfigFactory(objectMapper());
    }

    public static ConfigMapper createConfigMapper()
    {
        return new ConfigMapper(createConfigFactory());
    }

    public static Config createConfig()
    {
        return createConfigFactory().create();
    }

    /**
     * Row of the schedules table for {@link DatabaseFactory#insertSchedule}.
     */
    public static class ScheduleRow
    {
        String name;
        String kind;
        Long intervalSeconds;
        String[] cron = new String[5];
        String task = "tasks.noop";
        String args;
        String kwargs;
        boolean enabled = true;
        Instant lastRunAt;
        long totalRunCount;

        public static ScheduleRow interval(String name, long seconds)
        {
            ScheduleRow row = new ScheduleRow();
            row.name = name;
            row.kind = "interval";
            row.intervalSeconds = seconds;
            return row;
        }

        public static ScheduleRow crontab(String name, String fiveFields)
        {
            ScheduleRow row = new ScheduleRow();
            row.name = name;
            row.kind = "crontab";
            row.cron = fiveFields.trim().split("\\s+");
            return row;
        }

        public ScheduleRow kind(String kind)
        {
            this.kind = kind;
            return this;
        }

        public ScheduleRow intervalSeconds(Long seconds)
        {
            this.intervalSeconds = seconds;
            return this;
        }

        public ScheduleRow task(String task)
        {
            this.task = task;
            return this;
        }

        public ScheduleRow args(String json)
        {
            this.args = json;
            return this;
        }

        public ScheduleRow kwargs(String json)
        {
            this.kwargs = json;
            return this;
        }

        public ScheduleRow enabled(boolean enabled)
        {
            this.enabled = enabled;
            return this;
        }

        public ScheduleRow lastRunAt(Instant lastRunAt)
        {
            this.lastRunAt = lastRunAt;
            return this;
        }

        public ScheduleRow totalRunCount(long count)
        {
            this.totalRunCount = count;
            return this;
        }
    }

    public interface MayNotFound
    {
        void run() throws ResourceNotFoundException;
    }

    public static void assertNotFound(MayNotFound r)
    {
        try {
            r.run();
            fail();
        }
        catch (ResourceNotFoundException expected) {
            assertThat(expected.getMessage(), containsString("does not exist"));
        }
    }
}
