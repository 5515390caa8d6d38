package io.pacer.cli;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import com.google.common.collect.ImmutableMap;
import io.pacer.commons.ObjectMappers;
import io.pacer.commons.config.Config;
import io.pacer.commons.config.ConfigFactory;
import io.pacer.core.database.DataSourceProvider;
import io.pacer.core.database.DatabaseConfig;
import org.jdbi.v3.core.Jdbi;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.not;

public class MainTest
{
    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    private Path configHome;
    private Path database;
    private ByteArrayOutputStream out;
    private ByteArrayOutputStream err;

    @Before
    public void setUp()
        throws Exception
    {
        configHome = folder.newFolder("config").toPath();
        database = folder.newFolder("db").toPath();
        out = new ByteArrayOutputStream();
        err = new ByteArrayOutputStream();
    }

    private int main(String... args)
    {
        Main main = new Main("0.1.0-test",
                ImmutableMap.of("PACER_CONFIG_HOME", configHome.toString()),
                new PrintStream(out, true),
                new PrintStream(err, true));
        return main.cli(args);
    }

    private String stdout()
    {
        return new String(out.toByteArray(), StandardCharsets.UTF_8);
    }

    private String stderr()
    {
        return new String(err.toByteArray(), StandardCharsets.UTF_8);
    }

    private void insertSchedules()
    {
        Config config = new ConfigFactory(ObjectMappers.objectMapper()).create()
            .set("database.type", "h2")
            .set("database.path", database.toAbsolutePath().toString());
        try (DataSourceProvider dsp = new DataSourceProvider(DatabaseConfig.convertFrom(config))) {
            Jdbi.create(dsp.get()).useHandle(handle -> {
                handle.execute("insert into schedules" +
                        " (name, kind, interval_seconds, task, args, kwargs, enabled, total_run_count, created_at, updated_at)" +
                        " values ('report', 'interval', 3600, 'reports.daily', '[]', '{}', true, 0, current_timestamp, current_timestamp)");
                handle.execute("insert into schedules" +
                        " (name, kind, cron_minute, cron_hour, cron_day_of_month, cron_month_of_year, cron_day_of_week," +
                        " task, args, kwargs, enabled, total_run_count, created_at, updated_at)" +
                        " values ('broken', 'crontab', '61', '*', '*', '*', '*', 'tasks.broken', '[]', '{}', true, 0, current_timestamp, current_timestamp)");
            });
        }
    }

    @Test
    public void showsVersion()
    {
        assertThat(main("--version"), is(0));
        assertThat(stdout(), containsString("0.1.0-test"));
    }

    @Test
    public void showsUsageWithoutArguments()
    {
        assertThat(main(), is(0));
        assertThat(stderr(), containsString("Usage: pacer <command>"));
    }

    @Test
    public void unknownCommandFails()
    {
        assertThat(main("unknown"), is(1));
        assertThat(stderr(), containsString("available commands are"));
    }

    @Test
    public void unknownLogLevelFails()
    {
        assertThat(main("health", "-l", "loud"), is(1));
        assertThat(stderr(), containsString("Unknown log level 'loud'"));
    }

    @Test
    public void migrateRequiresSubCommand()
    {
        assertThat(main("migrate", "-o", database.toString()), is(1));
        assertThat(stderr(), containsString("error: Expected 'run' or 'check'"));
    }

    @Test
    public void migrateRequiresDatabase()
    {
        assertThat(main("migrate", "run"), is(1));
        assertThat(stderr(), containsString("--database, or --config option is required"));
    }

    @Test
    public void migrateRunAndCheck()
    {
        assertThat(main("migrate", "check", "-o", database.toString(), "-l", "warn"), is(0));
        assertThat(stdout(), containsString("Database is not initialized"));
        assertThat(stdout(), containsString("pending: 20240105101500 CreateTables"));

        assertThat(main("migrate", "run", "-o", database.toString(), "-l", "warn"), is(0));
        assertThat(stdout(), containsString("Applied 2 migration(s)"));

        out.reset();
        assertThat(main("migrate", "run", "-o", database.toString(), "-l", "warn"), is(0));
        assertThat(stdout(), containsString("Schema is up to date"));

        out.reset();
        assertThat(main("migrate", "check", "-o", database.toString(), "-l", "warn"), is(0));
        assertThat(stdout(), containsString("Schema is up to date"));
    }

    @Test
    public void showSchedules()
    {
        assertThat(main("migrate", "run", "-o", database.toString(), "-l", "warn"), is(0));
        insertSchedules();

        out.reset();
        assertThat(main("schedules", "-o", database.toString(), "-l", "warn"), is(0));
        String output = stdout();
        assertThat(output, containsString("NAME"));
        assertThat(output, containsString("report"));
        assertThat(output, containsString("every 3600s"));
        assertThat(output, containsString("reports.daily"));
        assertThat(output, containsString("Skipped 1 malformed schedules:"));
        assertThat(output, containsString("broken: "));
    }

    @Test
    public void healthWithoutSchedulerChecksDatabase()
    {
        assertThat(main("health", "-o", database.toString(), "-l", "warn"), is(0));
        String output = stdout();
        assertThat(output, containsString("\"status\" : \"ok\""));
        assertThat(output, containsString("\"database\" : \"up\""));
        assertThat(output, containsString("\"scheduler\" : \"disabled\""));
        assertThat(output, not(containsString("ready")));
    }
}
