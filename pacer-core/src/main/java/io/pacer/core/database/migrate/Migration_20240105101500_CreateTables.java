package io.pacer.core.database.migrate;

import org.jdbi.v3.core.Handle;

public class Migration_20240105101500_CreateTables
        implements Migration
{
    @Override
    public void migrate(Handle handle, MigrationContext context)
    {
        // schedules
        handle.execute(
                context.newCreateTableBuilder("schedules")
                .addIntId("id")
                .addString("name", "not null")
                .addString("kind", "not null")  // interval or crontab
                .addLong("interval_seconds", "")
                .addString("cron_minute", "")
                .addString("cron_hour", "")
                .addString("cron_day_of_month", "")
                .addString("cron_month_of_year", "")
                .addString("cron_day_of_week", "")
                .addString("task", "not null")
                .addText("args", "")  // json array
                .addText("kwargs", "")  // json object
                .addBoolean("enabled", "not null default true")
                .addLong("last_run_at", "")  // epoch seconds
                .addLong("total_run_count", "not null default 0")
                .addTimestamp("created_at", "not null")
                .addTimestamp("updated_at", "not null")
                .build());
        handle.execute("create unique index schedules_on_name on schedules (name)");

        // queued_jobs
        handle.execute(
                context.newCreateTableBuilder("queued_jobs")
                .addLongId("id")
                .addString("correlation_id", "not null")
                .addString("schedule_name", "not null")
                .addString("task", "not null")
                .addText("args", "not null")
                .addText("kwargs", "not null")
                .addTimestamp("scheduled_at", "not null")
                .addTimestamp("created_at", "not null")
                .build());
        handle.execute("create unique index queued_jobs_on_correlation_id on queued_jobs (correlation_id)");
    }
}
