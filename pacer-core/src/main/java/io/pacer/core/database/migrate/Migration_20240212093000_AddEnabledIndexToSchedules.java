package io.pacer.core.database.migrate;

import org.jdbi.v3.core.Handle;

public class Migration_20240212093000_AddEnabledIndexToSchedules
        implements Migration
{
    @Override
    public void migrate(Handle handle, MigrationContext context)
    {
        if (context.isPostgres()) {
            handle.execute("create index concurrently schedules_on_enabled_and_name on schedules (enabled, name)");
        }
        else {
            handle.execute("create index schedules_on_enabled_and_name on schedules (enabled, name)");
        }
    }

    @Override
    public boolean noTransaction(MigrationContext context)
    {
        return context.isPostgres();
    }
}
