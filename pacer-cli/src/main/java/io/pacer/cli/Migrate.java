package io.pacer.cli;

import java.util.List;
import io.pacer.commons.ObjectMappers;
import io.pacer.commons.config.ConfigFactory;
import io.pacer.core.config.PropertyUtils;
import io.pacer.core.database.DataSourceProvider;
import io.pacer.core.database.DatabaseConfig;
import io.pacer.core.database.DatabaseMigrator;
import io.pacer.core.database.migrate.Migration;
import org.jdbi.v3.core.Jdbi;

import static io.pacer.cli.SystemExitException.systemExit;

public class Migrate
    extends Command
{
    @Override
    public void main()
            throws Exception
    {
        if (args.size() != 1 || !(args.get(0).equals("run") || args.get(0).equals("check"))) {
            throw usage("Expected 'run' or 'check'");
        }
        if (database == null && configPath == null) {
            throw usage("--database, or --config option is required");
        }
        boolean apply = args.get(0).equals("run");

        ConfigFactory cf = new ConfigFactory(ObjectMappers.objectMapper());
        DatabaseConfig dbConfig = DatabaseConfig.convertFrom(
                PropertyUtils.toConfigElement(loadSystemProperties()).toConfig(cf));
        try (DataSourceProvider dsp = new DataSourceProvider(dbConfig)) {
            DatabaseMigrator migrator = new DatabaseMigrator(Jdbi.create(dsp.get()), dbConfig);
            if (apply) {
                int applied = migrator.migrate();
                out.println(applied == 0 ? "Schema is up to date" : "Applied " + applied + " migration(s)");
            }
            else {
                printPending(migrator);
            }
        }
    }

    private void printPending(DatabaseMigrator migrator)
    {
        if (!migrator.existsSchemaMigrationsTable()) {
            out.println("Database is not initialized");
        }
        List<Migration> pending = migrator.getApplicableMigration();
        if (pending.isEmpty()) {
            out.println("Schema is up to date");
            return;
        }
        for (Migration m : pending) {
            out.println("pending: " + m.getVersion() + " " + m.getName());
        }
    }

    @Override
    public SystemExitException usage(String error)
    {
        err.println("Usage: " + programName + " migrate (run|check)");
        err.println("  run applies pending database migrations, check lists them");
        err.println("  Options:");
        err.println("    -c, --config PATH.properties     configuration file (default: " + ConfigUtil.defaultConfigPath(env) + ")");
        err.println("    -o, --database DIR               use an H2 database stored in this directory");
        return systemExit(error);
    }
}
