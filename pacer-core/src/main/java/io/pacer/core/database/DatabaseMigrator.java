package io.pacer.core.database;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Optional;
import com.google.inject.Inject;
import org.jdbi.v3.core.Jdbi;
import org.jdbi.v3.core.Handle;

import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import io.pacer.core.database.migrate.Migration;
import io.pacer.core.database.migrate.MigrationContext;
import io.pacer.core.database.migrate.Migration_20240105101500_CreateTables;
import io.pacer.core.database.migrate.Migration_20240212093000_AddEnabledIndexToSchedules;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class DatabaseMigrator
{
    private static final Logger logger = LoggerFactory.getLogger(DatabaseMigrator.class);

    private final List<Migration> migrations = Stream.of(new Migration[] {
        new Migration_20240105101500_CreateTables(),
        new Migration_20240212093000_AddEnabledIndexToSchedules(),
    })
    .sorted(Comparator.comparing(m -> m.getVersion()))
    .collect(Collectors.toList());

    private final Jdbi dbi;
    private final MigrationContext context;

    @Inject
    public DatabaseMigrator(Jdbi dbi, DatabaseConfig config)
    {
        this.dbi = dbi;
        this.context = new MigrationContext(config.isPostgres());
    }

    public Optional<String> getSchemaVersion()
    {
        try (Handle handle = dbi.open()) {
            return Optional.fromJavaUtil(
                    handle.createQuery("select name from schema_migrations order by name desc limit 1")
                    .mapTo(String.class)
                    .findFirst());
        }
    }

    public int migrate()
    {
        int numApplied = 0;
        Set<String> appliedSet;
        try (Handle handle = dbi.open()) {
            boolean isInitial = !existsSchemaMigrationsTable(handle);
            if (isInitial) {
                createSchemaMigrationsTable(handle, context);
            }
            appliedSet = getAppliedMigrationNames(handle);
        }
        for (Migration m : migrations) {
            if (appliedSet.add(m.getVersion())) {
                if (applyMigrationIfNotDone(m)) {
                    numApplied++;
                }
            }
        }
        if (numApplied > 0) {
            logger.info("Database schema is up to date after {} migration(s)", numApplied);
        }
        return numApplied;
    }

    // synchronized: threads of one process share the H2 database, which has no table lock
    private synchronized boolean applyMigrationIfNotDone(Migration m)
    {
        try (Handle handle = dbi.open()) {
            if (m.noTransaction(context)) {
                if (!context.isPostgres()) {
                    return applyUnlessRecorded(m, handle);
                }
                // session lock; the pooled connection outlives the handle, so unlock explicitly
                handle.select("SELECT pg_advisory_lock(23299, 0)").mapToMap().list();
                try {
                    return applyUnlessRecorded(m, handle);
                }
                finally {
                    handle.select("SELECT pg_advisory_unlock(23299, 0)").mapToMap().list();
                }
            }
            return handle.inTransaction(h -> {
                if (context.isPostgres()) {
                    h.execute("LOCK TABLE schema_migrations IN EXCLUSIVE MODE");
                }
                return applyUnlessRecorded(m, h);
            });
        }
    }

    private boolean applyUnlessRecorded(Migration m, Handle handle)
    {
        // another thread or scheduler process may have applied it while this one waited for the lock
        if (checkIfMigrationApplied(handle, m.getVersion())) {
            return false;
        }
        logger.info("Applying database migration {} ({})", m.getVersion(), m.getName());
        applyMigration(m, handle, context);
        return true;
    }

    /**
     * Migrations that {@link #migrate()} would apply, in order.
     */
    public List<Migration> getApplicableMigration()
    {
        try (Handle handle = dbi.open()) {
            Set<String> applied = existsSchemaMigrationsTable(handle)
                ? getAppliedMigrationNames(handle)
                : new HashSet<>();
            return migrations.stream()
                .filter(m -> !applied.contains(m.getVersion()))
                .collect(Collectors.toList());
        }
    }

    private Set<String> getAppliedMigrationNames(Handle handle)
    {
        return new HashSet<>(
                handle.createQuery("select name from schema_migrations")
                .mapTo(String.class)
                .list());
    }

    private boolean checkIfMigrationApplied(Handle handle, String name)
    {
        return handle.createQuery("select name from schema_migrations where name = :name limit 1")
            .bind("name", name)
            .mapTo(String.class)
            .list()
            .size() > 0;
    }

    @VisibleForTesting
    void createSchemaMigrationsTable(Handle handle, MigrationContext context)
    {
        handle.execute(
                context.newCreateTableBuilder("schema_migrations")
                .addString("name", "not null")
                .addTimestamp("created_at", "not null")
                .build());
    }

    public boolean existsSchemaMigrationsTable()
    {
        try (Handle handle = dbi.open()) {
            return existsSchemaMigrationsTable(handle);
        }
    }

    private boolean existsSchemaMigrationsTable(Handle handle)
    {
        try {
            handle.createQuery("select name from schema_migrations limit 1")
                    .mapTo(String.class)
                    .list();
            return true;
        }
        catch (RuntimeException re) {
            logger.trace("schema_migrations table is not readable", re);
            return false;
        }
    }

    @VisibleForTesting
    void applyMigration(Migration m, Handle handle, MigrationContext context)
    {
        m.migrate(handle, context);
        handle.execute("insert into schema_migrations (name, created_at) values (?, current_timestamp)", m.getVersion());
    }

    @VisibleForTesting
    List<Migration> getMigrations()
    {
        return migrations;
    }
}
