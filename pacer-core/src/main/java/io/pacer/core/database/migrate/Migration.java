package io.pacer.core.database.migrate;

import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.jdbi.v3.core.Handle;

/**
 * A schema change. Implementations are named {@code Migration_<yyyyMMddHHmmss>_<Name>};
 * the timestamp is the version recorded in schema_migrations.
 */
public interface Migration
{
    Pattern CLASS_NAME_FORMAT = Pattern.compile("Migration_(\\d{14})_(\\w+)");

    default String getVersion()
    {
        return parseClassName(this).group(1);
    }

    default String getName()
    {
        return parseClassName(this).group(2);
    }

    /**
     * Runs the migration outside a transaction, for statements such as
     * CREATE INDEX CONCURRENTLY. Such a migration must consist of a single statement.
     */
    default boolean noTransaction(MigrationContext context)
    {
        return false;
    }

    void migrate(Handle handle, MigrationContext context);

    static Matcher parseClassName(Migration migration)
    {
        String className = migration.getClass().getSimpleName();
        Matcher m = CLASS_NAME_FORMAT.matcher(className);
        if (!m.matches()) {
            throw new IllegalStateException("Migration class name doesn't follow Migration_<version>_<name>: " + className);
        }
        return m;
    }
}
