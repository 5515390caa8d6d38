package io.pacer.core.database.migrate;

/**
 * SQL dialect of the database a migration runs on. Only the column types
 * differ between h2 and postgresql in pacer's schema.
 */
public class MigrationContext
{
    private final boolean postgres;

    public MigrationContext(boolean postgres)
    {
        this.postgres = postgres;
    }

    public boolean isPostgres()
    {
        return postgres;
    }

    String serialPrimaryKey(boolean wide)
    {
        if (postgres) {
            return wide ? "bigserial primary key" : "serial primary key";
        }
        // h2 2.x rejects AUTO_INCREMENT after primary key
        return (wide ? "bigint" : "int") + " generated by default as identity primary key";
    }

    String shortStringType()
    {
        return postgres ? "text" : "varchar(255)";
    }

    String timestampType()
    {
        return postgres ? "timestamp with time zone" : "timestamp";
    }

    public CreateTableBuilder newCreateTableBuilder(String tableName)
    {
        return new CreateTableBuilder(this, tableName);
    }
}
