package io.pacer.core.database.migrate;

import java.util.ArrayList;
import java.util.List;

public class CreateTableBuilder
{
    private final MigrationContext context;
    private final String name;
    private final List<String> columns = new ArrayList<>();

    CreateTableBuilder(MigrationContext context, String name)
    {
        this.context = context;
        this.name = name;
    }

    private CreateTableBuilder column(String column, String type, String options)
    {
        columns.add(options.isEmpty() ? column + " " + type : column + " " + type + " " + options);
        return this;
    }

    public CreateTableBuilder addIntId(String column)
    {
        return column(column, context.serialPrimaryKey(false), "");
    }

    public CreateTableBuilder addLongId(String column)
    {
        return column(column, context.serialPrimaryKey(true), "");
    }

    public CreateTableBuilder addLong(String column, String options)
    {
        return column(column, "bigint", options);
    }

    public CreateTableBuilder addBoolean(String column, String options)
    {
        return column(column, "boolean", options);
    }

    // names and identifiers
    public CreateTableBuilder addString(String column, String options)
    {
        return column(column, context.shortStringType(), options);
    }

    // JSON documents
    public CreateTableBuilder addText(String column, String options)
    {
        return column(column, "text", options);
    }

    public CreateTableBuilder addTimestamp(String column, String options)
    {
        return column(column, context.timestampType(), options);
    }

    public String build()
    {
        return "CREATE TABLE " + name + " (\n  " + String.join(",\n  ", columns) + "\n)";
    }
}
