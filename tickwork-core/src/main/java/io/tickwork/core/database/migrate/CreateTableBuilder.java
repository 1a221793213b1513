package io.tickwork.core.database.migrate;

import io.tickwork.core.database.DatabaseConfig;

import java.util.ArrayList;
import java.util.List;

public class CreateTableBuilder
{
    private final String databaseType;
    private final String name;
    private final List<String> columns = new ArrayList<>();
    private final List<String> constraints = new ArrayList<>();

    CreateTableBuilder(String databaseType, String name)
    {
        this.databaseType = databaseType;
        this.name = name;
    }

    private boolean isPostgres()
    {
        return DatabaseConfig.isPostgres(databaseType);
    }

    public CreateTableBuilder add(String column, String typeAndOptions)
    {
        columns.add(column + " " + typeAndOptions);
        return this;
    }

    public CreateTableBuilder addLongId(String column)
    {
        if (isPostgres()) {
            return add(column, "bigserial primary key");
        }
        else {
            return add(column, "bigint generated by default as identity primary key");
        }
    }

    public CreateTableBuilder addInt(String column, String options)
    {
        return add(column, "int " + options);
    }

    public CreateTableBuilder addLong(String column, String options)
    {
        return add(column, "bigint " + options);
    }

    public CreateTableBuilder addUuid(String column, String options)
    {
        return add(column, "uuid " + options);
    }

    public CreateTableBuilder addString(String column, String options)
    {
        if (isPostgres()) {
            return add(column, "text " + options);
        }
        else {
            return add(column, "varchar(255) " + options);
        }
    }

    public CreateTableBuilder addLongText(String column, String options)
    {
        if (isPostgres()) {
            return add(column, "text " + options);
        }
        else {
            return add(column, "clob " + options);
        }
    }

    public CreateTableBuilder addTimestamp(String column, String options)
    {
        if (isPostgres()) {
            return add(column, "timestamp with time zone " + options);
        }
        else {
            return add(column, "timestamp " + options);
        }
    }

    public CreateTableBuilder addPrimaryKey(String... keyColumns)
    {
        constraints.add("primary key (" + String.join(", ", keyColumns) + ")");
        return this;
    }

    public CreateTableBuilder addCheck(String constraintName, String condition)
    {
        constraints.add("constraint " + constraintName + " check (" + condition + ")");
        return this;
    }

    public String build()
    {
        List<String> elements = new ArrayList<>(columns);
        elements.addAll(constraints);

        StringBuilder sb = new StringBuilder();
        sb.append("CREATE TABLE " + name + " (\n");
        for (int i = 0; i < elements.size(); i++) {
            sb.append("  ");
            sb.append(elements.get(i));
            if (i + 1 < elements.size()) {
                sb.append(",\n");
            }
            else {
                sb.append("\n");
            }
        }
        sb.append(")");
        return sb.toString();
    }
}
