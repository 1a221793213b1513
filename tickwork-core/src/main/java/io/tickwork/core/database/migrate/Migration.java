package io.tickwork.core.database.migrate;

import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.jdbi.v3.core.Handle;

public interface Migration
{
    Pattern MIGRATION_NAME_PATTERN = Pattern.compile("Migration_([0-9]{14})_([A-Za-z0-9]+)");

    /**
     * Version is the 14-digit timestamp embedded in the class name.
     */
    default String getVersion()
    {
        Matcher m = MIGRATION_NAME_PATTERN.matcher(getClass().getSimpleName());
        if (!m.matches()) {
            throw new AssertionError("Invalid migration class name: " + getClass().getSimpleName());
        }
        return m.group(1);
    }

    /**
     * If true, this migration runs outside of a transaction. Needed for
     * PostgreSQL's CREATE INDEX CONCURRENTLY.
     *
     * Such a migration MUST run exactly one DDL statement, or a failure in the
     * middle leaves the schema in a state that a retry can't recover from.
     */
    default boolean noTransaction(MigrationContext context)
    {
        return false;
    }

    void migrate(Handle handle, MigrationContext context);
}
