package io.tickwork.core.database.migrate;

import org.jdbi.v3.core.Handle;

public class Migration_20240312154021_AddScheduleDueIndex
        implements Migration
{
    @Override
    public boolean noTransaction(MigrationContext context)
    {
        return context.isPostgres();
    }

    @Override
    public void migrate(Handle handle, MigrationContext context)
    {
        if (context.isPostgres()) {
            handle.execute("create index concurrently if not exists schedules_on_updated_at_active on schedules (updated_at, id) where deleted_at is null");
        }
        else {
            handle.execute("create index schedules_on_updated_at_active on schedules (updated_at, id)");
        }
    }
}
