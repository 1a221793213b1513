package io.tickwork.core.database.migrate;

import org.jdbi.v3.core.Handle;

public class Migration_20240105093012_CreateScheduleTables
        implements Migration
{
    @Override
    public void migrate(Handle handle, MigrationContext context)
    {
        // only the columns the claim query reads are required here.
        // workflows are managed by another service
        handle.execute(
                context.newCreateTableBuilder("workflows")
                .addLongId("id")
                .addUuid("owner_id", "not null")
                .addString("name", "not null")
                .addTimestamp("created_at", "not null")
                .addTimestamp("updated_at", "not null")
                .addTimestamp("deleted_at", "")
                .build());

        handle.execute(
                context.newCreateTableBuilder("schedules")
                .addLongId("id")
                .addUuid("owner_id", "not null")
                .addInt("update_interval", "not null")
                .addLongText("metadata", "not null")
                .addTimestamp("created_at", "not null")
                .addTimestamp("updated_at", "not null")
                .addTimestamp("deleted_at", "")
                .addCheck("schedules_update_interval_positive", "update_interval > 0")
                .addCheck("schedules_updated_after_created", "updated_at >= created_at")
                .addCheck("schedules_deleted_after_updated", "deleted_at is null or deleted_at >= updated_at")
                .build());
        handle.execute("create index schedules_on_owner_id_and_id on schedules (owner_id, id)");

        handle.execute(
                context.newCreateTableBuilder("workflow_schedules")
                .addLong("workflow_id", "not null references workflows (id)")
                .addLong("schedule_id", "not null references schedules (id)")
                .addTimestamp("created_at", "not null")
                .addPrimaryKey("workflow_id", "schedule_id")
                .build());
        handle.execute("create index workflow_schedules_on_schedule_id on workflow_schedules (schedule_id)");
    }
}
