package io.tickwork.core.database;

import com.google.common.annotations.VisibleForTesting;
import com.google.inject.Inject;
import io.tickwork.core.database.migrate.Migration;
import io.tickwork.core.database.migrate.MigrationContext;
import io.tickwork.core.database.migrate.Migration_20240105093012_CreateScheduleTables;
import io.tickwork.core.database.migrate.Migration_20240312154021_AddScheduleDueIndex;
import org.jdbi.v3.core.Handle;
import org.jdbi.v3.core.Jdbi;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

public class DatabaseMigrator
{
    private static final Logger logger = LoggerFactory.getLogger(DatabaseMigrator.class);

    private final List<Migration> migrations = Stream.of(new Migration[] {
        new Migration_20240105093012_CreateScheduleTables(),
        new Migration_20240312154021_AddScheduleDueIndex(),
    })
    .sorted(Comparator.comparing(m -> m.getVersion()))
    .collect(Collectors.toList());

    private final Jdbi dbi;
    private final String databaseType;

    @Inject
    public DatabaseMigrator(DataSource ds, DatabaseConfig config)
    {
        this(JdbiHelper.createJdbi(ds, config.getType()), config.getType());
    }

    DatabaseMigrator(Jdbi dbi, String databaseType)
    {
        this.dbi = dbi;
        this.databaseType = databaseType;
    }

    public static String getDriverClassName(String type)
    {
        switch (type) {
        case "h2":
            return "org.h2.Driver";
        case "postgresql":
            return "org.postgresql.Driver";
        default:
            throw new IllegalArgumentException("Unsupported database type: " + type);
        }
    }

    public int migrate()
    {
        int numApplied = 0;
        MigrationContext context = new MigrationContext(databaseType);
        Set<String> appliedSet;
        try (Handle handle = dbi.open()) {
            if (!existsSchemaMigrationsTable(handle)) {
                createSchemaMigrationsTable(handle, context);
            }
            appliedSet = getAppliedMigrationNames(handle);
        }
        for (Migration m : migrations) {
            if (appliedSet.add(m.getVersion())) {
                if (applyMigrationIfNotDone(context, m)) {
                    numApplied++;
                }
            }
        }
        if (numApplied > 0) {
            logger.info("{} migrations applied.", numApplied);
        }
        return numApplied;
    }

    // synchronized so that threads of this process don't run the same migration twice
    private synchronized boolean applyMigrationIfNotDone(MigrationContext context, Migration m)
    {
        try (Handle handle = dbi.open()) {
            if (m.noTransaction(context)) {
                if (context.isPostgres()) {
                    // session-level lock across processes, released when the handle closes
                    handle.createQuery("select pg_advisory_lock(23299, 0)").mapTo(String.class).list();
                    if (!checkIfMigrationApplied(handle, m.getVersion())) {
                        logger.info("Applying database migration: {}", m.getVersion());
                        applyMigration(m, handle, context);
                        return true;
                    }
                    return false;
                }
                else {
                    logger.debug("Applying database migration: {}", m.getVersion());
                    applyMigration(m, handle, context);
                    return true;
                }
            }
            else {
                return handle.inTransaction((h) -> {
                    if (context.isPostgres()) {
                        h.execute("LOCK TABLE schema_migrations IN EXCLUSIVE MODE");
                        if (!checkIfMigrationApplied(h, m.getVersion())) {
                            logger.info("Applying database migration: {}", m.getVersion());
                            applyMigration(m, h, context);
                            return true;
                        }
                        return false;
                    }
                    else {
                        logger.debug("Applying database migration: {}", m.getVersion());
                        applyMigration(m, h, context);
                        return true;
                    }
                });
            }
        }
    }

    /**
     * Migrations not applied yet, in version order. Empty if the database
     * was never migrated.
     */
    public List<Migration> getApplicableMigration()
    {
        List<Migration> applicableMigrations = new ArrayList<>();
        try (Handle handle = dbi.open()) {
            if (!existsSchemaMigrationsTable(handle)) {
                return applicableMigrations;
            }

            Set<String> appliedSet = getAppliedMigrationNames(handle);
            for (Migration m : migrations) {
                if (!appliedSet.contains(m.getVersion())) {
                    applicableMigrations.add(m);
                }
            }
        }
        return applicableMigrations;
    }

    public List<Migration> getMigrations()
    {
        return migrations;
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
        return handle.createQuery("select name from schema_migrations where name = :name")
            .bind("name", name)
            .mapTo(String.class)
            .findFirst()
            .isPresent();
    }

    private void createSchemaMigrationsTable(Handle handle, MigrationContext context)
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
            logger.trace("schema_migrations table is not available", re);
            return false;
        }
    }

    @VisibleForTesting
    void applyMigration(Migration m, Handle handle, MigrationContext context)
    {
        m.migrate(handle, context);
        handle.execute("insert into schema_migrations (name, created_at) values (?, now())", m.getVersion());
    }
}
