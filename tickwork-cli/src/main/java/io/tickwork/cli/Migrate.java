package io.tickwork.cli;

import io.tickwork.core.database.DataSourceProvider;
import io.tickwork.core.database.DatabaseConfig;
import io.tickwork.core.database.DatabaseMigrator;
import io.tickwork.core.database.migrate.Migration;

import java.util.List;

import static io.tickwork.cli.SystemExitException.systemExit;

public class Migrate
    extends Command
{
    private SubCommand subCommand = null;

    @Override
    public void main()
            throws Exception
    {
        checkArgs();
        DatabaseConfig dbConfig = DatabaseConfig.convertFrom(buildSystemConfig(loadSystemProperties()));
        try (DataSourceProvider dsp = new DataSourceProvider(dbConfig)) {
            DatabaseMigrator migrator = new DatabaseMigrator(dsp.get(), dbConfig);
            switch (subCommand) {
                case RUN:
                    runMigrate(migrator);
                    break;
                case CHECK:
                    checkMigrate(migrator);
                    break;
                default:
                    throw new IllegalStateException("No command");
            }
        }
    }

    // migrate run
    private void runMigrate(DatabaseMigrator migrator)
    {
        int numApplied = migrator.migrate();
        if (numApplied == 0) {
            out.println("No update");
        }
        else {
            out.println("Migrations successfully finished");
        }
    }

    // migrate check
    private void checkMigrate(DatabaseMigrator migrator)
    {
        if (!migrator.existsSchemaMigrationsTable()) {
            out.println("No table exist");
            return;
        }

        List<Migration> migrations = migrator.getApplicableMigration();
        for (Migration m : migrations) {
            out.println(m.getVersion());
        }
        if (migrations.isEmpty()) {
            out.println("No update");
        }
    }

    private void checkArgs()
        throws SystemExitException
    {
        if (args.size() != 1) {
            throw usage("Invalid parameters");
        }
        switch (args.get(0)) {
            case "run":
                subCommand = SubCommand.RUN;
                break;
            case "check":
                subCommand = SubCommand.CHECK;
                break;
            default:
                throw usage("Invalid command");
        }

        // an in-memory database vanishes when this command exits
        if (database == null && configPath == null && !env.containsKey("TICKWORK_CONFIG")) {
            throw usage("--database, or --config option is required");
        }
    }

    @Override
    public SystemExitException usage(String error)
    {
        err.println("Usage: " + programName + " migrate (run|check)   run or check database migration");
        err.println("  Options:");
        err.println("    -o, --database DIR               path to H2 database");
        Main.showCommonOptions(env, err);
        return systemExit(error);
    }

    private enum SubCommand
    {
        RUN,
        CHECK;
    }
}
