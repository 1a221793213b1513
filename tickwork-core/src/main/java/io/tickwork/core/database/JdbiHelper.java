package io.tickwork.core.database;

import org.jdbi.v3.core.Handles;
import org.jdbi.v3.core.Jdbi;
import org.jdbi.v3.core.h2.H2DatabasePlugin;
import org.jdbi.v3.postgres.PostgresPlugin;
import org.jdbi.v3.sqlobject.SqlObjectPlugin;

import javax.sql.DataSource;

public class JdbiHelper
{
    private JdbiHelper()
    { }

    public static Jdbi createJdbi(DataSource ds, String databaseType)
    {
        Jdbi jdbi = Jdbi.create(ds);
        // ThreadLocalTransactionManager sets auto-commit itself. Without this,
        // Handle.close after commit fails because auto-commit is still off.
        jdbi.getConfig(Handles.class).setForceEndTransactions(false);
        jdbi.installPlugin(new SqlObjectPlugin());
        if (DatabaseConfig.isPostgres(databaseType)) {
            jdbi.installPlugin(new PostgresPlugin());
        }
        else {
            jdbi.installPlugin(new H2DatabasePlugin());
        }
        return jdbi;
    }
}
