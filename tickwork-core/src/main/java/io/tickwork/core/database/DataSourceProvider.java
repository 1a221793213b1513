package io.tickwork.core.database;

import javax.sql.DataSource;
import java.sql.SQLException;
import com.google.inject.Inject;
import com.google.inject.Provider;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import io.tickwork.core.ThrowablesUtil;
import org.h2.jdbcx.JdbcDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class DataSourceProvider
        implements Provider<DataSource>, AutoCloseable
{
    private final Logger logger = LoggerFactory.getLogger(getClass());

    private final DatabaseConfig config;
    private DataSource ds;
    private AutoCloseable closer;

    @Inject
    public DataSourceProvider(DatabaseConfig config)
    {
        this.config = config;
    }

    @Override
    public synchronized DataSource get()
    {
        if (ds == null) {
            switch (config.getType()) {
            case "h2":
                createSimpleDataSource();
                break;
            default:
                createPooledDataSource();
                break;
            }
        }
        return ds;
    }

    private void createSimpleDataSource()
    {
        String url = DatabaseConfig.buildJdbcUrl(config);

        // H2 drops an in-memory database when its last connection closes.
        // One connection is held until close() to keep it alive.
        JdbcDataSource ds = new JdbcDataSource();
        ds.setUrl(url + ";DB_CLOSE_ON_EXIT=FALSE");

        logger.debug("Using database URL {}", url);

        try {
            this.closer = ds.getConnection();
        }
        catch (SQLException ex) {
            throw ThrowablesUtil.propagate(ex);
        }
        this.ds = ds;
    }

    private void createPooledDataSource()
    {
        String url = DatabaseConfig.buildJdbcUrl(config);

        HikariConfig hikari = new HikariConfig();
        hikari.setJdbcUrl(url);
        hikari.setDriverClassName(DatabaseMigrator.getDriverClassName(config.getType()));
        hikari.setDataSourceProperties(DatabaseConfig.buildJdbcProperties(config));

        hikari.setConnectionTimeout(config.getConnectionTimeout() * 1000L);
        hikari.setIdleTimeout(config.getIdleTimeout() * 1000L);
        hikari.setMaxLifetime(config.getMaxLifetime() * 1000L);
        hikari.setValidationTimeout(config.getValidationTimeout() * 1000L);
        hikari.setMaximumPoolSize(config.getMaximumPoolSize());
        hikari.setMinimumIdle(config.getMinimumPoolSize());
        hikari.setLeakDetectionThreshold(config.getLeakDetectionThreshold());
        // start even if the database is down. Each operation reports CONNECTION until it's back
        hikari.setInitializationFailTimeout(-1);

        // connectionTestQuery must stay unset. ThreadLocalTransactionManager
        // relies on Connection.isValid returning false for an aborted transaction.

        logger.debug("Using database URL {} with pool profile {} (max={}, min={})",
                hikari.getJdbcUrl(), config.getPoolProfile().getName(),
                config.getMaximumPoolSize(), config.getMinimumPoolSize());

        HikariDataSource ds = new HikariDataSource(hikari);
        this.ds = ds;
        this.closer = ds;
    }

    @Override
    public synchronized void close()
    {
        if (ds != null) {
            try {
                closer.close();
            }
            catch (Exception ex) {
                throw ThrowablesUtil.propagate(ex);
            }
            ds = null;
            closer = null;
        }
    }
}
