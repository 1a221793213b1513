package io.tickwork.core.database;

import com.google.inject.Provider;
import io.tickwork.core.ThrowablesUtil;
import io.tickwork.core.schedule.ScheduleClaimQueue;
import org.jdbi.v3.core.Jdbi;

import java.time.Clock;

import javax.sql.DataSource;

import static io.tickwork.core.database.DatabaseTestingUtils.createConfigMapper;

public class DatabaseFactory
        implements AutoCloseable, Provider<TransactionManager>
{
    private final TransactionManager tm;
    private final AutoCloseable closeable;
    private final DatabaseConfig config;
    private final Jdbi dbi;
    private final DataSource dataSource;

    public DatabaseFactory(TransactionManager tm, AutoCloseable closeable, DatabaseConfig config, Jdbi dbi, DataSource dataSource)
    {
        this.tm = tm;
        this.dataSource = dataSource;
        this.closeable = closeable;
        this.config = config;
        this.dbi = dbi;
    }

    @Override
    public TransactionManager get()
    {
        return tm;
    }

    public <T> T begin(TransactionManager.SupplierInTransaction<T, Exception, RuntimeException> func)
            throws Exception
    {
        return tm.begin(func, Exception.class);
    }

    public void begin(ThrowableRunnable func)
            throws Exception
    {
        begin(() -> {
            func.run();
            return null;
        });
    }

    @FunctionalInterface
    public interface ThrowableRunnable
    {
        void run() throws Exception;
    }

    public DatabaseConfig getConfig()
    {
        return config;
    }

    public DataSource getDataSource()
    {
        return dataSource;
    }

    public Jdbi getJdbi()
    {
        return dbi;
    }

    public DatabaseScheduleStoreManager getScheduleStoreManager(Clock clock)
    {
        return new DatabaseScheduleStoreManager(tm, createConfigMapper(), config, clock);
    }

    public ScheduleClaimQueue getScheduleClaimQueue(Clock clock)
    {
        return new ScheduleClaimQueue(tm, getScheduleStoreManager(clock));
    }

    public void close()
    {
        try {
            closeable.close();
        }
        catch (Exception ex) {
            throw ThrowablesUtil.propagate(ex);
        }
    }
}
