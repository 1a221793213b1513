package io.tickwork.core.database;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.UUID;

import com.google.common.base.Optional;
import com.google.common.base.Throwables;
import io.tickwork.core.ThrowablesUtil;
import io.tickwork.core.repository.ResourceNotFoundException;
import org.jdbi.v3.core.Handle;
import org.jdbi.v3.core.statement.UnableToExecuteStatementException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public abstract class BasicDatabaseStoreManager <D>
{
    protected final Logger logger = LoggerFactory.getLogger(getClass());

    protected final String databaseType;
    private final Class<? extends D> daoIface;
    private final TransactionManager transactionManager;
    protected final ConfigMapper configMapper;

    protected BasicDatabaseStoreManager(
            String databaseType,
            Class<? extends D> daoIface,
            TransactionManager transactionManager,
            ConfigMapper configMapper)
    {
        this.databaseType = databaseType;
        this.daoIface = daoIface;
        this.transactionManager = transactionManager;
        this.configMapper = configMapper;
    }

    public <T> T requiredResource(T resource, String messageFormat, Object... messageParameters)
            throws ResourceNotFoundException
    {
        if (resource == null) {
            throw new ResourceNotFoundException("Resource does not exist: " + String.format(messageFormat, messageParameters));
        }
        return resource;
    }

    public <T> T requiredResource(AutoCommitAction<T, D> action, String messageFormat, Object... messageParameters)
            throws ResourceNotFoundException
    {
        return requiredResource(autoCommit(action), messageFormat, messageParameters);
    }

    public interface ForeignKeyAction <T>
    {
        T call();
    }

    /**
     * Runs the action and converts a foreign key violation into
     * ResourceNotFoundException. Other database failures are translated
     * as usual.
     */
    public <T> T catchForeignKeyNotFound(ForeignKeyAction<T> function,
            String messageFormat, Object... messageParameters)
            throws ResourceNotFoundException
    {
        try {
            return function.call();
        }
        catch (UnableToExecuteStatementException ex) {
            if (isForeignKeyException(ex)) {
                throw new ResourceNotFoundException("Resource not found: " + String.format(messageFormat, messageParameters), ex);
            }
            throw DatabaseExceptions.translate(ex);
        }
    }

    boolean isForeignKeyException(Exception ex)
    {
        String expected;
        switch (databaseType) {
        case "h2":
            expected = "23506";
            break;
        default:
            expected = "23503";
            break;
        }
        for (Throwable cause : Throwables.getCausalChain(ex)) {
            SQLException sqlEx = cause instanceof SQLException ? (SQLException) cause : null;
            while (sqlEx != null) {
                // batch statements report the failed row as the next exception
                if (expected.equals(sqlEx.getSQLState())) {
                    return true;
                }
                sqlEx = sqlEx.getNextException();
            }
        }
        return false;
    }

    public interface AutoCommitAction <T, D>
    {
        T call(Handle handle, D dao);
    }

    public interface TransactionAction <T, D>
    {
        T call(Handle handle, D dao);
    }

    public interface TransactionActionWithExceptions <T, D, E1 extends Exception>
    {
        T call(Handle handle, D dao) throws E1;
    }

    /**
     * Runs the action on the current transaction of this thread.
     */
    public <T> T transaction(TransactionAction<T, D> action)
    {
        Handle handle = transactionManager.getHandle(configMapper);
        try {
            return action.call(handle, handle.attach(daoIface));
        }
        catch (RuntimeException ex) {
            throw DatabaseExceptions.translate(ex);
        }
    }

    public <T, E1 extends Exception> T transaction(
            TransactionActionWithExceptions<T, D, E1> action,
            Class<E1> exClass1)
        throws E1
    {
        Handle handle = transactionManager.getHandle(configMapper);
        try {
            return action.call(handle, handle.attach(daoIface));
        }
        catch (Exception ex) {
            Exception translated = DatabaseExceptions.translate(ex);
            ThrowablesUtil.propagateIfInstanceOf(translated, exClass1);
            throw ThrowablesUtil.propagate(translated);
        }
    }

    /**
     * Runs the action on the current transaction, or in a new transaction
     * that commits when the action returns.
     */
    public <T, E1 extends Exception> T inTransaction(
            TransactionActionWithExceptions<T, D, E1> action,
            Class<E1> exClass1)
        throws E1
    {
        return transactionManager.transactional(() -> transaction(action, exClass1), exClass1);
    }

    /**
     * Runs the action on the current transaction, or on a temporary
     * auto-commit connection if this thread has none.
     */
    public <T> T autoCommit(AutoCommitAction<T, D> action)
    {
        return transactionManager.autoCommit(() -> {
            Handle handle = transactionManager.getHandle(configMapper);
            return action.call(handle, handle.attach(daoIface));
        });
    }

    public static UUID getUuid(ResultSet r, String column)
            throws SQLException
    {
        String v = r.getString(column);
        return UUID.fromString(v);
    }

    public static Instant getTimestampInstant(ResultSet r, String column)
            throws SQLException
    {
        return r.getTimestamp(column).toInstant();
    }

    public static Optional<Instant> getOptionalTimestampInstant(ResultSet r, String column)
            throws SQLException
    {
        Timestamp t = r.getTimestamp(column);
        if (r.wasNull()) {
            return Optional.absent();
        }
        else {
            return Optional.of(t.toInstant());
        }
    }
}
