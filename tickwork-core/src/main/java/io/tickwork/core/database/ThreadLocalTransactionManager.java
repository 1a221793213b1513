package io.tickwork.core.database;

import com.google.inject.Inject;
import io.tickwork.core.ThrowablesUtil;
import org.jdbi.v3.core.Handle;
import org.jdbi.v3.core.Jdbi;
import org.jdbi.v3.core.transaction.TransactionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.SQLException;

import javax.sql.DataSource;

import static com.google.common.base.Preconditions.checkNotNull;
import static java.util.Locale.ENGLISH;

public class ThreadLocalTransactionManager
        implements TransactionManager
{
    private static final Logger logger = LoggerFactory.getLogger(ThreadLocalTransactionManager.class);

    private final ThreadLocal<Transaction> threadLocalTransaction = new ThreadLocal<>();
    private final ThreadLocal<Transaction> threadLocalAutoCommitTransaction = new ThreadLocal<>();
    private final DataSource ds;
    private final String databaseType;

    private static class LazyTransaction
            implements Transaction
    {
        private enum State
        {
            ACTIVE,
            ABORTED,
            COMMITTED;
        }

        private final DataSource ds;
        private final String databaseType;
        private final boolean autoAutoCommit;
        private Handle handle;
        private State state = State.ACTIVE;

        LazyTransaction(DataSource ds, String databaseType, boolean autoAutoCommit)
        {
            this.ds = checkNotNull(ds);
            this.databaseType = databaseType;
            this.autoAutoCommit = autoAutoCommit;
        }

        @Override
        public Handle getHandle(ConfigMapper configMapper)
        {
            if (state != State.ACTIVE) {
                throw new IllegalStateException("Transaction is already " + state.name().toLowerCase(ENGLISH));
            }

            if (handle == null) {
                Jdbi dbi = JdbiHelper.createJdbi(ds, databaseType);
                dbi.registerRowMapper(new DatabaseScheduleStoreManager.StoredScheduleMapper(configMapper));
                dbi.registerRowMapper(new DatabaseScheduleStoreManager.ClaimedScheduleMapper(configMapper));
                dbi.registerArgument(configMapper.getArgumentFactory());
                handle = dbi.open();

                try {
                    handle.getConnection().setAutoCommit(autoAutoCommit);
                }
                catch (SQLException ex) {
                    handle.close();
                    handle = null;
                    throw new TransactionException("Failed to set auto commit: " + autoAutoCommit, ex);
                }
                if (!autoAutoCommit) {
                    handle.begin();
                }
            }
            return handle;
        }

        @Override
        public void commit()
        {
            if (handle == null) {
                return;
            }
            if (state != State.ACTIVE) {
                throw new IllegalStateException("Committing " + state.name().toLowerCase(ENGLISH) + " is not allowed");
            }

            // PostgreSQL turns COMMIT into a silent ROLLBACK when a statement failed
            // earlier in the transaction. Connection.isValid returns false in that state.
            boolean isValid;
            try {
                isValid = handle.getConnection().isValid(30);
            }
            catch (SQLException ex) {
                throw new TransactionException("Can't validate a transaction before commit", ex);
            }
            if (!isValid) {
                throw new TransactionException(
                        "Trying to commit a transaction that is already aborted. " +
                        "Commands including commit are ignored until end of transaction block.");
            }
            handle.commit();

            state = State.COMMITTED;
        }

        @Override
        public void abort()
        {
            if (handle == null) {
                return;
            }
            if (state == State.COMMITTED) {
                throw new IllegalStateException("Aborting committed transaction is not allowed");
            }
            if (!autoAutoCommit) {
                handle.rollback();
            }
            state = State.ABORTED;
        }

        void close()
        {
            if (handle != null) {
                handle.close();
            }
        }

        @Override
        public String toString()
        {
            return "LazyTransaction{" +
                    "autoAutoCommit=" + autoAutoCommit +
                    ", handle=" + handle +
                    ", state=" + state +
                    "}";
        }
    }

    @Inject
    public ThreadLocalTransactionManager(DataSource ds, DatabaseConfig config)
    {
        this(ds, config.getType());
    }

    ThreadLocalTransactionManager(DataSource ds, String databaseType)
    {
        this.ds = checkNotNull(ds);
        this.databaseType = checkNotNull(databaseType);
    }

    @Override
    public Handle getHandle(ConfigMapper configMapper)
    {
        Transaction transaction = threadLocalTransaction.get();
        if (transaction == null) {
            transaction = threadLocalAutoCommitTransaction.get();
            if (transaction == null) {
                throw new IllegalStateException("Not in transaction");
            }
        }
        try {
            return transaction.getHandle(configMapper);
        }
        catch (RuntimeException ex) {
            throw DatabaseExceptions.translate(ex);
        }
    }

    @Override
    public <T> T begin(SupplierInTransaction<T, RuntimeException, RuntimeException> func)
    {
        return begin(func, RuntimeException.class, RuntimeException.class);
    }

    @Override
    public <T, E1 extends Exception> T begin(SupplierInTransaction<T, E1, RuntimeException> func, Class<E1> e1)
            throws E1
    {
        return begin(func, e1, RuntimeException.class);
    }

    @Override
    public <T, E1 extends Exception, E2 extends Exception>
    T begin(SupplierInTransaction<T, E1, E2> func, Class<E1> e1, Class<E2> e2)
            throws E1, E2
    {
        if (threadLocalTransaction.get() != null) {
            throw new IllegalStateException("Nested transaction is not allowed: " + threadLocalTransaction.get());
        }

        LazyTransaction transaction = new LazyTransaction(ds, databaseType, false);
        threadLocalTransaction.set(transaction);
        T result;
        try {
            result = func.get();
            transaction.commit();
        }
        catch (Exception e) {
            Exception translated = DatabaseExceptions.translate(e);
            abortAndClose(transaction, translated);
            ThrowablesUtil.propagateIfInstanceOf(translated, e1);
            ThrowablesUtil.propagateIfInstanceOf(translated, e2);
            throw ThrowablesUtil.propagate(translated);
        }
        catch (Error e) {
            abortAndClose(transaction, e);
            throw e;
        }

        threadLocalTransaction.set(null);
        try {
            transaction.close();
        }
        catch (RuntimeException ex) {
            // already committed. the result is valid even if the connection is broken
            logger.warn("Failed to close a committed transaction", ex);
        }
        return result;
    }

    /**
     * Rolls back and releases the connection. Failures are attached to
     * {@code primary} so that the original error reaches the caller.
     */
    private void abortAndClose(LazyTransaction transaction, Throwable primary)
    {
        threadLocalTransaction.set(null);
        try {
            transaction.abort();
        }
        catch (RuntimeException ex) {
            primary.addSuppressed(ex);
        }
        try {
            transaction.close();
        }
        catch (RuntimeException ex) {
            primary.addSuppressed(ex);
        }
    }

    @Override
    public <T, E1 extends Exception> T transactional(SupplierInTransaction<T, E1, RuntimeException> func, Class<E1> e1)
            throws E1
    {
        if (threadLocalTransaction.get() == null) {
            return begin(func, e1);
        }
        try {
            return func.get();
        }
        catch (Exception e) {
            Exception translated = DatabaseExceptions.translate(e);
            ThrowablesUtil.propagateIfInstanceOf(translated, e1);
            throw ThrowablesUtil.propagate(translated);
        }
    }

    @Override
    public <T> T autoCommit(SupplierInTransaction<T, RuntimeException, RuntimeException> func)
    {
        return autoCommit(func, RuntimeException.class);
    }

    @Override
    public <T, E1 extends Exception> T autoCommit(SupplierInTransaction<T, E1, RuntimeException> func, Class<E1> e1)
            throws E1
    {
        try {
            if (threadLocalTransaction.get() != null || threadLocalAutoCommitTransaction.get() != null) {
                return func.get();
            }
            else {
                LazyTransaction transaction = new LazyTransaction(ds, databaseType, true);
                threadLocalAutoCommitTransaction.set(transaction);
                try {
                    return func.get();
                }
                finally {
                    threadLocalAutoCommitTransaction.set(null);
                    try {
                        transaction.close();
                    }
                    catch (RuntimeException ex) {
                        // statements are committed as they run
                        logger.warn("Failed to close an auto-commit connection", ex);
                    }
                }
            }
        }
        catch (Exception e) {
            Exception translated = DatabaseExceptions.translate(e);
            ThrowablesUtil.propagateIfInstanceOf(translated, e1);
            throw ThrowablesUtil.propagate(translated);
        }
    }
}
