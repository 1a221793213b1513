package io.tickwork.core.database;

import org.jdbi.v3.core.Handle;

/**
 * Binds one database transaction to the calling thread.
 *
 * Failures of the database are rethrown as {@link DatabaseAccessException};
 * exceptions thrown by the supplied function pass through unchanged.
 */
public interface TransactionManager
{
    /**
     * Return the handle of the current transaction. A connection is taken
     * from the pool on the first call in a transaction.
     */
    Handle getHandle(ConfigMapper configMapper);

    /**
     * Create a new transaction, set it as the current transaction and commit
     * it when the function returns. Any exception rolls it back.
     */
    <T> T begin(SupplierInTransaction<T, RuntimeException, RuntimeException> func);

    <T, E1 extends Exception> T begin(
            SupplierInTransaction<T, E1, RuntimeException> func, Class<E1> e1)
        throws E1;

    <T, E1 extends Exception, E2 extends Exception> T begin(
            SupplierInTransaction<T, E1, E2> func, Class<E1> e1, Class<E2> e2)
        throws E1, E2;

    /**
     * Join the current transaction if exists, otherwise run the function on a
     * temporary connection in auto-commit mode.
     */
    <T> T autoCommit(SupplierInTransaction<T, RuntimeException, RuntimeException> func);

    <T, E1 extends Exception> T autoCommit(
            SupplierInTransaction<T, E1, RuntimeException> func, Class<E1> e1)
        throws E1;

    /**
     * Join the current transaction if exists, otherwise do the same as
     * {@link #begin(SupplierInTransaction, Class)}.
     */
    <T, E1 extends Exception> T transactional(
            SupplierInTransaction<T, E1, RuntimeException> func, Class<E1> e1)
        throws E1;

    @FunctionalInterface
    interface SupplierInTransaction<T, E1 extends Exception, E2 extends Exception>
    {
        T get()
                throws E1, E2;
    }
}
