package io.pacer.core.database;

import org.jdbi.v3.core.Handle;

/**
 * Binds one database transaction to the calling thread. Stores never open
 * connections themselves; they run on the handle of the transaction started
 * by their caller.
 */
public interface TransactionManager
{
    /**
     * Returns the handle of the transaction bound to the current thread.
     *
     * @throws IllegalStateException if the thread is not in a transaction
     */
    Handle getHandle(ConfigMapper configMapper);

    /**
     * Runs func in a new transaction. Commits when func returns and rolls back
     * when it throws.
     */
    <T> T begin(SupplierInTransaction<T, RuntimeException> func);

    <T, E extends Exception> T begin(SupplierInTransaction<T, E> func, Class<E> exceptionClass)
        throws E;

    @FunctionalInterface
    interface SupplierInTransaction<T, E extends Exception>
    {
        T get()
                throws E;
    }
}
