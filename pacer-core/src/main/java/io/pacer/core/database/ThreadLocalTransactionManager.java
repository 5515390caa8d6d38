package io.pacer.core.database;

import com.google.inject.Inject;
import io.pacer.commons.guava.ThrowablesUtil;
import org.jdbi.v3.core.Handle;
import org.jdbi.v3.core.Jdbi;
import org.jdbi.v3.core.transaction.TransactionException;
import org.jdbi.v3.sqlobject.SqlObjectPlugin;

import java.sql.SQLException;

import javax.sql.DataSource;

import static com.google.common.base.Preconditions.checkNotNull;

public class ThreadLocalTransactionManager
        implements TransactionManager
{
    // seconds
    private static final int VALIDATION_TIMEOUT = 30;

    private final ThreadLocal<ThreadTransaction> current = new ThreadLocal<>();
    private final Jdbi dbi;

    @Inject
    public ThreadLocalTransactionManager(DataSource ds)
    {
        this.dbi = Jdbi.create(checkNotNull(ds));
        dbi.installPlugin(new SqlObjectPlugin());
        dbi.registerRowMapper(new DatabaseScheduleStore.StoredScheduleMapper());
    }

    /**
     * Opens its connection on the first statement so that a transaction that
     * never touches the database costs nothing.
     */
    private class ThreadTransaction
    {
        private final Thread owner = Thread.currentThread();
        private Handle handle;
        private boolean committed;

        Handle handle(ConfigMapper configMapper)
        {
            if (committed) {
                throw new IllegalStateException("Transaction is already committed");
            }
            if (handle == null) {
                handle = dbi.open();
                handle.registerArgument(configMapper.getArgumentFactory());
                // Jdbi turns autocommit off here and restores the connection's
                // original mode on commit and rollback
                handle.begin();
            }
            return handle;
        }

        void commit()
        {
            if (handle == null) {
                committed = true;
                return;
            }

            // PostgreSQL turns COMMIT into ROLLBACK after a failed statement.
            // Connection.isValid reports that state before the commit is issued.
            boolean valid;
            try {
                valid = handle.getConnection().isValid(VALIDATION_TIMEOUT);
            }
            catch (SQLException ex) {
                throw new TransactionException("Failed to validate the connection before commit", ex);
            }
            if (!valid) {
                throw new TransactionException("Transaction was aborted by the database and can't be committed");
            }
            handle.commit();
            committed = true;
        }

        void close()
        {
            if (handle == null) {
                return;
            }
            try {
                if (!committed) {
                    handle.rollback();
                }
            }
            finally {
                handle.close();
            }
        }

        @Override
        public String toString()
        {
            return "transaction of thread " + owner.getName();
        }
    }

    @Override
    public Handle getHandle(ConfigMapper configMapper)
    {
        ThreadTransaction transaction = current.get();
        if (transaction == null) {
            throw new IllegalStateException("Not in transaction");
        }
        return transaction.handle(configMapper);
    }

    @Override
    public <T> T begin(SupplierInTransaction<T, RuntimeException> func)
    {
        return begin(func, RuntimeException.class);
    }

    @Override
    public <T, E extends Exception> T begin(SupplierInTransaction<T, E> func, Class<E> exceptionClass)
            throws E
    {
        if (current.get() != null) {
            throw new IllegalStateException("Nested transaction is not allowed in " + current.get());
        }

        ThreadTransaction transaction = new ThreadTransaction();
        current.set(transaction);
        try {
            T result = func.get();
            transaction.commit();
            return result;
        }
        catch (Exception ex) {
            ThrowablesUtil.propagateIfInstanceOf(ex, exceptionClass);
            throw ThrowablesUtil.propagate(ex);
        }
        finally {
            current.remove();
            transaction.close();
        }
    }
}
