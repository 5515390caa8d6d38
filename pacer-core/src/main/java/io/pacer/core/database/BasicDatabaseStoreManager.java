package io.pacer.core.database;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.UUID;

import com.google.common.base.Optional;
import io.pacer.core.repository.ResourceConflictException;
import org.jdbi.v3.core.Handle;
import org.jdbi.v3.core.statement.UnableToExecuteStatementException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Base of the JDBC stores. Statements run on the handle of the transaction that
 * the caller started with {@link TransactionManager#begin}.
 */
public abstract class BasicDatabaseStoreManager <D>
{
    // unique_violation on both h2 and postgresql
    private static final String UNIQUE_VIOLATION = "23505";

    protected final Logger logger = LoggerFactory.getLogger(getClass());

    private final Class<D> daoIface;
    private final TransactionManager tm;
    protected final ConfigMapper configMapper;

    protected BasicDatabaseStoreManager(Class<D> daoIface, TransactionManager tm, ConfigMapper configMapper)
    {
        this.daoIface = daoIface;
        this.tm = tm;
        this.configMapper = configMapper;
    }

    @FunctionalInterface
    public interface DaoAction <T, D>
    {
        T call(Handle handle, D dao);
    }

    protected <T> T inTransaction(DaoAction<T, D> action)
    {
        Handle handle = tm.getHandle(configMapper);
        return action.call(handle, handle.attach(daoIface));
    }

    /**
     * Runs an insert and reports a duplicate unique key as {@link ResourceConflictException}.
     */
    protected <T> T insertUnique(DaoAction<T, D> action, String key)
            throws ResourceConflictException
    {
        try {
            return inTransaction(action);
        }
        catch (UnableToExecuteStatementException ex) {
            if (isUniqueViolation(ex)) {
                throw new ResourceConflictException(key);
            }
            throw ex;
        }
    }

    static boolean isUniqueViolation(UnableToExecuteStatementException ex)
    {
        return ex.getCause() instanceof SQLException
            && UNIQUE_VIOLATION.equals(((SQLException) ex.getCause()).getSQLState());
    }

    static UUID getUuid(ResultSet r, String column)
            throws SQLException
    {
        return UUID.fromString(r.getString(column));
    }

    static Instant getInstant(ResultSet r, String column)
            throws SQLException
    {
        return r.getTimestamp(column).toInstant();
    }

    static Optional<Long> getOptionalLong(ResultSet r, String column)
            throws SQLException
    {
        long v = r.getLong(column);
        return r.wasNull() ? Optional.absent() : Optional.of(v);
    }

    static Optional<String> getOptionalString(ResultSet r, String column)
            throws SQLException
    {
        String v = r.getString(column);
        return r.wasNull() ? Optional.absent() : Optional.of(v);
    }

    // last_run_at is stored as epoch seconds
    static Optional<Instant> getOptionalEpochSecond(ResultSet r, String column)
            throws SQLException
    {
        return getOptionalLong(r, column).transform(Instant::ofEpochSecond);
    }
}
