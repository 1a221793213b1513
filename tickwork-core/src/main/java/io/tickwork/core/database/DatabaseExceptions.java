package io.tickwork.core.database;

import java.sql.SQLException;
import java.sql.SQLNonTransientConnectionException;
import java.sql.SQLTimeoutException;
import java.sql.SQLTransientConnectionException;
import com.google.common.base.Throwables;
import org.jdbi.v3.core.ConnectionException;
import org.jdbi.v3.core.JdbiException;

import static io.tickwork.core.database.DatabaseAccessException.Kind.CONNECTION;
import static io.tickwork.core.database.DatabaseAccessException.Kind.QUERY;
import static io.tickwork.core.database.DatabaseAccessException.Kind.TIMEOUT;

public final class DatabaseExceptions
{
    private DatabaseExceptions()
    { }

    /**
     * Converts a jdbi or JDBC failure into {@link DatabaseAccessException}.
     * Any other exception is returned as is.
     */
    public static Exception translate(Exception ex)
    {
        if (ex instanceof DatabaseAccessException) {
            return ex;
        }

        SQLException sqlException = findSQLException(ex);
        if (sqlException != null) {
            return new DatabaseAccessException(classify(sqlException), describe(ex, sqlException), ex);
        }
        else if (ex instanceof ConnectionException) {
            return new DatabaseAccessException(CONNECTION, ex.getMessage(), ex);
        }
        else if (ex instanceof JdbiException) {
            return new DatabaseAccessException(QUERY, ex.getMessage(), ex);
        }
        else {
            return ex;
        }
    }

    /**
     * Same as {@link #translate(Exception)} for callers that only deal with
     * unchecked exceptions.
     */
    public static RuntimeException translate(RuntimeException ex)
    {
        return (RuntimeException) translate((Exception) ex);
    }

    static DatabaseAccessException.Kind classify(SQLException ex)
    {
        if (ex instanceof SQLTransientConnectionException || ex instanceof SQLTimeoutException) {
            // HikariCP reports connection acquisition timeouts as SQLTransientConnectionException
            return TIMEOUT;
        }
        if (ex instanceof SQLNonTransientConnectionException) {
            return CONNECTION;
        }

        String state = ex.getSQLState();
        if (state == null) {
            return QUERY;
        }
        switch (state) {
        case "55P03":  // lock_not_available
        case "57014":  // query_canceled (statement_timeout)
        case "HYT00":  // H2 lock timeout
            return TIMEOUT;
        case "57P01":  // admin_shutdown
        case "57P03":  // cannot_connect_now
            return CONNECTION;
        default:
            break;
        }
        if (state.startsWith("40")) {
            // serialization_failure, deadlock_detected
            return TIMEOUT;
        }
        if (state.startsWith("08") || state.startsWith("28")) {
            return CONNECTION;
        }
        return QUERY;
    }

    private static SQLException findSQLException(Throwable ex)
    {
        for (Throwable cause : Throwables.getCausalChain(ex)) {
            if (cause instanceof SQLException) {
                return (SQLException) cause;
            }
        }
        return null;
    }

    private static String describe(Exception ex, SQLException sqlException)
    {
        String message = ex.getMessage();
        if (message == null) {
            message = sqlException.getMessage();
        }
        if (sqlException.getSQLState() != null) {
            return message + " (SQLState " + sqlException.getSQLState() + ")";
        }
        return message;
    }
}
