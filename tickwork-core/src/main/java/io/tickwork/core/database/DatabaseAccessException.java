package io.tickwork.core.database;

/**
 * A failure of the database itself, as opposed to a missing resource.
 *
 * Callers decide whether to retry with {@link #isRetryable()}.
 */
public class DatabaseAccessException
        extends RuntimeException
{
    public enum Kind
    {
        /**
         * Connection acquisition, lock wait or statement timed out, or the
         * transaction was rolled back by a deadlock or serialization failure.
         */
        TIMEOUT,

        /**
         * The database is unreachable or rejected authentication.
         */
        CONNECTION,

        /**
         * The statement itself failed. Malformed SQL or a constraint violation.
         */
        QUERY;
    }

    private final Kind kind;

    public DatabaseAccessException(Kind kind, String message, Throwable cause)
    {
        super(message, cause);
        this.kind = kind;
    }

    public Kind getKind()
    {
        return kind;
    }

    public boolean isRetryable()
    {
        return kind == Kind.TIMEOUT || kind == Kind.CONNECTION;
    }
}
