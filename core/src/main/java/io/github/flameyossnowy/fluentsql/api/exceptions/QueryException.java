package io.github.flameyossnowy.fluentsql.api.exceptions;

import org.jetbrains.annotations.Nullable;

/**
 * Thrown when preparing, executing or reading a statement fails.
 * <p>
 * Covers syntax errors, constraint violations, type mismatches and lost connections alike.
 * The message carries the driver's diagnostic text.
 */
public class QueryException extends DatabaseException {
    private final String query;

    public QueryException(String message, @Nullable String query, Throwable cause) {
        super(message, cause);
        this.query = query;
    }

    /**
     * @return the SQL text that failed, or {@code null} if the failure happened before any SQL was known
     */
    public @Nullable String getQuery() {
        return query;
    }
}
