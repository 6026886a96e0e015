package io.github.flameyossnowy.fluentsql.api.exceptions;

/**
 * Base type of every failure reported by the library.
 */
public class DatabaseException extends RuntimeException {
    public DatabaseException(String message) {
        super(message);
    }

    public DatabaseException(String message, Throwable cause) {
        super(message, cause);
    }
}
