package io.github.flameyossnowy.fluentsql.api.exceptions;

/**
 * Thrown when a session to the database cannot be established or acquired.
 * <p>
 * The message carries the driver's own diagnostic text, the original driver exception is kept as the cause.
 */
public class ConnectionException extends DatabaseException {
    public ConnectionException(String message) {
        super(message);
    }

    public ConnectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
