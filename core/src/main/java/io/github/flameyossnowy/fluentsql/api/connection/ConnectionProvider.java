package io.github.flameyossnowy.fluentsql.api.connection;

/**
 * Hands out database sessions to query builders.
 * <p>
 * Every session obtained through {@link #getConnection()} must be given back with
 * {@link #releaseConnection(Object)} once the caller is done with it. A provider that holds a
 * single session treats the release as a no-op, a pooling provider returns the session to its pool.
 *
 * @param <C> The type of session handed out.
 * @author flameyosflow
 */
public interface ConnectionProvider<C> extends AutoCloseable {
    /**
     * Get a session from the provider.
     *
     * @return an open session
     * @throws io.github.flameyossnowy.fluentsql.api.exceptions.ConnectionException if no session can be acquired
     */
    C getConnection();

    /**
     * Give a session obtained from {@link #getConnection()} back to the provider.
     *
     * @param connection the session to release
     */
    void releaseConnection(C connection);

    /**
     * Close the provider and every session it still owns.
     */
    @Override
    void close();
}
