package io.github.flameyossnowy.fluentsql.sql.internals;

import io.github.flameyossnowy.fluentsql.api.connection.ConnectionProvider;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;

public interface SQLConnectionProvider extends ConnectionProvider<Connection> {
    /**
     * Get a connection from the provider.
     * <p>
     * It may return a pooled connection if it uses specific connection providers.
     * <p>
     * @return A connection, or throw a {@link io.github.flameyossnowy.fluentsql.api.exceptions.ConnectionException}
     * if the connection cannot be acquired.
     */
    @Override
    Connection getConnection();

    /**
     * Give back a connection obtained from {@link #getConnection()}.
     * @param connection the connection
     */
    @Override
    void releaseConnection(Connection connection);

    /**
     * Close the connection provider.
     */
    @Override
    void close();

    /**
     * Prepares a SQL statement with the given connection.
     * @param sql the SQL to prepare
     * @param connection the connection to use
     * @return the prepared statement
     * @throws SQLException if the driver rejects the statement
     */
    default PreparedStatement prepareStatement(String sql, Connection connection) throws SQLException {
        return connection.prepareStatement(sql);
    }

    /**
     * Prepares a SQL statement that reports generated keys.
     * @param sql the SQL to prepare
     * @param connection the connection to use
     * @param autoGeneratedKeys one of {@link java.sql.Statement#RETURN_GENERATED_KEYS} or {@link java.sql.Statement#NO_GENERATED_KEYS}
     * @return the prepared statement
     * @throws SQLException if the driver rejects the statement
     */
    default PreparedStatement prepareStatement(String sql, Connection connection, int autoGeneratedKeys) throws SQLException {
        return connection.prepareStatement(sql, autoGeneratedKeys);
    }
}
