package io.github.flameyossnowy.fluentsql.sql;

import io.github.flameyossnowy.fluentsql.api.exceptions.ConnectionException;
import io.github.flameyossnowy.fluentsql.api.utils.Logging;
import io.github.flameyossnowy.fluentsql.sql.internals.SQLConnectionProvider;
import org.jetbrains.annotations.NotNull;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.Objects;

/**
 * Connection provider that owns exactly one open connection.
 * <p>
 * The same connection is handed to every caller and stays open until {@link #close()}, releasing it does nothing.
 * JDBC connections are not meant for concurrent statements, so one caller at a time.
 */
public class SimpleConnectionProvider implements SQLConnectionProvider {
    private final Connection connection;
    private volatile boolean closed;

    public SimpleConnectionProvider(@NotNull Connection connection) {
        this.connection = Objects.requireNonNull(connection, "Connection cannot be null");
    }

    @Override
    public Connection getConnection() {
        if (closed) {
            throw new ConnectionException("Connection provider has been closed");
        }
        return connection;
    }

    @Override
    public void releaseConnection(Connection connection) {
    }

    @Override
    public void close() {
        if (closed) return;
        closed = true;
        try {
            connection.close();
            Logging.info("Closed database connection.");
        } catch (SQLException e) {
            throw new ConnectionException("Failed to close connection: " + e.getMessage(), e);
        }
    }

    public boolean isClosed() {
        return closed;
    }
}
