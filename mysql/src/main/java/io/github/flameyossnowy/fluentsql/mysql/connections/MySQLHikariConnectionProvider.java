package io.github.flameyossnowy.fluentsql.mysql.connections;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import io.github.flameyossnowy.fluentsql.api.Optimizations;
import io.github.flameyossnowy.fluentsql.api.exceptions.ConnectionException;
import io.github.flameyossnowy.fluentsql.api.utils.Logging;
import io.github.flameyossnowy.fluentsql.mysql.credentials.MySQLCredentials;
import io.github.flameyossnowy.fluentsql.sql.internals.SQLConnectionProvider;
import org.jetbrains.annotations.NotNull;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.EnumSet;

/**
 * Pooled MySQL connections through HikariCP.
 * <p>
 * Each call borrows a connection, releasing it returns it to the pool, so builders on different threads
 * can share this provider.
 */
public class MySQLHikariConnectionProvider implements SQLConnectionProvider {
    private final HikariDataSource pool;

    public MySQLHikariConnectionProvider(@NotNull MySQLCredentials credentials) {
        this(credentials, EnumSet.noneOf(Optimizations.class));
    }

    public MySQLHikariConnectionProvider(@NotNull MySQLCredentials credentials, @NotNull EnumSet<Optimizations> optimizations) {
        HikariConfig config = new HikariConfig();
        config.setDataSource(MySQLDataSources.create(credentials, optimizations));
        config.setPoolName("fluentsql-" + credentials.getDatabase());
        config.setMinimumIdle(credentials.getMinimumIdle());
        config.setIdleTimeout(credentials.getIdleTimeout());
        config.setConnectionTimeout(credentials.getConnectionTimeout());
        config.setMaximumPoolSize(credentials.getPoolSize());

        try {
            this.pool = new HikariDataSource(config);
        } catch (RuntimeException e) {
            String message = "Database connection failed: " + e.getMessage();
            Logging.error(message);
            throw new ConnectionException(message, e);
        }
        Logging.info("Started connection pool " + config.getPoolName() + " with up to " + credentials.getPoolSize() + " connections");
    }

    @Override
    public Connection getConnection() {
        try {
            return pool.getConnection();
        } catch (SQLException e) {
            throw new ConnectionException("Failed to acquire pooled connection: " + e.getMessage(), e);
        }
    }

    @Override
    public void releaseConnection(Connection connection) {
        try {
            connection.close();
        } catch (SQLException e) {
            Logging.warn("Failed to return connection to the pool: " + e.getMessage());
        }
    }

    @Override
    public void close() {
        pool.close();
    }
}
