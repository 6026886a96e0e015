package io.github.flameyossnowy.fluentsql.mysql.connections;

import com.mysql.cj.jdbc.MysqlDataSource;
import io.github.flameyossnowy.fluentsql.api.Optimizations;
import io.github.flameyossnowy.fluentsql.api.exceptions.ConnectionException;
import io.github.flameyossnowy.fluentsql.api.utils.Logging;
import io.github.flameyossnowy.fluentsql.mysql.credentials.MySQLCredentials;
import io.github.flameyossnowy.fluentsql.sql.SimpleConnectionProvider;
import org.jetbrains.annotations.NotNull;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.EnumSet;

/**
 * Opens one MySQL connection when constructed and serves it until closed.
 * A failed connect is final: the constructor throws and there is no provider to retry with.
 */
public class MySQLSimpleConnectionProvider extends SimpleConnectionProvider {
    public MySQLSimpleConnectionProvider(final @NotNull MySQLCredentials credentials) {
        this(credentials, EnumSet.noneOf(Optimizations.class));
    }

    public MySQLSimpleConnectionProvider(final @NotNull MySQLCredentials credentials, final @NotNull EnumSet<Optimizations> optimizations) {
        super(connect(credentials, MySQLDataSources.create(credentials, optimizations)));
    }

    private static Connection connect(MySQLCredentials credentials, MysqlDataSource dataSource) {
        try {
            Connection connection = dataSource.getConnection();
            Logging.info("Connected to MySQL database " + credentials.getDatabase() + " at " + credentials.getHost() + ':' + credentials.getPort());
            return connection;
        } catch (SQLException e) {
            String message = "Database connection failed: " + e.getMessage();
            Logging.error(message);
            throw new ConnectionException(message, e);
        }
    }
}
