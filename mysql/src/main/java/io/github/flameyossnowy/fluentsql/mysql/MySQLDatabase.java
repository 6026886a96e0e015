package io.github.flameyossnowy.fluentsql.mysql;

import io.github.flameyossnowy.fluentsql.api.Optimizations;
import io.github.flameyossnowy.fluentsql.mysql.connections.MySQLSimpleConnectionProvider;
import io.github.flameyossnowy.fluentsql.mysql.credentials.MySQLCredentials;
import io.github.flameyossnowy.fluentsql.sql.QueryBuilder;
import io.github.flameyossnowy.fluentsql.sql.internals.SQLConnectionProvider;
import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;

import java.util.EnumSet;
import java.util.Objects;

/**
 * Entry point for talking to one MySQL database.
 * <p>
 * The connection is opened when the database is constructed; a failure surfaces as a
 * {@link io.github.flameyossnowy.fluentsql.api.exceptions.ConnectionException} and no instance is produced.
 * Every {@link #table(String)} call hands out a fresh builder over the same connection provider.
 *
 * <pre>{@code
 * try (MySQLDatabase db = new MySQLDatabase("localhost", "shop", "root", "secret")) {
 *     List<Row> rows = db.table("users").select("id", "name").where("age", ">", 18).execute();
 * }
 * }</pre>
 */
public class MySQLDatabase implements AutoCloseable {
    private final SQLConnectionProvider connectionProvider;

    public MySQLDatabase(@NotNull String host, @NotNull String database, @NotNull String username, @NotNull String password) {
        this(new MySQLCredentials(host, database, username, password));
    }

    public MySQLDatabase(@NotNull String host, @NotNull String database, @NotNull String username, @NotNull String password, @NotNull String charset) {
        this(new MySQLCredentials(host, database, username, password).setCharset(charset));
    }

    public MySQLDatabase(@NotNull MySQLCredentials credentials) {
        this(credentials, EnumSet.noneOf(Optimizations.class));
    }

    public MySQLDatabase(@NotNull MySQLCredentials credentials, @NotNull EnumSet<Optimizations> optimizations) {
        this(new MySQLSimpleConnectionProvider(credentials, optimizations));
    }

    public MySQLDatabase(@NotNull SQLConnectionProvider connectionProvider) {
        this.connectionProvider = Objects.requireNonNull(connectionProvider, "Connection provider cannot be null");
    }

    @Contract(" -> new")
    public static @NotNull MySQLDatabaseBuilder builder() {
        return new MySQLDatabaseBuilder();
    }

    /**
     * Starts a query against {@code table}. Builders are not shared, each call returns a new one.
     */
    @Contract("_ -> new")
    public @NotNull QueryBuilder table(@NotNull String table) {
        return new QueryBuilder(connectionProvider, table);
    }

    public SQLConnectionProvider getConnectionProvider() {
        return connectionProvider;
    }

    @Override
    public void close() {
        connectionProvider.close();
    }
}
