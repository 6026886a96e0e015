package io.github.flameyossnowy.fluentsql.mysql;

import io.github.flameyossnowy.fluentsql.api.Optimizations;
import io.github.flameyossnowy.fluentsql.mysql.connections.MySQLSimpleConnectionProvider;
import io.github.flameyossnowy.fluentsql.mysql.credentials.MySQLCredentials;
import io.github.flameyossnowy.fluentsql.sql.internals.SQLConnectionProvider;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.function.BiFunction;

public class MySQLDatabaseBuilder {
    private MySQLCredentials credentials;
    private BiFunction<MySQLCredentials, EnumSet<Optimizations>, SQLConnectionProvider> connectionProvider;
    private final EnumSet<Optimizations> optimizations = EnumSet.noneOf(Optimizations.class);

    MySQLDatabaseBuilder() {
    }

    /**
     * Replaces the default single-connection provider, e.g. with
     * {@code MySQLHikariConnectionProvider::new} for a pool.
     */
    public MySQLDatabaseBuilder withConnectionProvider(BiFunction<MySQLCredentials, EnumSet<Optimizations>, SQLConnectionProvider> connectionProvider) {
        this.connectionProvider = connectionProvider;
        return this;
    }

    public MySQLDatabaseBuilder withCredentials(MySQLCredentials credentials) {
        this.credentials = credentials;
        return this;
    }

    public MySQLDatabaseBuilder withOptimizations(Optimizations... optimizations) {
        Collections.addAll(this.optimizations, optimizations);
        return this;
    }

    public MySQLDatabaseBuilder withOptimizations(Collection<Optimizations> optimizations) {
        this.optimizations.addAll(optimizations);
        return this;
    }

    public MySQLDatabase build() {
        if (this.credentials == null) throw new IllegalArgumentException("Credentials cannot be null");

        return new MySQLDatabase(
            this.connectionProvider != null
                ? this.connectionProvider.apply(this.credentials, this.optimizations)
                : new MySQLSimpleConnectionProvider(this.credentials, this.optimizations)
        );
    }
}
