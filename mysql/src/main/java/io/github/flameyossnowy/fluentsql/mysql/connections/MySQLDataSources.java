package io.github.flameyossnowy.fluentsql.mysql.connections;

import com.mysql.cj.jdbc.MysqlDataSource;
import io.github.flameyossnowy.fluentsql.api.Optimizations;
import io.github.flameyossnowy.fluentsql.api.exceptions.ConnectionException;
import io.github.flameyossnowy.fluentsql.mysql.credentials.MySQLCredentials;
import org.jetbrains.annotations.NotNull;

import java.sql.SQLException;
import java.util.EnumSet;

/**
 * Builds the Connector/J data source shared by the MySQL connection providers.
 * <p>
 * Statements are always prepared on the server, never emulated by the driver.
 */
final class MySQLDataSources {
    private MySQLDataSources() {
    }

    static @NotNull MysqlDataSource create(final @NotNull MySQLCredentials credentials, final @NotNull EnumSet<Optimizations> optimizations) {
        MysqlDataSource dataSource = new MysqlDataSource();
        dataSource.setServerName(credentials.getHost());
        dataSource.setPortNumber(credentials.getPort());
        dataSource.setDatabaseName(credentials.getDatabase());
        dataSource.setUser(credentials.getUsername());
        dataSource.setPassword(credentials.getPassword());
        try {
            if (credentials.isSsl()) {
                dataSource.setUseSSL(true);
                dataSource.setRequireSSL(true);
                dataSource.setVerifyServerCertificate(true);
            } else {
                dataSource.setUseSSL(false);
                dataSource.setRequireSSL(false);
                dataSource.setVerifyServerCertificate(false);
            }

            dataSource.setAllowPublicKeyRetrieval(true);
            dataSource.setCharacterEncoding(credentials.getCharset());
            dataSource.setUseServerPrepStmts(true);
            dataSource.setConnectTimeout(Math.toIntExact(credentials.getConnectionTimeout()));

            if (optimizations.contains(Optimizations.CACHE_PREPARED_STATEMENTS)) {
                dataSource.setCachePrepStmts(true);
            }
            if (optimizations.contains(Optimizations.RECOMMENDED_SETTINGS)) {
                dataSource.setCachePrepStmts(true);
                dataSource.setPrepStmtCacheSize(250);
                dataSource.setPrepStmtCacheSqlLimit(2048);
                dataSource.setRewriteBatchedStatements(true);
                dataSource.setUseLocalSessionState(true);
                dataSource.setCacheResultSetMetadata(true);
                dataSource.setElideSetAutoCommits(true);
                dataSource.setMaintainTimeStats(false);
            }
        } catch (SQLException e) {
            throw new ConnectionException("Invalid MySQL data source configuration: " + e.getMessage(), e);
        }
        credentials.getDataSourceConsumer().accept(dataSource);
        return dataSource;
    }
}
