package io.github.flameyossnowy.fluentsql.mysql;

import io.github.flameyossnowy.fluentsql.api.Optimizations;
import io.github.flameyossnowy.fluentsql.api.exceptions.ConnectionException;
import io.github.flameyossnowy.fluentsql.mysql.credentials.MySQLCredentials;
import io.github.flameyossnowy.fluentsql.sql.QueryBuilder;
import io.github.flameyossnowy.fluentsql.sql.internals.SQLConnectionProvider;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.EnumSet;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
public class MySQLDatabaseTest {
    @Mock
    private SQLConnectionProvider provider;

    @Test
    void tableHandsOutFreshBuilders() {
        MySQLDatabase database = new MySQLDatabase(provider);

        QueryBuilder users = database.table("users").where("id", 1);
        QueryBuilder other = database.table("users");

        assertNotSame(users, other);
        assertEquals("", other.getRawQuery());
        assertEquals("SELECT * FROM users WHERE id = ?", users.getRawQuery());
        assertSame(provider, database.getConnectionProvider());
    }

    @Test
    void closeClosesProvider() {
        new MySQLDatabase(provider).close();
        verify(provider).close();
    }

    @Test
    void builderPassesCredentialsAndOptimizations() {
        MySQLCredentials credentials = new MySQLCredentials("localhost", "shop", "root", "secret");
        AtomicReference<EnumSet<Optimizations>> seen = new AtomicReference<>();

        MySQLDatabase database = MySQLDatabase.builder()
            .withCredentials(credentials)
            .withOptimizations(Optimizations.RECOMMENDED_SETTINGS)
            .withConnectionProvider((given, optimizations) -> {
                assertSame(credentials, given);
                seen.set(optimizations);
                return provider;
            })
            .build();

        assertSame(provider, database.getConnectionProvider());
        assertEquals(EnumSet.of(Optimizations.RECOMMENDED_SETTINGS), seen.get());
    }

    @Test
    void builderRequiresCredentials() {
        assertThrows(IllegalArgumentException.class, () -> MySQLDatabase.builder().build());
    }

    @Test
    void unreachableServerFailsConstruction() {
        MySQLCredentials credentials = new MySQLCredentials("127.0.0.1", 1, "shop", "root", "secret").setConnectionTimeout(1000);
        assertThrows(ConnectionException.class, () -> new MySQLDatabase(credentials));
    }
}
