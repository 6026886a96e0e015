package io.github.flameyossnowy.fluentsql.sql.resolvers;

import io.github.flameyossnowy.fluentsql.api.result.Value;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.sql.Blob;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
public class SQLValueResolverTest {
    private enum Status { OPEN }

    @Mock
    private PreparedStatement statement;

    @Mock
    private ResultSet resultSet;

    @Test
    void bindsNullAsSqlNull() throws SQLException {
        SQLValueResolver.bind(statement, 1, null);
        SQLValueResolver.bind(statement, 2, Value.NULL);

        verify(statement).setNull(1, Types.NULL);
        verify(statement).setNull(2, Types.NULL);
    }

    @Test
    void bindsEnumsAndUuidsAsText() throws SQLException {
        UUID id = UUID.randomUUID();
        SQLValueResolver.bind(statement, 1, Status.OPEN);
        SQLValueResolver.bind(statement, 2, id);

        verify(statement).setString(1, "OPEN");
        verify(statement).setString(2, id.toString());
    }

    @Test
    void unwrapsValues() throws SQLException {
        SQLValueResolver.bind(statement, 1, new Value.IntegerValue(5));
        verify(statement).setObject(1, 5L);
    }

    @Test
    void passesOtherObjectsThrough() throws SQLException {
        SQLValueResolver.bind(statement, 3, "Alice");
        verify(statement).setObject(3, "Alice");
    }

    @Test
    void readsNull() throws SQLException {
        when(resultSet.getObject(1)).thenReturn(null);
        assertSame(Value.NULL, SQLValueResolver.read(resultSet, 1));
    }

    @Test
    void readsBlobAsBinary() throws SQLException {
        Blob blob = mock(Blob.class);
        when(blob.length()).thenReturn(2L);
        when(blob.getBytes(1, 2)).thenReturn(new byte[]{1, 2});
        when(resultSet.getObject(1)).thenReturn(blob);

        assertEquals(new Value.BinaryValue(new byte[]{1, 2}), SQLValueResolver.read(resultSet, 1));
        verify(blob).free();
    }

    @Test
    void readsPlainObjects() throws SQLException {
        when(resultSet.getObject(2)).thenReturn(42);
        assertEquals(new Value.IntegerValue(42), SQLValueResolver.read(resultSet, 2));
    }
}
