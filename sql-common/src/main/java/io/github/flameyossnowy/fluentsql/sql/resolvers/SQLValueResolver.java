package io.github.flameyossnowy.fluentsql.sql.resolvers;

import io.github.flameyossnowy.fluentsql.api.result.Value;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.sql.Blob;
import java.sql.Clob;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.util.UUID;

/**
 * Moves values across the JDBC boundary: binds parameters into statements and reads columns into {@link Value}s.
 */
public final class SQLValueResolver {
    private SQLValueResolver() {
    }

    /**
     * Binds one positional parameter.
     * <p>
     * {@code null} and {@link Value#NULL} bind SQL NULL, other {@link Value}s bind their raw object,
     * enums bind their name and UUIDs their string form. Everything else goes to the driver as is.
     *
     * @param statement the statement
     * @param index the 1-based parameter index
     * @param value the value
     * @throws SQLException if the driver rejects the value
     */
    public static void bind(@NotNull PreparedStatement statement, int index, @Nullable Object value) throws SQLException {
        Object object = value instanceof Value wrapped ? wrapped.raw() : value;
        if (object == null) {
            statement.setNull(index, Types.NULL);
        } else if (object instanceof Enum<?> constant) {
            statement.setString(index, constant.name());
        } else if (object instanceof Character || object instanceof UUID) {
            statement.setString(index, object.toString());
        } else {
            statement.setObject(index, object);
        }
    }

    /**
     * Reads one column of the current row.
     *
     * @param resultSet the result set, positioned on a row
     * @param column the 1-based column index
     * @return the tagged value
     * @throws SQLException if the driver fails to read the column
     */
    public static @NotNull Value read(@NotNull ResultSet resultSet, int column) throws SQLException {
        Object object = resultSet.getObject(column);
        if (object == null) return Value.NULL;

        if (object instanceof Blob blob) {
            try {
                return new Value.BinaryValue(blob.getBytes(1, Math.toIntExact(blob.length())));
            } finally {
                blob.free();
            }
        }
        if (object instanceof Clob clob) {
            try {
                return new Value.StringValue(clob.getSubString(1, Math.toIntExact(clob.length())));
            } finally {
                clob.free();
            }
        }
        return Value.of(object);
    }
}
