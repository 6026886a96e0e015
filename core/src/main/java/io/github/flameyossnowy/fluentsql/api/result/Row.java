package io.github.flameyossnowy.fluentsql.api.result;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One result row: column labels mapped to their values, in the order the driver reported them.
 * Rows are immutable.
 */
public final class Row implements DatabaseResult {
    private final Map<String, Value> values;
    private final List<String> columns;

    public Row(@NotNull Map<String, Value> values) {
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
        this.columns = List.copyOf(this.values.keySet());
    }

    /**
     * Builds a row from plain Java objects, wrapping each with {@link Value#of(Object)}.
     *
     * @param values column labels mapped to raw objects
     * @return the row
     */
    @Contract("_ -> new")
    public static @NotNull Row of(@NotNull Map<String, ?> values) {
        Map<String, Value> converted = new LinkedHashMap<>(values.size());
        for (Map.Entry<String, ?> entry : values.entrySet()) {
            converted.put(entry.getKey(), Value.of(entry.getValue()));
        }
        return new Row(converted);
    }

    /**
     * @param column the column label
     * @return the value of that column
     * @throws IllegalArgumentException if the row has no such column
     */
    public @NotNull Value get(@NotNull String column) {
        Value value = values.get(column);
        if (value == null) {
            throw new IllegalArgumentException("No column '" + column + "' in row, columns are " + columns);
        }
        return value;
    }

    public @Nullable String getString(@NotNull String column) {
        return get(column).asString();
    }

    public long getLong(@NotNull String column) {
        return get(column).asLong();
    }

    public double getDouble(@NotNull String column) {
        return get(column).asDouble();
    }

    public byte @Nullable [] getBytes(@NotNull String column) {
        return get(column).asBytes();
    }

    public boolean isNull(@NotNull String column) {
        return get(column).isNull();
    }

    /**
     * @return the column labels in driver order
     */
    public @NotNull List<String> columns() {
        return columns;
    }

    /**
     * @return an unmodifiable view of the row
     */
    public @NotNull Map<String, Value> asMap() {
        return values;
    }

    /**
     * @return the row with every value unwrapped to its raw Java object
     */
    public @NotNull Map<String, Object> toRawMap() {
        Map<String, Object> raw = new LinkedHashMap<>(values.size());
        for (Map.Entry<String, Value> entry : values.entrySet()) {
            raw.put(entry.getKey(), entry.getValue().raw());
        }
        return raw;
    }

    @Override
    @SuppressWarnings("unchecked")
    public <T> T get(String columnName, Class<T> type) {
        Value value = get(columnName);
        if (value.isNull()) return null;

        try {
            if (type == Value.class) return (T) value;
            if (type == String.class) return (T) value.asString();
            if (type == Long.class || type == long.class) return (T) Long.valueOf(value.asLong());
            if (type == Integer.class || type == int.class) return (T) Integer.valueOf(Math.toIntExact(value.asLong()));
            if (type == Double.class || type == double.class) return (T) Double.valueOf(value.asDouble());
            if (type == Boolean.class || type == boolean.class) return (T) Boolean.valueOf(value.asLong() != 0);
            if (type == byte[].class) return (T) value.asBytes();
        } catch (IllegalStateException | ArithmeticException e) {
            throw new IllegalArgumentException("Cannot convert column '" + columnName + "' to " + type.getName() + ": " + e.getMessage(), e);
        }
        if (type.isInstance(value.raw())) return type.cast(value.raw());

        throw new IllegalArgumentException("Cannot convert column '" + columnName + "' of " + value.getClass().getSimpleName() + " to " + type.getName());
    }

    @Override
    public boolean hasColumn(String columnName) {
        return values.containsKey(columnName);
    }

    @Override
    public int getColumnCount() {
        return columns.size();
    }

    @Override
    public String getColumnName(int columnIndex) {
        return columns.get(columnIndex);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Row row)) return false;
        return values.equals(row.values) && columns.equals(row.columns);
    }

    @Override
    public int hashCode() {
        return Objects.hash(values);
    }

    @Override
    public String toString() {
        return "Row" + values;
    }
}
