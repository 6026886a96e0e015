package io.github.flameyossnowy.fluentsql.api.result;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class RowTest {

    private static Row sampleRow() {
        Map<String, Object> values = new LinkedHashMap<>();
        values.put("id", 1L);
        values.put("name", "Alice");
        values.put("score", 9.5d);
        values.put("deleted_at", null);
        return Row.of(values);
    }

    @Test
    void keepsColumnOrder() {
        Row row = sampleRow();
        assertEquals(List.of("id", "name", "score", "deleted_at"), row.columns());
        assertEquals(4, row.getColumnCount());
        assertEquals("name", row.getColumnName(1));
    }

    @Test
    void typedAccessors() {
        Row row = sampleRow();
        assertEquals(1L, row.getLong("id"));
        assertEquals("Alice", row.getString("name"));
        assertEquals(9.5d, row.getDouble("score"));
        assertTrue(row.isNull("deleted_at"));
        assertFalse(row.isNull("name"));
    }

    @Test
    void getWithTypeConverts() {
        Row row = sampleRow();
        assertEquals(1, row.get("id", Integer.class));
        assertEquals("1", row.get("id", String.class));
        assertEquals(Boolean.TRUE, row.get("id", Boolean.class));
        assertNull(row.get("deleted_at", String.class));
        assertInstanceOf(Value.StringValue.class, row.get("name", Value.class));
    }

    @Test
    void missingColumnIsRejected() {
        Row row = sampleRow();
        assertFalse(row.hasColumn("email"));
        assertThrows(IllegalArgumentException.class, () -> row.get("email"));
    }

    @Test
    void failedConversionsAreRejectedAsIllegalArguments() {
        Row row = Row.of(Map.of("answer", "yes", "big", Long.MAX_VALUE));

        IllegalArgumentException notNumeric = assertThrows(IllegalArgumentException.class, () -> row.get("answer", Boolean.class));
        assertInstanceOf(IllegalStateException.class, notNumeric.getCause());
        assertTrue(notNumeric.getMessage().contains("answer"));

        IllegalArgumentException overflow = assertThrows(IllegalArgumentException.class, () -> row.get("big", Integer.class));
        assertInstanceOf(ArithmeticException.class, overflow.getCause());
        assertTrue(overflow.getMessage().contains("big"));
        assertEquals(Long.MAX_VALUE, row.get("big", Long.class));
    }

    @Test
    void rowIsImmutable() {
        Row row = sampleRow();
        assertThrows(UnsupportedOperationException.class, () -> row.asMap().put("x", Value.NULL));
    }

    @Test
    void rawMapUnwrapsValues() {
        Map<String, Object> raw = sampleRow().toRawMap();
        assertEquals(1L, raw.get("id"));
        assertEquals("Alice", raw.get("name"));
        assertTrue(raw.containsKey("deleted_at"));
        assertNull(raw.get("deleted_at"));
    }

    @Test
    void equalRowsCompareEqual() {
        assertEquals(sampleRow(), sampleRow());
        assertEquals(sampleRow().hashCode(), sampleRow().hashCode());
    }
}
