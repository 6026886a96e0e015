package io.github.flameyossnowy.fluentsql.api.result;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * A single column value read from a result row.
 * <p>
 * Values are tagged by the shape the driver produced them in: text, integral number,
 * floating point number, raw bytes or SQL {@code NULL}.
 */
public sealed interface Value permits Value.StringValue, Value.IntegerValue, Value.FloatValue, Value.BinaryValue, Value.NullValue {
    NullValue NULL = new NullValue();

    /**
     * Wraps a plain Java object in the matching value type.
     * <p>
     * Integral numbers and booleans become {@link IntegerValue} (booleans as 1 or 0),
     * {@code float} and {@code double} become {@link FloatValue}, {@link BigDecimal} keeps its exact
     * text as a {@link StringValue}, byte arrays become {@link BinaryValue} and anything else is
     * stored as its string form.
     *
     * @param object the object, may be {@code null}
     * @return the wrapped value
     */
    static @NotNull Value of(@Nullable Object object) {
        if (object == null) return NULL;
        if (object instanceof Value value) return value;
        if (object instanceof String string) return new StringValue(string);
        if (object instanceof Long || object instanceof Integer || object instanceof Short || object instanceof Byte) {
            return new IntegerValue(((Number) object).longValue());
        }
        if (object instanceof Boolean bool) return new IntegerValue(bool ? 1 : 0);
        if (object instanceof Double || object instanceof Float) return new FloatValue(((Number) object).doubleValue());
        if (object instanceof BigInteger integer) {
            return integer.bitLength() < 64 ? new IntegerValue(integer.longValue()) : new StringValue(integer.toString());
        }
        if (object instanceof BigDecimal decimal) return new StringValue(decimal.toPlainString());
        if (object instanceof byte[] bytes) return new BinaryValue(bytes);
        return new StringValue(object.toString());
    }

    /**
     * @return the underlying Java object, {@code null} for SQL NULL
     */
    @Nullable Object raw();

    default boolean isNull() {
        return false;
    }

    /**
     * @return the value as text, {@code null} for SQL NULL
     */
    @Nullable String asString();

    /**
     * @return the value as an integral number
     * @throws IllegalStateException if the value has no integral form
     */
    long asLong();

    /**
     * @return the value as a floating point number
     * @throws IllegalStateException if the value has no numeric form
     */
    double asDouble();

    /**
     * @return the value as raw bytes, {@code null} for SQL NULL
     */
    default byte @Nullable [] asBytes() {
        String string = asString();
        return string == null ? null : string.getBytes(StandardCharsets.UTF_8);
    }

    record StringValue(@NotNull String value) implements Value {
        @Override
        public Object raw() {
            return value;
        }

        @Override
        public String asString() {
            return value;
        }

        @Override
        public long asLong() {
            try {
                return new BigDecimal(value.trim()).longValue();
            } catch (NumberFormatException e) {
                throw new IllegalStateException("Not a number: " + value, e);
            }
        }

        @Override
        public double asDouble() {
            try {
                return Double.parseDouble(value.trim());
            } catch (NumberFormatException e) {
                throw new IllegalStateException("Not a number: " + value, e);
            }
        }
    }

    record IntegerValue(long value) implements Value {
        @Override
        public Object raw() {
            return value;
        }

        @Override
        public String asString() {
            return Long.toString(value);
        }

        @Override
        public long asLong() {
            return value;
        }

        @Override
        public double asDouble() {
            return value;
        }
    }

    record FloatValue(double value) implements Value {
        @Override
        public Object raw() {
            return value;
        }

        @Override
        public String asString() {
            return Double.toString(value);
        }

        @Override
        public long asLong() {
            return (long) value;
        }

        @Override
        public double asDouble() {
            return value;
        }
    }

    record BinaryValue(byte @NotNull [] value) implements Value {
        public BinaryValue {
            value = value.clone();
        }

        @Override
        public Object raw() {
            return value.clone();
        }

        @Override
        public String asString() {
            return new String(value, StandardCharsets.UTF_8);
        }

        @Override
        public long asLong() {
            throw new IllegalStateException("Binary value has no numeric form");
        }

        @Override
        public double asDouble() {
            throw new IllegalStateException("Binary value has no numeric form");
        }

        @Override
        public byte[] asBytes() {
            return value.clone();
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof BinaryValue other && Arrays.equals(value, other.value);
        }

        @Override
        public int hashCode() {
            return Arrays.hashCode(value);
        }

        @Override
        @Contract(pure = true)
        public @NotNull String toString() {
            return "BinaryValue[" + value.length + " bytes]";
        }
    }

    record NullValue() implements Value {
        @Override
        public Object raw() {
            return null;
        }

        @Override
        public boolean isNull() {
            return true;
        }

        @Override
        public String asString() {
            return null;
        }

        @Override
        public long asLong() {
            throw new IllegalStateException("Value is NULL");
        }

        @Override
        public double asDouble() {
            throw new IllegalStateException("Value is NULL");
        }

        @Override
        public byte[] asBytes() {
            return null;
        }
    }
}
