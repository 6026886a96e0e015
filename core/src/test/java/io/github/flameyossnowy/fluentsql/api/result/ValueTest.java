package io.github.flameyossnowy.fluentsql.api.result;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

public class ValueTest {

    @Test
    void nullBecomesNullValue() {
        Value value = Value.of(null);
        assertSame(Value.NULL, value);
        assertTrue(value.isNull());
        assertNull(value.asString());
        assertNull(value.raw());
        assertThrows(IllegalStateException.class, value::asLong);
    }

    @Test
    void integralsAndBooleansBecomeIntegerValue() {
        assertEquals(new Value.IntegerValue(42), Value.of(42));
        assertEquals(new Value.IntegerValue(42), Value.of(42L));
        assertEquals(new Value.IntegerValue(7), Value.of((short) 7));
        assertEquals(new Value.IntegerValue(1), Value.of(true));
        assertEquals(new Value.IntegerValue(0), Value.of(false));
    }

    @Test
    void bigIntegerFallsBackToTextWhenTooWide() {
        assertEquals(new Value.IntegerValue(5), Value.of(BigInteger.valueOf(5)));

        BigInteger wide = BigInteger.ONE.shiftLeft(70);
        assertEquals(new Value.StringValue(wide.toString()), Value.of(wide));
    }

    @Test
    void decimalsKeepTheirExactText() {
        Value value = Value.of(new BigDecimal("19.990"));
        assertEquals("19.990", value.asString());
        assertEquals(19.99, value.asDouble(), 0.0001);
        assertEquals(19, value.asLong());
    }

    @Test
    void floatingPointBecomesFloatValue() {
        Value value = Value.of(2.5d);
        assertInstanceOf(Value.FloatValue.class, value);
        assertEquals(2, value.asLong());
        assertEquals("2.5", value.asString());
    }

    @Test
    void binaryValueIsDefensivelyCopied() {
        byte[] bytes = "abc".getBytes(StandardCharsets.UTF_8);
        Value value = Value.of(bytes);
        bytes[0] = 'z';

        assertEquals("abc", value.asString());
        assertEquals(new Value.BinaryValue("abc".getBytes(StandardCharsets.UTF_8)), value);
        assertThrows(IllegalStateException.class, value::asDouble);
    }

    @Test
    void textThatIsNotNumericRejectsNumericAccess() {
        Value value = Value.of("alice");
        assertThrows(IllegalStateException.class, value::asLong);
        assertArrayEquals("alice".getBytes(StandardCharsets.UTF_8), value.asBytes());
    }

    @Test
    void existingValuesAreNotRewrapped() {
        Value value = new Value.StringValue("x");
        assertSame(value, Value.of(value));
    }
}
