package io.github.cyfko.curatorkit.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Values Tests")
class ValuesTest {

    @Test
    @DisplayName("Should parse integers as longs and decimals as doubles")
    void shouldParseNumbers() {
        assertEquals(42L, Values.parseNumber("42"));
        assertEquals(-7L, Values.parseNumber("-7"));
        assertEquals(1.5, Values.parseNumber("1.5"));
        assertEquals(1000.0, Values.parseNumber("1e3"));
    }

    @ParameterizedTest
    @ValueSource(strings = {"NaN", "Infinity", "1f", "0x1p3", "abc", ""})
    @DisplayName("Should not treat non-numeric tokens as numbers")
    void shouldRejectNonNumbers(String token) {
        assertNull(Values.parseNumber(token));
    }

    @Test
    @DisplayName("Should coerce literals before numbers")
    void shouldCoerceBarewords() {
        // Given
        Object fallback = new Object();

        // Then
        assertEquals(Boolean.TRUE, Values.coerceBareword("true", fallback));
        assertEquals(Boolean.FALSE, Values.coerceBareword("false", fallback));
        assertNull(Values.coerceBareword("null", fallback));
        assertEquals(3L, Values.coerceBareword("3", fallback));
        assertSame(fallback, Values.coerceBareword("maybe", fallback));
        assertSame(fallback, Values.coerceBareword("True", fallback), "Literals are case-sensitive");
    }

    @Test
    @DisplayName("Should widen floats to doubles")
    void shouldNormalizeFloats() {
        assertEquals(0.5, Values.normalize(0.5f));
        assertEquals(7L, Values.normalize((short) 7));
    }
}
