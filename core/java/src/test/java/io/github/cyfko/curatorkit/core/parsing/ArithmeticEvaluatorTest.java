package io.github.cyfko.curatorkit.core.parsing;

import io.github.cyfko.curatorkit.core.exception.DSLSyntaxException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ArithmeticEvaluator Tests")
class ArithmeticEvaluatorTest {

    @Test
    @DisplayName("Should keep integer arithmetic integral")
    void shouldKeepIntegersIntegral() {
        assertEquals(10L, ArithmeticEvaluator.evaluate("5+5"));
        assertEquals(14L, ArithmeticEvaluator.evaluate("2*7"));
        assertEquals(500L, ArithmeticEvaluator.evaluate("100 * 5"));
        assertEquals(10L, ArithmeticEvaluator.evaluate("20 // 2"));
        assertEquals(8L, ArithmeticEvaluator.evaluate("2 ** 3"));
    }

    @Test
    @DisplayName("Should honour precedence and parentheses")
    void shouldHonourPrecedence() {
        assertEquals(7L, ArithmeticEvaluator.evaluate("1 + 2 * 3"));
        assertEquals(9L, ArithmeticEvaluator.evaluate("(1 + 2) * 3"));
        assertEquals(-4L, ArithmeticEvaluator.evaluate("-(2 + 2)"));
    }

    @Test
    @DisplayName("Should produce a decimal for true division")
    void shouldProduceDecimalForDivision() {
        assertEquals(0.6, ArithmeticEvaluator.evaluate("3/5"));
        assertEquals(2.0, ArithmeticEvaluator.evaluate("4/2"));
        assertEquals(3.0, ArithmeticEvaluator.evaluate("1.5 * 2"));
    }

    @Test
    @DisplayName("Should floor integer division and modulo towards negative infinity")
    void shouldFloorDivisionAndModulo() {
        assertEquals(-4L, ArithmeticEvaluator.evaluate("-7 // 2"));
        assertEquals(1L, ArithmeticEvaluator.evaluate("-7 % 2"));
        assertEquals(-1L, ArithmeticEvaluator.evaluate("7 % -2"));
    }

    @Test
    @DisplayName("Should raise integers to large powers without iterating the exponent")
    void shouldEvaluateLargeExponentsQuickly() {
        assertTimeoutPreemptively(Duration.ofSeconds(5), () -> {
            assertEquals(1L, ArithmeticEvaluator.evaluate("1**99999999999999"));
            assertEquals(0L, ArithmeticEvaluator.evaluate("0**99999999999999"));
            assertEquals(1L, ArithmeticEvaluator.evaluate("0**0"));
            assertEquals(-1L, ArithmeticEvaluator.evaluate("(0-1)**99999999999999"));
            assertEquals(1L, ArithmeticEvaluator.evaluate("(0-1)**99999999999998"));
            assertEquals(1024L, ArithmeticEvaluator.evaluate("2**10"));
            assertEquals(4611686018427387904L, ArithmeticEvaluator.evaluate("2**62"));
        });
    }

    @ParameterizedTest
    @ValueSource(strings = {"2**63", "2**99999999999999", "10**19"})
    @DisplayName("Should report integer overflow for powers out of range")
    void shouldRejectOverflowingPowers(String expression) {
        DSLSyntaxException e = assertTimeoutPreemptively(Duration.ofSeconds(5),
                () -> assertThrows(DSLSyntaxException.class, () -> ArithmeticEvaluator.evaluate(expression)));
        assertTrue(e.getMessage().contains("Integer overflow"));
    }

    @ParameterizedTest
    @ValueSource(strings = {"1/0", "1 // 0", "5 % 0"})
    @DisplayName("Should reject division by zero")
    void shouldRejectDivisionByZero(String expression) {
        DSLSyntaxException e = assertThrows(DSLSyntaxException.class, () -> ArithmeticEvaluator.evaluate(expression));
        assertTrue(e.getMessage().contains("Division by zero"));
    }

    @ParameterizedTest
    @ValueSource(strings = {"5+", "(1 + 2", "1 2", "abc", ""})
    @DisplayName("Should reject malformed expressions")
    void shouldRejectMalformedExpressions(String expression) {
        assertThrows(DSLSyntaxException.class, () -> ArithmeticEvaluator.evaluate(expression));
    }

    @Test
    @DisplayName("Should recognise arithmetic text")
    void shouldRecogniseArithmeticText() {
        assertTrue(ArithmeticEvaluator.isArithmetic("5 + 5"));
        assertTrue(ArithmeticEvaluator.isArithmetic("(2*7) % 3"));
        assertFalse(ArithmeticEvaluator.isArithmetic("five"));
        assertFalse(ArithmeticEvaluator.isArithmetic("  "));
        assertFalse(ArithmeticEvaluator.isArithmetic(null));
    }
}
