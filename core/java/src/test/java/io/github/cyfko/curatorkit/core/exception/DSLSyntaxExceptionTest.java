package io.github.cyfko.curatorkit.core.exception;

import io.github.cyfko.curatorkit.core.impl.CriterionDslParser;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.DisplayName;
import static org.junit.jupiter.api.Assertions.*;

class DSLSyntaxExceptionTest {

    @Test
    @DisplayName("Should create DSLSyntaxException with message")
    void shouldCreateDSLSyntaxExceptionWithMessage() {
        // Given
        String message = "Invalid DSL syntax";

        // When
        DSLSyntaxException exception = new DSLSyntaxException(message);

        // Then
        assertEquals(message, exception.getMessage());
        assertNull(exception.getCause());
        assertFalse(exception.hasLocation(), "An unlocated error should report no location");
        assertEquals(-1, exception.offset());
        assertEquals("", exception.snippet());
    }

    @Test
    @DisplayName("Should create DSLSyntaxException with message and cause")
    void shouldCreateDSLSyntaxExceptionWithMessageAndCause() {
        // Given
        String message = "Invalid DSL syntax";
        Throwable cause = new IllegalArgumentException("Root cause");

        // When
        DSLSyntaxException exception = new DSLSyntaxException(message, cause);

        // Then
        assertEquals(message, exception.getMessage());
        assertEquals(cause, exception.getCause());
    }

    @Test
    @DisplayName("Should render the location after the reason")
    void shouldRenderLocation() {
        // When
        DSLSyntaxException exception = new DSLSyntaxException("Unexpected ')'", 4, 1, 5, "age()", "    ^");

        // Then
        assertTrue(exception.hasLocation());
        assertEquals(4, exception.offset());
        assertEquals(1, exception.line());
        assertEquals(5, exception.column());
        assertEquals("age()", exception.snippet());
        assertEquals("    ^", exception.pointer());
        assertEquals(String.format("Unexpected ')' (line 1, column 5):%nage()%n    ^"), exception.getMessage());
    }

    @Test
    @DisplayName("Should point at the offending criterion when parsing fails")
    void shouldCarryParserLocation() {
        // When
        DSLSyntaxException exception = assertThrows(DSLSyntaxException.class,
                () -> new CriterionDslParser().parse("not{age(min=18), sex(value=\"male\")}"));

        // Then
        assertEquals(0, exception.offset());
        assertEquals(1, exception.line());
        assertEquals(1, exception.column());
        assertTrue(exception.getMessage().startsWith("Expected 1 child in 'not', got 2"));
    }

    @Test
    @DisplayName("Should be a curator exception")
    void shouldBeCuratorException() {
        // Given
        DSLSyntaxException exception = new DSLSyntaxException("test");

        // Then
        assertInstanceOf(CuratorException.class, exception);
        assertInstanceOf(RuntimeException.class, exception);
    }
}
