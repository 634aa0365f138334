package org.scharp.stataxml;

import org.junit.jupiter.api.Test;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class ArgumentUtilTest {

    /** Tests for {@link ArgumentUtil#checkNotNull(Object, String)} */
    @Test
    void testCheckNotNull() {
        ArgumentUtil.checkNotNull("", "arg");
        ArgumentUtil.checkNotNull(0, "arg");

        Exception exception = assertThrows(NullPointerException.class, () -> ArgumentUtil.checkNotNull(null, "myArg"));
        assertEquals("myArg must not be null", exception.getMessage());
    }

    /** Tests for {@link ArgumentUtil#checkNoNullElements(Collection, String)} */
    @Test
    void testCheckNoNullElements() {
        ArgumentUtil.checkNoNullElements(List.of(), "arg");
        ArgumentUtil.checkNoNullElements(List.of("a", "b"), "arg");

        Exception exception = assertThrows(
            NullPointerException.class,
            () -> ArgumentUtil.checkNoNullElements(null, "columns"));
        assertEquals("columns must not be null", exception.getMessage());

        exception = assertThrows(
            NullPointerException.class,
            () -> ArgumentUtil.checkNoNullElements(Arrays.asList("a", null), "columns"));
        assertEquals("columns must not contain a null entry", exception.getMessage());
    }

    /** Tests for {@link ArgumentUtil#checkMaximumLength(String, Charset, int, String)} */
    @Test
    void testCheckMaximumLength() {
        final String sigma = "σ"; // GREEK SMALL LETTER SIGMA (two bytes in UTF-8)

        // empty string fits into 1 byte.
        ArgumentUtil.checkMaximumLength("", StandardCharsets.US_ASCII, 1, "arg");
        ArgumentUtil.checkMaximumLength("", StandardCharsets.UTF_8, 1, "arg");

        // Normally string arguments are ASCII.
        ArgumentUtil.checkMaximumLength("hello", StandardCharsets.US_ASCII, 5, "arg");
        ArgumentUtil.checkMaximumLength("hello", StandardCharsets.UTF_8, 5, "arg");

        Exception exception = assertThrows(
            IllegalArgumentException.class,
            () -> ArgumentUtil.checkMaximumLength("hello", StandardCharsets.US_ASCII, 4, "arg"));
        assertEquals("arg must not be longer than 4 bytes when encoded with US-ASCII", exception.getMessage());

        // sigma is 1 character but 2 bytes in UTF-8.
        ArgumentUtil.checkMaximumLength(sigma, StandardCharsets.UTF_8, 2, "arg");
        exception = assertThrows(
            IllegalArgumentException.class,
            () -> ArgumentUtil.checkMaximumLength(sigma + sigma, StandardCharsets.UTF_8, 3, "myArg"));
        assertEquals("myArg must not be longer than 3 bytes when encoded with UTF-8", exception.getMessage());
    }

    /** Tests for {@link ArgumentUtil#checkNotNegative(int, String)} */
    @Test
    void testCheckNotNegative() {
        ArgumentUtil.checkNotNegative(0, "arg");
        ArgumentUtil.checkNotNegative(Integer.MAX_VALUE, "arg");

        Exception exception = assertThrows(
            IllegalArgumentException.class,
            () -> ArgumentUtil.checkNotNegative(-1, "questionId"));
        assertEquals("questionId must not be negative", exception.getMessage());
    }
}
