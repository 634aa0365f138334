package org.scharp.stataxml;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/** Unit tests for {@link DisplayFormat}. */
public class DisplayFormatTest {

    @Test
    void testGeneralNumeric() {
        assertEquals("%10.0g", DisplayFormat.GENERAL_NUMERIC.toString());
        assertEquals(10, DisplayFormat.GENERAL_NUMERIC.width());
        assertEquals(0, DisplayFormat.GENERAL_NUMERIC.numberOfDigits());
        assertFalse(DisplayFormat.GENERAL_NUMERIC.isTimestamp());
    }

    @Test
    void testTimestamp() {
        assertEquals("%tc", DisplayFormat.TIMESTAMP.toString());
        assertEquals(0, DisplayFormat.TIMESTAMP.width());
        assertTrue(DisplayFormat.TIMESTAMP.isTimestamp());
    }

    @Test
    void testGeneral() {
        DisplayFormat format = DisplayFormat.general(9, 2);
        assertEquals("%9.2g", format.toString());
        assertEquals(9, format.width());
        assertEquals(2, format.numberOfDigits());

        Exception exception = assertThrows(IllegalArgumentException.class, () -> DisplayFormat.general(0, 0));
        assertEquals("format width must be positive", exception.getMessage());

        exception = assertThrows(IllegalArgumentException.class, () -> DisplayFormat.general(5, -1));
        assertEquals("format numberOfDigits must not be negative", exception.getMessage());

        exception = assertThrows(IllegalArgumentException.class, () -> DisplayFormat.general(5, 5));
        assertEquals("format numberOfDigits must be less than its width", exception.getMessage());
    }

    @Test
    void testString() {
        assertEquals("%1s", DisplayFormat.string(1).toString());
        assertEquals("%244s", DisplayFormat.string(244).toString());
        assertFalse(DisplayFormat.string(12).isTimestamp());

        Exception exception = assertThrows(IllegalArgumentException.class, () -> DisplayFormat.string(0));
        assertEquals("string width must be between 1 and 244", exception.getMessage());

        exception = assertThrows(IllegalArgumentException.class, () -> DisplayFormat.string(245));
        assertEquals("string width must be between 1 and 244", exception.getMessage());
    }

    @Test
    void testEquals() {
        assertEquals(DisplayFormat.general(10, 0), DisplayFormat.GENERAL_NUMERIC);
        assertEquals(DisplayFormat.general(10, 0).hashCode(), DisplayFormat.GENERAL_NUMERIC.hashCode());
        assertEquals(DisplayFormat.string(12), DisplayFormat.string(12));

        assertNotEquals(DisplayFormat.string(12), DisplayFormat.string(13));
        assertNotEquals(DisplayFormat.general(10, 0), DisplayFormat.general(10, 1));
        assertNotEquals(DisplayFormat.string(10), DisplayFormat.general(10, 0));
        assertNotEquals(DisplayFormat.TIMESTAMP, DisplayFormat.GENERAL_NUMERIC);
        assertNotEquals(DisplayFormat.TIMESTAMP, null);
        assertNotEquals(DisplayFormat.TIMESTAMP, "%tc");
    }
}
