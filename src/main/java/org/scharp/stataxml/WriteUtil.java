///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.stataxml;

import java.nio.charset.StandardCharsets;

/** Utility methods for measuring and fitting string values into Stata's fixed-width strings */
final class WriteUtil {

    /** The longest string, in bytes, that Stata's {@code str#} types can hold. */
    static final int MAX_STRING_LENGTH = 244;

    // private constructor to prevent anyone from instantiating the class.
    private WriteUtil() {
    }

    /**
     * Throws an exception if {@code width} is not a legal width for a {@code str#} variable.
     *
     * @param width
     *     The width to check.
     *
     * @throws IllegalArgumentException
     *     if {@code width} is less than 1 or greater than {@value #MAX_STRING_LENGTH}.
     */
    static void checkStringWidth(int width) {
        if (width < 1 || MAX_STRING_LENGTH < width) {
            throw new IllegalArgumentException("string width must be between 1 and " + MAX_STRING_LENGTH);
        }
    }

    /**
     * Gets the number of bytes a string occupies when encoded in UTF-8.
     *
     * @param string
     *     The string to measure.
     *
     * @return The string's length in bytes.
     */
    static int utf8Length(String string) {
        return string.getBytes(StandardCharsets.UTF_8).length;
    }

    /**
     * Truncates a string so that it fits into a given number of bytes when encoded in UTF-8.
     * <p>
     * Truncation never splits a character, so the result may be a few bytes shorter than {@code maxBytes}.
     * </p>
     *
     * @param string
     *     The string to truncate.
     * @param maxBytes
     *     The maximum number of bytes in the result.
     *
     * @return {@code string}, if it already fits; otherwise, its longest prefix that fits.
     */
    static String truncateUtf8(String string, int maxBytes) {
        assert 0 <= maxBytes : "maxBytes must not be negative";

        int totalBytes = 0;
        int offset = 0;
        while (offset < string.length()) {
            int codePoint = string.codePointAt(offset);
            int codePointBytes = codePoint < 0x80 ? 1 : codePoint < 0x800 ? 2 : codePoint < 0x10000 ? 3 : 4;
            if (maxBytes < totalBytes + codePointBytes) {
                return string.substring(0, offset);
            }
            totalBytes += codePointBytes;
            offset += Character.charCount(codePoint);
        }
        return string;
    }
}
