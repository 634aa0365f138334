package org.scharp.stataxml;

import java.util.regex.Pattern;

/**
 * Utility methods for testing whether response text is a number.
 */
final class NumericText {

    private static final Pattern INTEGER = Pattern.compile("[+-]?[0-9]+");
    private static final Pattern NUMBER = Pattern.compile("[+-]?([0-9]+\\.?[0-9]*|\\.[0-9]+)([eE][+-]?[0-9]+)?");

    // private constructor to prevent anyone from instantiating the class.
    private NumericText() {
    }

    /**
     * Determines if a text is an integer: only digits, with an optional leading sign.
     *
     * @param text
     *     The text to test.
     *
     * @return {@code true}, if {@code text} is an integer.
     */
    static boolean isInteger(String text) {
        return INTEGER.matcher(text).matches();
    }

    /**
     * Determines if a text is a number, given with a point as the decimal separator and an optional exponent.
     *
     * @param text
     *     The text to test.
     *
     * @return {@code true}, if {@code text} is a number.
     */
    static boolean isNumber(String text) {
        return NUMBER.matcher(text).matches();
    }

    /**
     * Determines if an answer code can be used as the value of a Stata value label.
     *
     * @param code
     *     The answer code.
     *
     * @return {@code true}, if {@code code} is an integer that fits into 32 bits.
     */
    static boolean isLabelCode(String code) {
        String trimmedCode = code.trim();
        if (!isInteger(trimmedCode)) {
            return false;
        }
        try {
            Integer.parseInt(trimmedCode);
            return true;
        } catch (NumberFormatException exception) {
            // The code is an integer but it's too large.
            return false;
        }
    }
}
