///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.stataxml;

import java.util.HashMap;
import java.util.Objects;

/**
 * A simple class for describing the display format of a Stata variable.
 *
 * <p>
 * Instances of this class are immutable.
 * </p>
 *
 * <p>
 * This class supports {@code equals()} and {@code hashCode()} so that its instances suitable for use in a HashMap.
 * </p>
 *
 * <p>
 * See the Stata documentation for the {@code format} command.
 * </p>
 */
public final class DisplayFormat {

    private static final String GENERAL_SUFFIX = "g";
    private static final String TIMESTAMP_SUFFIX = "tc";
    private static final String STRING_SUFFIX = "s";

    /**
     * The general numeric format ({@code %10.0g}) that is given to all non-timestamp numeric variables.
     */
    public static final DisplayFormat GENERAL_NUMERIC = general(10, 0);

    /**
     * The format for timestamps that are given as milliseconds since 1960-01-01 00:00:00 ({@code %tc}).
     */
    public static final DisplayFormat TIMESTAMP = new DisplayFormat(TIMESTAMP_SUFFIX, 0, 0);

    private final String suffix;
    private final short width;
    private final short numberOfDigits;

    private DisplayFormat(String suffix, int width, int numberOfDigits) {
        this.suffix = suffix;
        this.width = (short) width;
        this.numberOfDigits = (short) numberOfDigits;
    }

    /**
     * Creates a general numeric format, rendered as {@code %w.dg}.
     *
     * @param width
     *     The total width of the displayed value.  In {@code %w.dg}, this is the "w".
     * @param numberOfDigits
     *     The number of digits to the right of the decimal point.  In {@code %w.dg}, this is the "d".
     *
     * @return A general numeric format.
     *
     * @throws IllegalArgumentException
     *     if {@code width} is not positive, if {@code numberOfDigits} is negative, or if {@code numberOfDigits} is not
     *     less than {@code width}.
     */
    public static DisplayFormat general(int width, int numberOfDigits) {
        if (width <= 0) {
            throw new IllegalArgumentException("format width must be positive");
        }
        ArgumentUtil.checkNotNegative(numberOfDigits, "format numberOfDigits");
        if (width <= numberOfDigits) {
            throw new IllegalArgumentException("format numberOfDigits must be less than its width");
        }
        return new DisplayFormat(GENERAL_SUFFIX, width, numberOfDigits);
    }

    /**
     * Creates a string format, rendered as {@code %ws}.
     *
     * @param width
     *     The width of the string. This must be between 1 and {@value WriteUtil#MAX_STRING_LENGTH}.
     *
     * @return A string format.
     *
     * @throws IllegalArgumentException
     *     if {@code width} is out of range.
     */
    public static DisplayFormat string(int width) {
        WriteUtil.checkStringWidth(width);
        return new DisplayFormat(STRING_SUFFIX, width, 0);
    }

    /**
     * Gets this format's width. If this is zero, then no explicit width is set.
     *
     * @return The width of this format.
     */
    public short width() {
        return width;
    }

    /**
     * Gets this format's number of digits to the right of the decimal point.
     *
     * @return The number of digits in this format.
     */
    public short numberOfDigits() {
        return numberOfDigits;
    }

    /**
     * Gets whether this format renders its variable as a timestamp.
     *
     * @return {@code true}, if this is {@link #TIMESTAMP}; {@code false}, otherwise.
     */
    public boolean isTimestamp() {
        return TIMESTAMP_SUFFIX.equals(suffix);
    }

    /**
     * Gets a hash code for this format.
     * <p>
     * This method is supported for the benefit of hash tables such as those provided by {@link HashMap}.
     * </p>
     *
     * @return this format's hash code
     */
    @Override
    public int hashCode() {
        return Objects.hash(suffix, width, numberOfDigits);
    }

    /**
     * Determines if this format is equal to another object.
     *
     * @param other
     *     The object with which to compare this format
     *
     * @return {@code true}, if this format is equal to {@code other}.  {@code false}, otherwise.
     */
    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof DisplayFormat otherFormat)) {
            return false;
        }

        return suffix.equals(otherFormat.suffix) &&
            width == otherFormat.width &&
            numberOfDigits == otherFormat.numberOfDigits;
    }

    /**
     * Gets this format as a string rendered the way that Stata would render it.
     *
     * <p>
     * For example "%10.0g", "%tc", or "%12s".
     * </p>
     *
     * @return A string representing this format.
     */
    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder("%");
        if (width != 0) {
            builder.append(width);
        }
        if (GENERAL_SUFFIX.equals(suffix)) {
            builder.append('.').append(numberOfDigits);
        }
        builder.append(suffix);
        return builder.toString();
    }
}
