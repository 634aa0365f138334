///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.stataxml;

/**
 * Thrown when a response to a date/time column can't be read as a timestamp.
 * <p>
 * A single malformed timestamp aborts the export, because the column's values could otherwise not all be stored as
 * Stata timestamps.
 * </p>
 */
public class MalformedTimestampException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    private final int rowNumber;
    private final String variableName;
    private final String value;

    /**
     * Creates an exception for a malformed timestamp.
     *
     * @param rowNumber
     *     The zero-based number of the response that contains the value.
     * @param variableName
     *     The name of the variable that contains the value.
     * @param value
     *     The value that could not be read.
     * @param cause
     *     The parsing error.
     */
    public MalformedTimestampException(int rowNumber, String variableName, String value, Throwable cause) {
        super("response " + rowNumber + " has a malformed timestamp in " + variableName + ": \"" + value + "\"", cause);
        this.rowNumber = rowNumber;
        this.variableName = variableName;
        this.value = value;
    }

    /**
     * @return The zero-based number of the response that contains the value.
     */
    public int rowNumber() {
        return rowNumber;
    }

    /**
     * @return The name of the variable that contains the value.
     */
    public String variableName() {
        return variableName;
    }

    /**
     * @return The value that could not be read.
     */
    public String value() {
        return value;
    }
}
