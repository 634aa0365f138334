package org.scharp.stataxml;

/**
 * The decimal separator with which respondents enter numbers.
 */
public enum DecimalSeparator {
    /** Numbers are entered like "3.5". */
    POINT,

    /** Numbers are entered like "3,5". */
    COMMA,
}
