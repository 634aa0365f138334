package org.scharp.stataxml;

/**
 * The narrowest type that can hold a single value.  The constants are declared from narrowest to widest.
 */
enum CellClass {
    /** An empty value, which fits into any type. */
    EMPTY,

    BYTE,

    INT,

    LONG,

    FLOAT,

    DOUBLE,

    STRING;

    CellClass widen(CellClass other) {
        return compareTo(other) < 0 ? other : this;
    }
}
