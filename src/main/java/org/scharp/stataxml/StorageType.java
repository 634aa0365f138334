///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.stataxml;

/**
 * The storage type of a Stata variable.
 * <p>
 * The constants are declared from narrowest to widest, so {@link #compareTo} can be used to promote a column's type.
 * </p>
 */
public enum StorageType {
    /** A one byte integer that holds -127 to 100. */
    BYTE("byte"),

    /** A two byte integer that holds -32,767 to 32,740. */
    INT("int"),

    /** A four byte integer that holds -2,147,483,647 to 2,147,483,620. */
    LONG("long"),

    /** A four byte IEEE 754 floating point number. */
    FLOAT("float"),

    /** An eight byte IEEE 754 floating point number. Timestamps are always stored as doubles. */
    DOUBLE("double"),

    /** A fixed-width string of 1 to 244 bytes. */
    STRING("str");

    private final String token;

    StorageType(String token) {
        this.token = token;
    }

    /**
     * Gets the name that Stata uses for this type in a {@code typelist}. For {@link #STRING}, this is only the prefix;
     * the width must be appended.
     *
     * @return This type's token. This is never {@code null}.
     */
    public String token() {
        return token;
    }
}
