///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.stataxml;

import java.util.Objects;

/**
 * The storage type and display format that were inferred for a column.
 * <p>
 * Instances of this class are immutable.
 * </p>
 */
public final class ColumnType {

    private final StorageType storageType;
    private final int width;
    private final DisplayFormat displayFormat;

    private ColumnType(StorageType storageType, int width, DisplayFormat displayFormat) {
        this.storageType = storageType;
        this.width = width;
        this.displayFormat = displayFormat;
    }

    /**
     * Creates the type of a numeric column that is displayed with the general numeric format.
     *
     * @param storageType
     *     The storage type.  This must not be {@link StorageType#STRING}.
     *
     * @return A numeric column type.
     *
     * @throws NullPointerException
     *     if {@code storageType} is {@code null}.
     * @throws IllegalArgumentException
     *     if {@code storageType} is {@link StorageType#STRING}.
     */
    public static ColumnType numeric(StorageType storageType) {
        ArgumentUtil.checkNotNull(storageType, "storageType");
        if (storageType == StorageType.STRING) {
            throw new IllegalArgumentException("string columns must have a width");
        }
        return new ColumnType(storageType, 0, DisplayFormat.GENERAL_NUMERIC);
    }

    /**
     * Creates the type of a timestamp column, which is a double with the timestamp format.
     *
     * @return A timestamp column type.
     */
    public static ColumnType timestamp() {
        return new ColumnType(StorageType.DOUBLE, 0, DisplayFormat.TIMESTAMP);
    }

    /**
     * Creates the type of a string column.
     *
     * @param width
     *     The width of the column in bytes. This must be between 1 and {@value WriteUtil#MAX_STRING_LENGTH}.
     *
     * @return A string column type.
     *
     * @throws IllegalArgumentException
     *     if {@code width} is out of range.
     */
    public static ColumnType string(int width) {
        return new ColumnType(StorageType.STRING, width, DisplayFormat.string(width));
    }

    /**
     * @return The storage type. This is never {@code null}.
     */
    public StorageType storageType() {
        return storageType;
    }

    /**
     * Gets the width of a string column.
     *
     * @return The width in bytes, or 0 if this is a numeric type.
     */
    public int width() {
        return width;
    }

    /**
     * @return The display format. This is never {@code null}.
     */
    public DisplayFormat displayFormat() {
        return displayFormat;
    }

    /**
     * Gets this type as it's written in a Stata {@code typelist}, like "byte" or "str12".
     *
     * @return This type's name.
     */
    public String token() {
        return storageType == StorageType.STRING ? storageType.token() + width : storageType.token();
    }

    @Override
    public int hashCode() {
        return Objects.hash(storageType, width, displayFormat);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof ColumnType otherType)) {
            return false;
        }

        return storageType == otherType.storageType &&
            width == otherType.width &&
            displayFormat.equals(otherType.displayFormat);
    }

    @Override
    public String toString() {
        return token() + " " + displayFormat;
    }
}
