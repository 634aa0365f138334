package org.scharp.stataxml;

import java.util.Collections;
import java.util.Map;

/**
 * The inferred type of each column of a dataset.
 * <p>
 * Instances of this class are immutable.
 * </p>
 */
public final class TypeTable {

    private final Map<String, ColumnType> typesByColumnKey;

    TypeTable(Map<String, ColumnType> typesByColumnKey) {
        this.typesByColumnKey = Collections.unmodifiableMap(typesByColumnKey);
    }

    /**
     * Gets a column's type.
     *
     * @param column
     *     The column.
     *
     * @return The column's type. This is never {@code null}.
     *
     * @throws IllegalStateException
     *     if no type was inferred for {@code column}.
     */
    public ColumnType typeOf(Column column) {
        ArgumentUtil.checkNotNull(column, "column");

        ColumnType type = typesByColumnKey.get(column.key());
        if (type == null) {
            throw new IllegalStateException("no type was inferred for column " + column);
        }
        return type;
    }

    /**
     * @return The number of columns in this table.
     */
    public int size() {
        return typesByColumnKey.size();
    }
}
