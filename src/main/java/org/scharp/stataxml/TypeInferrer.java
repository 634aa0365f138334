///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.stataxml;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Chooses the narrowest Stata storage type that holds every recoded value of a column.
 */
final class TypeInferrer {

    private static final Logger log = Logger.getLogger(TypeInferrer.class.getName());

    // Stata reserves the top of each integer type's range for missing values.
    static final int MIN_BYTE = -127;
    static final int MAX_BYTE = 100;
    static final int MIN_INT = -32_767;
    static final int MAX_INT = 32_740;
    static final long MIN_LONG = -2_147_483_647L;
    static final long MAX_LONG = 2_147_483_620L;

    /** The largest magnitude below which a double represents every integer. */
    private static final BigInteger MAX_EXACT_DOUBLE_INTEGER = BigInteger.ONE.shiftLeft(53);

    /** The number of significant decimal digits that survive a round trip through a float. */
    private static final int FLOAT_DIGITS = 6;

    /** The number of significant decimal digits that survive a round trip through a double. */
    private static final int DOUBLE_DIGITS = 15;

    private static final BigDecimal MAX_FLOAT = new BigDecimal(Float.MAX_VALUE);
    private static final BigDecimal MIN_NORMAL_FLOAT = new BigDecimal(Float.MIN_NORMAL);
    private static final BigDecimal MAX_DOUBLE = new BigDecimal(Double.MAX_VALUE);
    private static final BigDecimal MIN_NORMAL_DOUBLE = new BigDecimal(Double.MIN_NORMAL);

    private TypeInferrer() {
    }

    /**
     * Classifies a single recoded value.
     *
     * @param cell
     *     The value.
     *
     * @return The narrowest class that can hold {@code cell}.
     */
    static CellClass classify(String cell) {
        if (cell.isEmpty()) {
            return CellClass.EMPTY;
        }

        if (NumericText.isInteger(cell)) {
            BigInteger value = new BigInteger(cell);
            if (fits(value, MIN_BYTE, MAX_BYTE)) {
                return CellClass.BYTE;
            }
            if (fits(value, MIN_INT, MAX_INT)) {
                return CellClass.INT;
            }
            if (fits(value, MIN_LONG, MAX_LONG)) {
                return CellClass.LONG;
            }
            return value.abs().compareTo(MAX_EXACT_DOUBLE_INTEGER) <= 0 ? CellClass.DOUBLE : CellClass.STRING;
        }

        if (NumericText.isNumber(cell)) {
            BigDecimal value = new BigDecimal(cell);
            if (value.signum() == 0) {
                return CellClass.FLOAT;
            }

            int significantDigits = value.stripTrailingZeros().precision();
            BigDecimal magnitude = value.abs();
            if (significantDigits <= FLOAT_DIGITS && inRange(magnitude, MIN_NORMAL_FLOAT, MAX_FLOAT)) {
                return CellClass.FLOAT;
            }
            if (significantDigits <= DOUBLE_DIGITS && inRange(magnitude, MIN_NORMAL_DOUBLE, MAX_DOUBLE)) {
                return CellClass.DOUBLE;
            }
        }

        return CellClass.STRING;
    }

    private static boolean fits(BigInteger value, long min, long max) {
        return BigInteger.valueOf(min).compareTo(value) <= 0 && value.compareTo(BigInteger.valueOf(max)) <= 0;
    }

    private static boolean inRange(BigDecimal magnitude, BigDecimal min, BigDecimal max) {
        return min.compareTo(magnitude) <= 0 && magnitude.compareTo(max) <= 0;
    }

    /**
     * Infers the type of every column from its recoded values.  This doesn't modify the matrix.
     *
     * @param columns
     *     The columns of the matrix.
     * @param matrix
     *     The recoded responses.
     *
     * @return The type of each column.
     */
    static TypeTable infer(List<Column> columns, ResponseMatrix matrix) {
        assert columns.size() == matrix.totalColumns();

        Map<String, ColumnType> types = new LinkedHashMap<>();
        int i = 0;
        for (Column column : columns) {
            ColumnType type = inferColumn(column, matrix, i);
            log.log(Level.FINE, "Column {0} has type {1}", new Object[] { column, type });
            types.put(column.key(), type);
            i++;
        }
        return new TypeTable(types);
    }

    private static ColumnType inferColumn(Column column, ResponseMatrix matrix, int columnIndex) {
        CellClass widest = CellClass.EMPTY;
        boolean hasLong = false;
        int maxLength = 0;
        for (int row = 0; row < matrix.totalRows(); row++) {
            String cell = matrix.get(row, columnIndex);
            CellClass cellClass = classify(cell);
            widest = widest.widen(cellClass);
            hasLong |= cellClass == CellClass.LONG;
            maxLength = Math.max(maxLength, WriteUtil.utf8Length(cell));
        }

        // A float's 24-bit mantissa can't hold every long, but a double's can.
        if (widest == CellClass.FLOAT && hasLong) {
            widest = CellClass.DOUBLE;
        }

        if (widest == CellClass.EMPTY) {
            // Stata has no empty type, so a column without values is the narrowest string.
            return ColumnType.string(1);
        }

        if (column.kind() == SemanticKind.FREE_DATE && widest != CellClass.STRING) {
            return ColumnType.timestamp();
        }

        switch (widest) {
        case BYTE:
            return ColumnType.numeric(StorageType.BYTE);
        case INT:
            return ColumnType.numeric(StorageType.INT);
        case LONG:
            return ColumnType.numeric(StorageType.LONG);
        case FLOAT:
            return ColumnType.numeric(StorageType.FLOAT);
        case DOUBLE:
            return ColumnType.numeric(StorageType.DOUBLE);
        default:
            return ColumnType.string(Math.min(WriteUtil.MAX_STRING_LENGTH, maxLength));
        }
    }
}
