package com.spreadsheet.calc.models;

import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * A lazily-read rectangle of values handed to range-consuming functions.
 * Nothing is copied: {@link #get(int, int)} and the iterator read the
 * underlying cells on demand.
 *
 * The "used" extent clips whole-column and whole-row ranges to the part of
 * the sheet that has ever held a cell; everything outside it is blank.
 */
public interface RangeValues extends Iterable<CellValue> {

    int rows();

    int columns();

    /**
     * Rows worth scanning, at most {@link #rows()}.
     */
    default int usedRows() {
        return rows();
    }

    /**
     * Columns worth scanning, at most {@link #columns()}.
     */
    default int usedColumns() {
        return columns();
    }

    /**
     * Value at a position relative to the top-left corner (zero-based).
     */
    CellValue get(int row, int column);

    /**
     * The sheet area this range reads, or null for a computed value.
     */
    RangeAddress getAddress();

    default boolean isSingleCell() {
        return rows() == 1 && columns() == 1;
    }

    default long usedArea() {
        return (long) usedRows() * usedColumns();
    }

    /**
     * Row-major iteration over the used extent.
     */
    @Override
    default Iterator<CellValue> iterator() {
        final int rowCount = usedRows();
        final int columnCount = usedColumns();
        return new Iterator<CellValue>() {
            private int row;
            private int column;

            @Override
            public boolean hasNext() {
                return columnCount > 0 && row < rowCount;
            }

            @Override
            public CellValue next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                CellValue value = get(row, column);
                if (++column == columnCount) {
                    column = 0;
                    row++;
                }
                return value;
            }
        };
    }

    /**
     * A 1x1 range around a computed value, used when a scalar is passed
     * where a range is expected.
     */
    static RangeValues of(final CellValue value) {
        return new RangeValues() {
            @Override
            public int rows() {
                return 1;
            }

            @Override
            public int columns() {
                return 1;
            }

            @Override
            public CellValue get(int row, int column) {
                return row == 0 && column == 0 ? value : CellValue.error(ErrorCode.REF);
            }

            @Override
            public RangeAddress getAddress() {
                return null;
            }
        };
    }
}
