package com.spreadsheet.calc.models;

import java.util.Objects;

/**
 * A rectangular block of cells on a single sheet, normalized so that the
 * first corner is the top-left one.
 */
public final class RangeAddress {

    private final int sheetIndex;
    private final int firstRow;
    private final int firstColumn;
    private final int lastRow;
    private final int lastColumn;

    public RangeAddress(int sheetIndex, int rowA, int columnA, int rowB, int columnB) {
        this.sheetIndex = sheetIndex;
        this.firstRow = Math.min(rowA, rowB);
        this.lastRow = Math.max(rowA, rowB);
        this.firstColumn = Math.min(columnA, columnB);
        this.lastColumn = Math.max(columnA, columnB);
    }

    public static RangeAddress of(CellAddress cell) {
        return new RangeAddress(cell.getSheetIndex(), cell.getRow(), cell.getColumn(), cell.getRow(), cell.getColumn());
    }

    public int getSheetIndex() {
        return sheetIndex;
    }

    public int getFirstRow() {
        return firstRow;
    }

    public int getFirstColumn() {
        return firstColumn;
    }

    public int getLastRow() {
        return lastRow;
    }

    public int getLastColumn() {
        return lastColumn;
    }

    public int rowCount() {
        return lastRow - firstRow + 1;
    }

    public int columnCount() {
        return lastColumn - firstColumn + 1;
    }

    public long area() {
        return (long) rowCount() * columnCount();
    }

    public boolean isSingleCell() {
        return firstRow == lastRow && firstColumn == lastColumn;
    }

    public CellAddress topLeft() {
        return new CellAddress(sheetIndex, firstRow, firstColumn);
    }

    public boolean contains(CellAddress cell) {
        return cell.getSheetIndex() == sheetIndex
                && cell.getRow() >= firstRow && cell.getRow() <= lastRow
                && cell.getColumn() >= firstColumn && cell.getColumn() <= lastColumn;
    }

    /**
     * The overlapping block of two ranges, or null when they share no cell
     * (including ranges on different sheets).
     */
    public RangeAddress intersect(RangeAddress other) {
        if (other.sheetIndex != sheetIndex) {
            return null;
        }
        int top = Math.max(firstRow, other.firstRow);
        int bottom = Math.min(lastRow, other.lastRow);
        int left = Math.max(firstColumn, other.firstColumn);
        int right = Math.min(lastColumn, other.lastColumn);
        if (top > bottom || left > right) {
            return null;
        }
        return new RangeAddress(sheetIndex, top, left, bottom, right);
    }

    public String toA1() {
        String start = CellAddress.columnLetters(firstColumn) + (firstRow + 1);
        if (isSingleCell()) {
            return start;
        }
        return start + ":" + CellAddress.columnLetters(lastColumn) + (lastRow + 1);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RangeAddress)) return false;
        RangeAddress that = (RangeAddress) o;
        return sheetIndex == that.sheetIndex
                && firstRow == that.firstRow && firstColumn == that.firstColumn
                && lastRow == that.lastRow && lastColumn == that.lastColumn;
    }

    @Override
    public int hashCode() {
        return Objects.hash(sheetIndex, firstRow, firstColumn, lastRow, lastColumn);
    }

    @Override
    public String toString() {
        return sheetIndex + "!" + toA1();
    }
}
