package com.spreadsheet.calc.models;

import java.util.Comparator;
import java.util.Objects;

/**
 * Identifies a cell by sheet index, row and column (all zero-based).
 * The natural order is sheet index, then row, then column, which is the
 * tie-break order used everywhere a deterministic sequence is needed.
 */
public final class CellAddress implements Comparable<CellAddress> {

    public static final int MAX_ROWS = 1_048_576;
    public static final int MAX_COLUMNS = 16_384;

    private static final Comparator<CellAddress> ORDER = Comparator
            .comparingInt(CellAddress::getSheetIndex)
            .thenComparingInt(CellAddress::getRow)
            .thenComparingInt(CellAddress::getColumn);

    private final int sheetIndex;
    private final int row;
    private final int column;

    public CellAddress(int sheetIndex, int row, int column) {
        this.sheetIndex = sheetIndex;
        this.row = row;
        this.column = column;
    }

    /**
     * Parses an A1-style address such as "B7" or "$B$7" on the given sheet.
     * Returns null if the text is not a valid in-bounds address.
     */
    public static CellAddress parse(int sheetIndex, String a1) {
        if (a1 == null) {
            return null;
        }
        String text = a1.trim().toUpperCase();
        int i = 0;
        if (i < text.length() && text.charAt(i) == '$') i++;
        int colStart = i;
        while (i < text.length() && text.charAt(i) >= 'A' && text.charAt(i) <= 'Z') i++;
        if (i == colStart || i - colStart > 3) {
            return null;
        }
        int column = columnIndex(text.substring(colStart, i));
        if (i < text.length() && text.charAt(i) == '$') i++;
        int rowStart = i;
        while (i < text.length() && Character.isDigit(text.charAt(i))) i++;
        if (i == rowStart || i != text.length() || i - rowStart > 7) {
            return null;
        }
        int row = Integer.parseInt(text.substring(rowStart, i)) - 1;
        if (row < 0 || row >= MAX_ROWS || column >= MAX_COLUMNS) {
            return null;
        }
        return new CellAddress(sheetIndex, row, column);
    }

    /**
     * "A" -> 0, "Z" -> 25, "AA" -> 26.
     */
    public static int columnIndex(String letters) {
        int result = 0;
        for (int i = 0; i < letters.length(); i++) {
            result = result * 26 + (Character.toUpperCase(letters.charAt(i)) - 'A' + 1);
        }
        return result - 1;
    }

    public static String columnLetters(int column) {
        StringBuilder sb = new StringBuilder();
        int n = column + 1;
        while (n > 0) {
            int rem = (n - 1) % 26;
            sb.insert(0, (char) ('A' + rem));
            n = (n - 1) / 26;
        }
        return sb.toString();
    }

    public int getSheetIndex() {
        return sheetIndex;
    }

    public int getRow() {
        return row;
    }

    public int getColumn() {
        return column;
    }

    /**
     * Row and column packed into one long, the key of a sheet's sparse cell map.
     */
    public long packedKey() {
        return pack(row, column);
    }

    public static long pack(int row, int column) {
        return ((long) row << 32) | (column & 0xFFFFFFFFL);
    }

    public String toA1() {
        return columnLetters(column) + (row + 1);
    }

    @Override
    public int compareTo(CellAddress other) {
        return ORDER.compare(this, other);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CellAddress)) return false;
        CellAddress that = (CellAddress) o;
        return sheetIndex == that.sheetIndex && row == that.row && column == that.column;
    }

    @Override
    public int hashCode() {
        return Objects.hash(sheetIndex, row, column);
    }

    @Override
    public String toString() {
        return sheetIndex + "!" + toA1();
    }
}
