package com.spreadsheet.calc.parser;

import java.util.Objects;

/**
 * A reference extracted from a formula: a cell, a range or a named range,
 * optionally qualified with a sheet name (null means the formula's own sheet).
 */
public final class Reference {

    public enum Kind {
        CELL,
        RANGE,
        NAME
    }

    private final Kind kind;
    private final String sheetName;
    private final int firstRow;
    private final int firstColumn;
    private final int lastRow;
    private final int lastColumn;
    private final String name;

    private Reference(Kind kind, String sheetName, int firstRow, int firstColumn,
                      int lastRow, int lastColumn, String name) {
        this.kind = kind;
        this.sheetName = sheetName;
        this.firstRow = firstRow;
        this.firstColumn = firstColumn;
        this.lastRow = lastRow;
        this.lastColumn = lastColumn;
        this.name = name;
    }

    public static Reference cell(String sheetName, int row, int column) {
        return new Reference(Kind.CELL, sheetName, row, column, row, column, null);
    }

    public static Reference range(String sheetName, int firstRow, int firstColumn, int lastRow, int lastColumn) {
        return new Reference(Kind.RANGE, sheetName, firstRow, firstColumn, lastRow, lastColumn, null);
    }

    public static Reference name(String name) {
        return new Reference(Kind.NAME, null, -1, -1, -1, -1, name.toUpperCase());
    }

    public Kind getKind() {
        return kind;
    }

    public String getSheetName() {
        return sheetName;
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

    public String getName() {
        return name;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Reference)) return false;
        Reference that = (Reference) o;
        return kind == that.kind
                && firstRow == that.firstRow && firstColumn == that.firstColumn
                && lastRow == that.lastRow && lastColumn == that.lastColumn
                && Objects.equals(sheetName == null ? null : sheetName.toUpperCase(),
                        that.sheetName == null ? null : that.sheetName.toUpperCase())
                && Objects.equals(name, that.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, sheetName == null ? null : sheetName.toUpperCase(),
                firstRow, firstColumn, lastRow, lastColumn, name);
    }

    @Override
    public String toString() {
        if (kind == Kind.NAME) {
            return name;
        }
        String prefix = sheetName == null ? "" : sheetName + "!";
        return prefix + new RangeRefNode(firstRow, firstColumn, lastRow, lastColumn);
    }
}
