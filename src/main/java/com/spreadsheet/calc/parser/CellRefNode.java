package com.spreadsheet.calc.parser;

import com.spreadsheet.calc.models.CellAddress;

/**
 * A single-cell reference such as A1, $A1, A$1 or $A$1. The absolute
 * markers are kept for display; evaluation does not depend on them.
 */
public final class CellRefNode extends FormulaNode {
    private final int row;
    private final int column;
    private final boolean rowAbsolute;
    private final boolean columnAbsolute;

    public CellRefNode(int row, int column, boolean rowAbsolute, boolean columnAbsolute) {
        this.row = row;
        this.column = column;
        this.rowAbsolute = rowAbsolute;
        this.columnAbsolute = columnAbsolute;
    }

    public int getRow() {
        return row;
    }

    public int getColumn() {
        return column;
    }

    public boolean isRowAbsolute() {
        return rowAbsolute;
    }

    public boolean isColumnAbsolute() {
        return columnAbsolute;
    }

    @Override
    public boolean isReference() {
        return true;
    }

    @Override
    public <R> R accept(FormulaVisitor<R> visitor) {
        return visitor.visitCellRef(this);
    }

    @Override
    public String toString() {
        return (columnAbsolute ? "$" : "") + CellAddress.columnLetters(column) + (rowAbsolute ? "$" : "") + (row + 1);
    }
}
