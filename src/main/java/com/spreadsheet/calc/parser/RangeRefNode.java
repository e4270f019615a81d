package com.spreadsheet.calc.parser;

import com.spreadsheet.calc.models.CellAddress;

/**
 * A rectangular range such as A1:B10, or a whole column (A:A) or row (3:3)
 * spanning the sheet bounds.
 */
public final class RangeRefNode extends FormulaNode {
    private final int firstRow;
    private final int firstColumn;
    private final int lastRow;
    private final int lastColumn;

    public RangeRefNode(int rowA, int columnA, int rowB, int columnB) {
        this.firstRow = Math.min(rowA, rowB);
        this.lastRow = Math.max(rowA, rowB);
        this.firstColumn = Math.min(columnA, columnB);
        this.lastColumn = Math.max(columnA, columnB);
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

    @Override
    public boolean isReference() {
        return true;
    }

    @Override
    public <R> R accept(FormulaVisitor<R> visitor) {
        return visitor.visitRangeRef(this);
    }

    @Override
    public String toString() {
        return CellAddress.columnLetters(firstColumn) + (firstRow + 1)
                + ":" + CellAddress.columnLetters(lastColumn) + (lastRow + 1);
    }
}
