package com.spreadsheet.calc.parser;

import com.spreadsheet.calc.models.CellValue;

/**
 * A constant: number, string, boolean or error literal. A formula that
 * failed to parse is a single literal holding {@code #ERROR!}.
 */
public final class LiteralNode extends FormulaNode {
    private final CellValue value;

    public LiteralNode(CellValue value) {
        this.value = value;
    }

    public CellValue getValue() {
        return value;
    }

    @Override
    public <R> R accept(FormulaVisitor<R> visitor) {
        return visitor.visitLiteral(this);
    }

    @Override
    public String toString() {
        return value.toString();
    }
}
