package com.spreadsheet.calc.parser;

/**
 * A reference to a workbook-level named range.
 */
public final class NameRefNode extends FormulaNode {
    private final String name;

    public NameRefNode(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    @Override
    public boolean isReference() {
        return true;
    }

    @Override
    public <R> R accept(FormulaVisitor<R> visitor) {
        return visitor.visitNameRef(this);
    }

    @Override
    public String toString() {
        return name;
    }
}
