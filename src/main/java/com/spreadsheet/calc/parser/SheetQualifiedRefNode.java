package com.spreadsheet.calc.parser;

/**
 * A cell or range reference prefixed with a sheet name, e.g.
 * {@code 'Price List'!B2:C40}.
 */
public final class SheetQualifiedRefNode extends FormulaNode {
    private final String sheetName;
    private final FormulaNode target;

    public SheetQualifiedRefNode(String sheetName, FormulaNode target) {
        this.sheetName = sheetName;
        this.target = target;
    }

    public String getSheetName() {
        return sheetName;
    }

    /**
     * Either a {@link CellRefNode} or a {@link RangeRefNode}.
     */
    public FormulaNode getTarget() {
        return target;
    }

    @Override
    public boolean isReference() {
        return true;
    }

    @Override
    public <R> R accept(FormulaVisitor<R> visitor) {
        return visitor.visitSheetQualifiedRef(this);
    }

    @Override
    public String toString() {
        return "'" + sheetName + "'!" + target;
    }
}
