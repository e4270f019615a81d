package com.spreadsheet.calc.parser;

/**
 * A node of a parsed formula. Trees are immutable and may be shared by
 * every cell holding the same formula text.
 */
public abstract class FormulaNode {

    FormulaNode() {
    }

    public abstract <R> R accept(FormulaVisitor<R> visitor);

    /**
     * True for nodes that denote cells rather than computed values.
     */
    public boolean isReference() {
        return false;
    }
}
