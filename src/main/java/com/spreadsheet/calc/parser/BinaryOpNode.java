package com.spreadsheet.calc.parser;

public final class BinaryOpNode extends FormulaNode {
    private final BinaryOperator operator;
    private final FormulaNode left;
    private final FormulaNode right;

    public BinaryOpNode(BinaryOperator operator, FormulaNode left, FormulaNode right) {
        this.operator = operator;
        this.left = left;
        this.right = right;
    }

    public BinaryOperator getOperator() {
        return operator;
    }

    public FormulaNode getLeft() {
        return left;
    }

    public FormulaNode getRight() {
        return right;
    }

    /**
     * Only the intersection of two references is itself a reference.
     */
    @Override
    public boolean isReference() {
        return operator == BinaryOperator.INTERSECT;
    }

    @Override
    public <R> R accept(FormulaVisitor<R> visitor) {
        return visitor.visitBinaryOp(this);
    }

    @Override
    public String toString() {
        return "(" + left + " " + operator.getSymbol() + " " + right + ")";
    }
}
