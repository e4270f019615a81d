package com.spreadsheet.calc.parser;

public final class UnaryOpNode extends FormulaNode {
    private final UnaryOperator operator;
    private final FormulaNode operand;

    public UnaryOpNode(UnaryOperator operator, FormulaNode operand) {
        this.operator = operator;
        this.operand = operand;
    }

    public UnaryOperator getOperator() {
        return operator;
    }

    public FormulaNode getOperand() {
        return operand;
    }

    @Override
    public <R> R accept(FormulaVisitor<R> visitor) {
        return visitor.visitUnaryOp(this);
    }

    @Override
    public String toString() {
        switch (operator) {
            case NEGATE:
                return "-" + operand;
            case PERCENT:
                return operand + "%";
            default:
                return "+" + operand;
        }
    }
}
