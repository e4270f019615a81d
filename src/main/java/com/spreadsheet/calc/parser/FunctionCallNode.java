package com.spreadsheet.calc.parser;

import java.util.Collections;
import java.util.List;

/**
 * A call such as {@code SUM(A1:A3, 4)}. The name is upper-cased; whether
 * the function exists is only checked at evaluation time.
 */
public final class FunctionCallNode extends FormulaNode {
    private final String name;
    private final List<FormulaNode> arguments;

    public FunctionCallNode(String name, List<FormulaNode> arguments) {
        this.name = name;
        this.arguments = Collections.unmodifiableList(arguments);
    }

    public String getName() {
        return name;
    }

    public List<FormulaNode> getArguments() {
        return arguments;
    }

    @Override
    public <R> R accept(FormulaVisitor<R> visitor) {
        return visitor.visitFunctionCall(this);
    }

    @Override
    public String toString() {
        return name + arguments;
    }
}
