package com.spreadsheet.calc.functions;

import java.util.Arrays;

/**
 * A function table entry: name, category, arity bounds, how each argument
 * position is consumed, and the implementation.
 */
public final class FunctionDefinition {

    public static final int VARIADIC = 255;

    private final String name;
    private final FunctionCategory category;
    private final int minArgs;
    private final int maxArgs;
    private final EvaluationStrategy strategy;
    private final ArgumentKind[] kinds;
    private final FormulaFunction implementation;

    public FunctionDefinition(String name, FunctionCategory category, int minArgs, int maxArgs,
                              EvaluationStrategy strategy, ArgumentKind[] kinds, FormulaFunction implementation) {
        if (kinds.length == 0) {
            throw new IllegalArgumentException("At least one argument kind is required for " + name);
        }
        this.name = name.toUpperCase();
        this.category = category;
        this.minArgs = minArgs;
        this.maxArgs = maxArgs;
        this.strategy = strategy;
        this.kinds = kinds.clone();
        this.implementation = implementation;
    }

    /**
     * Strict function whose arguments are all single values.
     */
    public static FunctionDefinition scalar(String name, FunctionCategory category, int minArgs, int maxArgs,
                                            FormulaFunction implementation) {
        return new FunctionDefinition(name, category, minArgs, maxArgs, EvaluationStrategy.STRICT,
                new ArgumentKind[]{ArgumentKind.SCALAR}, implementation);
    }

    /**
     * Strict function with per-position kinds; the last kind repeats for
     * any further arguments.
     */
    public static FunctionDefinition strict(String name, FunctionCategory category, int minArgs, int maxArgs,
                                            FormulaFunction implementation, ArgumentKind... kinds) {
        return new FunctionDefinition(name, category, minArgs, maxArgs, EvaluationStrategy.STRICT, kinds, implementation);
    }

    /**
     * Function that pulls its own arguments.
     */
    public static FunctionDefinition lazy(String name, FunctionCategory category, int minArgs, int maxArgs,
                                          FormulaFunction implementation) {
        return new FunctionDefinition(name, category, minArgs, maxArgs, EvaluationStrategy.LAZY,
                new ArgumentKind[]{ArgumentKind.SCALAR}, implementation);
    }

    public String getName() {
        return name;
    }

    public FunctionCategory getCategory() {
        return category;
    }

    public int getMinArgs() {
        return minArgs;
    }

    public int getMaxArgs() {
        return maxArgs;
    }

    public EvaluationStrategy getStrategy() {
        return strategy;
    }

    public ArgumentKind kindAt(int position) {
        return kinds[Math.min(position, kinds.length - 1)];
    }

    public boolean acceptsArgumentCount(int count) {
        return count >= minArgs && count <= maxArgs;
    }

    public FormulaFunction getImplementation() {
        return implementation;
    }

    @Override
    public String toString() {
        return name + "[" + category + ", " + minArgs + ".." + maxArgs + ", " + strategy + ", " + Arrays.toString(kinds) + "]";
    }
}
