package com.spreadsheet.calc.models;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Per-workbook calculation options. Immutable; the engine reads them on
 * every pass.
 */
public final class CalculationSettings {

    public static final RoundingMode ROUNDING = RoundingMode.HALF_UP;

    private final boolean iterative;
    private final int maxIterations;
    private final BigDecimal epsilon;
    private final int decimalScale;
    private final long maxRangeCells;

    public CalculationSettings(boolean iterative, int maxIterations, BigDecimal epsilon,
                               int decimalScale, long maxRangeCells) {
        if (maxIterations < 1) {
            throw new IllegalArgumentException("maxIterations must be positive");
        }
        if (decimalScale < 0) {
            throw new IllegalArgumentException("decimalScale must not be negative");
        }
        this.iterative = iterative;
        this.maxIterations = maxIterations;
        this.epsilon = epsilon;
        this.decimalScale = decimalScale;
        this.maxRangeCells = maxRangeCells;
    }

    public static CalculationSettings defaults() {
        return new CalculationSettings(false, 100, new BigDecimal("0.001"), 10, 5_000_000L);
    }

    public boolean isIterative() {
        return iterative;
    }

    public int getMaxIterations() {
        return maxIterations;
    }

    public BigDecimal getEpsilon() {
        return epsilon;
    }

    public int getDecimalScale() {
        return decimalScale;
    }

    public long getMaxRangeCells() {
        return maxRangeCells;
    }

    public CalculationSettings withIterative(boolean iterative, int maxIterations, BigDecimal epsilon) {
        return new CalculationSettings(iterative, maxIterations, epsilon, decimalScale, maxRangeCells);
    }

    public CalculationSettings withDecimalScale(int decimalScale) {
        return new CalculationSettings(iterative, maxIterations, epsilon, decimalScale, maxRangeCells);
    }

    public CalculationSettings withMaxRangeCells(long maxRangeCells) {
        return new CalculationSettings(iterative, maxIterations, epsilon, decimalScale, maxRangeCells);
    }

    /**
     * Brings an arithmetic result down to the configured scale. Results that
     * already fit are returned unchanged.
     */
    public BigDecimal round(BigDecimal value) {
        if (value.scale() > decimalScale) {
            return value.setScale(decimalScale, ROUNDING);
        }
        return value;
    }
}
