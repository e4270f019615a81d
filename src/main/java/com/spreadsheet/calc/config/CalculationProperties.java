package com.spreadsheet.calc.config;

import com.spreadsheet.calc.models.CalculationSettings;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;

/**
 * Engine defaults under {@code calc.*}. A workbook import may override the
 * iteration and precision settings for its own workbook.
 */
@ConfigurationProperties(prefix = "calc")
public class CalculationProperties {

    /**
     * Resolve cycles by repeated sweeps instead of marking them #CIRCULAR!.
     */
    private boolean iterative = false;
    private int maxIterations = 100;
    private BigDecimal epsilon = new BigDecimal("0.001");
    /**
     * Decimal places kept after division and rounding of arithmetic results.
     */
    private int decimalScale = 10;
    private int maxNestingDepth = 128;
    /**
     * Largest range a function may copy into memory.
     */
    private long maxRangeCells = 5_000_000L;
    private int formulaCacheSize = 20_000;
    /**
     * Worker threads per pass; 1 evaluates every level on the calling thread.
     */
    private int parallelism = 1;
    /**
     * Smallest level size worth handing to the workers.
     */
    private int parallelThreshold = 256;

    public CalculationSettings toSettings() {
        return new CalculationSettings(iterative, maxIterations, epsilon, decimalScale, maxRangeCells);
    }

    public boolean isIterative() {
        return iterative;
    }

    public void setIterative(boolean iterative) {
        this.iterative = iterative;
    }

    public int getMaxIterations() {
        return maxIterations;
    }

    public void setMaxIterations(int maxIterations) {
        this.maxIterations = maxIterations;
    }

    public BigDecimal getEpsilon() {
        return epsilon;
    }

    public void setEpsilon(BigDecimal epsilon) {
        this.epsilon = epsilon;
    }

    public int getDecimalScale() {
        return decimalScale;
    }

    public void setDecimalScale(int decimalScale) {
        this.decimalScale = decimalScale;
    }

    public int getMaxNestingDepth() {
        return maxNestingDepth;
    }

    public void setMaxNestingDepth(int maxNestingDepth) {
        this.maxNestingDepth = maxNestingDepth;
    }

    public long getMaxRangeCells() {
        return maxRangeCells;
    }

    public void setMaxRangeCells(long maxRangeCells) {
        this.maxRangeCells = maxRangeCells;
    }

    public int getFormulaCacheSize() {
        return formulaCacheSize;
    }

    public void setFormulaCacheSize(int formulaCacheSize) {
        this.formulaCacheSize = formulaCacheSize;
    }

    public int getParallelism() {
        return parallelism;
    }

    public void setParallelism(int parallelism) {
        this.parallelism = parallelism;
    }

    public int getParallelThreshold() {
        return parallelThreshold;
    }

    public void setParallelThreshold(int parallelThreshold) {
        this.parallelThreshold = parallelThreshold;
    }
}
