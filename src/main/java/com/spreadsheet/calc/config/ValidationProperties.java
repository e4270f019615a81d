package com.spreadsheet.calc.config;

import com.spreadsheet.calc.validation.FormulaCategory;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;
import java.util.EnumMap;
import java.util.Map;

/**
 * Golden-case tolerances under {@code calc.validation.*}.
 */
@ConfigurationProperties(prefix = "calc.validation")
public class ValidationProperties {

    /**
     * Allowed absolute difference for numeric results without a more
     * specific tolerance.
     */
    private BigDecimal numericTolerance = new BigDecimal("0.000001");

    /**
     * Per-category overrides, e.g. FINANCIAL=0.01.
     */
    private Map<FormulaCategory, BigDecimal> categoryTolerances = new EnumMap<>(FormulaCategory.class);

    public BigDecimal getNumericTolerance() {
        return numericTolerance;
    }

    public void setNumericTolerance(BigDecimal numericTolerance) {
        this.numericTolerance = numericTolerance;
    }

    public Map<FormulaCategory, BigDecimal> getCategoryTolerances() {
        return categoryTolerances;
    }

    public void setCategoryTolerances(Map<FormulaCategory, BigDecimal> categoryTolerances) {
        this.categoryTolerances = categoryTolerances;
    }
}
