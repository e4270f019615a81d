package com.spreadsheet.calc.validation;

import java.math.BigDecimal;

/**
 * One expected value, as exported from the reference spreadsheet:
 * { "sheet": "Loan", "cell": "B7", "expectedValue": -536.82, "tolerance": 0.01,
 *   "category": "FINANCIAL" }
 * The expected value is a number, string, boolean, error text such as
 * "#N/A", or null for a blank. Tolerance and category are optional.
 */
public class GoldenCase {
    private String sheet;
    private String cell;
    private Object expectedValue;
    private BigDecimal tolerance;
    private String category;

    // Default constructor needed for JSON (de)serialization
    public GoldenCase() {
    }

    public GoldenCase(String sheet, String cell, Object expectedValue) {
        this.sheet = sheet;
        this.cell = cell;
        this.expectedValue = expectedValue;
    }

    public String getSheet() {
        return sheet;
    }

    public void setSheet(String sheet) {
        this.sheet = sheet;
    }

    public String getCell() {
        return cell;
    }

    public void setCell(String cell) {
        this.cell = cell;
    }

    public Object getExpectedValue() {
        return expectedValue;
    }

    public void setExpectedValue(Object expectedValue) {
        this.expectedValue = expectedValue;
    }

    public BigDecimal getTolerance() {
        return tolerance;
    }

    public void setTolerance(BigDecimal tolerance) {
        this.tolerance = tolerance;
    }

    public String getCategory() {
        return category;
    }

    public void setCategory(String category) {
        this.category = category;
    }

    @Override
    public String toString() {
        return sheet + "!" + cell + " = " + expectedValue;
    }
}
