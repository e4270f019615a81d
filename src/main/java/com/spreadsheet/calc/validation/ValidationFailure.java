package com.spreadsheet.calc.validation;

import com.spreadsheet.calc.models.CellValue;

/**
 * A golden case whose computed value did not match.
 */
public class ValidationFailure {
    private final String cell;
    private final String formula;
    private final CellValue expected;
    private final CellValue actual;
    private final FormulaCategory category;
    private final String message;

    public ValidationFailure(String cell, String formula, CellValue expected, CellValue actual,
                             FormulaCategory category, String message) {
        this.cell = cell;
        this.formula = formula;
        this.expected = expected;
        this.actual = actual;
        this.category = category;
        this.message = message;
    }

    public String getCell() {
        return cell;
    }

    /**
     * The cell's formula text, or null for a literal cell.
     */
    public String getFormula() {
        return formula;
    }

    public CellValue getExpected() {
        return expected;
    }

    public CellValue getActual() {
        return actual;
    }

    public FormulaCategory getCategory() {
        return category;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public String toString() {
        return cell + " [" + category + "] " + message;
    }
}
