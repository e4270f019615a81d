package com.spreadsheet.calc.exceptions;

/**
 * Thrown when a formula nests deeper than the parser allows
 * (e.g., thousands of nested parentheses). Unlike ordinary syntax errors,
 * this aborts the recalculation pass that submitted the formula.
 */
public class FormulaTooComplexException extends RuntimeException {
    public FormulaTooComplexException(String message) {
        super(message);
    }
}
