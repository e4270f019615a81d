package com.spreadsheet.calc.exceptions;

/**
 * Thrown when an edit, import or golden case addresses a cell
 * with text that isn't a valid A1 reference (e.g., "A0" or "1A"),
 * or defines a named range with an unusable target.
 */
public class InvalidCellReferenceException extends RuntimeException {
    public InvalidCellReferenceException(String message) {
        super(message);
    }
}
