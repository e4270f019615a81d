package com.spreadsheet.calc.exceptions;

/**
 * Thrown when a workbook ID does not match any open session.
 */
public class WorkbookNotFoundException extends RuntimeException {
    public WorkbookNotFoundException(String message) {
        super(message);
    }
}
