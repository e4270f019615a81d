package com.spreadsheet.calc.exceptions;

/**
 * Thrown when a formula reads a range whose used extent holds more cells
 * than the workbook allows. This aborts the current recalculation pass.
 */
public class RangeTooLargeException extends RuntimeException {
    public RangeTooLargeException(String message) {
        super(message);
    }
}
