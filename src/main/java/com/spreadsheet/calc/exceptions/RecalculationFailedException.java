package com.spreadsheet.calc.exceptions;

/**
 * Thrown when a calculation pass has to stop, e.g. a formula nested too
 * deeply or a range too large to read. Levels committed before the failure
 * keep their values; every other affected cell stays dirty and is picked
 * up again by the next pass.
 */
public class RecalculationFailedException extends RuntimeException {
    public RecalculationFailedException(String message) {
        super(message);
    }

    public RecalculationFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
