package com.spreadsheet.calc.exceptions;

import com.spreadsheet.calc.models.ErrorCode;

/**
 * Carries a spreadsheet error value out of a function or coercion, e.g. a
 * division by zero deep inside a financial function. The executor turns it
 * back into an error value at the cell; it never reaches the caller.
 */
public class FormulaErrorException extends RuntimeException {
    private final ErrorCode code;

    public FormulaErrorException(ErrorCode code) {
        this(code, code.getDisplay());
    }

    public FormulaErrorException(ErrorCode code, String message) {
        super(message, null, false, false);
        this.code = code;
    }

    public ErrorCode getCode() {
        return code;
    }
}
