package com.spreadsheet.calc.functions;

public enum EvaluationStrategy {
    /**
     * Arguments are evaluated left to right before the call; the first error
     * becomes the result.
     */
    STRICT,
    /**
     * The function pulls arguments itself, so it can skip branches or
     * intercept errors (IF, IFERROR, ISERROR...).
     */
    LAZY
}
