package com.spreadsheet.calc.parser;

/**
 * Raised inside the parser for malformed formula text. It never leaves
 * {@link FormulaParser#parse(String)}: the formula is kept with a parse-error
 * marker instead.
 */
class FormulaSyntaxException extends RuntimeException {
    FormulaSyntaxException(String message, int position) {
        super(message + " at position " + position);
    }
}
