package com.spreadsheet.calc.functions;

/**
 * How a function consumes an argument position.
 */
public enum ArgumentKind {
    /** A single value; references are dereferenced and errors short-circuit the call. */
    SCALAR,
    /** A whole range, read lazily; a computed value arrives as a 1x1 range. */
    RANGE
}
