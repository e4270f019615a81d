package com.spreadsheet.calc.functions;

/**
 * Formula classes, used to group functions in the registry and to
 * categorize golden-case failures.
 */
public enum FunctionCategory {
    LOGICAL,
    INFORMATION,
    MATH,
    STATISTICAL,
    LOOKUP,
    TEXT,
    FINANCIAL,
    DATE
}
