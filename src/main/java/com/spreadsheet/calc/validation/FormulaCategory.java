package com.spreadsheet.calc.validation;

/**
 * Buckets for golden-case results. Function categories come from the
 * registry; ARITHMETIC covers formulas without a function at the top and
 * LITERAL covers plain values.
 */
public enum FormulaCategory {
    LOGICAL,
    LOOKUP,
    FINANCIAL,
    TEXT,
    MATH,
    STATISTICAL,
    INFORMATION,
    DATE,
    ARITHMETIC,
    LITERAL
}
