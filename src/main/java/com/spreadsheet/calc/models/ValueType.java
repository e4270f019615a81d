package com.spreadsheet.calc.models;

/**
 * The variants of {@link CellValue}.
 */
public enum ValueType {
    BLANK,
    NUMBER,
    TEXT,
    BOOLEAN,
    ERROR
}
