package com.spreadsheet.calc.parser;

public enum UnaryOperator {
    NEGATE,
    PLUS,
    PERCENT
}
