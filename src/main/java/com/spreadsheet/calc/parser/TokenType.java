package com.spreadsheet.calc.parser;

enum TokenType {
    NUMBER,
    STRING,
    BOOLEAN,
    ERROR,
    CELL,
    COLUMN_RANGE,
    ROW_RANGE,
    SHEET,
    FUNCTION,
    NAME,
    OPERATOR,
    LPAREN,
    RPAREN,
    SEPARATOR,
    COLON,
    END
}
