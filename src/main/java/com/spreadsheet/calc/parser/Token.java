package com.spreadsheet.calc.parser;

final class Token {
    final TokenType type;
    final String text;
    final int position;
    final boolean spaceBefore;

    Token(TokenType type, String text, int position, boolean spaceBefore) {
        this.type = type;
        this.text = text;
        this.position = position;
        this.spaceBefore = spaceBefore;
    }

    boolean is(TokenType type, String text) {
        return this.type == type && this.text.equals(text);
    }

    boolean startsReference() {
        return type == TokenType.CELL || type == TokenType.COLUMN_RANGE
                || type == TokenType.ROW_RANGE || type == TokenType.SHEET || type == TokenType.NAME;
    }

    @Override
    public String toString() {
        return type + "(" + text + ")@" + position;
    }
}
