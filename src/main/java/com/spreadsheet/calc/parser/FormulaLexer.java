package com.spreadsheet.calc.parser;

import com.spreadsheet.calc.models.ErrorCode;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Splits formula text (without the leading '=') into tokens.
 */
class FormulaLexer {

    private static final Pattern CELL = Pattern.compile("\\$?[A-Za-z]{1,3}\\$?[0-9]{1,7}");
    private static final Pattern COLUMN = Pattern.compile("\\$?[A-Za-z]{1,3}");

    private final String text;
    private int pos;

    FormulaLexer(String text) {
        this.text = text;
    }

    List<Token> tokenize() {
        List<Token> tokens = new ArrayList<>();
        while (true) {
            boolean space = skipWhitespace();
            if (pos >= text.length()) {
                tokens.add(new Token(TokenType.END, "", pos, space));
                return tokens;
            }
            tokens.add(next(space));
        }
    }

    private boolean skipWhitespace() {
        boolean skipped = false;
        while (pos < text.length() && Character.isWhitespace(text.charAt(pos))) {
            pos++;
            skipped = true;
        }
        return skipped;
    }

    private Token next(boolean space) {
        int start = pos;
        char c = text.charAt(pos);

        if (Character.isDigit(c) || (c == '.' && pos + 1 < text.length() && Character.isDigit(text.charAt(pos + 1)))) {
            Token rowRange = tryRowRange(space);
            if (rowRange != null) {
                return rowRange;
            }
            return number(space);
        }
        if (c == '"') {
            return string(space);
        }
        if (c == '\'') {
            return quotedSheet(space);
        }
        if (c == '#') {
            return errorLiteral(space);
        }
        if (Character.isLetter(c) || c == '_' || c == '$' || c == '\\') {
            return word(space);
        }

        pos++;
        switch (c) {
            case '+':
            case '-':
            case '*':
            case '/':
            case '^':
            case '&':
            case '%':
            case '=':
                return new Token(TokenType.OPERATOR, String.valueOf(c), start, space);
            case '<':
                if (pos < text.length() && (text.charAt(pos) == '=' || text.charAt(pos) == '>')) {
                    pos++;
                    return new Token(TokenType.OPERATOR, text.substring(start, pos), start, space);
                }
                return new Token(TokenType.OPERATOR, "<", start, space);
            case '>':
                if (pos < text.length() && text.charAt(pos) == '=') {
                    pos++;
                    return new Token(TokenType.OPERATOR, ">=", start, space);
                }
                return new Token(TokenType.OPERATOR, ">", start, space);
            case '(':
                return new Token(TokenType.LPAREN, "(", start, space);
            case ')':
                return new Token(TokenType.RPAREN, ")", start, space);
            case ',':
            case ';':
                return new Token(TokenType.SEPARATOR, ",", start, space);
            case ':':
                return new Token(TokenType.COLON, ":", start, space);
            case '{':
                throw new FormulaSyntaxException("Array constants are not supported", start);
            default:
                throw new FormulaSyntaxException("Unexpected character '" + c + "'", start);
        }
    }

    private Token tryRowRange(boolean space) {
        int i = pos;
        while (i < text.length() && Character.isDigit(text.charAt(i))) i++;
        if (i >= text.length() || text.charAt(i) != ':') {
            return null;
        }
        int j = i + 1;
        if (j < text.length() && text.charAt(j) == '$') j++;
        int digitsStart = j;
        while (j < text.length() && Character.isDigit(text.charAt(j))) j++;
        if (j == digitsStart) {
            return null;
        }
        Token token = new Token(TokenType.ROW_RANGE, text.substring(pos, j), pos, space);
        pos = j;
        return token;
    }

    private Token number(boolean space) {
        int start = pos;
        while (pos < text.length() && Character.isDigit(text.charAt(pos))) pos++;
        if (pos < text.length() && text.charAt(pos) == '.') {
            pos++;
            while (pos < text.length() && Character.isDigit(text.charAt(pos))) pos++;
        }
        if (pos < text.length() && (text.charAt(pos) == 'e' || text.charAt(pos) == 'E')) {
            int mark = pos;
            pos++;
            if (pos < text.length() && (text.charAt(pos) == '+' || text.charAt(pos) == '-')) pos++;
            int digits = pos;
            while (pos < text.length() && Character.isDigit(text.charAt(pos))) pos++;
            if (digits == pos) {
                pos = mark;
            }
        }
        return new Token(TokenType.NUMBER, text.substring(start, pos), start, space);
    }

    private Token string(boolean space) {
        int start = pos;
        pos++;
        StringBuilder sb = new StringBuilder();
        while (pos < text.length()) {
            char c = text.charAt(pos++);
            if (c == '"') {
                if (pos < text.length() && text.charAt(pos) == '"') {
                    sb.append('"');
                    pos++;
                } else {
                    return new Token(TokenType.STRING, sb.toString(), start, space);
                }
            } else {
                sb.append(c);
            }
        }
        throw new FormulaSyntaxException("Unterminated string", start);
    }

    private Token quotedSheet(boolean space) {
        int start = pos;
        pos++;
        StringBuilder sb = new StringBuilder();
        while (pos < text.length()) {
            char c = text.charAt(pos++);
            if (c == '\'') {
                if (pos < text.length() && text.charAt(pos) == '\'') {
                    sb.append('\'');
                    pos++;
                } else if (pos < text.length() && text.charAt(pos) == '!') {
                    pos++;
                    return new Token(TokenType.SHEET, sb.toString(), start, space);
                } else {
                    throw new FormulaSyntaxException("Quoted sheet name must be followed by '!'", start);
                }
            } else {
                sb.append(c);
            }
        }
        throw new FormulaSyntaxException("Unterminated sheet name", start);
    }

    private Token errorLiteral(boolean space) {
        int start = pos;
        ErrorCode best = null;
        for (ErrorCode code : ErrorCode.values()) {
            String display = code.getDisplay();
            if (text.regionMatches(true, pos, display, 0, display.length())
                    && (best == null || display.length() > best.getDisplay().length())) {
                best = code;
            }
        }
        if (best == null) {
            throw new FormulaSyntaxException("Unknown error literal", start);
        }
        pos += best.getDisplay().length();
        return new Token(TokenType.ERROR, best.name(), start, space);
    }

    private Token word(boolean space) {
        int start = pos;
        while (pos < text.length()) {
            char c = text.charAt(pos);
            if (Character.isLetterOrDigit(c) || c == '_' || c == '.' || c == '$' || c == '\\') {
                pos++;
            } else {
                break;
            }
        }
        String word = text.substring(start, pos);

        if (pos < text.length() && text.charAt(pos) == '!') {
            pos++;
            return new Token(TokenType.SHEET, word, start, space);
        }
        if (pos < text.length() && text.charAt(pos) == '(') {
            return new Token(TokenType.FUNCTION, word.toUpperCase(), start, space);
        }
        if (CELL.matcher(word).matches()) {
            return new Token(TokenType.CELL, word.toUpperCase(), start, space);
        }
        if (COLUMN.matcher(word).matches() && pos < text.length() && text.charAt(pos) == ':') {
            int save = pos;
            pos++;
            int second = pos;
            while (pos < text.length() && (Character.isLetter(text.charAt(pos)) || text.charAt(pos) == '$')) pos++;
            String other = text.substring(second, pos);
            if (COLUMN.matcher(other).matches()
                    && (pos >= text.length() || !Character.isLetterOrDigit(text.charAt(pos)))) {
                return new Token(TokenType.COLUMN_RANGE, (word + ":" + other).toUpperCase(), start, space);
            }
            pos = save;
        }
        if (word.equalsIgnoreCase("TRUE") || word.equalsIgnoreCase("FALSE")) {
            return new Token(TokenType.BOOLEAN, word.toUpperCase(), start, space);
        }
        if (word.indexOf('$') >= 0) {
            throw new FormulaSyntaxException("Invalid reference '" + word + "'", start);
        }
        return new Token(TokenType.NAME, word, start, space);
    }
}
