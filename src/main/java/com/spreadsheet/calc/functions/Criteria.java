package com.spreadsheet.calc.functions;

import com.spreadsheet.calc.models.CellValue;
import com.spreadsheet.calc.models.ValueType;
import com.spreadsheet.calc.services.SheetManager;

import java.math.BigDecimal;
import java.util.regex.Pattern;

/**
 * A COUNTIF-style condition such as {@code ">=10"}, {@code "<>done"} or
 * {@code "inv*"}. Text comparisons ignore case; {@code *} and {@code ?} are
 * wildcards for = and <>, and {@code ~} escapes them.
 */
final class Criteria {

    private enum Operator { EQ, NE, LT, LE, GT, GE }

    private final Operator operator;
    private final CellValue operand;
    private final Pattern pattern;

    private Criteria(Operator operator, CellValue operand) {
        this.operator = operator;
        this.operand = operand;
        if (operand.getType() == ValueType.TEXT && (operator == Operator.EQ || operator == Operator.NE)) {
            this.pattern = wildcardPattern(((CellValue.TextValue) operand).getValue());
        } else {
            this.pattern = null;
        }
    }

    static Criteria parse(CellValue criterion) {
        ValueCoercion.requireNonError(criterion);
        if (criterion.getType() != ValueType.TEXT) {
            return new Criteria(Operator.EQ, criterion.isBlank() ? CellValue.text("") : criterion);
        }
        String text = ((CellValue.TextValue) criterion).getValue();
        Operator operator = Operator.EQ;
        String rest = text;
        if (text.startsWith(">=")) {
            operator = Operator.GE;
            rest = text.substring(2);
        } else if (text.startsWith("<=")) {
            operator = Operator.LE;
            rest = text.substring(2);
        } else if (text.startsWith("<>")) {
            operator = Operator.NE;
            rest = text.substring(2);
        } else if (text.startsWith(">")) {
            operator = Operator.GT;
            rest = text.substring(1);
        } else if (text.startsWith("<")) {
            operator = Operator.LT;
            rest = text.substring(1);
        } else if (text.startsWith("=")) {
            rest = text.substring(1);
        }
        return new Criteria(operator, operandOf(rest));
    }

    boolean matches(CellValue value) {
        if (value.isError()) {
            return operand.isError() && operator == Operator.EQ && operand.equals(value);
        }
        switch (operator) {
            case EQ:
                return equalsOperand(value);
            case NE:
                return !equalsOperand(value);
            default:
                return ordered(value);
        }
    }

    private boolean equalsOperand(CellValue value) {
        switch (operand.getType()) {
            case NUMBER: {
                BigDecimal number = numberOf(value);
                return number != null && number.compareTo(((CellValue.NumberValue) operand).getValue()) == 0;
            }
            case BOOLEAN:
                return operand.equals(value);
            case TEXT: {
                if (value.isBlank()) {
                    return ((CellValue.TextValue) operand).getValue().isEmpty();
                }
                return value.getType() == ValueType.TEXT
                        && pattern.matcher(((CellValue.TextValue) value).getValue()).matches();
            }
            default:
                return false;
        }
    }

    private boolean ordered(CellValue value) {
        int comparison;
        if (operand.getType() == ValueType.NUMBER) {
            if (value.getType() != ValueType.NUMBER) {
                return false;
            }
            comparison = ((CellValue.NumberValue) value).getValue().compareTo(((CellValue.NumberValue) operand).getValue());
        } else if (operand.getType() == ValueType.TEXT) {
            if (value.getType() != ValueType.TEXT) {
                return false;
            }
            comparison = ((CellValue.TextValue) value).getValue()
                    .compareToIgnoreCase(((CellValue.TextValue) operand).getValue());
        } else {
            return false;
        }
        switch (operator) {
            case LT:
                return comparison < 0;
            case LE:
                return comparison <= 0;
            case GT:
                return comparison > 0;
            default:
                return comparison >= 0;
        }
    }

    private static BigDecimal numberOf(CellValue value) {
        if (value.getType() == ValueType.NUMBER) {
            return ((CellValue.NumberValue) value).getValue();
        }
        if (value.getType() == ValueType.TEXT) {
            return SheetManager.parseNumber(((CellValue.TextValue) value).getValue());
        }
        return null;
    }

    private static CellValue operandOf(String text) {
        if (text.isEmpty()) {
            return CellValue.text("");
        }
        CellValue literal = SheetManager.parseLiteral(text);
        return literal.isBlank() ? CellValue.text(text) : literal;
    }

    static Pattern wildcardPattern(String text) {
        StringBuilder regex = new StringBuilder();
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '~' && i + 1 < text.length()) {
                regex.append(Pattern.quote(String.valueOf(text.charAt(++i))));
            } else if (c == '*') {
                regex.append(".*");
            } else if (c == '?') {
                regex.append('.');
            } else {
                regex.append(Pattern.quote(String.valueOf(c)));
            }
        }
        return Pattern.compile(regex.toString(), Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE | Pattern.DOTALL);
    }
}
