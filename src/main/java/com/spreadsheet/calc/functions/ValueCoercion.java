package com.spreadsheet.calc.functions;

import com.spreadsheet.calc.exceptions.FormulaErrorException;
import com.spreadsheet.calc.models.CellValue;
import com.spreadsheet.calc.models.ErrorCode;
import com.spreadsheet.calc.models.ValueType;
import com.spreadsheet.calc.services.SheetManager;

import java.math.BigDecimal;

/**
 * Spreadsheet type coercion. Every method throws
 * {@link FormulaErrorException} when handed an error value or a value that
 * cannot be converted.
 */
public final class ValueCoercion {

    private ValueCoercion() {
    }

    /**
     * Blank is 0, booleans are 1/0, numeric text is parsed, other text is #VALUE!.
     */
    public static BigDecimal toNumber(CellValue value) {
        switch (value.getType()) {
            case BLANK:
                return BigDecimal.ZERO;
            case NUMBER:
                return ((CellValue.NumberValue) value).getValue();
            case BOOLEAN:
                return ((CellValue.BoolValue) value).getValue() ? BigDecimal.ONE : BigDecimal.ZERO;
            case TEXT: {
                BigDecimal parsed = SheetManager.parseNumber(((CellValue.TextValue) value).getValue());
                if (parsed == null) {
                    throw new FormulaErrorException(ErrorCode.VALUE);
                }
                return parsed;
            }
            default:
                throw new FormulaErrorException(((CellValue.ErrorValue) value).getCode());
        }
    }

    /**
     * Blank is "", numbers print without trailing zeros, booleans as TRUE/FALSE.
     */
    public static String toText(CellValue value) {
        switch (value.getType()) {
            case BLANK:
                return "";
            case NUMBER:
                return formatNumber(((CellValue.NumberValue) value).getValue());
            case BOOLEAN:
                return ((CellValue.BoolValue) value).getValue() ? "TRUE" : "FALSE";
            case TEXT:
                return ((CellValue.TextValue) value).getValue();
            default:
                throw new FormulaErrorException(((CellValue.ErrorValue) value).getCode());
        }
    }

    /**
     * Blank is FALSE, numbers are TRUE unless zero, text must read TRUE or FALSE.
     */
    public static boolean toBoolean(CellValue value) {
        switch (value.getType()) {
            case BLANK:
                return false;
            case NUMBER:
                return ((CellValue.NumberValue) value).getValue().signum() != 0;
            case BOOLEAN:
                return ((CellValue.BoolValue) value).getValue();
            case TEXT: {
                String text = ((CellValue.TextValue) value).getValue().trim();
                if (text.equalsIgnoreCase("TRUE")) return true;
                if (text.equalsIgnoreCase("FALSE")) return false;
                throw new FormulaErrorException(ErrorCode.VALUE);
            }
            default:
                throw new FormulaErrorException(((CellValue.ErrorValue) value).getCode());
        }
    }

    public static String formatNumber(BigDecimal number) {
        if (number.signum() == 0) {
            return "0";
        }
        return number.stripTrailingZeros().toPlainString();
    }

    /**
     * Orders two non-error values the way comparison operators do: numbers
     * before text before booleans, text compared without case. A blank takes
     * the empty value of the other side's type.
     */
    public static int compare(CellValue left, CellValue right) {
        if (left.isError()) {
            throw new FormulaErrorException(((CellValue.ErrorValue) left).getCode());
        }
        if (right.isError()) {
            throw new FormulaErrorException(((CellValue.ErrorValue) right).getCode());
        }
        CellValue a = left.isBlank() ? emptyOf(right.getType()) : left;
        CellValue b = right.isBlank() ? emptyOf(left.getType()) : right;
        int rankA = rank(a.getType());
        int rankB = rank(b.getType());
        if (rankA != rankB) {
            return Integer.compare(rankA, rankB);
        }
        switch (a.getType()) {
            case NUMBER:
                return ((CellValue.NumberValue) a).getValue().compareTo(((CellValue.NumberValue) b).getValue());
            case TEXT:
                return ((CellValue.TextValue) a).getValue().compareToIgnoreCase(((CellValue.TextValue) b).getValue());
            case BOOLEAN:
                return Boolean.compare(((CellValue.BoolValue) a).getValue(), ((CellValue.BoolValue) b).getValue());
            default:
                return 0;
        }
    }

    public static boolean looseEquals(CellValue left, CellValue right) {
        if (left.isError() || right.isError()) {
            return left.equals(right);
        }
        return compare(left, right) == 0;
    }

    /**
     * Rethrows the error carried by a value, if any.
     */
    public static CellValue requireNonError(CellValue value) {
        if (value.isError()) {
            throw new FormulaErrorException(((CellValue.ErrorValue) value).getCode());
        }
        return value;
    }

    private static CellValue emptyOf(ValueType type) {
        switch (type) {
            case TEXT:
                return CellValue.text("");
            case BOOLEAN:
                return CellValue.FALSE;
            default:
                return CellValue.ZERO;
        }
    }

    private static int rank(ValueType type) {
        switch (type) {
            case TEXT:
                return 1;
            case BOOLEAN:
                return 2;
            default:
                return 0;
        }
    }
}
