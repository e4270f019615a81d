package com.spreadsheet.calc.functions;

import com.spreadsheet.calc.exceptions.FormulaErrorException;
import com.spreadsheet.calc.models.CalculationSettings;
import com.spreadsheet.calc.models.ErrorCode;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;

/**
 * Decimal arithmetic helpers. Operations with no exact decimal form
 * (fractional powers, {@code LN}, {@code EXP} and the functions built on
 * them) are the one place values pass through {@code double}: they go
 * through {@link StrictMath}, whose results are identical on every JVM, and
 * are then rounded to the workbook scale. Their precision is therefore that
 * of a double (about 15 significant digits) rather than {@link #PRECISION}.
 */
public final class DecimalMath {

    public static final MathContext PRECISION = MathContext.DECIMAL128;

    public static final BigDecimal PI = new BigDecimal("3.141592653589793238462643383279503");

    private static final int MAX_INTEGER_EXPONENT = 9_999;

    private DecimalMath() {
    }

    public static BigDecimal divide(BigDecimal dividend, BigDecimal divisor, CalculationSettings settings) {
        if (divisor.signum() == 0) {
            throw new FormulaErrorException(ErrorCode.DIV_ZERO);
        }
        return dividend.divide(divisor, settings.getDecimalScale(), CalculationSettings.ROUNDING);
    }

    public static BigDecimal power(BigDecimal base, BigDecimal exponent, CalculationSettings settings) {
        if (base.signum() == 0) {
            if (exponent.signum() == 0) {
                throw new FormulaErrorException(ErrorCode.NUM);
            }
            if (exponent.signum() < 0) {
                throw new FormulaErrorException(ErrorCode.DIV_ZERO);
            }
            return BigDecimal.ZERO;
        }
        if (isInteger(exponent) && exponent.abs().compareTo(BigDecimal.valueOf(MAX_INTEGER_EXPONENT)) <= 0) {
            return settings.round(integerPower(base, exponent.intValueExact()));
        }
        if (base.signum() < 0) {
            throw new FormulaErrorException(ErrorCode.NUM);
        }
        return fromDouble(StrictMath.pow(base.doubleValue(), exponent.doubleValue()), settings);
    }

    /**
     * base^n at 34 significant digits, before any scale rounding.
     */
    public static BigDecimal integerPower(BigDecimal base, int n) {
        if (n >= 0) {
            return base.pow(n, PRECISION);
        }
        return BigDecimal.ONE.divide(base.pow(-n, PRECISION), PRECISION);
    }

    public static BigDecimal sqrt(BigDecimal value, CalculationSettings settings) {
        if (value.signum() < 0) {
            throw new FormulaErrorException(ErrorCode.NUM);
        }
        return settings.round(value.sqrt(PRECISION));
    }

    public static BigDecimal ln(BigDecimal value, CalculationSettings settings) {
        if (value.signum() <= 0) {
            throw new FormulaErrorException(ErrorCode.NUM);
        }
        return fromDouble(StrictMath.log(value.doubleValue()), settings);
    }

    public static BigDecimal exp(BigDecimal value, CalculationSettings settings) {
        return fromDouble(StrictMath.exp(value.doubleValue()), settings);
    }

    public static BigDecimal fromDouble(double value, CalculationSettings settings) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            throw new FormulaErrorException(ErrorCode.NUM);
        }
        return settings.round(BigDecimal.valueOf(value));
    }

    /**
     * Rounds to {@code digits} decimal places (negative digits round to tens,
     * hundreds...) with the given mode; HALF_UP is half away from zero.
     */
    public static BigDecimal roundTo(BigDecimal value, int digits, RoundingMode mode) {
        BigDecimal rounded = value.setScale(digits, mode);
        return digits < 0 ? rounded.setScale(0, RoundingMode.UNNECESSARY) : rounded;
    }

    public static boolean isInteger(BigDecimal value) {
        return value.signum() == 0 || value.scale() <= 0 || value.stripTrailingZeros().scale() <= 0;
    }

    /**
     * Truncates toward zero to an int, as functions do with counts and indexes.
     */
    public static int toInt(BigDecimal value) {
        BigDecimal truncated = value.setScale(0, RoundingMode.DOWN);
        if (truncated.compareTo(BigDecimal.valueOf(Integer.MAX_VALUE)) > 0
                || truncated.compareTo(BigDecimal.valueOf(Integer.MIN_VALUE)) < 0) {
            throw new FormulaErrorException(ErrorCode.NUM);
        }
        return truncated.intValue();
    }
}
