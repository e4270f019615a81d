package com.spreadsheet.calc.functions;

import com.spreadsheet.calc.exceptions.FormulaErrorException;
import com.spreadsheet.calc.models.CalculationSettings;
import com.spreadsheet.calc.models.CellValue;
import com.spreadsheet.calc.models.ErrorCode;
import com.spreadsheet.calc.models.RangeValues;
import com.spreadsheet.calc.models.ValueType;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import java.util.function.BinaryOperator;

import static com.spreadsheet.calc.functions.FunctionCategory.MATH;
import static com.spreadsheet.calc.functions.FunctionDefinition.VARIADIC;

/**
 * Sums, products, rounding and the elementary functions.
 */
final class MathFunctions {

    private static final BigDecimal TEN = BigDecimal.TEN;

    private MathFunctions() {
    }

    static void register(FunctionRegistry registry) {
        registry.register(FunctionDefinition.strict("SUM", MATH, 1, VARIADIC, args -> {
            BigDecimal[] sum = {BigDecimal.ZERO};
            Aggregates.eachNumber(args, 0, n -> sum[0] = sum[0].add(n));
            return CellValue.number(args.round(sum[0]));
        }, ArgumentKind.RANGE));
        registry.register(FunctionDefinition.strict("SUMIF", MATH, 2, 3, MathFunctions::sumIf,
                ArgumentKind.RANGE, ArgumentKind.SCALAR, ArgumentKind.RANGE));
        registry.register(FunctionDefinition.lazy("SUMIFS", MATH, 3, VARIADIC, MathFunctions::sumIfs));
        registry.register(FunctionDefinition.strict("SUMPRODUCT", MATH, 1, VARIADIC, MathFunctions::sumProduct,
                ArgumentKind.RANGE));
        registry.register(FunctionDefinition.strict("PRODUCT", MATH, 1, VARIADIC, args -> {
            List<BigDecimal> numbers = Aggregates.numbers(args, 0);
            if (numbers.isEmpty()) {
                return CellValue.ZERO;
            }
            BigDecimal product = BigDecimal.ONE;
            for (BigDecimal number : numbers) {
                product = product.multiply(number, DecimalMath.PRECISION);
            }
            return CellValue.number(args.round(product));
        }, ArgumentKind.RANGE));

        registry.register(FunctionDefinition.scalar("ROUND", MATH, 2, 2,
                args -> rounded(args, RoundingMode.HALF_UP)));
        registry.register(FunctionDefinition.scalar("ROUNDUP", MATH, 2, 2,
                args -> rounded(args, RoundingMode.UP)));
        registry.register(FunctionDefinition.scalar("ROUNDDOWN", MATH, 2, 2,
                args -> rounded(args, RoundingMode.DOWN)));
        registry.register(FunctionDefinition.scalar("MROUND", MATH, 2, 2, MathFunctions::mround));
        registry.register(FunctionDefinition.scalar("CEILING", MATH, 1, 2,
                args -> toMultiple(args, RoundingMode.CEILING)));
        registry.register(FunctionDefinition.scalar("FLOOR", MATH, 1, 2,
                args -> toMultiple(args, RoundingMode.FLOOR)));
        registry.register(FunctionDefinition.scalar("INT", MATH, 1, 1,
                args -> CellValue.number(args.number(0).setScale(0, RoundingMode.FLOOR))));
        registry.register(FunctionDefinition.scalar("TRUNC", MATH, 1, 2,
                args -> CellValue.number(DecimalMath.roundTo(args.number(0), args.integer(1, 0), RoundingMode.DOWN))));
        registry.register(FunctionDefinition.scalar("ABS", MATH, 1, 1,
                args -> CellValue.number(args.number(0).abs())));
        registry.register(FunctionDefinition.scalar("SIGN", MATH, 1, 1,
                args -> CellValue.number(args.number(0).signum())));
        registry.register(FunctionDefinition.scalar("SQRT", MATH, 1, 1,
                args -> CellValue.number(DecimalMath.sqrt(args.number(0), args.settings()))));
        registry.register(FunctionDefinition.scalar("POWER", MATH, 2, 2,
                args -> CellValue.number(DecimalMath.power(args.number(0), args.number(1), args.settings()))));
        registry.register(FunctionDefinition.scalar("MOD", MATH, 2, 2, MathFunctions::mod));
        registry.register(FunctionDefinition.scalar("EXP", MATH, 1, 1,
                args -> CellValue.number(DecimalMath.exp(args.number(0), args.settings()))));
        registry.register(FunctionDefinition.scalar("LN", MATH, 1, 1,
                args -> CellValue.number(DecimalMath.ln(args.number(0), args.settings()))));
        registry.register(FunctionDefinition.scalar("LOG", MATH, 1, 2,
                args -> CellValue.number(log(args.number(0), args.number(1, TEN), args.settings()))));
        registry.register(FunctionDefinition.scalar("LOG10", MATH, 1, 1,
                args -> CellValue.number(log(args.number(0), TEN, args.settings()))));
        registry.register(FunctionDefinition.scalar("PI", MATH, 0, 0,
                args -> CellValue.number(args.round(DecimalMath.PI))));
    }

    private static CellValue sumIf(Arguments args) {
        RangeValues range = args.range(0);
        Criteria criteria = Criteria.parse(args.value(1));
        RangeValues target = args.isMissing(2) ? range : args.range(2);
        BigDecimal[] sum = {BigDecimal.ZERO};
        for (int r = 0; r < range.usedRows(); r++) {
            for (int c = 0; c < range.usedColumns(); c++) {
                if (criteria.matches(range.get(r, c)) && r < target.rows() && c < target.columns()) {
                    BigDecimal number = Aggregates.numberAt(target, r, c);
                    if (number != null) {
                        sum[0] = sum[0].add(number);
                    }
                }
            }
        }
        return CellValue.number(args.round(sum[0]));
    }

    private static CellValue sumIfs(Arguments args) {
        RangeValues target = args.range(0);
        List<RangeValues> ranges = new ArrayList<>();
        List<Criteria> criteria = new ArrayList<>();
        Aggregates.criteriaPairs(args, 1, ranges, criteria);
        checkShape(target, ranges.get(0));
        BigDecimal[] sum = {BigDecimal.ZERO};
        Aggregates.scan(ranges, criteria, (r, c) -> {
            BigDecimal number = Aggregates.numberAt(target, r, c);
            if (number != null) {
                sum[0] = sum[0].add(number);
            }
        });
        return CellValue.number(args.round(sum[0]));
    }

    private static CellValue sumProduct(Arguments args) {
        RangeValues first = args.range(0);
        List<RangeValues> arrays = new ArrayList<>();
        for (int i = 0; i < args.size(); i++) {
            RangeValues array = args.range(i);
            checkShape(first, array);
            arrays.add(array);
        }
        int rows = 0;
        int columns = 0;
        for (RangeValues array : arrays) {
            rows = Math.max(rows, array.usedRows());
            columns = Math.max(columns, array.usedColumns());
        }
        BigDecimal sum = BigDecimal.ZERO;
        for (int r = 0; r < rows; r++) {
            for (int c = 0; c < columns; c++) {
                BigDecimal product = BigDecimal.ONE;
                for (RangeValues array : arrays) {
                    CellValue value = ValueCoercion.requireNonError(array.get(r, c));
                    product = value.getType() == ValueType.NUMBER
                            ? product.multiply(((CellValue.NumberValue) value).getValue(), DecimalMath.PRECISION)
                            : BigDecimal.ZERO;
                }
                sum = sum.add(product);
            }
        }
        return CellValue.number(args.round(sum));
    }

    static void checkShape(RangeValues expected, RangeValues actual) {
        if (expected.rows() != actual.rows() || expected.columns() != actual.columns()) {
            throw new FormulaErrorException(ErrorCode.VALUE);
        }
    }

    private static CellValue rounded(Arguments args, RoundingMode mode) {
        return CellValue.number(DecimalMath.roundTo(args.number(0), args.integer(1), mode));
    }

    private static CellValue mround(Arguments args) {
        BigDecimal number = args.number(0);
        BigDecimal multiple = args.number(1);
        if (multiple.signum() == 0) {
            return CellValue.ZERO;
        }
        if (number.signum() * multiple.signum() < 0) {
            throw new FormulaErrorException(ErrorCode.NUM);
        }
        BigDecimal steps = number.divide(multiple, DecimalMath.PRECISION).setScale(0, RoundingMode.HALF_UP);
        return CellValue.number(args.round(steps.multiply(multiple)));
    }

    /**
     * CEILING and FLOOR: a positive number with a negative significance is
     * #NUM!; otherwise the quotient is rounded with {@code mode}.
     */
    private static CellValue toMultiple(Arguments args, RoundingMode mode) {
        BigDecimal number = args.number(0);
        BigDecimal significance = args.number(1, number.signum() < 0 ? BigDecimal.ONE.negate() : BigDecimal.ONE);
        if (significance.signum() == 0) {
            if (mode == RoundingMode.FLOOR && number.signum() != 0) {
                throw new FormulaErrorException(ErrorCode.DIV_ZERO);
            }
            return CellValue.ZERO;
        }
        if (number.signum() > 0 && significance.signum() < 0) {
            throw new FormulaErrorException(ErrorCode.NUM);
        }
        BigDecimal steps = number.divide(significance, DecimalMath.PRECISION).setScale(0, mode);
        return CellValue.number(args.round(steps.multiply(significance)));
    }

    private static CellValue mod(Arguments args) {
        BigDecimal number = args.number(0);
        BigDecimal divisor = args.number(1);
        if (divisor.signum() == 0) {
            throw new FormulaErrorException(ErrorCode.DIV_ZERO);
        }
        BigDecimal quotient = number.divide(divisor, DecimalMath.PRECISION).setScale(0, RoundingMode.FLOOR);
        return CellValue.number(args.round(number.subtract(divisor.multiply(quotient))));
    }

    private static BigDecimal log(BigDecimal number, BigDecimal base, CalculationSettings settings) {
        if (number.signum() <= 0 || base.signum() <= 0) {
            throw new FormulaErrorException(ErrorCode.NUM);
        }
        if (base.compareTo(BigDecimal.ONE) == 0) {
            throw new FormulaErrorException(ErrorCode.DIV_ZERO);
        }
        double value = base.compareTo(TEN) == 0
                ? StrictMath.log10(number.doubleValue())
                : StrictMath.log(number.doubleValue()) / StrictMath.log(base.doubleValue());
        return DecimalMath.fromDouble(value, settings);
    }

    static BigDecimal fold(List<BigDecimal> numbers, BinaryOperator<BigDecimal> operator) {
        BigDecimal result = numbers.get(0);
        for (int i = 1; i < numbers.size(); i++) {
            result = operator.apply(result, numbers.get(i));
        }
        return result;
    }
}
