package com.spreadsheet.calc.functions;

import com.spreadsheet.calc.exceptions.FormulaErrorException;
import com.spreadsheet.calc.models.CellValue;
import com.spreadsheet.calc.models.ErrorCode;
import com.spreadsheet.calc.models.RangeValues;
import com.spreadsheet.calc.models.ValueType;
import com.spreadsheet.calc.services.SheetManager;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static com.spreadsheet.calc.functions.FunctionCategory.STATISTICAL;
import static com.spreadsheet.calc.functions.FunctionDefinition.VARIADIC;

/**
 * Counting, averaging and order statistics, including the conditional
 * *IF/*IFS variants.
 */
final class StatisticalFunctions {

    private StatisticalFunctions() {
    }

    static void register(FunctionRegistry registry) {
        registry.register(FunctionDefinition.strict("MAX", STATISTICAL, 1, VARIADIC, args -> {
            List<BigDecimal> numbers = Aggregates.numbers(args, 0);
            return numbers.isEmpty() ? CellValue.ZERO : CellValue.number(MathFunctions.fold(numbers, BigDecimal::max));
        }, ArgumentKind.RANGE));
        registry.register(FunctionDefinition.strict("MIN", STATISTICAL, 1, VARIADIC, args -> {
            List<BigDecimal> numbers = Aggregates.numbers(args, 0);
            return numbers.isEmpty() ? CellValue.ZERO : CellValue.number(MathFunctions.fold(numbers, BigDecimal::min));
        }, ArgumentKind.RANGE));
        registry.register(FunctionDefinition.strict("AVERAGE", STATISTICAL, 1, VARIADIC, args -> {
            BigDecimal[] sum = {BigDecimal.ZERO};
            int[] count = {0};
            Aggregates.eachNumber(args, 0, n -> {
                sum[0] = sum[0].add(n);
                count[0]++;
            });
            return CellValue.number(DecimalMath.divide(sum[0], BigDecimal.valueOf(count[0]), args.settings()));
        }, ArgumentKind.RANGE));
        registry.register(FunctionDefinition.strict("AVERAGEIF", STATISTICAL, 2, 3, StatisticalFunctions::averageIf,
                ArgumentKind.RANGE, ArgumentKind.SCALAR, ArgumentKind.RANGE));
        registry.register(FunctionDefinition.lazy("AVERAGEIFS", STATISTICAL, 3, VARIADIC, args -> {
            List<BigDecimal> matched = matchingNumbers(args);
            BigDecimal sum = BigDecimal.ZERO;
            for (BigDecimal number : matched) {
                sum = sum.add(number);
            }
            return CellValue.number(DecimalMath.divide(sum, BigDecimal.valueOf(matched.size()), args.settings()));
        }));
        registry.register(FunctionDefinition.lazy("COUNT", STATISTICAL, 1, VARIADIC,
                args -> CellValue.number(count(args, false))));
        registry.register(FunctionDefinition.lazy("COUNTA", STATISTICAL, 1, VARIADIC,
                args -> CellValue.number(count(args, true))));
        registry.register(FunctionDefinition.strict("COUNTBLANK", STATISTICAL, 1, 1,
                StatisticalFunctions::countBlank, ArgumentKind.RANGE));
        registry.register(FunctionDefinition.strict("COUNTIF", STATISTICAL, 2, 2, args -> {
            long matched = Aggregates.scan(Collections.singletonList(args.range(0)),
                    Collections.singletonList(Criteria.parse(args.value(1))), (r, c) -> { });
            return CellValue.number(matched);
        }, ArgumentKind.RANGE, ArgumentKind.SCALAR));
        registry.register(FunctionDefinition.lazy("COUNTIFS", STATISTICAL, 2, VARIADIC, args -> {
            List<RangeValues> ranges = new ArrayList<>();
            List<Criteria> criteria = new ArrayList<>();
            Aggregates.criteriaPairs(args, 0, ranges, criteria);
            return CellValue.number(Aggregates.scan(ranges, criteria, (r, c) -> { }));
        }));
        registry.register(FunctionDefinition.lazy("MAXIFS", STATISTICAL, 3, VARIADIC, args -> {
            List<BigDecimal> matched = matchingNumbers(args);
            return matched.isEmpty() ? CellValue.ZERO : CellValue.number(MathFunctions.fold(matched, BigDecimal::max));
        }));
        registry.register(FunctionDefinition.lazy("MINIFS", STATISTICAL, 3, VARIADIC, args -> {
            List<BigDecimal> matched = matchingNumbers(args);
            return matched.isEmpty() ? CellValue.ZERO : CellValue.number(MathFunctions.fold(matched, BigDecimal::min));
        }));
        registry.register(FunctionDefinition.strict("MEDIAN", STATISTICAL, 1, VARIADIC,
                StatisticalFunctions::median, ArgumentKind.RANGE));
        registry.register(FunctionDefinition.strict("LARGE", STATISTICAL, 2, 2,
                args -> kth(args, true), ArgumentKind.RANGE, ArgumentKind.SCALAR));
        registry.register(FunctionDefinition.strict("SMALL", STATISTICAL, 2, 2,
                args -> kth(args, false), ArgumentKind.RANGE, ArgumentKind.SCALAR));
        registry.register(FunctionDefinition.strict("VAR", STATISTICAL, 1, VARIADIC,
                args -> CellValue.number(args.round(variance(args))), ArgumentKind.RANGE));
        registry.register(FunctionDefinition.strict("STDEV", STATISTICAL, 1, VARIADIC,
                args -> CellValue.number(DecimalMath.sqrt(variance(args), args.settings())), ArgumentKind.RANGE));
    }

    private static CellValue averageIf(Arguments args) {
        RangeValues range = args.range(0);
        Criteria criteria = Criteria.parse(args.value(1));
        RangeValues target = args.isMissing(2) ? range : args.range(2);
        BigDecimal sum = BigDecimal.ZERO;
        int count = 0;
        for (int r = 0; r < range.usedRows(); r++) {
            for (int c = 0; c < range.usedColumns(); c++) {
                if (criteria.matches(range.get(r, c)) && r < target.rows() && c < target.columns()) {
                    BigDecimal number = Aggregates.numberAt(target, r, c);
                    if (number != null) {
                        sum = sum.add(number);
                        count++;
                    }
                }
            }
        }
        return CellValue.number(DecimalMath.divide(sum, BigDecimal.valueOf(count), args.settings()));
    }

    /**
     * Numbers of the first range at positions matching all criteria pairs.
     */
    private static List<BigDecimal> matchingNumbers(Arguments args) {
        RangeValues target = args.range(0);
        List<RangeValues> ranges = new ArrayList<>();
        List<Criteria> criteria = new ArrayList<>();
        Aggregates.criteriaPairs(args, 1, ranges, criteria);
        MathFunctions.checkShape(target, ranges.get(0));
        List<BigDecimal> matched = new ArrayList<>();
        Aggregates.scan(ranges, criteria, (r, c) -> {
            BigDecimal number = Aggregates.numberAt(target, r, c);
            if (number != null) {
                matched.add(number);
            }
        });
        return matched;
    }

    /**
     * COUNT counts numbers (and, for literal arguments, anything that
     * coerces to one); COUNTA counts every non-blank value, errors included.
     */
    private static long count(Arguments args, boolean nonBlank) {
        long count = 0;
        for (int i = 0; i < args.size(); i++) {
            if (args.isMissing(i)) {
                continue;
            }
            Argument argument = args.get(i);
            if (argument.isReference()) {
                for (CellValue value : argument.range()) {
                    if (nonBlank ? !value.isBlank() : value.getType() == ValueType.NUMBER) {
                        count++;
                    }
                }
                continue;
            }
            CellValue value = argument.value();
            if (nonBlank) {
                count++;
            } else if (value.getType() == ValueType.NUMBER || value.getType() == ValueType.BOOLEAN
                    || (value.getType() == ValueType.TEXT
                    && SheetManager.parseNumber(((CellValue.TextValue) value).getValue()) != null)) {
                count++;
            }
        }
        return count;
    }

    private static CellValue countBlank(Arguments args) {
        RangeValues range = args.range(0);
        long filled = 0;
        for (CellValue value : range) {
            boolean empty = value.isBlank()
                    || (value.getType() == ValueType.TEXT && ((CellValue.TextValue) value).getValue().isEmpty());
            if (!empty) {
                filled++;
            }
        }
        return CellValue.number((long) range.rows() * range.columns() - filled);
    }

    private static CellValue median(Arguments args) {
        List<BigDecimal> numbers = Aggregates.numbers(args, 0);
        if (numbers.isEmpty()) {
            throw new FormulaErrorException(ErrorCode.NUM);
        }
        Collections.sort(numbers);
        int middle = numbers.size() / 2;
        if (numbers.size() % 2 == 1) {
            return CellValue.number(numbers.get(middle));
        }
        BigDecimal sum = numbers.get(middle - 1).add(numbers.get(middle));
        return CellValue.number(DecimalMath.divide(sum, BigDecimal.valueOf(2), args.settings()));
    }

    private static CellValue kth(Arguments args, boolean largest) {
        List<BigDecimal> numbers = new ArrayList<>();
        for (CellValue value : args.range(0)) {
            if (value.getType() == ValueType.NUMBER) {
                numbers.add(((CellValue.NumberValue) value).getValue());
            } else {
                ValueCoercion.requireNonError(value);
            }
        }
        BigDecimal k = args.number(1).setScale(0, RoundingMode.CEILING);
        if (k.signum() <= 0 || k.compareTo(BigDecimal.valueOf(numbers.size())) > 0) {
            throw new FormulaErrorException(ErrorCode.NUM);
        }
        Collections.sort(numbers);
        int index = k.intValue() - 1;
        return CellValue.number(largest ? numbers.get(numbers.size() - 1 - index) : numbers.get(index));
    }

    /**
     * Sample variance at full precision.
     */
    private static BigDecimal variance(Arguments args) {
        List<BigDecimal> numbers = Aggregates.numbers(args, 0);
        if (numbers.size() < 2) {
            throw new FormulaErrorException(ErrorCode.DIV_ZERO);
        }
        BigDecimal sum = BigDecimal.ZERO;
        for (BigDecimal number : numbers) {
            sum = sum.add(number);
        }
        BigDecimal mean = sum.divide(BigDecimal.valueOf(numbers.size()), DecimalMath.PRECISION);
        BigDecimal squares = BigDecimal.ZERO;
        for (BigDecimal number : numbers) {
            BigDecimal deviation = number.subtract(mean);
            squares = squares.add(deviation.multiply(deviation, DecimalMath.PRECISION));
        }
        return squares.divide(BigDecimal.valueOf(numbers.size() - 1L), DecimalMath.PRECISION);
    }
}
