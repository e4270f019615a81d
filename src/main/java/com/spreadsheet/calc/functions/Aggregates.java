package com.spreadsheet.calc.functions;

import com.spreadsheet.calc.exceptions.FormulaErrorException;
import com.spreadsheet.calc.models.CellValue;
import com.spreadsheet.calc.models.ErrorCode;
import com.spreadsheet.calc.models.RangeValues;
import com.spreadsheet.calc.models.ValueType;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Shared walks over function arguments.
 * - Values read through a reference count only when they are numbers;
 *   text, booleans and blanks there are skipped
 * - Values typed directly into the call are coerced, so {@code SUM("3", TRUE)} is 4
 * - Errors anywhere propagate
 */
final class Aggregates {

    interface NumberConsumer {
        void accept(BigDecimal number);
    }

    /**
     * Receives the index of each position that satisfies every criterion.
     */
    interface PositionConsumer {
        void accept(int row, int column);
    }

    private Aggregates() {
    }

    static void eachNumber(Arguments args, int from, NumberConsumer consumer) {
        for (int i = from; i < args.size(); i++) {
            if (args.isMissing(i)) {
                continue;
            }
            Argument argument = args.get(i);
            if (argument.isReference()) {
                for (CellValue value : argument.range()) {
                    if (value.getType() == ValueType.NUMBER) {
                        consumer.accept(((CellValue.NumberValue) value).getValue());
                    } else {
                        ValueCoercion.requireNonError(value);
                    }
                }
            } else {
                RangeValues range = argument.range();
                if (range.isSingleCell()) {
                    consumer.accept(ValueCoercion.toNumber(range.get(0, 0)));
                } else {
                    for (CellValue value : range) {
                        if (value.getType() == ValueType.NUMBER) {
                            consumer.accept(((CellValue.NumberValue) value).getValue());
                        } else {
                            ValueCoercion.requireNonError(value);
                        }
                    }
                }
            }
        }
    }

    static List<BigDecimal> numbers(Arguments args, int from) {
        List<BigDecimal> numbers = new ArrayList<>();
        eachNumber(args, from, numbers::add);
        return numbers;
    }

    /**
     * Number of positions matched, scanning the used part of the ranges.
     * When every criterion also accepts a blank, the unscanned blank
     * positions are counted without being visited.
     */
    static long scan(List<RangeValues> ranges, List<Criteria> criteria, PositionConsumer consumer) {
        RangeValues first = ranges.get(0);
        for (RangeValues range : ranges) {
            if (range.rows() != first.rows() || range.columns() != first.columns()) {
                throw new FormulaErrorException(ErrorCode.VALUE);
            }
        }
        int rows = 0;
        int columns = 0;
        for (RangeValues range : ranges) {
            rows = Math.max(rows, range.usedRows());
            columns = Math.max(columns, range.usedColumns());
        }
        long matched = 0;
        for (int r = 0; r < rows; r++) {
            for (int c = 0; c < columns; c++) {
                boolean all = true;
                for (int k = 0; k < criteria.size() && all; k++) {
                    all = criteria.get(k).matches(ranges.get(k).get(r, c));
                }
                if (all) {
                    matched++;
                    consumer.accept(r, c);
                }
            }
        }
        boolean blanksMatch = true;
        for (Criteria criterion : criteria) {
            blanksMatch &= criterion.matches(CellValue.BLANK);
        }
        if (blanksMatch) {
            matched += (long) first.rows() * first.columns() - (long) rows * columns;
        }
        return matched;
    }

    /**
     * Collects the criteria ranges and conditions from argument pairs
     * starting at {@code from}, as in {@code SUMIFS(sum, range1, crit1, ...)}.
     */
    static void criteriaPairs(Arguments args, int from, List<RangeValues> ranges, List<Criteria> criteria) {
        if ((args.size() - from) % 2 != 0) {
            throw new FormulaErrorException(ErrorCode.VALUE);
        }
        for (int i = from; i < args.size(); i += 2) {
            ranges.add(args.range(i));
            criteria.add(Criteria.parse(args.value(i + 1)));
        }
    }

    static BigDecimal numberAt(RangeValues range, int row, int column) {
        CellValue value = range.get(row, column);
        if (value.getType() == ValueType.NUMBER) {
            return ((CellValue.NumberValue) value).getValue();
        }
        ValueCoercion.requireNonError(value);
        return null;
    }
}
