package com.spreadsheet.calc.functions;

import com.spreadsheet.calc.exceptions.FormulaErrorException;
import com.spreadsheet.calc.models.CellAddress;
import com.spreadsheet.calc.models.CellValue;
import com.spreadsheet.calc.models.ErrorCode;
import com.spreadsheet.calc.models.RangeAddress;
import com.spreadsheet.calc.models.RangeValues;
import com.spreadsheet.calc.models.ValueType;

import java.util.regex.Pattern;

import static com.spreadsheet.calc.functions.FunctionCategory.LOOKUP;
import static com.spreadsheet.calc.functions.FunctionDefinition.VARIADIC;

/**
 * Table lookups and reference information.
 * - Exact matches ignore case and accept wildcards in text
 * - Approximate matches assume the lookup vector is sorted and stop at the
 *   first value past the one searched for
 * - Nothing found is #N/A; an index outside the table is #REF!
 */
final class LookupFunctions {

    private LookupFunctions() {
    }

    static void register(FunctionRegistry registry) {
        registry.register(FunctionDefinition.strict("VLOOKUP", LOOKUP, 3, 4, args -> tableLookup(args, true),
                ArgumentKind.SCALAR, ArgumentKind.RANGE, ArgumentKind.SCALAR));
        registry.register(FunctionDefinition.strict("HLOOKUP", LOOKUP, 3, 4, args -> tableLookup(args, false),
                ArgumentKind.SCALAR, ArgumentKind.RANGE, ArgumentKind.SCALAR));
        registry.register(FunctionDefinition.strict("INDEX", LOOKUP, 2, 3, LookupFunctions::index,
                ArgumentKind.RANGE, ArgumentKind.SCALAR));
        registry.register(FunctionDefinition.strict("MATCH", LOOKUP, 2, 3, LookupFunctions::match,
                ArgumentKind.SCALAR, ArgumentKind.RANGE, ArgumentKind.SCALAR));
        registry.register(FunctionDefinition.lazy("XLOOKUP", LOOKUP, 3, 6, LookupFunctions::xlookup));
        registry.register(FunctionDefinition.lazy("CHOOSE", LOOKUP, 2, VARIADIC, args -> {
            int index = args.integer(0);
            if (index < 1 || index >= args.size()) {
                throw new FormulaErrorException(ErrorCode.VALUE);
            }
            return args.value(index);
        }));
        registry.register(FunctionDefinition.lazy("ROW", LOOKUP, 0, 1,
                args -> CellValue.number(position(args, true) + 1L)));
        registry.register(FunctionDefinition.lazy("COLUMN", LOOKUP, 0, 1,
                args -> CellValue.number(position(args, false) + 1L)));
        registry.register(FunctionDefinition.strict("ROWS", LOOKUP, 1, 1,
                args -> CellValue.number(args.range(0).rows()), ArgumentKind.RANGE));
        registry.register(FunctionDefinition.strict("COLUMNS", LOOKUP, 1, 1,
                args -> CellValue.number(args.range(0).columns()), ArgumentKind.RANGE));
    }

    private static CellValue tableLookup(Arguments args, boolean vertical) {
        CellValue lookup = args.value(0);
        RangeValues table = args.range(1);
        int index = args.integer(2);
        boolean approximate = args.bool(3, true);
        if (index < 1) {
            throw new FormulaErrorException(ErrorCode.VALUE);
        }
        if (index > (vertical ? table.columns() : table.rows())) {
            throw new FormulaErrorException(ErrorCode.REF);
        }
        Vector keys = new Vector(table, vertical, 0);
        int found = approximate ? approximateMatch(lookup, keys, true) : exactMatch(lookup, keys, false, true);
        if (found < 0) {
            throw new FormulaErrorException(ErrorCode.NA);
        }
        return vertical ? table.get(found, index - 1) : table.get(index - 1, found);
    }

    private static CellValue index(Arguments args) {
        RangeValues range = args.range(0);
        int row = args.integer(1);
        int column;
        if (args.isMissing(2)) {
            if (range.rows() == 1 && range.columns() > 1) {
                column = row;
                row = 1;
            } else {
                column = 1;
            }
        } else {
            column = args.integer(2);
        }
        if (row < 0 || column < 0 || row > range.rows() || column > range.columns()) {
            throw new FormulaErrorException(ErrorCode.REF);
        }
        if (row == 0 || column == 0) {
            // A whole row or column cannot be returned as a single value
            if ((row == 0 && range.rows() != 1) || (column == 0 && range.columns() != 1)) {
                throw new FormulaErrorException(ErrorCode.VALUE);
            }
            row = Math.max(row, 1);
            column = Math.max(column, 1);
        }
        return range.get(row - 1, column - 1);
    }

    private static CellValue match(Arguments args) {
        CellValue lookup = args.value(0);
        RangeValues range = args.range(1);
        int type = args.integer(2, 1);
        if (range.rows() != 1 && range.columns() != 1) {
            throw new FormulaErrorException(ErrorCode.NA);
        }
        Vector vector = new Vector(range, range.columns() == 1, 0);
        int found;
        if (type == 0) {
            found = exactMatch(lookup, vector, false, true);
        } else {
            found = approximateMatch(lookup, vector, type > 0);
        }
        if (found < 0) {
            throw new FormulaErrorException(ErrorCode.NA);
        }
        return CellValue.number(found + 1L);
    }

    private static CellValue xlookup(Arguments args) {
        CellValue lookup = ValueCoercion.requireNonError(args.value(0));
        RangeValues keys = args.range(1);
        RangeValues results = args.range(2);
        int matchMode = args.integer(4, 0);
        int searchMode = args.integer(5, 1);
        if (keys.rows() != 1 && keys.columns() != 1) {
            throw new FormulaErrorException(ErrorCode.VALUE);
        }
        boolean vertical = keys.columns() == 1;
        if ((vertical ? results.rows() : results.columns()) != (vertical ? keys.rows() : keys.columns())) {
            throw new FormulaErrorException(ErrorCode.VALUE);
        }
        Vector vector = new Vector(keys, vertical, 0);
        boolean reverse = searchMode == -1;
        int found;
        switch (matchMode) {
            case 0:
                found = exactMatch(lookup, vector, reverse, false);
                break;
            case 2:
                found = exactMatch(lookup, vector, reverse, true);
                break;
            case -1:
            case 1:
                found = nearestMatch(lookup, vector, matchMode > 0, reverse);
                break;
            default:
                throw new FormulaErrorException(ErrorCode.VALUE);
        }
        if (found < 0) {
            if (!args.isMissing(3)) {
                return args.value(3);
            }
            throw new FormulaErrorException(ErrorCode.NA);
        }
        return vertical ? results.get(found, 0) : results.get(0, found);
    }

    private static int position(Arguments args, boolean row) {
        if (args.isMissing(0)) {
            CellAddress current = args.context().currentCell();
            if (current == null) {
                throw new FormulaErrorException(ErrorCode.VALUE);
            }
            return row ? current.getRow() : current.getColumn();
        }
        if (!args.get(0).isReference()) {
            throw new FormulaErrorException(ErrorCode.VALUE);
        }
        RangeAddress address = args.range(0).getAddress();
        if (address == null) {
            throw new FormulaErrorException(ErrorCode.VALUE);
        }
        return row ? address.getFirstRow() : address.getFirstColumn();
    }

    private static int exactMatch(CellValue lookup, Vector vector, boolean reverse, boolean wildcards) {
        ValueCoercion.requireNonError(lookup);
        Pattern pattern = wildcards && lookup.getType() == ValueType.TEXT
                ? Criteria.wildcardPattern(((CellValue.TextValue) lookup).getValue()) : null;
        int length = vector.used();
        for (int step = 0; step < length; step++) {
            int i = reverse ? length - 1 - step : step;
            CellValue candidate = vector.get(i);
            if (pattern != null) {
                if (candidate.getType() == ValueType.TEXT
                        && pattern.matcher(((CellValue.TextValue) candidate).getValue()).matches()) {
                    return i;
                }
            } else if (!candidate.isError() && candidate.getType() == lookup.getType()
                    && ValueCoercion.compare(candidate, lookup) == 0) {
                return i;
            }
        }
        return -1;
    }

    /**
     * Sorted search: the last position whose value is not past the lookup
     * value (ascending) or not before it (descending). Values of another type
     * are skipped.
     */
    private static int approximateMatch(CellValue lookup, Vector vector, boolean ascending) {
        ValueCoercion.requireNonError(lookup);
        int best = -1;
        for (int i = 0; i < vector.used(); i++) {
            CellValue candidate = vector.get(i);
            if (candidate.isError() || candidate.isBlank() || candidate.getType() != lookup.getType()) {
                continue;
            }
            int comparison = ValueCoercion.compare(candidate, lookup);
            if (comparison == 0) {
                return i;
            }
            if (ascending ? comparison < 0 : comparison > 0) {
                best = i;
            } else {
                break;
            }
        }
        return best;
    }

    /**
     * Exact match or else the closest larger (or smaller) value, without
     * assuming any order.
     */
    private static int nearestMatch(CellValue lookup, Vector vector, boolean larger, boolean reverse) {
        int exact = exactMatch(lookup, vector, reverse, false);
        if (exact >= 0) {
            return exact;
        }
        int best = -1;
        int length = vector.used();
        for (int step = 0; step < length; step++) {
            int i = reverse ? length - 1 - step : step;
            CellValue candidate = vector.get(i);
            if (candidate.isError() || candidate.isBlank() || candidate.getType() != lookup.getType()) {
                continue;
            }
            int comparison = ValueCoercion.compare(candidate, lookup);
            if (larger ? comparison > 0 : comparison < 0) {
                if (best < 0 || (larger ? ValueCoercion.compare(candidate, vector.get(best)) < 0
                        : ValueCoercion.compare(candidate, vector.get(best)) > 0)) {
                    best = i;
                }
            }
        }
        return best;
    }

    /**
     * One row or column of a range, seen as a list.
     */
    private static final class Vector {
        private final RangeValues range;
        private final boolean vertical;
        private final int offset;

        Vector(RangeValues range, boolean vertical, int offset) {
            this.range = range;
            this.vertical = vertical;
            this.offset = offset;
        }

        int used() {
            return vertical ? range.usedRows() : range.usedColumns();
        }

        CellValue get(int i) {
            return vertical ? range.get(i, offset) : range.get(offset, i);
        }
    }
}
