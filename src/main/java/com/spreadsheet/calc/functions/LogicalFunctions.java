package com.spreadsheet.calc.functions;

import com.spreadsheet.calc.exceptions.FormulaErrorException;
import com.spreadsheet.calc.models.CellValue;
import com.spreadsheet.calc.models.ErrorCode;
import com.spreadsheet.calc.models.ValueType;

import static com.spreadsheet.calc.functions.FunctionCategory.LOGICAL;
import static com.spreadsheet.calc.functions.FunctionDefinition.VARIADIC;

/**
 * IF, IFS, AND, OR, NOT, XOR, SWITCH, IFERROR, IFNA, TRUE and FALSE.
 * The branching functions are lazy: only the branch taken is evaluated,
 * so an error in the other branch does not leak out.
 */
final class LogicalFunctions {

    private LogicalFunctions() {
    }

    static void register(FunctionRegistry registry) {
        registry.register(FunctionDefinition.lazy("IF", LOGICAL, 2, 3, LogicalFunctions::ifFunction));
        registry.register(FunctionDefinition.lazy("IFS", LOGICAL, 2, VARIADIC, LogicalFunctions::ifs));
        registry.register(FunctionDefinition.strict("AND", LOGICAL, 1, VARIADIC,
                args -> {
                    int[] counts = tally(args);
                    return CellValue.bool(counts[1] == counts[0]);
                }, ArgumentKind.RANGE));
        registry.register(FunctionDefinition.strict("OR", LOGICAL, 1, VARIADIC,
                args -> CellValue.bool(tally(args)[1] > 0), ArgumentKind.RANGE));
        registry.register(FunctionDefinition.strict("XOR", LOGICAL, 1, VARIADIC,
                args -> CellValue.bool(tally(args)[1] % 2 == 1), ArgumentKind.RANGE));
        registry.register(FunctionDefinition.scalar("NOT", LOGICAL, 1, 1,
                args -> CellValue.bool(!args.bool(0))));
        registry.register(FunctionDefinition.lazy("SWITCH", LOGICAL, 3, VARIADIC, LogicalFunctions::switchFunction));
        registry.register(FunctionDefinition.lazy("IFERROR", LOGICAL, 2, 2, args -> {
            CellValue value = args.value(0);
            return value.isError() ? args.value(1) : value;
        }));
        registry.register(FunctionDefinition.lazy("IFNA", LOGICAL, 2, 2, args -> {
            CellValue value = args.value(0);
            return value.equals(CellValue.error(ErrorCode.NA)) ? args.value(1) : value;
        }));
        registry.register(FunctionDefinition.scalar("TRUE", LOGICAL, 0, 0, args -> CellValue.TRUE));
        registry.register(FunctionDefinition.scalar("FALSE", LOGICAL, 0, 0, args -> CellValue.FALSE));
    }

    private static CellValue ifFunction(Arguments args) {
        CellValue condition = ValueCoercion.requireNonError(args.value(0));
        if (ValueCoercion.toBoolean(condition)) {
            return args.value(1);
        }
        return args.size() > 2 ? args.value(2) : CellValue.FALSE;
    }

    private static CellValue ifs(Arguments args) {
        if (args.size() % 2 != 0) {
            throw new FormulaErrorException(ErrorCode.VALUE);
        }
        for (int i = 0; i < args.size(); i += 2) {
            if (args.bool(i)) {
                return args.value(i + 1);
            }
        }
        throw new FormulaErrorException(ErrorCode.NA);
    }

    private static CellValue switchFunction(Arguments args) {
        CellValue subject = ValueCoercion.requireNonError(args.value(0));
        int i = 1;
        for (; i + 1 < args.size(); i += 2) {
            CellValue candidate = ValueCoercion.requireNonError(args.value(i));
            if (ValueCoercion.looseEquals(subject, candidate)) {
                return args.value(i + 1);
            }
        }
        if (i < args.size()) {
            return args.value(i);
        }
        throw new FormulaErrorException(ErrorCode.NA);
    }

    /**
     * {logical values seen, of which TRUE}. Values read through references
     * ignore text and blanks.
     */
    private static int[] tally(Arguments args) {
        int logical = 0;
        int truthy = 0;
        for (int i = 0; i < args.size(); i++) {
            if (args.isMissing(i)) {
                continue;
            }
            Argument argument = args.get(i);
            if (!argument.isReference() && argument.range().isSingleCell()) {
                logical++;
                if (ValueCoercion.toBoolean(argument.range().get(0, 0))) {
                    truthy++;
                }
                continue;
            }
            for (CellValue value : argument.range()) {
                if (value.getType() == ValueType.NUMBER || value.getType() == ValueType.BOOLEAN) {
                    logical++;
                    if (ValueCoercion.toBoolean(value)) {
                        truthy++;
                    }
                } else {
                    ValueCoercion.requireNonError(value);
                }
            }
        }
        if (logical == 0) {
            throw new FormulaErrorException(ErrorCode.VALUE);
        }
        return new int[]{logical, truthy};
    }
}
