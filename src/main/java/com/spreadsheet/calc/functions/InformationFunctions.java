package com.spreadsheet.calc.functions;

import com.spreadsheet.calc.exceptions.FormulaErrorException;
import com.spreadsheet.calc.models.CellValue;
import com.spreadsheet.calc.models.ErrorCode;
import com.spreadsheet.calc.models.ValueType;

import java.util.function.Predicate;

import static com.spreadsheet.calc.functions.FunctionCategory.INFORMATION;

/**
 * The IS* predicates plus N, T, TYPE and NA. The predicates are lazy so they
 * can inspect an error value instead of propagating it.
 */
final class InformationFunctions {

    private InformationFunctions() {
    }

    static void register(FunctionRegistry registry) {
        predicate(registry, "ISERROR", CellValue::isError);
        predicate(registry, "ISERR", v -> v.isError() && !isNa(v));
        predicate(registry, "ISNA", InformationFunctions::isNa);
        predicate(registry, "ISBLANK", CellValue::isBlank);
        predicate(registry, "ISNUMBER", v -> v.getType() == ValueType.NUMBER);
        predicate(registry, "ISTEXT", v -> v.getType() == ValueType.TEXT);
        predicate(registry, "ISLOGICAL", v -> v.getType() == ValueType.BOOLEAN);
        predicate(registry, "ISNONTEXT", v -> v.getType() != ValueType.TEXT);

        registry.register(FunctionDefinition.scalar("N", INFORMATION, 1, 1, args -> {
            CellValue value = args.value(0);
            switch (value.getType()) {
                case NUMBER:
                    return value;
                case BOOLEAN:
                    return ((CellValue.BoolValue) value).getValue() ? CellValue.number(1) : CellValue.ZERO;
                default:
                    return CellValue.ZERO;
            }
        }));
        registry.register(FunctionDefinition.scalar("T", INFORMATION, 1, 1, args -> {
            CellValue value = args.value(0);
            return value.getType() == ValueType.TEXT ? value : CellValue.text("");
        }));
        registry.register(FunctionDefinition.lazy("TYPE", INFORMATION, 1, 1, args -> {
            switch (args.value(0).getType()) {
                case TEXT:
                    return CellValue.number(2);
                case BOOLEAN:
                    return CellValue.number(4);
                case ERROR:
                    return CellValue.number(16);
                default:
                    return CellValue.number(1);
            }
        }));
        registry.register(FunctionDefinition.scalar("NA", INFORMATION, 0, 0, args -> {
            throw new FormulaErrorException(ErrorCode.NA);
        }));
    }

    private static void predicate(FunctionRegistry registry, String name, Predicate<CellValue> test) {
        registry.register(FunctionDefinition.lazy(name, INFORMATION, 1, 1,
                args -> CellValue.bool(test.test(args.value(0)))));
    }

    private static boolean isNa(CellValue value) {
        return value.isError() && ((CellValue.ErrorValue) value).getCode() == ErrorCode.NA;
    }
}
