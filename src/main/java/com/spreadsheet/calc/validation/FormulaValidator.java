package com.spreadsheet.calc.validation;

import com.spreadsheet.calc.exceptions.InvalidCellReferenceException;
import com.spreadsheet.calc.exceptions.SheetNotFoundException;
import com.spreadsheet.calc.functions.FunctionDefinition;
import com.spreadsheet.calc.models.*;
import com.spreadsheet.calc.services.FormulaEngine;
import com.spreadsheet.calc.services.SheetManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Replays a workbook snapshot through the engine and compares the results
 * with golden values exported from a reference spreadsheet.
 *
 * Numbers match within a tolerance: the case's own, else its category's,
 * else the global numeric tolerance. Text, booleans and errors must match
 * exactly; text is compared case-sensitively and untrimmed.
 */
public class FormulaValidator {

    private static final Logger log = LoggerFactory.getLogger(FormulaValidator.class);

    private final FormulaEngine engine;
    private final CalculationSettings defaults;
    private final BigDecimal numericTolerance;
    private final Map<FormulaCategory, BigDecimal> categoryTolerances;

    public FormulaValidator(FormulaEngine engine, CalculationSettings defaults, BigDecimal numericTolerance,
                            Map<FormulaCategory, BigDecimal> categoryTolerances) {
        this.engine = engine;
        this.defaults = defaults;
        this.numericTolerance = numericTolerance;
        this.categoryTolerances = categoryTolerances.isEmpty()
                ? new EnumMap<>(FormulaCategory.class) : new EnumMap<>(categoryTolerances);
    }

    public ValidationReport validate(WorkbookImport snapshot, List<GoldenCase> cases) {
        Workbook workbook = engine.open(snapshot, defaults);
        SheetManager sheets = workbook.getSheets();
        ValidationReport report = new ValidationReport();
        for (GoldenCase golden : cases) {
            CellValue expected = toCellValue(golden.getExpectedValue());
            String label = golden.getSheet() + "!" + golden.getCell();
            CellAddress address;
            try {
                address = sheets.address(golden.getSheet(), golden.getCell());
            } catch (SheetNotFoundException | InvalidCellReferenceException e) {
                FormulaCategory category = explicitCategory(golden, FormulaCategory.LITERAL);
                report.recordFailure(new ValidationFailure(label, null, expected, CellValue.error(ErrorCode.REF),
                        category, e.getMessage()));
                continue;
            }
            Cell cell = sheets.getCell(address);
            String formula = cell != null && cell.isFormula() ? cell.getRawInput() : null;
            FormulaCategory category = explicitCategory(golden, categorize(cell));
            CellValue actual = sheets.getValue(address);
            String mismatch = compare(expected, actual, toleranceFor(golden, category));
            if (mismatch == null) {
                report.recordPass(category);
            } else {
                report.recordFailure(new ValidationFailure(sheets.describe(address), formula, expected, actual,
                        category, mismatch));
            }
        }
        log.info("Validated {} golden cases: {} passed, {} failed",
                report.getTotal(), report.getPassed(), report.getFailed().size());
        return report;
    }

    /**
     * Category of a cell from the function at the top of its formula.
     */
    FormulaCategory categorize(Cell cell) {
        if (cell == null || !cell.isFormula()) {
            return FormulaCategory.LITERAL;
        }
        String function = cell.getFormula().outermostFunction();
        if (function == null) {
            return FormulaCategory.ARITHMETIC;
        }
        FunctionDefinition definition = engine.getFunctions().lookup(function);
        if (definition == null) {
            return FormulaCategory.ARITHMETIC;
        }
        return FormulaCategory.valueOf(definition.getCategory().name());
    }

    BigDecimal toleranceFor(GoldenCase golden, FormulaCategory category) {
        if (golden.getTolerance() != null) {
            return golden.getTolerance();
        }
        return categoryTolerances.getOrDefault(category, numericTolerance);
    }

    /**
     * Null when the values match, otherwise a description of the mismatch.
     */
    static String compare(CellValue expected, CellValue actual, BigDecimal tolerance) {
        if (expected.getType() == ValueType.NUMBER && actual.getType() == ValueType.NUMBER) {
            BigDecimal difference = ((CellValue.NumberValue) actual).getValue()
                    .subtract(((CellValue.NumberValue) expected).getValue()).abs();
            if (difference.compareTo(tolerance) <= 0) {
                return null;
            }
            return "Expected " + expected + " but got " + actual + " (difference " + difference.toPlainString()
                    + " exceeds tolerance " + tolerance.toPlainString() + ")";
        }
        if (expected.getType() != actual.getType()) {
            return "Expected " + expected.getType() + " " + expected + " but got " + actual.getType() + " " + actual;
        }
        return expected.equals(actual) ? null : "Expected " + expected + " but got " + actual;
    }

    /**
     * Converts a JSON value into a cell value. Strings that spell an error
     * code become that error.
     */
    static CellValue toCellValue(Object value) {
        if (value == null) {
            return CellValue.BLANK;
        }
        if (value instanceof Boolean) {
            return CellValue.bool((Boolean) value);
        }
        if (value instanceof BigDecimal) {
            return CellValue.number((BigDecimal) value);
        }
        if (value instanceof Number) {
            return CellValue.number(new BigDecimal(value.toString()));
        }
        String text = value.toString();
        ErrorCode error = ErrorCode.fromDisplay(text);
        return error != null ? CellValue.error(error) : CellValue.text(text);
    }

    private static FormulaCategory explicitCategory(GoldenCase golden, FormulaCategory fallback) {
        if (golden.getCategory() == null || golden.getCategory().isEmpty()) {
            return fallback;
        }
        try {
            return FormulaCategory.valueOf(golden.getCategory().trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            log.debug("Unknown category {} for {}!{}", golden.getCategory(), golden.getSheet(), golden.getCell());
            return fallback;
        }
    }
}
