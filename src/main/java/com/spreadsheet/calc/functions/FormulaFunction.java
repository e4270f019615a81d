package com.spreadsheet.calc.functions;

import com.spreadsheet.calc.models.CellValue;

/**
 * The evaluation strategy of a registered function. Implementations may
 * throw {@link com.spreadsheet.calc.exceptions.FormulaErrorException} to
 * return an error value.
 */
@FunctionalInterface
public interface FormulaFunction {
    CellValue apply(Arguments args);
}
