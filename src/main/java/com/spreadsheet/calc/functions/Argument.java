package com.spreadsheet.calc.functions;

import com.spreadsheet.calc.models.CellValue;
import com.spreadsheet.calc.models.RangeValues;

/**
 * One argument of a function call. For lazy functions nothing is evaluated
 * until {@link #value()} or {@link #range()} is called; either result is
 * computed at most once.
 */
public interface Argument {

    /**
     * The argument as a single value. Errors come back as error values.
     */
    CellValue value();

    /**
     * The argument as a range; a computed value is wrapped in a 1x1 range.
     */
    RangeValues range();

    /**
     * True when the argument is written as a reference (A1, B2:C9, a name).
     */
    boolean isReference();

    /**
     * True for an omitted argument, as in {@code IF(A1,,2)}.
     */
    boolean isMissing();
}
