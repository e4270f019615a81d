package com.spreadsheet.calc.functions;

import com.spreadsheet.calc.models.CalculationSettings;
import com.spreadsheet.calc.models.CellValue;
import com.spreadsheet.calc.models.RangeValues;
import com.spreadsheet.calc.services.CalculationContext;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.List;

/**
 * The arguments of one function call together with the calculation context,
 * with the coercions functions need most.
 */
public final class Arguments {

    private final List<Argument> arguments;
    private final CalculationContext context;

    public Arguments(List<Argument> arguments, CalculationContext context) {
        this.arguments = Collections.unmodifiableList(arguments);
        this.context = context;
    }

    public int size() {
        return arguments.size();
    }

    public Argument get(int index) {
        return arguments.get(index);
    }

    public CalculationContext context() {
        return context;
    }

    public CalculationSettings settings() {
        return context.getSettings();
    }

    /**
     * True when the position is past the end or was left empty.
     */
    public boolean isMissing(int index) {
        return index >= arguments.size() || arguments.get(index).isMissing();
    }

    public CellValue value(int index) {
        return arguments.get(index).value();
    }

    public RangeValues range(int index) {
        return arguments.get(index).range();
    }

    public BigDecimal number(int index) {
        return ValueCoercion.toNumber(value(index));
    }

    public BigDecimal number(int index, BigDecimal defaultValue) {
        return isMissing(index) ? defaultValue : number(index);
    }

    public int integer(int index) {
        return DecimalMath.toInt(number(index));
    }

    public int integer(int index, int defaultValue) {
        return isMissing(index) ? defaultValue : integer(index);
    }

    public String text(int index) {
        return ValueCoercion.toText(value(index));
    }

    public boolean bool(int index) {
        return ValueCoercion.toBoolean(value(index));
    }

    public boolean bool(int index, boolean defaultValue) {
        return isMissing(index) ? defaultValue : bool(index);
    }

    /**
     * Rounds an arithmetic result to the workbook scale.
     */
    public BigDecimal round(BigDecimal value) {
        return settings().round(value);
    }
}
