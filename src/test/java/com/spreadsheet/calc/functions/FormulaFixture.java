package com.spreadsheet.calc.functions;

import com.spreadsheet.calc.models.CalculationSettings;
import com.spreadsheet.calc.models.CellEdit;
import com.spreadsheet.calc.models.CellValue;
import com.spreadsheet.calc.models.ErrorCode;
import com.spreadsheet.calc.models.Workbook;
import com.spreadsheet.calc.models.WorkbookImport;
import com.spreadsheet.calc.services.FormulaEngine;
import com.spreadsheet.calc.services.SheetManager;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A one-sheet workbook for function tests. Formulas under test are written
 * to a scratch cell far from the data.
 */
final class FormulaFixture {

    private static final String SCRATCH = "ZZ1000";

    private final FormulaEngine engine = new FormulaEngine();
    private final Workbook workbook;

    /**
     * @param cells alternating addresses and inputs, e.g. "A1", "10", "A2", "=A1*2"
     */
    FormulaFixture(String... cells) {
        List<CellEdit> edits = new ArrayList<>();
        for (int i = 0; i + 1 < cells.length; i += 2) {
            edits.add(new CellEdit("Sheet1", cells[i], cells[i + 1]));
        }
        workbook = engine.open(new WorkbookImport(Collections.singletonList("Sheet1"), edits),
                CalculationSettings.defaults());
    }

    CellValue eval(String formula) {
        engine.calculate(workbook, Collections.singletonList(new CellEdit("Sheet1", SCRATCH, formula)));
        return value(SCRATCH);
    }

    CellValue value(String a1) {
        SheetManager sheets = workbook.getSheets();
        return sheets.getValue(sheets.address("Sheet1", a1));
    }

    static CellValue number(String value) {
        return CellValue.number(new BigDecimal(value));
    }

    static CellValue text(String value) {
        return CellValue.text(value);
    }

    static CellValue error(ErrorCode code) {
        return CellValue.error(code);
    }
}
