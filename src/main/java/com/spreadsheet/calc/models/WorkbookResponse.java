package com.spreadsheet.calc.models;

import java.util.Map;

/**
 * Returned when a workbook is opened: its session ID and every non-blank
 * value after the initial calculation, keyed "Sheet!A1".
 */
public class WorkbookResponse {
    private final long id;
    private final Map<String, CellValue> values;

    public WorkbookResponse(long id, Map<String, CellValue> values) {
        this.id = id;
        this.values = values;
    }

    public long getId() {
        return id;
    }

    public Map<String, CellValue> getValues() {
        return values;
    }
}
