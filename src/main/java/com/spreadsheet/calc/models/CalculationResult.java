package com.spreadsheet.calc.models;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The outcome of one recalculation pass: the change-set, whether the pass
 * ran to the end (it may stop early on cancellation), and how many formula
 * cells it evaluated.
 */
public class CalculationResult {
    private final List<CellChange> changes;
    private final boolean complete;
    private final int evaluatedCells;

    public CalculationResult(List<CellChange> changes, boolean complete, int evaluatedCells) {
        this.changes = Collections.unmodifiableList(changes);
        this.complete = complete;
        this.evaluatedCells = evaluatedCells;
    }

    public List<CellChange> getChanges() {
        return changes;
    }

    public boolean isComplete() {
        return complete;
    }

    public int getEvaluatedCells() {
        return evaluatedCells;
    }

    /**
     * The change-set as "Sheet!A1" -> value, in change-set order.
     */
    public Map<String, CellValue> asMap() {
        Map<String, CellValue> map = new LinkedHashMap<>();
        for (CellChange change : changes) {
            map.put(change.getCell(), change.getValue());
        }
        return map;
    }
}
