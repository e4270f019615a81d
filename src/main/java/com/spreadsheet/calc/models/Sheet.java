package com.spreadsheet.calc.models;

import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * A named grid of cells inside a workbook.
 * - Has a fixed index (its position in the workbook) and a display name
 * - Stores only populated cells, keyed by packed (row, column)
 * - Tracks the used extent so whole-column ranges stop at the last populated row;
 *   removing a boundary cell shrinks it on the next read
 */
public class Sheet {

    private final int index;
    private final String name;
    private final Map<Long, Cell> cells = new HashMap<>();

    private int maxRow = -1;
    private int maxColumn = -1;
    private volatile boolean extentStale;

    public Sheet(int index, String name) {
        this.index = index;
        this.name = name;
    }

    public int getIndex() {
        return index;
    }

    public String getName() {
        return name;
    }

    public Cell getCell(int row, int column) {
        return cells.get(CellAddress.pack(row, column));
    }

    /**
     * Retrieves the cell at the given position, creating an empty one if needed.
     */
    public Cell getOrCreateCell(int row, int column) {
        Cell cell = cells.get(CellAddress.pack(row, column));
        if (cell == null) {
            cell = new Cell(new CellAddress(index, row, column));
            cells.put(CellAddress.pack(row, column), cell);
            maxRow = Math.max(maxRow, row);
            maxColumn = Math.max(maxColumn, column);
        }
        return cell;
    }

    public Cell removeCell(int row, int column) {
        Cell removed = cells.remove(CellAddress.pack(row, column));
        if (removed != null && (row == maxRow || column == maxColumn)) {
            extentStale = true;
        }
        return removed;
    }

    public Collection<Cell> getCells() {
        return Collections.unmodifiableCollection(cells.values());
    }

    public int size() {
        return cells.size();
    }

    /**
     * Highest populated row index, or -1 for an empty sheet.
     */
    public int getMaxRow() {
        refreshExtent();
        return maxRow;
    }

    public int getMaxColumn() {
        refreshExtent();
        return maxColumn;
    }

    // Range reads may run on worker threads, so the rescan is guarded.
    private void refreshExtent() {
        if (!extentStale) {
            return;
        }
        synchronized (this) {
            if (extentStale) {
                int rows = -1;
                int columns = -1;
                for (Cell cell : cells.values()) {
                    rows = Math.max(rows, cell.getAddress().getRow());
                    columns = Math.max(columns, cell.getAddress().getColumn());
                }
                maxRow = rows;
                maxColumn = columns;
                extentStale = false;
            }
        }
    }
}
