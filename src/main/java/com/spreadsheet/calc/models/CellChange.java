package com.spreadsheet.calc.models;

import java.util.Objects;

/**
 * A cell whose committed value changed during a pass, e.g.
 * { "cell": "Sheet1!A3", "value": 35 }.
 */
public class CellChange {
    private final String cell;
    private final CellValue value;

    public CellChange(String cell, CellValue value) {
        this.cell = cell;
        this.value = value;
    }

    public String getCell() {
        return cell;
    }

    public CellValue getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CellChange)) return false;
        CellChange that = (CellChange) o;
        return cell.equals(that.cell) && value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(cell, value);
    }

    @Override
    public String toString() {
        return cell + "=" + value;
    }
}
