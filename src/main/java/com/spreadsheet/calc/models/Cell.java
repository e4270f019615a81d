package com.spreadsheet.calc.models;

import com.spreadsheet.calc.parser.ParsedFormula;

/**
 * Represents a single spreadsheet cell.
 * Stores:
 * - its address (sheet, row, column)
 * - rawInput (a literal such as "42" or a formula such as "=A1+1")
 * - the parsed formula, if the input is one
 * - the committed value and the pass version that produced it
 * - dirty flag to signal that the committed value is stale
 */
public class Cell {
    private final CellAddress address;
    private String rawInput;
    private ParsedFormula formula;
    private CellValue value = CellValue.BLANK;
    private boolean dirty;
    private long version;

    public Cell(CellAddress address) {
        this.address = address;
    }

    public CellAddress getAddress() {
        return address;
    }

    public String getRawInput() {
        return rawInput;
    }

    public ParsedFormula getFormula() {
        return formula;
    }

    public boolean isFormula() {
        return formula != null;
    }

    /**
     * Replaces the input with a formula. The cell becomes dirty until the
     * next pass evaluates it.
     */
    public void setFormula(String rawInput, ParsedFormula formula) {
        this.rawInput = rawInput;
        this.formula = formula;
        this.dirty = true;
    }

    /**
     * Replaces the input with a literal, which is its own committed value.
     */
    public void setLiteral(String rawInput, CellValue literal, long version) {
        this.rawInput = rawInput;
        this.formula = null;
        commit(literal, version);
    }

    public CellValue getValue() {
        return value;
    }

    /**
     * Stores a computed value and marks it current.
     */
    public void commit(CellValue value, long version) {
        this.value = value;
        this.version = version;
        this.dirty = false;
    }

    public boolean isDirty() {
        return dirty;
    }

    public void setDirty(boolean dirty) {
        this.dirty = dirty;
    }

    public long getVersion() {
        return version;
    }

    @Override
    public String toString() {
        return address + "=" + (formula != null ? rawInput : value);
    }
}
