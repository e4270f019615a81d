package com.spreadsheet.calc.models;

/**
 * One requested change: put a literal or a formula into a cell.
 * An empty input clears the cell.
 */
public class CellEdit {
    private String sheet;
    private String cell;
    private String input;

    // Default constructor needed for JSON (de)serialization
    public CellEdit() {
    }

    public CellEdit(String sheet, String cell, String input) {
        this.sheet = sheet;
        this.cell = cell;
        this.input = input;
    }

    public String getSheet() {
        return sheet;
    }

    public String getCell() {
        return cell;
    }

    public String getInput() {
        return input;
    }

    public void setSheet(String sheet) {
        this.sheet = sheet;
    }

    public void setCell(String cell) {
        this.cell = cell;
    }

    public void setInput(String input) {
        this.input = input;
    }

    @Override
    public String toString() {
        return sheet + "!" + cell + " <- " + input;
    }
}
