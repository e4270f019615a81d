package com.spreadsheet.calc.models;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Everything loaded when a workbook is opened: sheet names in order, the
 * initial cell inputs, named ranges ("TaxRate" -> "Rates!B2") and optional
 * overrides of the default calculation settings.
 * For example:
 * {
 *   "sheets": ["Inputs", "Totals"],
 *   "cells": [{"sheet": "Inputs", "cell": "A1", "input": "10"}],
 *   "names": {"Qty": "Inputs!A1"},
 *   "iterative": false
 * }
 */
public class WorkbookImport {
    private List<String> sheets = new ArrayList<>();
    private List<CellEdit> cells = new ArrayList<>();
    private Map<String, String> names = new LinkedHashMap<>();
    private Boolean iterative;
    private Integer maxIterations;
    private BigDecimal epsilon;
    private Integer decimalScale;

    // Default constructor needed for JSON (de)serialization
    public WorkbookImport() {
    }

    public WorkbookImport(List<String> sheets, List<CellEdit> cells) {
        this.sheets = sheets;
        this.cells = cells;
    }

    public List<String> getSheets() {
        return sheets;
    }

    public List<CellEdit> getCells() {
        return cells;
    }

    public Map<String, String> getNames() {
        return names;
    }

    public Boolean getIterative() {
        return iterative;
    }

    public Integer getMaxIterations() {
        return maxIterations;
    }

    public BigDecimal getEpsilon() {
        return epsilon;
    }

    public Integer getDecimalScale() {
        return decimalScale;
    }

    public void setSheets(List<String> sheets) {
        this.sheets = sheets;
    }

    public void setCells(List<CellEdit> cells) {
        this.cells = cells;
    }

    public void setNames(Map<String, String> names) {
        this.names = names;
    }

    public void setIterative(Boolean iterative) {
        this.iterative = iterative;
    }

    public void setMaxIterations(Integer maxIterations) {
        this.maxIterations = maxIterations;
    }

    public void setEpsilon(BigDecimal epsilon) {
        this.epsilon = epsilon;
    }

    public void setDecimalScale(Integer decimalScale) {
        this.decimalScale = decimalScale;
    }

    /**
     * Applies this import's overrides on top of the given defaults.
     */
    public CalculationSettings applyTo(CalculationSettings defaults) {
        CalculationSettings settings = defaults;
        if (iterative != null || maxIterations != null || epsilon != null) {
            settings = settings.withIterative(
                    iterative != null ? iterative : settings.isIterative(),
                    maxIterations != null ? maxIterations : settings.getMaxIterations(),
                    epsilon != null ? epsilon : settings.getEpsilon());
        }
        if (decimalScale != null) {
            settings = settings.withDecimalScale(decimalScale);
        }
        return settings;
    }
}
