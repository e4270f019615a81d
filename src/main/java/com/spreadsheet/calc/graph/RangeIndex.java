package com.spreadsheet.calc.graph;

import com.spreadsheet.calc.models.CellAddress;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Finds the range nodes covering a cell without scanning every range.
 * Ranges are bucketed per sheet and column; ranges wider than
 * {@link #WIDE_COLUMNS} columns (whole rows, mostly) sit in one list per sheet.
 */
final class RangeIndex {

    static final int WIDE_COLUMNS = 64;

    private final Map<Integer, Map<Integer, List<RangeNode>>> byColumn = new HashMap<>();
    private final Map<Integer, List<RangeNode>> wide = new HashMap<>();

    void add(RangeNode node) {
        int sheet = node.getAddress().getSheetIndex();
        if (node.getAddress().columnCount() > WIDE_COLUMNS) {
            wide.computeIfAbsent(sheet, k -> new ArrayList<>()).add(node);
            return;
        }
        Map<Integer, List<RangeNode>> columns = byColumn.computeIfAbsent(sheet, k -> new HashMap<>());
        for (int c = node.getAddress().getFirstColumn(); c <= node.getAddress().getLastColumn(); c++) {
            columns.computeIfAbsent(c, k -> new ArrayList<>()).add(node);
        }
    }

    void remove(RangeNode node) {
        int sheet = node.getAddress().getSheetIndex();
        if (node.getAddress().columnCount() > WIDE_COLUMNS) {
            List<RangeNode> list = wide.get(sheet);
            if (list != null) {
                list.remove(node);
            }
            return;
        }
        Map<Integer, List<RangeNode>> columns = byColumn.get(sheet);
        if (columns == null) {
            return;
        }
        for (int c = node.getAddress().getFirstColumn(); c <= node.getAddress().getLastColumn(); c++) {
            List<RangeNode> list = columns.get(c);
            if (list != null) {
                list.remove(node);
                if (list.isEmpty()) {
                    columns.remove(c);
                }
            }
        }
    }

    Set<RangeNode> covering(CellAddress cell) {
        Set<RangeNode> result = null;
        Map<Integer, List<RangeNode>> columns = byColumn.get(cell.getSheetIndex());
        List<RangeNode> candidates = columns == null ? null : columns.get(cell.getColumn());
        if (candidates != null) {
            for (RangeNode node : candidates) {
                if (node.contains(cell)) {
                    if (result == null) result = new LinkedHashSet<>();
                    result.add(node);
                }
            }
        }
        List<RangeNode> wideCandidates = wide.get(cell.getSheetIndex());
        if (wideCandidates != null) {
            for (RangeNode node : wideCandidates) {
                if (node.contains(cell)) {
                    if (result == null) result = new LinkedHashSet<>();
                    result.add(node);
                }
            }
        }
        return result == null ? Collections.emptySet() : result;
    }
}
