package com.spreadsheet.calc.graph;

import com.spreadsheet.calc.models.CellAddress;
import com.spreadsheet.calc.models.RangeAddress;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * A formula's references after sheet and name lookup: the single cells it
 * reads, the multi-cell ranges it reads, and the named ranges it mentions.
 */
public final class ResolvedReferences {

    public static final ResolvedReferences NONE = new ResolvedReferences(
            Collections.emptySet(), Collections.emptySet(), Collections.emptySet());

    private final Set<CellAddress> cells;
    private final Set<RangeAddress> ranges;
    private final Set<String> names;

    public ResolvedReferences(Set<CellAddress> cells, Set<RangeAddress> ranges, Set<String> names) {
        this.cells = Collections.unmodifiableSet(new LinkedHashSet<>(cells));
        this.ranges = Collections.unmodifiableSet(new LinkedHashSet<>(ranges));
        this.names = Collections.unmodifiableSet(new LinkedHashSet<>(names));
    }

    public Set<CellAddress> getCells() {
        return cells;
    }

    public Set<RangeAddress> getRanges() {
        return ranges;
    }

    public Set<String> getNames() {
        return names;
    }

    public boolean isEmpty() {
        return cells.isEmpty() && ranges.isEmpty() && names.isEmpty();
    }
}
