package com.spreadsheet.calc.graph;

import com.spreadsheet.calc.models.CellAddress;
import com.spreadsheet.calc.models.RangeAddress;

import java.util.Collections;
import java.util.HashSet;
import java.util.Set;

/**
 * One node per distinct range read by any formula. A formula reading the
 * range costs one edge to this node no matter how many cells the range
 * covers; membership is answered by containment.
 */
public final class RangeNode {
    private final RangeAddress address;
    private final Set<CellAddress> dependents = new HashSet<>();

    RangeNode(RangeAddress address) {
        this.address = address;
    }

    public RangeAddress getAddress() {
        return address;
    }

    public boolean contains(CellAddress cell) {
        return address.contains(cell);
    }

    /**
     * The formula cells that read this range.
     */
    public Set<CellAddress> getDependents() {
        return Collections.unmodifiableSet(dependents);
    }

    boolean addDependent(CellAddress cell) {
        return dependents.add(cell);
    }

    boolean removeDependent(CellAddress cell) {
        return dependents.remove(cell);
    }

    boolean isUnused() {
        return dependents.isEmpty();
    }

    @Override
    public String toString() {
        return "RangeNode[" + address + ", dependents=" + dependents.size() + "]";
    }
}
