package com.spreadsheet.calc.graph;

import com.spreadsheet.calc.models.CellAddress;

import java.util.Collections;
import java.util.List;

/**
 * A strongly-connected component left over after the acyclic levels of a
 * plan. Cyclic blocks have more than one member or a cell reading itself;
 * acyclic blocks are single cells downstream of a cycle.
 */
public final class EvaluationBlock {
    private final List<CellAddress> members;
    private final boolean cyclic;

    public EvaluationBlock(List<CellAddress> members, boolean cyclic) {
        this.members = Collections.unmodifiableList(members);
        this.cyclic = cyclic;
    }

    public List<CellAddress> getMembers() {
        return members;
    }

    public boolean isCyclic() {
        return cyclic;
    }

    @Override
    public String toString() {
        return (cyclic ? "cycle" : "block") + members;
    }
}
