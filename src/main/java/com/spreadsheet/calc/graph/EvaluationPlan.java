package com.spreadsheet.calc.graph;

import com.spreadsheet.calc.models.CellAddress;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The order in which a pass evaluates cells. First come the acyclic levels:
 * no edge joins two cells of the same level, and every precedent of a cell
 * sits in an earlier level. Then come the blocks that Kahn's algorithm could
 * not schedule, in topological order of their components.
 */
public final class EvaluationPlan {
    private final List<List<CellAddress>> levels;
    private final List<EvaluationBlock> blocks;

    public EvaluationPlan(List<List<CellAddress>> levels, List<EvaluationBlock> blocks) {
        this.levels = Collections.unmodifiableList(levels);
        this.blocks = Collections.unmodifiableList(blocks);
    }

    public List<List<CellAddress>> getLevels() {
        return levels;
    }

    public List<EvaluationBlock> getBlocks() {
        return blocks;
    }

    /**
     * Every planned cell in evaluation order.
     */
    public List<CellAddress> order() {
        List<CellAddress> order = new ArrayList<>();
        for (List<CellAddress> level : levels) {
            order.addAll(level);
        }
        for (EvaluationBlock block : blocks) {
            order.addAll(block.getMembers());
        }
        return order;
    }

    public List<EvaluationBlock> cycles() {
        List<EvaluationBlock> cycles = new ArrayList<>();
        for (EvaluationBlock block : blocks) {
            if (block.isCyclic()) {
                cycles.add(block);
            }
        }
        return cycles;
    }

    public int size() {
        int size = 0;
        for (List<CellAddress> level : levels) {
            size += level.size();
        }
        for (EvaluationBlock block : blocks) {
            size += block.getMembers().size();
        }
        return size;
    }

    @Override
    public String toString() {
        return "EvaluationPlan[levels=" + levels.size() + ", blocks=" + blocks.size() + ", cells=" + size() + "]";
    }
}
