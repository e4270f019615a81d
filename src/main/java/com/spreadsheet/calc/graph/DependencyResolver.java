package com.spreadsheet.calc.graph;

import com.spreadsheet.calc.models.CellAddress;
import com.spreadsheet.calc.models.RangeAddress;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * The precedent/dependent graph of a workbook.
 * - Cell references are direct edges, kept in both directions
 * - Each distinct range is one shared {@link RangeNode}; a formula reading it
 *   holds a single edge to the node, and a cell's range dependents are found
 *   by containment through the {@link RangeIndex}
 * - Named ranges resolve to cell or range edges; the resolver also remembers
 *   which cells mention each name so a redefinition can re-register them
 *
 * Not thread-safe: the owning workbook's single writer drives all updates.
 */
public class DependencyResolver {

    private static final Logger log = LoggerFactory.getLogger(DependencyResolver.class);

    // Forward adjacency: formula cell -> cells it reads directly
    private final Map<CellAddress, Set<CellAddress>> cellPrecedents = new HashMap<>();
    // Reverse adjacency: cell -> formula cells reading it directly
    private final Map<CellAddress, Set<CellAddress>> cellDependents = new HashMap<>();
    // Formula cell -> range nodes it reads
    private final Map<CellAddress, Set<RangeNode>> rangePrecedents = new HashMap<>();
    private final Map<RangeAddress, RangeNode> rangeNodes = new HashMap<>();
    private final RangeIndex rangeIndex = new RangeIndex();
    private final Map<CellAddress, Set<String>> namesUsed = new HashMap<>();
    private final Map<String, Set<CellAddress>> nameDependents = new HashMap<>();

    /**
     * Makes the outgoing edges of {@code cell} equal to {@code references}.
     * Only the symmetric difference between the old and new reference sets
     * is touched.
     */
    public void registerOrUpdate(CellAddress cell, ResolvedReferences references) {
        Set<CellAddress> newCells = new HashSet<>(references.getCells());
        Set<RangeAddress> newRanges = new HashSet<>();
        for (RangeAddress range : references.getRanges()) {
            if (range.isSingleCell()) {
                newCells.add(range.topLeft());
            } else {
                newRanges.add(range);
            }
        }

        Set<CellAddress> oldCells = new HashSet<>(cellPrecedents.getOrDefault(cell, Collections.emptySet()));
        for (CellAddress target : oldCells) {
            if (!newCells.contains(target)) {
                removeCellEdge(cell, target);
            }
        }
        for (CellAddress target : newCells) {
            if (!oldCells.contains(target)) {
                addCellEdge(cell, target);
            }
        }

        Set<RangeAddress> oldRanges = new HashSet<>();
        for (RangeNode node : rangePrecedents.getOrDefault(cell, Collections.emptySet())) {
            oldRanges.add(node.getAddress());
        }
        for (RangeAddress range : oldRanges) {
            if (!newRanges.contains(range)) {
                removeRangeEdge(cell, range);
            }
        }
        for (RangeAddress range : newRanges) {
            if (!oldRanges.contains(range)) {
                addRangeEdge(cell, range);
            }
        }

        Set<String> oldNames = new HashSet<>(namesUsed.getOrDefault(cell, Collections.emptySet()));
        for (String name : oldNames) {
            if (!references.getNames().contains(name)) {
                removeName(cell, name);
            }
        }
        for (String name : references.getNames()) {
            if (!oldNames.contains(name)) {
                namesUsed.computeIfAbsent(cell, k -> new HashSet<>()).add(name);
                nameDependents.computeIfAbsent(name, k -> new HashSet<>()).add(cell);
            }
        }
    }

    /**
     * Drops every outgoing edge of {@code cell}, e.g. when it turns into a literal.
     */
    public void remove(CellAddress cell) {
        registerOrUpdate(cell, ResolvedReferences.NONE);
    }

    /**
     * Formula cells that read {@code cell}, directly or through a range.
     */
    public Set<CellAddress> dependentsOf(CellAddress cell) {
        Set<CellAddress> result = new TreeSet<>(cellDependents.getOrDefault(cell, Collections.emptySet()));
        for (RangeNode node : rangeIndex.covering(cell)) {
            result.addAll(node.getDependents());
        }
        return result;
    }

    public Set<CellAddress> precedentsOf(CellAddress cell) {
        return Collections.unmodifiableSet(cellPrecedents.getOrDefault(cell, Collections.emptySet()));
    }

    public Set<RangeAddress> precedentRangesOf(CellAddress cell) {
        Set<RangeAddress> result = new LinkedHashSet<>();
        for (RangeNode node : rangePrecedents.getOrDefault(cell, Collections.emptySet())) {
            result.add(node.getAddress());
        }
        return result;
    }

    public Set<CellAddress> cellsUsingName(String name) {
        return new TreeSet<>(nameDependents.getOrDefault(name.toUpperCase(), Collections.emptySet()));
    }

    public RangeNode rangeNode(RangeAddress range) {
        return rangeNodes.get(range);
    }

    public int rangeNodeCount() {
        return rangeNodes.size();
    }

    /**
     * Number of outgoing edges: one per referenced cell plus one per
     * referenced range, however large.
     */
    public int edgeCount() {
        int count = 0;
        for (Set<CellAddress> targets : cellPrecedents.values()) {
            count += targets.size();
        }
        for (Set<RangeNode> nodes : rangePrecedents.values()) {
            count += nodes.size();
        }
        return count;
    }

    /**
     * Plans the evaluation of {@code changed} and everything downstream of it.
     * Kahn's algorithm schedules the acyclic part level by level, each level
     * sorted by (sheet index, row, column). Cells it cannot schedule are
     * split into strongly-connected components and appended in topological
     * order.
     */
    public EvaluationPlan computeOrder(Collection<CellAddress> changed) {
        Map<CellAddress, Set<CellAddress>> successors = new HashMap<>();
        Deque<CellAddress> queue = new ArrayDeque<>(changed);
        Set<CellAddress> affected = new HashSet<>(changed);
        while (!queue.isEmpty()) {
            CellAddress current = queue.poll();
            Set<CellAddress> next = dependentsOf(current);
            successors.put(current, next);
            for (CellAddress dependent : next) {
                if (affected.add(dependent)) {
                    queue.add(dependent);
                }
            }
        }

        Map<CellAddress, Integer> inDegree = new HashMap<>();
        for (CellAddress cell : affected) {
            inDegree.putIfAbsent(cell, 0);
            for (CellAddress dependent : successors.get(cell)) {
                inDegree.merge(dependent, 1, Integer::sum);
            }
        }

        List<List<CellAddress>> levels = new ArrayList<>();
        TreeSet<CellAddress> ready = new TreeSet<>();
        for (Map.Entry<CellAddress, Integer> entry : inDegree.entrySet()) {
            if (entry.getValue() == 0) {
                ready.add(entry.getKey());
            }
        }
        Set<CellAddress> scheduled = new HashSet<>();
        while (!ready.isEmpty()) {
            List<CellAddress> level = new ArrayList<>(ready);
            levels.add(level);
            scheduled.addAll(level);
            ready = new TreeSet<>();
            for (CellAddress cell : level) {
                for (CellAddress dependent : successors.get(cell)) {
                    if (inDegree.merge(dependent, -1, Integer::sum) == 0) {
                        ready.add(dependent);
                    }
                }
            }
        }

        List<EvaluationBlock> blocks = new ArrayList<>();
        if (scheduled.size() < affected.size()) {
            TreeSet<CellAddress> leftover = new TreeSet<>(affected);
            leftover.removeAll(scheduled);
            List<List<CellAddress>> components = StronglyConnectedComponents.find(leftover, cell -> {
                List<CellAddress> within = new ArrayList<>();
                for (CellAddress dependent : successors.get(cell)) {
                    if (leftover.contains(dependent)) {
                        within.add(dependent);
                    }
                }
                return within;
            });
            Collections.reverse(components);
            for (List<CellAddress> component : components) {
                CellAddress first = component.get(0);
                boolean cyclic = component.size() > 1 || successors.get(first).contains(first);
                blocks.add(new EvaluationBlock(component, cyclic));
            }
        }

        EvaluationPlan plan = new EvaluationPlan(levels, blocks);
        log.debug("Planned {} from {} changed cells", plan, changed.size());
        return plan;
    }

    /**
     * Every cycle in the graph: components with more than one cell, plus
     * cells that read themselves. Sorted by their first member.
     */
    public List<Set<CellAddress>> detectCycles() {
        Set<CellAddress> formulaCells = new TreeSet<>(cellPrecedents.keySet());
        formulaCells.addAll(rangePrecedents.keySet());
        Map<CellAddress, Set<CellAddress>> successors = new HashMap<>();
        for (CellAddress cell : formulaCells) {
            successors.put(cell, dependentsOf(cell));
        }
        List<Set<CellAddress>> cycles = new ArrayList<>();
        for (List<CellAddress> component : StronglyConnectedComponents.find(formulaCells, successors::get)) {
            CellAddress first = component.get(0);
            if (component.size() > 1 || successors.get(first).contains(first)) {
                cycles.add(new TreeSet<>(component));
            }
        }
        cycles.sort((a, b) -> a.iterator().next().compareTo(b.iterator().next()));
        return cycles;
    }

    private void addCellEdge(CellAddress source, CellAddress target) {
        cellPrecedents.computeIfAbsent(source, k -> new HashSet<>()).add(target);
        cellDependents.computeIfAbsent(target, k -> new HashSet<>()).add(source);
    }

    private void removeCellEdge(CellAddress source, CellAddress target) {
        removeFrom(cellPrecedents, source, target);
        removeFrom(cellDependents, target, source);
    }

    private void addRangeEdge(CellAddress source, RangeAddress range) {
        RangeNode node = rangeNodes.get(range);
        if (node == null) {
            node = new RangeNode(range);
            rangeNodes.put(range, node);
            rangeIndex.add(node);
        }
        node.addDependent(source);
        rangePrecedents.computeIfAbsent(source, k -> new HashSet<>()).add(node);
    }

    private void removeRangeEdge(CellAddress source, RangeAddress range) {
        RangeNode node = rangeNodes.get(range);
        if (node == null) {
            return;
        }
        node.removeDependent(source);
        removeFrom(rangePrecedents, source, node);
        if (node.isUnused()) {
            rangeNodes.remove(range);
            rangeIndex.remove(node);
        }
    }

    private void removeName(CellAddress cell, String name) {
        removeFrom(namesUsed, cell, name);
        removeFrom(nameDependents, name, cell);
    }

    private static <K, V> void removeFrom(Map<K, Set<V>> map, K key, V value) {
        Set<V> set = map.get(key);
        if (set != null) {
            set.remove(value);
            if (set.isEmpty()) {
                map.remove(key);
            }
        }
    }
}
