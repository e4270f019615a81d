package com.spreadsheet.calc.graph;

import com.spreadsheet.calc.models.CellAddress;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * Tarjan's algorithm with an explicit stack, so long dependency chains
 * cannot overflow the call stack.
 */
final class StronglyConnectedComponents {

    private StronglyConnectedComponents() {
    }

    /**
     * Returns the components of the graph spanned by {@code nodes}, each
     * sorted by address. A component is listed only after every component it
     * can reach, so the reversed list is a topological order.
     *
     * @param successors must only return members of {@code nodes}
     */
    static List<List<CellAddress>> find(Collection<CellAddress> nodes,
                                        Function<CellAddress, Collection<CellAddress>> successors) {
        Map<CellAddress, Integer> index = new HashMap<>();
        Map<CellAddress, Integer> low = new HashMap<>();
        Deque<CellAddress> stack = new ArrayDeque<>();
        Set<CellAddress> onStack = new HashSet<>();
        List<List<CellAddress>> components = new ArrayList<>();
        int counter = 0;

        for (CellAddress root : nodes) {
            if (index.containsKey(root)) {
                continue;
            }
            Deque<Frame> work = new ArrayDeque<>();
            index.put(root, counter);
            low.put(root, counter);
            counter++;
            stack.push(root);
            onStack.add(root);
            work.push(new Frame(root, successors.apply(root).iterator()));

            while (!work.isEmpty()) {
                Frame frame = work.peek();
                if (frame.successors.hasNext()) {
                    CellAddress next = frame.successors.next();
                    if (!index.containsKey(next)) {
                        index.put(next, counter);
                        low.put(next, counter);
                        counter++;
                        stack.push(next);
                        onStack.add(next);
                        work.push(new Frame(next, successors.apply(next).iterator()));
                    } else if (onStack.contains(next)) {
                        low.put(frame.node, Math.min(low.get(frame.node), index.get(next)));
                    }
                    continue;
                }
                work.pop();
                if (!work.isEmpty()) {
                    CellAddress parent = work.peek().node;
                    low.put(parent, Math.min(low.get(parent), low.get(frame.node)));
                }
                if (low.get(frame.node).equals(index.get(frame.node))) {
                    List<CellAddress> component = new ArrayList<>();
                    CellAddress member;
                    do {
                        member = stack.pop();
                        onStack.remove(member);
                        component.add(member);
                    } while (!member.equals(frame.node));
                    Collections.sort(component);
                    components.add(component);
                }
            }
        }
        return components;
    }

    private static final class Frame {
        final CellAddress node;
        final Iterator<CellAddress> successors;

        Frame(CellAddress node, Iterator<CellAddress> successors) {
            this.node = node;
            this.successors = successors;
        }
    }
}
