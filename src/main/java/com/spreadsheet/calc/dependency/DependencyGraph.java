package com.spreadsheet.calc.dependency;

import com.spreadsheet.calc.exceptions.CircularReferenceException;
import com.spreadsheet.calc.models.CellAddress;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Tracks which cells each formula reads:
 * - forward: formula cell -> cells it references
 * - reverse: referenced cell -> formula cells that read it
 * The graph never holds a cycle; edges that would close one are rejected
 * before anything is changed.
 * Not synchronised: the owning facade serialises access.
 */
public class DependencyGraph {

    private final Map<CellAddress, Set<CellAddress>> forward = new HashMap<>();
    private final Map<CellAddress, Set<CellAddress>> reverse = new HashMap<>();
    private final Set<CellAddress> formulaCells = new HashSet<>();

    /**
     * Throws {@link CircularReferenceException} if giving {@code cell} these
     * dependencies would close a loop. Does not modify the graph.
     */
    public void validateDependencies(CellAddress cell, Collection<CellAddress> dependencies) {
        if (dependencies.contains(cell)) {
            throw new CircularReferenceException(List.of(cell, cell));
        }
        for (CellAddress dependency : new TreeSet<>(dependencies)) {
            List<CellAddress> path = findPath(dependency, cell);
            if (path != null) {
                List<CellAddress> cycle = new ArrayList<>();
                cycle.add(cell);
                cycle.addAll(path);
                throw new CircularReferenceException(cycle);
            }
        }
    }

    /**
     * Replaces the recorded dependencies of a formula cell. All-or-nothing:
     * on a cycle the previous edges stay in place.
     */
    public void setDependencies(CellAddress cell, Collection<CellAddress> dependencies) {
        validateDependencies(cell, dependencies);
        clearEdges(cell);
        Set<CellAddress> targets = new HashSet<>(dependencies);
        if (!targets.isEmpty()) {
            forward.put(cell, targets);
        }
        for (CellAddress target : targets) {
            reverse.computeIfAbsent(target, k -> new HashSet<>()).add(cell);
        }
        formulaCells.add(cell);
    }

    /**
     * Forgets the outgoing edges of {@code cell}; cells that read it keep their edges.
     */
    public void removeDependencies(CellAddress cell) {
        clearEdges(cell);
        formulaCells.remove(cell);
    }

    public boolean isFormulaCell(CellAddress cell) {
        return formulaCells.contains(cell);
    }

    /**
     * Formula cells that read {@code cell} directly.
     */
    public SortedSet<CellAddress> getDependents(CellAddress cell) {
        return new TreeSet<>(reverse.getOrDefault(cell, Collections.emptySet()));
    }

    /**
     * Cells the formula in {@code cell} reads directly.
     */
    public SortedSet<CellAddress> getDependencies(CellAddress cell) {
        return new TreeSet<>(forward.getOrDefault(cell, Collections.emptySet()));
    }

    /**
     * Every cell that reads any of {@code cells}, directly or through other formulas.
     * The start cells are only included if they themselves depend on another start cell.
     */
    public Set<CellAddress> getTransitiveDependents(Collection<CellAddress> cells) {
        Set<CellAddress> result = new HashSet<>();
        Deque<CellAddress> queue = new ArrayDeque<>(cells);
        while (!queue.isEmpty()) {
            CellAddress current = queue.poll();
            for (CellAddress dependent : reverse.getOrDefault(current, Collections.emptySet())) {
                if (result.add(dependent)) {
                    queue.add(dependent);
                }
            }
        }
        return result;
    }

    /**
     * All formula cells, dependencies before dependents.
     * Cells that are ready at the same time come out in row-major address order.
     */
    public List<CellAddress> getCalculationOrder() {
        return topologicalOrder(formulaCells);
    }

    /**
     * Orders {@code cells} so that each comes after every other member it depends on,
     * directly or through cells outside the set. Ties are broken by address.
     */
    public List<CellAddress> topologicalOrder(Collection<CellAddress> cells) {
        Set<CellAddress> members = new HashSet<>(cells);
        Map<CellAddress, Integer> pending = new HashMap<>();
        for (CellAddress cell : members) {
            pending.put(cell, 0);
        }
        Map<CellAddress, Set<CellAddress>> successors = new HashMap<>();
        for (CellAddress cell : members) {
            for (CellAddress upstream : upstreamMembers(cell, members)) {
                successors.computeIfAbsent(upstream, k -> new HashSet<>()).add(cell);
                pending.merge(cell, 1, Integer::sum);
            }
        }

        PriorityQueue<CellAddress> ready = new PriorityQueue<>();
        for (Map.Entry<CellAddress, Integer> entry : pending.entrySet()) {
            if (entry.getValue() == 0) {
                ready.add(entry.getKey());
            }
        }
        List<CellAddress> order = new ArrayList<>(members.size());
        while (!ready.isEmpty()) {
            CellAddress cell = ready.poll();
            order.add(cell);
            for (CellAddress next : successors.getOrDefault(cell, Collections.emptySet())) {
                if (pending.merge(next, -1, Integer::sum) == 0) {
                    ready.add(next);
                }
            }
        }
        if (order.size() < members.size()) {
            // unreachable while the no-cycle invariant holds
            throw new IllegalStateException("Dependency graph contains a cycle");
        }
        return order;
    }

    public void clear() {
        forward.clear();
        reverse.clear();
        formulaCells.clear();
    }

    /**
     * Members of {@code members} that {@code cell} reaches by following forward edges,
     * stopping at the first member on each path.
     */
    private Set<CellAddress> upstreamMembers(CellAddress cell, Set<CellAddress> members) {
        Set<CellAddress> found = new HashSet<>();
        Set<CellAddress> visited = new HashSet<>();
        Deque<CellAddress> stack = new ArrayDeque<>(forward.getOrDefault(cell, Collections.emptySet()));
        while (!stack.isEmpty()) {
            CellAddress current = stack.pop();
            if (!visited.add(current)) {
                continue;
            }
            if (members.contains(current)) {
                found.add(current);
            } else {
                stack.addAll(forward.getOrDefault(current, Collections.emptySet()));
            }
        }
        return found;
    }

    /**
     * Depth-first search along forward edges. Returns the path from {@code from}
     * to {@code to} (both included), or null if {@code to} is unreachable.
     * Iterative so long reference chains cannot overflow the stack.
     */
    private List<CellAddress> findPath(CellAddress from, CellAddress to) {
        Map<CellAddress, CellAddress> parent = new HashMap<>();
        Set<CellAddress> visited = new HashSet<>();
        Deque<CellAddress> stack = new ArrayDeque<>();
        stack.push(from);
        visited.add(from);
        while (!stack.isEmpty()) {
            CellAddress current = stack.pop();
            if (current.equals(to)) {
                List<CellAddress> path = new ArrayList<>();
                for (CellAddress step = current; step != null; step = parent.get(step)) {
                    path.add(0, step);
                }
                return path;
            }
            for (CellAddress next : forward.getOrDefault(current, Collections.emptySet())) {
                if (visited.add(next)) {
                    parent.put(next, current);
                    stack.push(next);
                }
            }
        }
        return null;
    }

    private void clearEdges(CellAddress cell) {
        Set<CellAddress> oldTargets = forward.remove(cell);
        if (oldTargets == null) {
            return;
        }
        for (CellAddress target : oldTargets) {
            Set<CellAddress> readers = reverse.get(target);
            if (readers != null) {
                readers.remove(cell);
                if (readers.isEmpty()) {
                    reverse.remove(target);
                }
            }
        }
    }
}
