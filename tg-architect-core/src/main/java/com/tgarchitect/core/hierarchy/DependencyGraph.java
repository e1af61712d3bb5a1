package com.tgarchitect.core.hierarchy;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Directed graph of configuration files.
 *
 * <p>An edge {@code A -> B} means that A includes or depends on B, so B runs first.
 * Cycles are kept as {@link CycleError} data; their members and every node that depends on
 * them are left out of {@link #executionOrder()}, while the rest of the graph is still
 * ordered.
 *
 * @param nodes node ids in insertion order
 * @param dependencies node to the nodes it points at
 * @param dependents node to the nodes pointing at it
 * @param roots nodes without dependencies
 * @param leaves nodes without dependents
 * @param executionOrder topological order, dependencies first
 * @param cycles cycles found
 */
public record DependencyGraph(
    Set<String> nodes,
    Map<String, Set<String>> dependencies,
    Map<String, Set<String>> dependents,
    List<String> roots,
    List<String> leaves,
    List<String> executionOrder,
    List<CycleError> cycles
) {
    public DependencyGraph {
        nodes = Collections.unmodifiableSet(new LinkedHashSet<>(nodes));
        dependencies = freeze(dependencies);
        dependents = freeze(dependents);
        roots = List.copyOf(roots);
        leaves = List.copyOf(leaves);
        executionOrder = List.copyOf(executionOrder);
        cycles = List.copyOf(cycles);
    }

    /**
     * Builds a graph from an adjacency map. Targets missing from the key set become nodes too.
     *
     * @param adjacency node to the nodes it points at, iteration order is kept
     * @return graph with cycles detected and an execution order computed
     */
    public static DependencyGraph of(Map<String, ? extends Collection<String>> adjacency) {
        Map<String, Set<String>> dependencies = new LinkedHashMap<>();
        adjacency.forEach((node, targets) -> {
            dependencies.computeIfAbsent(node, k -> new LinkedHashSet<>());
            for (String target : targets) {
                if (!target.equals(node)) {
                    dependencies.get(node).add(target);
                }
                dependencies.computeIfAbsent(target, k -> new LinkedHashSet<>());
            }
        });
        // A self edge is a one-node cycle.
        List<String> selfLoops = new ArrayList<>();
        adjacency.forEach((node, targets) -> {
            if (targets.contains(node)) {
                selfLoops.add(node);
            }
        });

        Map<String, Set<String>> dependents = new LinkedHashMap<>();
        dependencies.keySet().forEach(node -> dependents.put(node, new LinkedHashSet<>()));
        dependencies.forEach((node, targets) -> targets.forEach(target -> dependents.get(target).add(node)));

        List<CycleError> cycles = new ArrayList<>();
        selfLoops.forEach(node -> cycles.add(new CycleError(List.of(node, node))));
        cycles.addAll(detectCycles(dependencies));

        Set<String> blocked = new HashSet<>();
        cycles.forEach(cycle -> blocked.addAll(cycle.members()));

        List<String> roots = dependencies.entrySet().stream()
            .filter(e -> e.getValue().isEmpty())
            .map(Map.Entry::getKey)
            .toList();
        List<String> leaves = dependents.entrySet().stream()
            .filter(e -> e.getValue().isEmpty())
            .map(Map.Entry::getKey)
            .toList();

        return new DependencyGraph(
            dependencies.keySet(),
            dependencies,
            dependents,
            roots,
            leaves,
            topologicalOrder(dependencies, dependents, blocked),
            cycles);
    }

    public boolean hasCycles() {
        return !cycles.isEmpty();
    }

    public Set<String> dependenciesOf(String node) {
        return dependencies.getOrDefault(node, Set.of());
    }

    public Set<String> dependentsOf(String node) {
        return dependents.getOrDefault(node, Set.of());
    }

    /**
     * Collects every node reachable from the given ones, including themselves.
     *
     * @param targets start nodes
     * @return transitive dependencies
     */
    public Set<String> transitiveDependencies(Collection<String> targets) {
        Set<String> seen = new LinkedHashSet<>();
        Deque<String> pending = new ArrayDeque<>(targets);
        while (!pending.isEmpty()) {
            String node = pending.pop();
            if (seen.add(node)) {
                pending.addAll(dependenciesOf(node));
            }
        }
        return seen;
    }

    /**
     * Throws if the graph has a cycle.
     *
     * @return this graph
     * @throws com.tgarchitect.core.error.CycleException for the first cycle
     */
    public DependencyGraph requireAcyclic() {
        if (hasCycles()) {
            throw cycles.get(0).toException();
        }
        return this;
    }

    // ==================== Algorithms ====================

    /**
     * Three-color depth first search. Each back edge yields one cycle.
     */
    private static List<CycleError> detectCycles(Map<String, Set<String>> dependencies) {
        List<CycleError> cycles = new ArrayList<>();
        Set<String> done = new HashSet<>();
        Set<String> onStack = new HashSet<>();

        for (String start : dependencies.keySet()) {
            if (done.contains(start)) {
                continue;
            }
            // Iterative to keep deep chains off the call stack.
            Deque<String> path = new ArrayDeque<>();
            Deque<Iterator<String>> iterators = new ArrayDeque<>();
            path.addLast(start);
            onStack.add(start);
            iterators.push(dependencies.get(start).iterator());

            while (!iterators.isEmpty()) {
                Iterator<String> it = iterators.peek();
                if (!it.hasNext()) {
                    iterators.pop();
                    String finished = path.removeLast();
                    onStack.remove(finished);
                    done.add(finished);
                    continue;
                }
                String next = it.next();
                if (onStack.contains(next)) {
                    List<String> cycle = new ArrayList<>();
                    boolean inCycle = false;
                    for (String node : path) {
                        inCycle = inCycle || node.equals(next);
                        if (inCycle) {
                            cycle.add(node);
                        }
                    }
                    cycle.add(next);
                    cycles.add(new CycleError(cycle));
                } else if (!done.contains(next)) {
                    path.addLast(next);
                    onStack.add(next);
                    iterators.push(dependencies.get(next).iterator());
                }
            }
        }
        return cycles;
    }

    /**
     * Kahn's algorithm. Blocked nodes never enter the queue, so nothing downstream of them
     * is ordered either.
     */
    private static List<String> topologicalOrder(
            Map<String, Set<String>> dependencies,
            Map<String, Set<String>> dependents,
            Set<String> blocked) {
        Map<String, Integer> remaining = new HashMap<>();
        Deque<String> queue = new ArrayDeque<>();
        dependencies.forEach((node, targets) -> {
            remaining.put(node, targets.size());
            if (targets.isEmpty() && !blocked.contains(node)) {
                queue.add(node);
            }
        });

        List<String> order = new ArrayList<>();
        while (!queue.isEmpty()) {
            String node = queue.poll();
            order.add(node);
            for (String dependent : dependents.get(node)) {
                int left = remaining.merge(dependent, -1, Integer::sum);
                if (left == 0 && !blocked.contains(dependent)) {
                    queue.add(dependent);
                }
            }
        }
        return order;
    }

    private static Map<String, Set<String>> freeze(Map<String, Set<String>> map) {
        Map<String, Set<String>> copy = new LinkedHashMap<>();
        map.forEach((k, v) -> copy.put(k, Collections.unmodifiableSet(new LinkedHashSet<>(v))));
        return Collections.unmodifiableMap(copy);
    }
}
