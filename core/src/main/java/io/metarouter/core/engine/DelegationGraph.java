package io.metarouter.core.engine;

import io.metarouter.core.model.MetaAgentDefinition;
import io.metarouter.core.model.RoutingRule;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Directed graph of "may delegate to" edges between agents, with depth-bounded cycle
 * detection.
 *
 * <p>
 * Edges are deduplicated; repeated {@link #trackDelegation} calls only bump a multiplicity
 * counter. Targets keep first-insertion order.
 *
 * <p>
 * The cycle search is a depth-first search bounded by {@code maxDepth} edges. Each branch
 * carries its own copy of the visited set, so sibling branches do not see each other's
 * nodes. A node seen twice on one branch counts as a cycle even when it is not the target.
 * Cycles longer than the bound are not reported.
 *
 * <p>
 * Not thread-safe for mutation. Build it fully, then share it read-only.
 */
public final class DelegationGraph {

    private final Map<String, Map<String, Integer>> edges = new LinkedHashMap<>();

    /**
     * Builds the graph of a configuration: for each meta-agent, an edge to every declared
     * delegate and to every rule target.
     */
    public static DelegationGraph fromConfig(Map<String, MetaAgentDefinition> metaAgents) {
        DelegationGraph graph = new DelegationGraph();
        metaAgents.forEach((name, definition) -> {
            for (String delegate : definition.delegatesTo()) {
                graph.trackDelegation(name, delegate);
            }
            for (RoutingRule rule : definition.routingRules()) {
                graph.trackDelegation(name, rule.targetAgent());
            }
        });
        return graph;
    }

    /** Records the edge {@code from -> to}, or bumps its count if it already exists. */
    public void trackDelegation(String from, String to) {
        edges.computeIfAbsent(from, k -> new LinkedHashMap<>()).merge(to, 1, Integer::sum);
    }

    /** Number of times {@code from -> to} was tracked, 0 if never. */
    public int delegationCount(String from, String to) {
        Map<String, Integer> targets = edges.get(from);
        if (targets == null) {
            return 0;
        }
        return targets.getOrDefault(to, 0);
    }

    /** Distinct targets of {@code from}, in first-insertion order. */
    public List<String> targetsOf(String from) {
        Map<String, Integer> targets = edges.get(from);
        return targets == null ? List.of() : List.copyOf(targets.keySet());
    }

    /** Number of distinct edges. */
    public int edgeCount() {
        return edges.values().stream().mapToInt(Map::size).sum();
    }

    /**
     * Returns true if {@code to} is reachable from {@code from} within {@code maxDepth} edges,
     * or a node repeats on the explored branch.
     */
    public boolean hasCircularPath(String from, String to, int maxDepth) {
        return findCircularPath(from, to, maxDepth).isPresent();
    }

    /**
     * Searches for a path from {@code from} back to {@code to}.
     *
     * @return the node sequence of the first path found (starting at {@code from}), or empty
     */
    public Optional<List<String>> findCircularPath(String from, String to, int maxDepth) {
        List<String> path = new ArrayList<>();
        if (search(from, to, maxDepth, Collections.emptySet(), path)) {
            return Optional.of(List.copyOf(path));
        }
        return Optional.empty();
    }

    private boolean search(String current, String target, int depth, Set<String> visited, List<String> path) {
        if (depth <= 0) {
            return false;
        }
        path.add(current);
        if (visited.contains(current) || current.equals(target)) {
            return true;
        }
        Set<String> branch = new HashSet<>(visited);
        branch.add(current);
        for (String next : targetsOf(current)) {
            if (search(next, target, depth - 1, new HashSet<>(branch), path)) {
                return true;
            }
        }
        path.remove(path.size() - 1);
        return false;
    }
}
