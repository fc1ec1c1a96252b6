package com.opsdiag.topology;

import com.opsdiag.model.Criticality;
import com.opsdiag.model.ServiceNode;
import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.function.Function;

/**
 * Immutable view of the service graph. Nodes reference each other by name; the
 * reverse (dependent) edges are derived once at construction.
 */
public final class TopologySnapshot {

    private final long version;
    private final Map<String, ServiceNode> nodes;
    private final Map<String, Set<String>> dependents;

    public TopologySnapshot(long version, Collection<ServiceNode> services) {
        this.version = version;
        Map<String, ServiceNode> byName = new TreeMap<>();
        Map<String, Set<String>> reverse = new HashMap<>();
        for (ServiceNode node : services) {
            if (byName.putIfAbsent(node.name(), node) != null) {
                throw new TopologyException("duplicate service in topology: " + node.name());
            }
            for (String dependency : node.dependencies()) {
                reverse.computeIfAbsent(dependency, key -> new HashSet<>()).add(node.name());
            }
        }
        this.nodes = Map.copyOf(byName);
        Map<String, Set<String>> frozen = new HashMap<>();
        reverse.forEach((k, v) -> frozen.put(k, Set.copyOf(v)));
        this.dependents = Map.copyOf(frozen);
    }

    public static TopologySnapshot empty() {
        return new TopologySnapshot(0, Set.of());
    }

    public long version() {
        return version;
    }

    public Collection<ServiceNode> services() {
        return nodes.values();
    }

    public boolean contains(String service) {
        return nodes.containsKey(service);
    }

    public ServiceNode node(String service) {
        ServiceNode node = nodes.get(service);
        if (node == null) {
            throw new UnknownServiceException(service);
        }
        return node;
    }

    public Criticality criticality(String service) {
        return node(service).criticality();
    }

    /** Services reachable within {@code hops} edges in either direction, excluding {@code service}. */
    public Set<String> neighbors(String service, int hops) {
        return traverse(service, hops, name -> {
            Set<String> next = new LinkedHashSet<>(dependenciesOf(name));
            next.addAll(dependents.getOrDefault(name, Set.of()));
            return next;
        });
    }

    /** Services {@code service} depends on, directly or transitively, within {@code hops} edges. */
    public Set<String> dependenciesWithin(String service, int hops) {
        return traverse(service, hops, this::dependenciesOf);
    }

    private Set<String> dependenciesOf(String service) {
        ServiceNode node = nodes.get(service);
        return node == null ? Set.of() : node.dependencies();
    }

    private Set<String> traverse(String start, int hops, Function<String, Set<String>> edges) {
        Set<String> visited = new LinkedHashSet<>();
        if (start == null || hops <= 0) {
            return visited;
        }
        visited.add(start);
        Deque<String> frontier = new ArrayDeque<>();
        frontier.add(start);
        for (int depth = 0; depth < hops && !frontier.isEmpty(); depth++) {
            Deque<String> next = new ArrayDeque<>();
            for (String current : frontier) {
                for (String candidate : edges.apply(current)) {
                    if (visited.add(candidate)) {
                        next.add(candidate);
                    }
                }
            }
            frontier = next;
        }
        visited.remove(start);
        return Set.copyOf(visited);
    }
}
