package com.herzen.mastery.graph;

import com.herzen.mastery.domain.DomainModels.ConceptNode;
import com.herzen.mastery.graph.KnowledgeGraphModels.Relationship;

import java.util.*;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * In-memory directed multigraph of concepts. Several edges of different types may connect the
 * same pair of concepts; an identical (source, target, type) edge is stored once.
 * <p>
 * Iteration order follows insertion order so every traversal is deterministic. Instances are not
 * thread-safe: build one per request or inference run.
 */
public class ConceptGraph {
    private final Map<String, ConceptNode> nodes = new LinkedHashMap<>();
    private final List<Relationship> edges = new ArrayList<>();
    private final Map<String, List<Relationship>> outgoing = new HashMap<>();
    private final Map<String, List<Relationship>> incoming = new HashMap<>();

    public void addNode(ConceptNode node) {
        nodes.put(node.id(), node);
        outgoing.computeIfAbsent(node.id(), k -> new ArrayList<>());
        incoming.computeIfAbsent(node.id(), k -> new ArrayList<>());
    }

    public Optional<ConceptNode> getNode(String id) {
        return Optional.ofNullable(nodes.get(id));
    }

    public boolean hasNode(String id) {
        return nodes.containsKey(id);
    }

    public List<ConceptNode> nodes() {
        return List.copyOf(nodes.values());
    }

    public List<String> nodeIds() {
        return List.copyOf(nodes.keySet());
    }

    public int size() {
        return nodes.size();
    }

    public boolean addEdge(Relationship edge) {
        if (!hasNode(edge.source()) || !hasNode(edge.target())) {
            throw new IllegalArgumentException("Edge references unknown concept: " + edge.source() + "->" + edge.target());
        }
        if (hasEdge(edge.source(), edge.target(), edge.type())) return false;

        edges.add(edge);
        outgoing.get(edge.source()).add(edge);
        incoming.get(edge.target()).add(edge);
        return true;
    }

    public List<Relationship> edges() {
        return Collections.unmodifiableList(edges);
    }

    public List<Relationship> edges(Predicate<Relationship> filter) {
        return edges.stream().filter(filter).toList();
    }

    public int edgeCount() {
        return edges.size();
    }

    public List<Relationship> outgoingEdges(String id) {
        return Collections.unmodifiableList(outgoing.getOrDefault(id, List.of()));
    }

    public List<Relationship> incomingEdges(String id) {
        return Collections.unmodifiableList(incoming.getOrDefault(id, List.of()));
    }

    public List<String> neighbors(String id) {
        return outgoing.getOrDefault(id, List.of()).stream()
                .map(Relationship::target)
                .distinct()
                .toList();
    }

    public boolean hasEdge(String source, String target) {
        return outgoing.getOrDefault(source, List.of()).stream().anyMatch(e -> e.target().equals(target));
    }

    public boolean hasEdge(String source, String target, String type) {
        return outgoing.getOrDefault(source, List.of()).stream()
                .anyMatch(e -> e.target().equals(target) && e.type().equals(type));
    }

    public boolean hasPath(String source, String target) {
        if (source.equals(target)) return true;

        Set<String> visited = new HashSet<>();
        Deque<String> queue = new ArrayDeque<>();
        visited.add(source);
        queue.add(source);
        while (!queue.isEmpty()) {
            String current = queue.poll();
            for (Relationship edge : outgoing.getOrDefault(current, List.of())) {
                if (edge.target().equals(target)) return true;
                if (visited.add(edge.target())) {
                    queue.add(edge.target());
                }
            }
        }
        return false;
    }

    /**
     * Enumerates simple paths starting at {@code start} with 1 to {@code maxLength} edges, following
     * only edges accepted by {@code edgeFilter}. Each path is the ordered list of node ids, start included.
     * A node is never repeated within one path, so cycles end the walk instead of looping.
     */
    public List<List<String>> findAllPaths(String start, int maxLength, Predicate<Relationship> edgeFilter) {
        List<List<String>> paths = new ArrayList<>();
        if (!hasNode(start) || maxLength < 1) return paths;

        Deque<String> path = new ArrayDeque<>();
        Set<String> onPath = new HashSet<>();
        path.addLast(start);
        onPath.add(start);
        walk(start, maxLength, edgeFilter == null ? e -> true : edgeFilter, path, onPath, paths);
        return paths;
    }

    private void walk(String current,
                      int remaining,
                      Predicate<Relationship> edgeFilter,
                      Deque<String> path,
                      Set<String> onPath,
                      List<List<String>> out) {
        if (remaining == 0) return;

        Set<String> expanded = new HashSet<>();
        // copy: callers may add virtual edges between enumerations
        for (Relationship edge : List.copyOf(outgoing.getOrDefault(current, List.of()))) {
            String next = edge.target();
            if (!edgeFilter.test(edge) || onPath.contains(next) || !expanded.add(next)) continue;

            path.addLast(next);
            onPath.add(next);
            out.add(List.copyOf(path));
            walk(next, remaining - 1, edgeFilter, path, onPath, out);
            path.removeLast();
            onPath.remove(next);
        }
    }

    public List<String> getPrerequisites(String id, boolean recursive) {
        return collect(id, recursive, incoming, Relationship::source);
    }

    public List<String> getPostrequisites(String id) {
        return getPostrequisites(id, false);
    }

    public List<String> getPostrequisites(String id, boolean recursive) {
        return collect(id, recursive, outgoing, Relationship::target);
    }

    private List<String> collect(String id,
                                 boolean recursive,
                                 Map<String, List<Relationship>> adjacency,
                                 Function<Relationship, String> endpoint) {
        List<String> direct = adjacency.getOrDefault(id, List.of()).stream().map(endpoint).distinct().toList();
        if (!recursive) return direct;

        Set<String> all = new LinkedHashSet<>(direct);
        Deque<String> pending = new ArrayDeque<>(direct);
        while (!pending.isEmpty()) {
            String current = pending.pop();
            for (Relationship edge : adjacency.getOrDefault(current, List.of())) {
                String next = endpoint.apply(edge);
                if (all.add(next)) {
                    pending.push(next);
                }
            }
        }
        all.remove(id);
        return List.copyOf(all);
    }
}
