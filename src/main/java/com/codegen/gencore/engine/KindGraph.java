package com.codegen.gencore.engine;

import com.codegen.gencore.api.*;
import com.codegen.gencore.store.RelationStore;

import java.util.*;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Registry of kinds and the transforms between them, kept as a DAG.
 *
 * <p>
 * Kinds and edges are append-only. Every {@link #connect} runs a reachability
 * search from the candidate target back toward the candidate source before the
 * edge is written, so the graph can never hold a cycle, a self-loop, or an edge
 * to an undefined kind. The check and the write happen under one lock, which
 * makes racing connects serialize instead of slipping two edges past each
 * other.
 *
 * <p>
 * Traversals (route, dependents, topological order) walk edges in definition
 * order. Among equal-length routes the one whose first differing edge was
 * defined earliest wins, so results are stable for a fixed graph.
 *
 * <p>
 * Storage layout: relation {@code kind} keyed by name, relation {@code edge}
 * keyed by {@code from:to:relation}.
 */
public final class KindGraph {
    private static final Logger log = LogManager.getLogger(KindGraph.class);

    static final String KINDS = "kind";
    static final String EDGES = "edge";

    private final RelationStore store;
    private final Object writeLock = new Object();

    public KindGraph(RelationStore store) {
        this.store = Objects.requireNonNull(store, "store");
    }

    // ── Definition ─────────────────────────────────────────────────

    /**
     * Registers a kind. Defining an existing name is a benign no-op and keeps the
     * original category.
     */
    public DefineResult define(String name, String category) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(category, "category");
        synchronized (writeLock) {
            if (store.get(KINDS, name).isPresent())
                return new DefineResult.Exists(name);

            ObjectNode record = JsonNodeFactory.instance.objectNode()
                    .put("name", name)
                    .put("category", category);
            store.put(KINDS, name, record);
            log.debug("Defined kind {} ({})", name, category);
            return new DefineResult.Ok(new Kind(name, category));
        }
    }

    /**
     * Adds the edge {@code from -> to}.
     *
     * @param transform name of the transform performing the conversion, may be
     *                  null.
     * @return {@link EdgeVerdict#OK}, or {@link EdgeVerdict.Invalid} for a
     *         self-loop, an undefined kind, or an edge that would close a cycle.
     */
    public EdgeVerdict connect(String from, String to, String relation, String transform) {
        Objects.requireNonNull(from, "from");
        Objects.requireNonNull(to, "to");
        Objects.requireNonNull(relation, "relation");
        synchronized (writeLock) {
            if (from.equals(to))
                return reject(new EdgeVerdict.Invalid("Self-loop not allowed: '" + from + "'"));

            boolean fromExists = store.get(KINDS, from).isPresent();
            boolean toExists = store.get(KINDS, to).isPresent();
            if (!fromExists || !toExists)
                return reject(new EdgeVerdict.Invalid(
                        "Kind '" + (fromExists ? to : from) + "' not defined"));

            if (reaches(to, from, adjacency(edges())))
                return reject(new EdgeVerdict.Invalid("Connecting '" + from + "' -> '" + to
                        + "' would create a cycle: '" + to + "' already reaches '" + from + "'"));

            ObjectNode record = JsonNodeFactory.instance.objectNode()
                    .put("from", from)
                    .put("to", to)
                    .put("relation", relation)
                    .put("transform", transform);
            store.put(EDGES, edgeKey(from, to, relation), record);
            log.debug("Connected {} --{}--> {} ({})", from, relation, to, transform);
            return EdgeVerdict.OK;
        }
    }

    private static EdgeVerdict reject(EdgeVerdict.Invalid invalid) {
        log.warn("Rejected edge: {}", invalid.message());
        return invalid;
    }

    // ── Queries ────────────────────────────────────────────────────

    /**
     * Shortest hop sequence from {@code from} to {@code to} (uniform edge cost).
     * The starting kind is not part of the path; routing a defined kind to itself
     * yields an empty path.
     */
    public RouteResult route(String from, String to) {
        if (!contains(from))
            return new RouteResult.Unreachable("Kind '" + from + "' not defined");
        if (!contains(to))
            return new RouteResult.Unreachable("Kind '" + to + "' not defined");

        Map<String, List<Edge>> adjacency = adjacency(edges());
        Map<String, Edge> reachedBy = new HashMap<>();
        Set<String> visited = new HashSet<>();
        Deque<String> queue = new ArrayDeque<>();
        queue.add(from);
        visited.add(from);

        while (!queue.isEmpty()) {
            String current = queue.poll();
            if (current.equals(to)) {
                LinkedList<Hop> path = new LinkedList<>();
                for (String node = to; !node.equals(from);) {
                    Edge via = reachedBy.get(node);
                    path.addFirst(new Hop(node, via.relation(), via.transform()));
                    node = via.from();
                }
                return new RouteResult.Ok(path);
            }
            for (Edge edge : adjacency.getOrDefault(current, List.of())) {
                if (visited.add(edge.to())) {
                    reachedBy.put(edge.to(), edge);
                    queue.add(edge.to());
                }
            }
        }
        return new RouteResult.Unreachable("No path from '" + from + "' to '" + to + "'");
    }

    /** Ok iff a direct edge {@code from -> to} exists. Reachability is not enough. */
    public EdgeVerdict validate(String from, String to) {
        if (!contains(from))
            return new EdgeVerdict.Invalid("Kind '" + from + "' not defined");
        if (!contains(to))
            return new EdgeVerdict.Invalid("Kind '" + to + "' not defined");
        for (Edge edge : edges()) {
            if (edge.from().equals(from) && edge.to().equals(to))
                return EdgeVerdict.OK;
        }
        return new EdgeVerdict.Invalid("No direct edge from '" + from + "' to '" + to + "'");
    }

    /** Every kind reachable from {@code kind}, excluding itself, in BFS order. */
    public List<String> dependents(String kind) {
        Map<String, List<Edge>> adjacency = adjacency(edges());
        Set<String> visited = new LinkedHashSet<>();
        Deque<String> queue = new ArrayDeque<>();
        queue.add(kind);
        while (!queue.isEmpty()) {
            for (Edge edge : adjacency.getOrDefault(queue.poll(), List.of())) {
                if (!edge.to().equals(kind) && visited.add(edge.to()))
                    queue.add(edge.to());
            }
        }
        return new ArrayList<>(visited);
    }

    /** Edges producing {@code kind}. */
    public List<Producer> producers(String kind) {
        List<Producer> result = new ArrayList<>();
        for (Edge edge : edges()) {
            if (edge.to().equals(kind))
                result.add(new Producer(edge.from(), edge.transform()));
        }
        return result;
    }

    /** Edges consuming {@code kind}. */
    public List<Consumer> consumers(String kind) {
        List<Consumer> result = new ArrayList<>();
        for (Edge edge : edges()) {
            if (edge.from().equals(kind))
                result.add(new Consumer(edge.to(), edge.transform()));
        }
        return result;
    }

    /** Full dump of kinds and edges in definition order, for diagnostics. */
    public GraphDump graph() {
        return new GraphDump(kinds(), edges());
    }

    /**
     * All kinds in dependency order: every kind appears after all kinds that
     * produce it. Kahn's algorithm; ready kinds are taken in definition order.
     */
    public List<String> topologicalOrder() {
        List<Kind> kinds = kinds();
        Map<String, List<Edge>> adjacency = adjacency(edges());
        Map<String, Integer> inDegree = new LinkedHashMap<>();
        for (Kind k : kinds)
            inDegree.put(k.name(), 0);
        for (List<Edge> out : adjacency.values())
            for (Edge e : out)
                inDegree.merge(e.to(), 1, Integer::sum);

        Deque<String> queue = new ArrayDeque<>();
        inDegree.forEach((name, degree) -> {
            if (degree == 0)
                queue.add(name);
        });

        List<String> order = new ArrayList<>(kinds.size());
        while (!queue.isEmpty()) {
            String current = queue.poll();
            order.add(current);
            for (Edge e : adjacency.getOrDefault(current, List.of()))
                if (inDegree.merge(e.to(), -1, Integer::sum) == 0)
                    queue.add(e.to());
        }
        if (order.size() != inDegree.size())
            throw new IllegalStateException("Cycle detected in stored kind graph! Ordered " + order.size()
                    + " of " + inDegree.size());
        return order;
    }

    public boolean contains(String name) {
        return name != null && store.get(KINDS, name).isPresent();
    }

    public Optional<Kind> kind(String name) {
        if (name == null)
            return Optional.empty();
        return store.get(KINDS, name).map(KindGraph::toKind);
    }

    // ── Internals ──────────────────────────────────────────────────

    private List<Kind> kinds() {
        List<Kind> kinds = new ArrayList<>();
        for (ObjectNode record : store.find(KINDS))
            kinds.add(toKind(record));
        return kinds;
    }

    private List<Edge> edges() {
        List<Edge> edges = new ArrayList<>();
        for (ObjectNode record : store.find(EDGES)) {
            edges.add(new Edge(
                    record.path("from").asText(),
                    record.path("to").asText(),
                    record.path("relation").asText(),
                    record.hasNonNull("transform") ? record.get("transform").asText() : null));
        }
        return edges;
    }

    private static Kind toKind(ObjectNode record) {
        return new Kind(record.path("name").asText(), record.path("category").asText());
    }

    private static Map<String, List<Edge>> adjacency(List<Edge> edges) {
        Map<String, List<Edge>> adjacency = new LinkedHashMap<>();
        for (Edge e : edges)
            adjacency.computeIfAbsent(e.from(), k -> new ArrayList<>()).add(e);
        return adjacency;
    }

    /** BFS from {@code start}; true if {@code target} is reachable. */
    private static boolean reaches(String start, String target, Map<String, List<Edge>> adjacency) {
        Set<String> visited = new HashSet<>();
        Deque<String> queue = new ArrayDeque<>();
        queue.add(start);
        visited.add(start);
        while (!queue.isEmpty()) {
            String current = queue.poll();
            if (current.equals(target))
                return true;
            for (Edge e : adjacency.getOrDefault(current, List.of()))
                if (visited.add(e.to()))
                    queue.add(e.to());
        }
        return false;
    }

    static String edgeKey(String from, String to, String relation) {
        return from + ":" + to + ":" + relation;
    }
}
