package com.codegen.gencore.util;

import com.codegen.gencore.api.*;
import com.codegen.gencore.engine.KindGraph;

import java.util.*;

/**
 * Diagnostic renderings of the kind graph.
 *
 * <p>
 * Generates human-readable text for the taxonomy, single kinds and routes, and
 * a Mermaid diagram of the whole graph. Intended for CLIs, logs and
 * dashboards; every call reads the graph afresh.
 */
public final class KindGraphExplain {
    private static final List<String> CATEGORY_ORDER = List.of("source", "model", "artifact");

    private final KindGraph graph;

    public KindGraphExplain(KindGraph graph) {
        this.graph = graph;
    }

    /**
     * Lists kinds grouped by category (source, model, artifact, then any other
     * category alphabetically), followed by every transform.
     */
    public String dumpTaxonomy() {
        GraphDump dump = graph.graph();
        Map<String, List<String>> byCategory = new TreeMap<>(Comparator
                .comparingInt((String c) -> CATEGORY_ORDER.contains(c) ? CATEGORY_ORDER.indexOf(c)
                        : CATEGORY_ORDER.size())
                .thenComparing(Comparator.naturalOrder()));
        for (Kind k : dump.kinds())
            byCategory.computeIfAbsent(k.category(), c -> new ArrayList<>()).add(k.name());

        StringBuilder sb = new StringBuilder(1024);
        sb.append("Kind Taxonomy\n=============\n\n");
        byCategory.forEach((category, names) -> {
            Collections.sort(names);
            sb.append("  ").append(category.toUpperCase(Locale.ROOT)).append(" (").append(names.size())
                    .append("):\n");
            for (String name : names)
                sb.append("    ").append(name).append('\n');
            sb.append('\n');
        });

        sb.append("  Transforms (").append(dump.edges().size()).append("):\n");
        for (Edge e : dump.edges())
            sb.append("    ").append(e.from()).append(" --").append(e.relation()).append("--> ").append(e.to())
                    .append(transformSuffix(e.transform())).append('\n');
        sb.append('\n').append(dump.kinds().size()).append(" kind(s), ").append(dump.edges().size())
                .append(" transform(s)\n");
        return sb.toString();
    }

    /** Dumps one kind with its incoming and outgoing transforms. */
    public String explainKind(String name) {
        Optional<Kind> kind = graph.kind(name);
        if (kind.isEmpty())
            return "Kind: " + name + " (not defined)\n";

        StringBuilder sb = new StringBuilder(256);
        sb.append("Kind: ").append(name).append('\n')
                .append("  Category: ").append(kind.get().category()).append('\n');

        List<Producer> producers = graph.producers(name);
        sb.append("  Produced by (").append(producers.size()).append("): ");
        for (int i = 0; i < producers.size(); i++) {
            Producer p = producers.get(i);
            sb.append(p.fromKind()).append(transformSuffix(p.transformName()));
            if (i < producers.size() - 1)
                sb.append(", ");
        }
        sb.append('\n');

        List<Consumer> consumers = graph.consumers(name);
        sb.append("  Consumed by (").append(consumers.size()).append("): ");
        for (int i = 0; i < consumers.size(); i++) {
            Consumer c = consumers.get(i);
            sb.append(c.toKind()).append(transformSuffix(c.transformName()));
            if (i < consumers.size() - 1)
                sb.append(", ");
        }
        sb.append('\n');
        sb.append("  Downstream kinds: ").append(graph.dependents(name).size()).append('\n');
        return sb.toString();
    }

    /** Renders the shortest route, one hop per line. */
    public String explainRoute(String from, String to) {
        RouteResult result = graph.route(from, to);
        if (result instanceof RouteResult.Unreachable) {
            return "No path from " + from + " to " + to + ".\n";
        }
        List<Hop> path = ((RouteResult.Ok) result).path();
        StringBuilder sb = new StringBuilder(256);
        sb.append("Path from ").append(from).append(" to ").append(to).append(":\n\n");
        sb.append("  ").append(from).append('\n');
        for (Hop hop : path) {
            sb.append("    --").append(hop.relation()).append("-->").append(transformSuffix(hop.transform()))
                    .append('\n');
            sb.append("  ").append(hop.kind()).append('\n');
        }
        sb.append('\n').append(path.size()).append(" step(s)\n");
        return sb.toString();
    }

    /**
     * Generates a Mermaid flowchart of the kind graph. Kinds are declared in
     * dependency order and styled by category; edges carry the transform name, or
     * the relation when the edge has none.
     */
    public String toMermaid() {
        GraphDump dump = graph.graph();
        Map<String, String> categories = new HashMap<>();
        for (Kind k : dump.kinds())
            categories.put(k.name(), k.category());

        StringBuilder sb = new StringBuilder(4096);
        sb.append("graph LR;\n");
        for (String name : graph.topologicalOrder()) {
            sb.append("  ").append(sanitize(name)).append("[\"").append(name).append("\"]:::")
                    .append(sanitize(categories.get(name))).append(";\n");
        }
        for (Edge e : dump.edges()) {
            String label = e.transform() != null ? e.transform() : e.relation();
            sb.append("  ").append(sanitize(e.from())).append(" -- \"").append(label).append("\" --> ")
                    .append(sanitize(e.to())).append(";\n");
        }
        return sb.toString();
    }

    private static String transformSuffix(String transform) {
        return transform != null ? " (" + transform + ")" : "";
    }

    private static String sanitize(String name) {
        return name.replaceAll("[^a-zA-Z0-9_]", "_");
    }
}
