package com.codegen.gencore.api;

import java.util.List;

/** Full copy of the kind graph, in definition order. */
public record GraphDump(List<Kind> kinds, List<Edge> edges) {
    public GraphDump {
        kinds = List.copyOf(kinds);
        edges = List.copyOf(edges);
    }
}
