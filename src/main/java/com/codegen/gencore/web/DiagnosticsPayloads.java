package com.codegen.gencore.web;

import com.codegen.gencore.api.*;
import com.codegen.gencore.engine.BuildCache;
import com.codegen.gencore.engine.GenerationPlan;
import com.codegen.gencore.engine.KindGraph;

import java.io.UncheckedIOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * Builds the JSON bodies served by {@link DiagnosticsServer}.
 *
 * Kept separate from the server so payloads can be produced and checked
 * without binding a port. Instants are written as ISO-8601 strings and status
 * enums by their wire names.
 */
public final class DiagnosticsPayloads {
    private final KindGraph graph;
    private final BuildCache cache;
    private final GenerationPlan plan;
    private final ObjectMapper mapper;

    public DiagnosticsPayloads(KindGraph graph, BuildCache cache, GenerationPlan plan) {
        this.graph = graph;
        this.cache = cache;
        this.plan = plan;
        this.mapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    public String kinds() {
        GraphDump dump = graph.graph();
        ObjectNode root = mapper.createObjectNode();
        ArrayNode kinds = root.putArray("kinds");
        for (Kind k : dump.kinds())
            kinds.addObject().put("name", k.name()).put("category", k.category());
        ArrayNode edges = root.putArray("edges");
        for (Edge e : dump.edges()) {
            edges.addObject()
                    .put("from", e.from())
                    .put("to", e.to())
                    .put("relation", e.relation())
                    .put("transform", e.transform());
        }
        return write(root);
    }

    public String route(String from, String to) {
        RouteResult result = graph.route(from, to);
        ObjectNode root = mapper.createObjectNode().put("from", from).put("to", to);
        if (result instanceof RouteResult.Ok ok) {
            root.put("reachable", true);
            ArrayNode path = root.putArray("path");
            for (Hop hop : ok.path())
                path.addObject().put("kind", hop.kind()).put("relation", hop.relation())
                        .put("transform", hop.transform());
        } else {
            root.put("reachable", false).put("message", ((RouteResult.Unreachable) result).message());
        }
        return write(root);
    }

    public String dependents(String kind) {
        ObjectNode root = mapper.createObjectNode().put("kind", kind);
        ArrayNode deps = root.putArray("dependents");
        graph.dependents(kind).forEach(deps::add);
        return write(root);
    }

    public String cacheStatus() {
        return write(cache.status());
    }

    public String staleSteps() {
        return write(cache.staleSteps());
    }

    public String history() {
        List<RunHistoryEntry> entries = plan.history();
        ArrayNode root = mapper.createArrayNode();
        for (RunHistoryEntry e : entries) {
            ObjectNode n = root.addObject()
                    .put("run", e.run())
                    .put("status", e.status().wireName())
                    .put("startedAt", e.startedAt().toString());
            if (e.completedAt() != null)
                n.put("completedAt", e.completedAt().toString());
            else
                n.putNull("completedAt");
            n.put("total", e.total()).put("executed", e.executed()).put("cached", e.cached())
                    .put("failed", e.failed());
        }
        return write(root);
    }

    public String runSteps(String run) {
        ArrayNode root = mapper.createArrayNode();
        for (StepRecord r : plan.status(run)) {
            root.addObject()
                    .put("stepKey", r.stepKey())
                    .put("status", r.status().wireName())
                    .put("filesProduced", r.filesProduced())
                    .put("duration", r.duration())
                    .put("cached", r.cached())
                    .put("recordedAt", r.recordedAt().toString());
        }
        return write(root);
    }

    public String summary(String run) {
        return write(plan.summary(run));
    }

    /** Small error body for 4xx/5xx responses. */
    public String error(String message) {
        Map<String, String> body = new LinkedHashMap<>();
        body.put("error", message);
        return write(body);
    }

    private String write(Object value) {
        try {
            return mapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to serialize diagnostics payload", e);
        }
    }
}
