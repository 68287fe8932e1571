package com.codegen.gencore.web;

import com.codegen.gencore.api.StepStatus;
import com.codegen.gencore.engine.BuildCache;
import com.codegen.gencore.engine.GenerationPlan;
import com.codegen.gencore.engine.KindGraph;
import com.codegen.gencore.store.InMemoryRelationStore;
import com.codegen.gencore.store.RelationStore;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.Before;
import org.junit.Test;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;

import static org.junit.Assert.*;

public class DiagnosticsPayloadsTest {

    private final ObjectMapper mapper = new ObjectMapper();

    private KindGraph graph;
    private BuildCache cache;
    private GenerationPlan plan;
    private DiagnosticsPayloads payloads;

    @Before
    public void setUp() {
        RelationStore store = new InMemoryRelationStore();
        graph = new KindGraph(store);
        cache = new BuildCache(store);
        plan = new GenerationPlan(store);
        payloads = new DiagnosticsPayloads(graph, cache, plan);

        graph.define("Spec", "source");
        graph.define("Model", "model");
        graph.define("Code", "artifact");
        graph.connect("Spec", "Model", "parses_to", "Parser");
        graph.connect("Model", "Code", "renders_to", null);
    }

    @Test
    public void testKinds() throws Exception {
        JsonNode root = mapper.readTree(payloads.kinds());
        assertEquals(3, root.get("kinds").size());
        assertEquals("source", root.get("kinds").get(0).get("category").asText());
        assertEquals(2, root.get("edges").size());
        assertTrue(root.get("edges").get(1).get("transform").isNull());
    }

    @Test
    public void testRoute() throws Exception {
        JsonNode ok = mapper.readTree(payloads.route("Spec", "Code"));
        assertTrue(ok.get("reachable").asBoolean());
        assertEquals("Model", ok.get("path").get(0).get("kind").asText());
        assertEquals("Code", ok.get("path").get(1).get("kind").asText());

        JsonNode none = mapper.readTree(payloads.route("Code", "Spec"));
        assertFalse(none.get("reachable").asBoolean());
        assertTrue(none.get("message").asText().contains("No path"));
    }

    @Test
    public void testDependents() throws Exception {
        JsonNode root = mapper.readTree(payloads.dependents("Spec"));
        assertEquals("Model", root.get("dependents").get(0).asText());
        assertEquals(2, root.get("dependents").size());
    }

    @Test
    public void testCacheWritesInstantsAsIsoStrings() throws Exception {
        cache.record("concept:Parser:user", "h1", "o1", null, "specs/user.concept", true);
        cache.invalidate("concept:Parser:user");

        JsonNode entries = mapper.readTree(payloads.cacheStatus());
        assertEquals(1, entries.size());
        assertTrue(entries.get(0).get("lastRun").isTextual());
        assertTrue(entries.get(0).get("stale").asBoolean());

        JsonNode stale = mapper.readTree(payloads.staleSteps());
        assertEquals("concept:Parser:user", stale.get(0).asText());
    }

    @Test
    public void testRunsAndSummary() throws Exception {
        String run = plan.begin();
        plan.recordStep("concept:Parser:user", StepStatus.DONE, 2, 15L, false);
        plan.complete();

        JsonNode history = mapper.readTree(payloads.history());
        assertEquals(run, history.get(0).get("run").asText());
        assertEquals("completed", history.get(0).get("status").asText());
        assertEquals(1, history.get(0).get("executed").asInt());

        JsonNode steps = mapper.readTree(payloads.runSteps(run));
        assertEquals("done", steps.get(0).get("status").asText());

        JsonNode summary = mapper.readTree(payloads.summary(run));
        assertEquals(1, summary.get("total").asInt());
        assertEquals(15, summary.get("totalDuration").asLong());
        assertEquals(2, summary.get("filesProduced").asLong());
    }

    @Test
    public void testServerServesPayloads() throws Exception {
        DiagnosticsServer server = new DiagnosticsServer(payloads);
        server.start(0);
        try {
            HttpClient client = HttpClient.newHttpClient();
            HttpResponse<String> response = client.send(
                    HttpRequest.newBuilder(URI.create("http://localhost:" + server.port() + "/api/route/Spec/Code"))
                            .GET().build(),
                    HttpResponse.BodyHandlers.ofString());
            assertEquals(200, response.statusCode());
            assertTrue(response.headers().firstValue("Content-Type").orElse("").startsWith("application/json"));
            assertTrue(mapper.readTree(response.body()).get("reachable").asBoolean());
        } finally {
            server.stop();
        }
        assertEquals(-1, server.port());
    }
}
