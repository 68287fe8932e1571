package com.codegen.gencore.engine;

import com.codegen.gencore.api.ImpactReport;
import com.codegen.gencore.io.StandardTaxonomy;
import com.codegen.gencore.store.InMemoryRelationStore;
import com.codegen.gencore.store.RelationStore;
import org.junit.Before;
import org.junit.Test;

import java.util.List;

import static org.junit.Assert.*;

public class ImpactAnalysisTest {

    private KindGraph graph;
    private BuildCache cache;
    private ImpactAnalysis impact;

    @Before
    public void setUp() {
        RelationStore store = new InMemoryRelationStore();
        graph = new KindGraph(store);
        cache = new BuildCache(store);
        impact = new ImpactAnalysis(graph, cache);
        StandardTaxonomy.bootstrap(graph);
    }

    @Test
    public void testImpactOfConceptAst() {
        ImpactReport report = impact.impactOf("ConceptAST");
        assertEquals("ConceptAST", report.kind());
        assertEquals(17, report.downstream().size());
        assertTrue(report.downstream().contains("HandlerImplFiles"));
        assertEquals("ConceptManifest", report.downstream().get(0));
        assertTrue(report.downstream().contains("RestRoutes"));
        assertFalse(report.downstream().contains("ConceptAST"));
        assertFalse(report.downstream().contains("CompiledSync"));

        assertEquals(17, report.transforms().size());
        assertEquals("SchemaGen", report.transforms().get(0));
        assertTrue(report.transforms().contains("TypeScriptGen"));
        assertTrue(report.transforms().contains("PySdkTarget"));
        assertFalse(report.transforms().contains("SpecParser"));
    }

    @Test
    public void testImpactOfLeafIsEmpty() {
        ImpactReport report = impact.impactOf("TypeScriptFiles");
        assertTrue(report.downstream().isEmpty());
        assertTrue(report.transforms().isEmpty());
    }

    @Test
    public void testInvalidateDownstream() {
        cache.record("concept:TypeScriptGen:user", "h", "o", null, null, true);
        cache.record("concept:RestTarget:user", "h", "o", null, null, true);
        cache.record("sync:SyncCompiler:flow", "h", "o", null, null, true);
        cache.record("deploy:TfProvider:prod", "h", "o", null, null, true);

        List<String> invalidated = impact.invalidateDownstream("ConceptManifest");
        assertEquals(List.of("concept:TypeScriptGen:user", "concept:RestTarget:user"), invalidated);
        assertEquals(invalidated, cache.staleSteps());

        assertEquals(List.of("deploy:TfProvider:prod"), impact.invalidateDownstream("DeployManifest"));
    }
}
