package com.codegen.gencore;

import com.codegen.gencore.api.CheckResult;
import com.codegen.gencore.api.RunSummary;
import com.codegen.gencore.api.StepStatus;
import com.codegen.gencore.io.CoreConfig;
import com.codegen.gencore.io.StandardTaxonomy;
import com.codegen.gencore.store.InMemoryRelationStore;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.time.Duration;
import java.util.List;

import static org.junit.Assert.*;

public class GenCoreTest {

    @Rule
    public TemporaryFolder tmp = new TemporaryFolder();

    private static CoreConfig memoryConfig() {
        CoreConfig config = new CoreConfig();
        config.setTaxonomy("classpath:" + StandardTaxonomy.RESOURCE);
        return config;
    }

    @Test
    public void testAppliesConfiguredTaxonomy() {
        try (GenCore core = new GenCore(memoryConfig(), new InMemoryRelationStore())) {
            assertTrue(core.graph().contains(StandardTaxonomy.CONCEPT_MANIFEST));
            assertTrue(core.explain().dumpTaxonomy().contains("28 kind(s), 24 transform(s)"));
        }
    }

    @Test
    public void testEmptyTaxonomySetting() {
        CoreConfig config = new CoreConfig();
        try (GenCore core = new GenCore(config, new InMemoryRelationStore())) {
            assertTrue(core.graph().graph().kinds().isEmpty());
        }
    }

    @Test
    public void testIncrementalBuildAcrossReopenedFileStore() throws Exception {
        CoreConfig config = memoryConfig();
        config.setStorage(CoreConfig.STORAGE_FILE);
        config.setStorageDir(tmp.newFolder("store").getPath());

        String stepKey = "concept:TypeScriptGen:user";
        try (GenCore core = new GenCore(config)) {
            core.plan().begin();
            assertTrue(core.cache().check(stepKey, "h1", true) instanceof CheckResult.Changed);
            core.cache().record(stepKey, "h1", "o1", "out/user.ts", "specs/user.concept", true);
            core.reporter().report(stepKey, StepStatus.DONE, 2, 10L, false);
            assertTrue(core.reporter().drain(Duration.ofSeconds(10)));
            core.plan().complete();
            assertEquals(1, core.runStats().runsCompleted());
        }

        try (GenCore reopened = new GenCore(config)) {
            assertEquals(28, reopened.graph().graph().kinds().size());
            assertTrue(reopened.cache().check(stepKey, "h1", true) instanceof CheckResult.Unchanged);

            String run = reopened.plan().begin();
            reopened.reporter().report(stepKey, StepStatus.CACHED, 0, 0L, true);
            reopened.reporter().close();
            reopened.plan().complete();

            RunSummary summary = reopened.plan().summary(run);
            assertEquals(1, summary.cached());
            assertEquals(2, reopened.plan().history(10).size());

            assertEquals(List.of(stepKey),
                    reopened.impact().invalidateDownstream(StandardTaxonomy.CONCEPT_MANIFEST));
        }
    }

    @Test(expected = IllegalArgumentException.class)
    public void testInvalidConfigRejected() {
        CoreConfig config = new CoreConfig();
        config.setRingBufferSize(3);
        new GenCore(config, new InMemoryRelationStore());
    }
}
