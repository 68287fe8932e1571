package com.codegen.gencore.wiring;

import com.codegen.gencore.api.RunSummary;
import com.codegen.gencore.api.StepRecord;
import com.codegen.gencore.api.StepStatus;
import com.codegen.gencore.engine.GenerationPlan;
import com.codegen.gencore.store.InMemoryRelationStore;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.Assert.*;

public class StepReporterTest {

    private GenerationPlan plan;
    private StepReporter reporter;

    @Before
    public void setUp() {
        plan = new GenerationPlan(new InMemoryRelationStore());
        reporter = new StepReporter(plan, 64);
    }

    @After
    public void tearDown() {
        reporter.close();
    }

    @Test
    public void testStepsFromManyThreadsLandInActiveRun() throws Exception {
        String run = plan.begin();

        Thread[] drivers = new Thread[4];
        for (int t = 0; t < drivers.length; t++) {
            int driver = t;
            drivers[t] = new Thread(() -> {
                for (int i = 0; i < 100; i++)
                    reporter.report("concept:Gen" + driver + ":" + i, StepStatus.DONE, 1, 2L, false);
            });
            drivers[t].start();
        }
        for (Thread d : drivers)
            d.join();

        assertTrue(reporter.drain(Duration.ofSeconds(10)));
        plan.complete();

        RunSummary summary = plan.summary(run);
        assertEquals(400, summary.total());
        assertEquals(400, summary.executed());
        assertEquals(400, summary.filesProduced());
        assertEquals(800, summary.totalDuration());
    }

    @Test
    public void testCloseDrainsPendingEvents() {
        String run = plan.begin();
        reporter.report("concept:TypeScriptGen:user", StepStatus.CACHED, null, null, true);
        reporter.report("concept:RustGen:user", StepStatus.FAILED, 0, 5L, false);
        reporter.close();

        List<StepRecord> steps = plan.status(run);
        assertEquals(2, steps.size());
        assertEquals(StepStatus.CACHED, steps.get(0).status());
        assertTrue(steps.get(0).cached());
        assertEquals(StepStatus.FAILED, steps.get(1).status());
    }

    @Test
    public void testCloseRightAfterStartKeepsEveryStep() {
        String run = plan.begin();
        StepReporter fresh = new StepReporter(plan, 16);
        for (int i = 0; i < 50; i++)
            fresh.report("concept:Gen:" + i, StepStatus.DONE, 1, 1L, false);
        fresh.close();

        assertEquals(50, plan.status(run).size());
        assertEquals(49, fresh.handler().processedSequence());
    }

    @Test(expected = IllegalStateException.class)
    public void testReportAfterCloseFails() {
        reporter.close();
        reporter.report("k:G:s", StepStatus.DONE, 1, 1L, false);
    }

    @Test
    public void testMalformedEventDoesNotStopConsumer() {
        String run = plan.begin();
        reporter.report("k:G:bad", null, 1, 1L, false);
        reporter.report("k:G:good", StepStatus.DONE, 1, 1L, false);
        assertTrue(reporter.drain(Duration.ofSeconds(10)));

        assertEquals(1, reporter.handler().failures());
        assertEquals(1, plan.status(run).size());
        assertEquals("k:G:good", plan.status(run).get(0).stepKey());
    }

    @Test
    public void testStepsWithoutActiveRunAreDropped() {
        reporter.report("k:G:s", StepStatus.DONE, 1, 1L, false);
        assertTrue(reporter.drain(Duration.ofSeconds(10)));
        String run = plan.begin();
        assertTrue(plan.status(run).isEmpty());
        assertEquals(0, reporter.handler().failures());
    }
}
