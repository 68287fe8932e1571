package com.codegen.gencore.util;

import com.codegen.gencore.api.GenerationListener;
import com.codegen.gencore.api.RunSummary;
import com.codegen.gencore.api.StepRecord;
import com.codegen.gencore.api.StepStatus;
import org.apache.logging.log4j.LogManager;
import org.junit.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.junit.Assert.*;

public class GenerationListenersTest {

    private static StepRecord step(String key, StepStatus status, long duration) {
        return new StepRecord("gen-run-1-1", key, status, 1, duration, status == StepStatus.CACHED, Instant.now());
    }

    @Test
    public void testCompositeFansOutInRegistrationOrder() {
        List<String> calls = new ArrayList<>();
        CompositeGenerationListener composite = new CompositeGenerationListener();
        for (String name : new String[] { "first", "second" }) {
            composite.add(new GenerationListener() {
                @Override
                public void onRunBegin(String runId) {
                    calls.add(name + ":begin");
                }

                @Override
                public void onRunSuperseded(String runId) {
                    calls.add(name + ":superseded");
                }

                @Override
                public void onStepRecorded(StepRecord record) {
                    calls.add(name + ":" + record.stepKey());
                }

                @Override
                public void onRunComplete(String runId, RunSummary summary) {
                    calls.add(name + ":complete");
                }
            });
        }
        assertEquals(2, composite.size());

        composite.onRunBegin("r");
        composite.onStepRecorded(step("k:G:s", StepStatus.DONE, 1));
        composite.onRunComplete("r", new RunSummary("r", 1, 1, 0, 0, 1, 1));

        assertEquals(List.of("first:begin", "second:begin", "first:k:G:s", "second:k:G:s", "first:complete",
                "second:complete"), calls);
    }

    @Test
    public void testRunStatsCounts() {
        RunStatsListener stats = new RunStatsListener();
        stats.onRunBegin("a");
        stats.onStepRecorded(step("k:G:1", StepStatus.DONE, 10));
        stats.onStepRecorded(step("k:G:2", StepStatus.FAILED, 5));
        stats.onStepRecorded(step("k:G:3", StepStatus.CACHED, 0));
        stats.onRunSuperseded("a");
        stats.onRunBegin("b");
        stats.onRunComplete("b", new RunSummary("b", 0, 0, 0, 0, 0, 0));

        assertEquals(2, stats.runsStarted());
        assertEquals(1, stats.runsCompleted());
        assertEquals(1, stats.runsSuperseded());
        assertEquals(3, stats.stepsRecorded());
        assertEquals(1, stats.stepsFailed());
        assertEquals(15, stats.totalStepMillis());
        assertTrue(stats.lastRunWallMillis() >= 0);
        assertTrue(stats.dump().contains("Steps failed"));
    }

    @Test
    public void testLoggingListenerAcceptsAllEvents() {
        LoggingGenerationListener listener = new LoggingGenerationListener();
        listener.onRunBegin("r");
        listener.onStepRecorded(step("k:G:s", StepStatus.FAILED, 3));
        listener.onStepRecorded(step("k:G:t", StepStatus.DONE, 3));
        listener.onRunSuperseded("r");
        listener.onRunComplete("r", new RunSummary("r", 2, 1, 0, 1, 6, 2));
    }

    @Test
    public void testErrorRateLimiterSuppressesBursts() {
        ErrorRateLimiter limiter = new ErrorRateLimiter(LogManager.getLogger(GenerationListenersTest.class),
                60_000);
        assertTrue(limiter.log("first", new RuntimeException("x")));
        assertFalse(limiter.log("second", new RuntimeException("x")));
        assertFalse(limiter.log("third", new RuntimeException("x")));
        assertEquals(2, limiter.suppressedCount());
    }
}
