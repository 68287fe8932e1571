package com.codegen.gencore.util;

import com.codegen.gencore.api.GenerationListener;
import com.codegen.gencore.api.RunSummary;
import com.codegen.gencore.api.StepRecord;
import com.codegen.gencore.api.StepStatus;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Process-lifetime counters over generation runs.
 *
 * <p>
 * Captures:
 * <ul>
 * <li><b>Runs:</b> started, completed and superseded.</li>
 * <li><b>Steps:</b> recorded, failed, and reported step time.</li>
 * <li><b>Wall time:</b> begin-to-complete time of the last completed run.</li>
 * </ul>
 */
public final class RunStatsListener implements GenerationListener {
    private final AtomicLong runsStarted = new AtomicLong();
    private final AtomicLong runsCompleted = new AtomicLong();
    private final AtomicLong runsSuperseded = new AtomicLong();
    private final AtomicLong stepsRecorded = new AtomicLong();
    private final AtomicLong stepsFailed = new AtomicLong();
    private final AtomicLong stepMillis = new AtomicLong();

    private volatile long runStartNanos;
    private volatile long lastRunWallNanos;

    @Override
    public void onRunBegin(String runId) {
        runsStarted.incrementAndGet();
        runStartNanos = System.nanoTime();
    }

    @Override
    public void onRunSuperseded(String runId) {
        runsSuperseded.incrementAndGet();
    }

    @Override
    public void onStepRecorded(StepRecord record) {
        stepsRecorded.incrementAndGet();
        stepMillis.addAndGet(record.duration());
        if (record.status() == StepStatus.FAILED)
            stepsFailed.incrementAndGet();
    }

    @Override
    public void onRunComplete(String runId, RunSummary summary) {
        runsCompleted.incrementAndGet();
        lastRunWallNanos = System.nanoTime() - runStartNanos;
    }

    public long runsStarted() {
        return runsStarted.get();
    }

    public long runsCompleted() {
        return runsCompleted.get();
    }

    public long runsSuperseded() {
        return runsSuperseded.get();
    }

    public long stepsRecorded() {
        return stepsRecorded.get();
    }

    public long stepsFailed() {
        return stepsFailed.get();
    }

    public long totalStepMillis() {
        return stepMillis.get();
    }

    public double lastRunWallMillis() {
        return lastRunWallNanos / 1_000_000.0;
    }

    public String dump() {
        StringBuilder sb = new StringBuilder();
        sb.append(String.format("%-16s | %10s%n", "Metric", "Value"));
        sb.append("------------------------------\n");
        sb.append(String.format("%-16s | %10d%n", "Runs started", runsStarted()));
        sb.append(String.format("%-16s | %10d%n", "Runs completed", runsCompleted()));
        sb.append(String.format("%-16s | %10d%n", "Runs superseded", runsSuperseded()));
        sb.append(String.format("%-16s | %10d%n", "Steps recorded", stepsRecorded()));
        sb.append(String.format("%-16s | %10d%n", "Steps failed", stepsFailed()));
        sb.append(String.format("%-16s | %10d%n", "Step time (ms)", totalStepMillis()));
        sb.append(String.format("%-16s | %10.2f%n", "Last run (ms)", lastRunWallMillis()));
        return sb.toString();
    }
}
