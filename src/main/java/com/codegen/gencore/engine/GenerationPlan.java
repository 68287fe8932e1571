package com.codegen.gencore.engine;

import com.codegen.gencore.api.*;
import com.codegen.gencore.store.RelationStore;
import com.codegen.gencore.util.ErrorRateLimiter;

import java.time.Clock;
import java.time.Instant;
import java.util.*;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Run lifecycle and step ledger of the generation pipeline.
 *
 * <p>
 * There is exactly one active-run slot per store, kept as the record
 * {@code pointer/active}. {@link #begin()} fills it, {@link #complete()} clears
 * it, and {@link #recordStep} attaches outcomes to whatever run it names.
 * Generator drivers therefore never pass a run handle around; a driver firing
 * outside an orchestrated run is silently ignored.
 *
 * <p>
 * Calling {@link #begin()} while a run is still active closes that run first
 * with status {@link RunStatus#SUPERSEDED} and a completion stamp, so no run is
 * left open forever by a restart of the orchestrator loop.
 *
 * <p>
 * Runs are expected to be sequential. Lifecycle calls serialize on one lock.
 */
public final class GenerationPlan {
    private static final Logger log = LogManager.getLogger(GenerationPlan.class);

    static final String RUNS = "run";
    static final String STEPS = "step";
    static final String POINTER = "pointer";
    static final String ACTIVE = "active";

    static final String RUN_PREFIX = "gen-run-";

    public static final int DEFAULT_HISTORY_LIMIT = 10;

    private final RelationStore store;
    private final Clock clock;
    private final Object lock = new Object();
    private final ErrorRateLimiter errLimiter = new ErrorRateLimiter(log, 1000);
    private GenerationListener listener;
    private volatile int historyLimit = DEFAULT_HISTORY_LIMIT;

    public GenerationPlan(RelationStore store) {
        this(store, Clock.systemUTC());
    }

    public GenerationPlan(RelationStore store, Clock clock) {
        this.store = Objects.requireNonNull(store, "store");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public void setListener(GenerationListener listener) {
        this.listener = listener;
    }

    /** Limit used by {@link #history()}. */
    public void setHistoryLimit(int historyLimit) {
        this.historyLimit = historyLimit;
    }

    // ── Lifecycle ──────────────────────────────────────────────────

    /**
     * Starts a new run and makes it the active run.
     *
     * @return the new run id.
     */
    public String begin() {
        String superseded = null;
        String runId;
        synchronized (lock) {
            Optional<String> previous = activeRun();
            if (previous.isPresent()) {
                superseded = previous.get();
                closeRun(superseded, RunStatus.SUPERSEDED);
                log.warn("Run {} was still active and has been superseded", superseded);
            }

            long sequence = nextSequence();
            Instant now = clock.instant();
            runId = RUN_PREFIX + now.toEpochMilli() + "-" + sequence;

            store.put(RUNS, runId, JsonNodeFactory.instance.objectNode()
                    .put("run", runId)
                    .put("sequence", sequence)
                    .put("status", RunStatus.RUNNING.wireName())
                    .put("startedAt", now.toString())
                    .putNull("completedAt"));
            store.put(POINTER, ACTIVE, JsonNodeFactory.instance.objectNode().put("run", runId));
            log.info("Generation run {} started", runId);
        }

        if (superseded != null) {
            String s = superseded;
            notifyListener(l -> l.onRunSuperseded(s));
        }
        notifyListener(l -> l.onRunBegin(runId));
        return runId;
    }

    /**
     * Attaches a step outcome to the active run, replacing any earlier record of
     * the same step in that run. Without an active run this does nothing.
     *
     * @param filesProduced may be null, stored as 0.
     * @param duration      milliseconds, may be null, stored as 0.
     */
    public void recordStep(String stepKey, StepStatus status, Integer filesProduced, Long duration,
            boolean cached) {
        Objects.requireNonNull(stepKey, "stepKey");
        Objects.requireNonNull(status, "status");
        StepRecord record;
        synchronized (lock) {
            Optional<String> active = activeRun();
            if (active.isEmpty()) {
                log.debug("No active run, dropping step {} ({})", stepKey, status.wireName());
                return;
            }
            record = new StepRecord(active.get(), stepKey, status,
                    filesProduced != null ? filesProduced : 0,
                    duration != null ? duration : 0L,
                    cached, clock.instant());
            store.put(STEPS, stepStoreKey(record.runId(), stepKey), toRecord(record));
        }
        log.debug("Step {} -> {} in {}", stepKey, status.wireName(), record.runId());
        notifyListener(l -> l.onStepRecorded(record));
    }

    /**
     * Completes the active run.
     *
     * @return the completed run id, or empty if no run was active.
     */
    public Optional<String> complete() {
        String runId;
        synchronized (lock) {
            Optional<String> active = activeRun();
            if (active.isEmpty())
                return Optional.empty();
            runId = active.get();
            closeRun(runId, RunStatus.COMPLETED);
        }
        RunSummary summary = summary(runId);
        log.info("Generation run {} completed: {} executed, {} cached, {} failed in {}ms",
                runId, summary.executed(), summary.cached(), summary.failed(), summary.totalDuration());
        notifyListener(l -> l.onRunComplete(runId, summary));
        return Optional.of(runId);
    }

    /** The run currently accepting step records, if any. */
    public Optional<String> activeRun() {
        return store.get(POINTER, ACTIVE)
                .filter(p -> p.hasNonNull("run"))
                .map(p -> p.get("run").asText());
    }

    // ── Reporting ──────────────────────────────────────────────────

    /** Step records of {@code run} in the order the steps were first recorded. */
    public List<StepRecord> status(String run) {
        List<StepRecord> steps = new ArrayList<>();
        for (ObjectNode record : store.find(STEPS, runFilter(run)))
            steps.add(toStep(record));
        return steps;
    }

    public RunSummary summary(String run) {
        List<StepRecord> steps = status(run);
        int executed = 0, cached = 0, failed = 0;
        long totalDuration = 0, files = 0;
        for (StepRecord s : steps) {
            switch (s.status()) {
                case DONE -> executed++;
                case CACHED -> cached++;
                case FAILED -> failed++;
                default -> {
                }
            }
            totalDuration += s.duration();
            files += s.filesProduced();
        }
        return new RunSummary(run, steps.size(), executed, cached, failed, totalDuration, files);
    }

    /** The most recent runs, up to the configured history limit. */
    public List<RunHistoryEntry> history() {
        return history(historyLimit);
    }

    /**
     * The {@code limit} most recently started runs, newest first, each with its
     * step counts.
     */
    public List<RunHistoryEntry> history(int limit) {
        if (limit <= 0)
            return List.of();

        Map<String, List<StepRecord>> stepsByRun = new HashMap<>();
        for (ObjectNode record : store.find(STEPS)) {
            StepRecord step = toStep(record);
            stepsByRun.computeIfAbsent(step.runId(), k -> new ArrayList<>()).add(step);
        }

        List<ObjectNode> runs = store.find(RUNS);
        runs.sort(Comparator
                .comparing((ObjectNode r) -> Instant.parse(r.path("startedAt").asText()))
                .thenComparingLong(r -> r.path("sequence").asLong())
                .reversed());

        List<RunHistoryEntry> history = new ArrayList<>(Math.min(limit, runs.size()));
        for (ObjectNode run : runs.subList(0, Math.min(limit, runs.size()))) {
            String runId = run.path("run").asText();
            int executed = 0, cached = 0, failed = 0;
            List<StepRecord> steps = stepsByRun.getOrDefault(runId, List.of());
            for (StepRecord s : steps) {
                if (s.status() == StepStatus.DONE)
                    executed++;
                else if (s.status() == StepStatus.CACHED)
                    cached++;
                else if (s.status() == StepStatus.FAILED)
                    failed++;
            }
            history.add(new RunHistoryEntry(runId,
                    RunStatus.fromString(run.path("status").asText(RunStatus.RUNNING.wireName())),
                    Instant.parse(run.path("startedAt").asText()),
                    run.hasNonNull("completedAt") ? Instant.parse(run.get("completedAt").asText()) : null,
                    steps.size(), executed, cached, failed));
        }
        return history;
    }

    // ── Internals ──────────────────────────────────────────────────

    private void closeRun(String runId, RunStatus status) {
        store.update(RUNS, runId, r -> r
                .put("status", status.wireName())
                .put("completedAt", clock.instant().toString()));
        store.delete(POINTER, ACTIVE);
    }

    private long nextSequence() {
        long max = 0;
        for (ObjectNode run : store.find(RUNS))
            max = Math.max(max, run.path("sequence").asLong());
        return max + 1;
    }

    private void notifyListener(java.util.function.Consumer<GenerationListener> call) {
        GenerationListener l = this.listener;
        if (l == null)
            return;
        try {
            call.accept(l);
        } catch (RuntimeException e) {
            errLimiter.log("Generation listener failed: " + e.getMessage(), e);
        }
    }

    private static ObjectNode runFilter(String run) {
        return JsonNodeFactory.instance.objectNode().put("runId", run);
    }

    static String stepStoreKey(String runId, String stepKey) {
        return runId + "/" + stepKey;
    }

    private static ObjectNode toRecord(StepRecord step) {
        return JsonNodeFactory.instance.objectNode()
                .put("runId", step.runId())
                .put("stepKey", step.stepKey())
                .put("status", step.status().wireName())
                .put("filesProduced", step.filesProduced())
                .put("duration", step.duration())
                .put("cached", step.cached())
                .put("recordedAt", step.recordedAt().toString());
    }

    private static StepRecord toStep(ObjectNode record) {
        return new StepRecord(
                record.path("runId").asText(),
                record.path("stepKey").asText(),
                StepStatus.fromString(record.path("status").asText()),
                record.path("filesProduced").asInt(),
                record.path("duration").asLong(),
                record.path("cached").asBoolean(),
                Instant.parse(record.path("recordedAt").asText()));
    }
}
