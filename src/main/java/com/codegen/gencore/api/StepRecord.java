package com.codegen.gencore.api;

import java.time.Instant;

/** One step outcome in a run's ledger. Duration is in milliseconds. */
public record StepRecord(String runId, String stepKey, StepStatus status, int filesProduced, long duration,
        boolean cached, Instant recordedAt) {
}
