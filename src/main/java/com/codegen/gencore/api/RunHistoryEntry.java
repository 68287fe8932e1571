package com.codegen.gencore.api;

import java.time.Instant;

/** A run as listed by history; {@code completedAt} is null while running or if abandoned. */
public record RunHistoryEntry(String run, RunStatus status, Instant startedAt, Instant completedAt, int total,
        int executed, int cached, int failed) {
}
