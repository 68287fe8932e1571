package com.codegen.gencore.api;

/**
 * Aggregate over all step records of a run. {@code executed}, {@code cached}
 * and {@code failed} count the {@code done}, {@code cached} and {@code failed}
 * statuses respectively.
 */
public record RunSummary(String run, int total, int executed, int cached, int failed, long totalDuration,
        long filesProduced) {
}
