package com.codegen.gencore.api;

import java.util.List;

/**
 * What must regenerate when a kind changes.
 *
 * @param downstream every kind reachable from {@code kind}, BFS order.
 * @param transforms distinct transform names on edges leaving {@code kind} or
 *                   any downstream kind, BFS order.
 */
public record ImpactReport(String kind, List<String> downstream, List<String> transforms) {
    public ImpactReport {
        downstream = List.copyOf(downstream);
        transforms = List.copyOf(transforms);
    }
}
