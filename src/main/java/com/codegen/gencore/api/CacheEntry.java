package com.codegen.gencore.api;

import java.time.Instant;

/**
 * Last known state of one generation step in the build cache.
 *
 * @param id            stable entry id, kept across re-recording.
 * @param stepKey       {@code namespace:generatorName:specId}.
 * @param outputRef     opaque output location, may be null.
 * @param sourceLocator opaque provenance such as a spec path, may be null.
 * @param stale         explicit invalidation flag, independent of the hashes.
 */
public record CacheEntry(String id, String stepKey, String inputHash, String outputHash, String outputRef,
        String sourceLocator, boolean deterministic, Instant lastRun, boolean stale) {
}
