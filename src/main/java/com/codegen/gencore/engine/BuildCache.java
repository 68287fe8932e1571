package com.codegen.gencore.engine;

import com.codegen.gencore.api.CacheEntry;
import com.codegen.gencore.api.CheckResult;
import com.codegen.gencore.api.InvalidateResult;
import com.codegen.gencore.store.RelationStore;

import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Predicate;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import lombok.extern.log4j.Log4j2;

/**
 * Content-hash based change detection for generation steps.
 *
 * <p>
 * Entries are keyed by step key ({@code namespace:generatorName:specId}). A
 * step is reusable only when it is deterministic, not stale, and its stored
 * input hash equals the proposed one. The stale flag is independent of the
 * hashes: an explicit invalidation always forces a rerun, and only a new
 * {@link #record} clears it.
 *
 * <p>
 * Entries are never removed, only marked stale or overwritten. Each operation
 * touches one key at a time, so steps with different keys can be checked and
 * recorded in parallel.
 */
@Log4j2
public final class BuildCache {
    static final String ENTRIES = "entries";

    private final RelationStore store;
    private final Clock clock;

    public BuildCache(RelationStore store) {
        this(store, Clock.systemUTC());
    }

    public BuildCache(RelationStore store, Clock clock) {
        this.store = Objects.requireNonNull(store, "store");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Decides whether the step must run for {@code inputHash}.
     *
     * @param deterministic false for steps whose output cannot be trusted from
     *                      cache; such steps always report changed.
     */
    public CheckResult check(String stepKey, String inputHash, boolean deterministic) {
        Optional<ObjectNode> existing = store.get(ENTRIES, stepKey);
        if (existing.isEmpty())
            return new CheckResult.Changed(null);

        CacheEntry entry = toEntry(existing.get());
        if (!deterministic || entry.stale() || !entry.inputHash().equals(inputHash))
            return new CheckResult.Changed(entry.inputHash());

        return new CheckResult.Unchanged(entry.lastRun(), entry.outputRef());
    }

    /**
     * Upserts the entry for {@code stepKey} and clears its stale flag. The entry
     * id is kept when the key was recorded before.
     */
    public CacheEntry record(String stepKey, String inputHash, String outputHash, String outputRef,
            String sourceLocator, boolean deterministic) {
        Objects.requireNonNull(stepKey, "stepKey");
        Objects.requireNonNull(inputHash, "inputHash");
        Objects.requireNonNull(outputHash, "outputHash");

        String id = store.get(ENTRIES, stepKey)
                .map(e -> e.path("id").asText(null))
                .orElseGet(() -> UUID.randomUUID().toString());
        CacheEntry entry = new CacheEntry(id, stepKey, inputHash, outputHash, outputRef, sourceLocator,
                deterministic, clock.instant(), false);
        store.put(ENTRIES, stepKey, toRecord(entry));
        log.debug("Recorded {} input={} output={}", stepKey, inputHash, outputHash);
        return entry;
    }

    /** Marks one entry stale. */
    public InvalidateResult invalidate(String stepKey) {
        boolean found = store.update(ENTRIES, stepKey, BuildCache::markStale).isPresent();
        if (found)
            log.debug("Invalidated {}", stepKey);
        return found ? InvalidateResult.OK : InvalidateResult.NOT_FOUND;
    }

    /**
     * Marks stale every entry recorded with exactly this source locator. A null
     * locator matches nothing.
     */
    public List<String> invalidateBySource(String sourceLocator) {
        if (sourceLocator == null)
            return List.of();
        List<String> invalidated = invalidateWhere(
                e -> Objects.equals(e.path("sourceLocator").asText(null), sourceLocator));
        log.debug("Invalidated {} step(s) for source {}", invalidated.size(), sourceLocator);
        return invalidated;
    }

    /**
     * Marks stale every entry whose step key names {@code kindName} as its
     * generator segment. Matching splits the key on ':' and compares whole
     * segments, so a name never matches as a substring of another.
     */
    public List<String> invalidateByKind(String kindName) {
        List<String> invalidated = invalidateWhere(e -> matchesGenerator(e.path("stepKey").asText(), kindName));
        log.debug("Invalidated {} step(s) for generator {}", invalidated.size(), kindName);
        return invalidated;
    }

    /** Marks every entry stale and returns how many there were. */
    public int invalidateAll() {
        int cleared = invalidateWhere(e -> true).size();
        log.info("Invalidated all {} cache entries", cleared);
        return cleared;
    }

    /** Every entry with its current stale flag, in first-recorded order. */
    public List<CacheEntry> status() {
        List<CacheEntry> entries = new ArrayList<>();
        for (ObjectNode record : store.find(ENTRIES))
            entries.add(toEntry(record));
        return entries;
    }

    /** Step keys currently marked stale. */
    public List<String> staleSteps() {
        ObjectNode filter = JsonNodeFactory.instance.objectNode().put("stale", true);
        List<String> steps = new ArrayList<>();
        for (ObjectNode record : store.find(ENTRIES, filter))
            steps.add(record.path("stepKey").asText());
        return steps;
    }

    /**
     * Step-key segment matching. Conventional keys
     * ({@code namespace:generator:spec...}) match on the generator segment only;
     * shorter keys match on any segment.
     */
    static boolean matchesGenerator(String stepKey, String name) {
        if (stepKey == null || name == null)
            return false;
        String[] segments = stepKey.split(":", -1);
        if (segments.length >= 3)
            return segments[1].equals(name);
        for (String segment : segments) {
            if (segment.equals(name))
                return true;
        }
        return false;
    }

    private List<String> invalidateWhere(Predicate<ObjectNode> selector) {
        List<String> invalidated = new ArrayList<>();
        for (ObjectNode record : store.find(ENTRIES)) {
            if (!selector.test(record))
                continue;
            String stepKey = record.path("stepKey").asText();
            if (store.update(ENTRIES, stepKey, BuildCache::markStale).isPresent())
                invalidated.add(stepKey);
        }
        return invalidated;
    }

    private static ObjectNode markStale(ObjectNode record) {
        return record.put("stale", true);
    }

    private static ObjectNode toRecord(CacheEntry entry) {
        return JsonNodeFactory.instance.objectNode()
                .put("id", entry.id())
                .put("stepKey", entry.stepKey())
                .put("inputHash", entry.inputHash())
                .put("outputHash", entry.outputHash())
                .put("outputRef", entry.outputRef())
                .put("sourceLocator", entry.sourceLocator())
                .put("deterministic", entry.deterministic())
                .put("lastRun", entry.lastRun().toString())
                .put("stale", entry.stale());
    }

    private CacheEntry toEntry(ObjectNode record) {
        return new CacheEntry(
                record.path("id").asText(null),
                record.path("stepKey").asText(),
                record.path("inputHash").asText(""),
                record.path("outputHash").asText(""),
                record.path("outputRef").asText(null),
                record.path("sourceLocator").asText(null),
                record.path("deterministic").asBoolean(true),
                parseInstant(record.path("lastRun").asText(null)),
                record.path("stale").asBoolean(false));
    }

    private Instant parseInstant(String value) {
        if (value == null)
            return clock.instant();
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException e) {
            log.warn("Unparseable lastRun '{}', using now", value);
            return clock.instant();
        }
    }
}
