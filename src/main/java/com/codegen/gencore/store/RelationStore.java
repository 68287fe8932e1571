package com.codegen.gencore.store;

import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.UnaryOperator;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Named-relation key-value store backing the kind graph, build cache and
 * generation plan.
 *
 * <p>
 * Each relation is an independent keyspace of JSON records. Implementations
 * must be atomic per key; no cross-key transactions are offered or expected.
 *
 * <p>
 * Contract shared by all implementations:
 * <ul>
 * <li>Records handed out are copies. Mutating them never changes stored
 * state.</li>
 * <li>Scans iterate in key insertion order. Replacing an existing key keeps its
 * position.</li>
 * <li>Failures of the underlying medium surface as {@link StoreException} and
 * are never retried here.</li>
 * </ul>
 */
public interface RelationStore {

    /** Returns a copy of the record stored under {@code key}, if any. */
    Optional<ObjectNode> get(String relation, String key);

    /** Upserts {@code record} under {@code key}, replacing the whole record. */
    void put(String relation, String key, ObjectNode record);

    /**
     * Removes the record under {@code key}.
     *
     * @return true if a record was removed.
     */
    boolean delete(String relation, String key);

    /** Returns copies of every record in {@code relation}. */
    default List<ObjectNode> find(String relation) {
        return find(relation, null);
    }

    /**
     * Returns copies of every record in {@code relation} whose fields equal all
     * fields of {@code filter}. A null or empty filter matches everything.
     */
    List<ObjectNode> find(String relation, ObjectNode filter);

    /**
     * Atomically replaces the record under {@code key} with
     * {@code mutator.apply(copyOfCurrent)}.
     *
     * @return the stored result, or empty if no record exists under the key.
     */
    Optional<ObjectNode> update(String relation, String key, UnaryOperator<ObjectNode> mutator);

    /** Names of relations that currently hold at least one record. */
    Set<String> relations();

    /** True if every field of {@code filter} is present in {@code record} with an equal value. */
    static boolean matches(ObjectNode record, ObjectNode filter) {
        if (filter == null)
            return true;
        var fields = filter.fields();
        while (fields.hasNext()) {
            var field = fields.next();
            JsonNode actual = record.get(field.getKey());
            if (actual == null || !actual.equals(field.getValue()))
                return false;
        }
        return true;
    }
}
