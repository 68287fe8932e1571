package com.codegen.gencore.store;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;

import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Process-local {@link RelationStore}.
 *
 * <p>
 * Every relation is an insertion-ordered map guarded by its own monitor, so
 * operations on one relation never contend with another. Stored records are
 * deep-copied on the way in and on the way out.
 */
public class InMemoryRelationStore implements RelationStore {

    private final Map<String, Map<String, ObjectNode>> relations = new ConcurrentHashMap<>();

    @Override
    public Optional<ObjectNode> get(String relation, String key) {
        Map<String, ObjectNode> rel = relations.get(relation);
        if (rel == null)
            return Optional.empty();
        synchronized (rel) {
            ObjectNode record = rel.get(key);
            return record == null ? Optional.empty() : Optional.of(record.deepCopy());
        }
    }

    @Override
    public void put(String relation, String key, ObjectNode record) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(record, "record");
        Map<String, ObjectNode> rel = relation(relation);
        synchronized (rel) {
            Map<String, ObjectNode> snapshot = new LinkedHashMap<>(rel);
            rel.put(key, record.deepCopy());
            commit(relation, rel, snapshot);
        }
    }

    @Override
    public boolean delete(String relation, String key) {
        Map<String, ObjectNode> rel = relations.get(relation);
        if (rel == null)
            return false;
        synchronized (rel) {
            if (!rel.containsKey(key))
                return false;
            Map<String, ObjectNode> snapshot = new LinkedHashMap<>(rel);
            rel.remove(key);
            commit(relation, rel, snapshot);
            return true;
        }
    }

    @Override
    public List<ObjectNode> find(String relation, ObjectNode filter) {
        Map<String, ObjectNode> rel = relations.get(relation);
        if (rel == null)
            return Collections.emptyList();
        List<ObjectNode> result = new ArrayList<>();
        synchronized (rel) {
            for (ObjectNode record : rel.values()) {
                if (RelationStore.matches(record, filter))
                    result.add(record.deepCopy());
            }
        }
        return result;
    }

    @Override
    public Optional<ObjectNode> update(String relation, String key, UnaryOperator<ObjectNode> mutator) {
        Map<String, ObjectNode> rel = relations.get(relation);
        if (rel == null)
            return Optional.empty();
        synchronized (rel) {
            ObjectNode current = rel.get(key);
            if (current == null)
                return Optional.empty();
            ObjectNode next = Objects.requireNonNull(mutator.apply(current.deepCopy()), "mutator result");
            Map<String, ObjectNode> snapshot = new LinkedHashMap<>(rel);
            rel.put(key, next.deepCopy());
            commit(relation, rel, snapshot);
            return Optional.of(next);
        }
    }

    @Override
    public Set<String> relations() {
        Set<String> names = new TreeSet<>();
        relations.forEach((name, rel) -> {
            synchronized (rel) {
                if (!rel.isEmpty())
                    names.add(name);
            }
        });
        return names;
    }

    /** Runs the change hook; if it throws, the relation is restored to {@code snapshot}. */
    private void commit(String relation, Map<String, ObjectNode> rel, Map<String, ObjectNode> snapshot) {
        try {
            onRelationChanged(relation, rel);
        } catch (RuntimeException e) {
            rel.clear();
            rel.putAll(snapshot);
            throw e;
        }
    }

    /**
     * Called with the relation's monitor held after every mutation. Throwing
     * rolls the mutation back. The map must
     * not be retained or modified.
     */
    protected void onRelationChanged(String relation, Map<String, ObjectNode> records) {
    }

    /** Seeds a relation without triggering {@link #onRelationChanged}. */
    protected void load(String relation, Map<String, ObjectNode> records) {
        Map<String, ObjectNode> rel = relation(relation);
        synchronized (rel) {
            rel.clear();
            rel.putAll(records);
        }
    }

    private Map<String, ObjectNode> relation(String relation) {
        Objects.requireNonNull(relation, "relation");
        return relations.computeIfAbsent(relation, r -> new LinkedHashMap<>());
    }
}
