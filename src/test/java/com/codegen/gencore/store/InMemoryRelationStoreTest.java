package com.codegen.gencore.store;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static org.junit.Assert.*;

public class InMemoryRelationStoreTest {

    private static ObjectNode rec(String name, int n) {
        return JsonNodeFactory.instance.objectNode().put("name", name).put("n", n);
    }

    @Test
    public void testPutGetDelete() {
        RelationStore store = new InMemoryRelationStore();
        assertFalse(store.get("kind", "A").isPresent());

        store.put("kind", "A", rec("A", 1));
        assertEquals("A", store.get("kind", "A").get().path("name").asText());

        assertTrue(store.delete("kind", "A"));
        assertFalse(store.delete("kind", "A"));
        assertFalse(store.delete("missing", "A"));
        assertFalse(store.get("kind", "A").isPresent());
    }

    @Test
    public void testRecordsAreCopies() {
        RelationStore store = new InMemoryRelationStore();
        ObjectNode original = rec("A", 1);
        store.put("kind", "A", original);

        original.put("n", 99);
        assertEquals(1, store.get("kind", "A").get().path("n").asInt());

        store.get("kind", "A").get().put("n", 42);
        store.find("kind").get(0).put("n", 43);
        assertEquals(1, store.get("kind", "A").get().path("n").asInt());
    }

    @Test
    public void testFindKeepsInsertionOrderAcrossReplace() {
        RelationStore store = new InMemoryRelationStore();
        store.put("r", "b", rec("b", 1));
        store.put("r", "a", rec("a", 2));
        store.put("r", "c", rec("c", 3));
        store.put("r", "b", rec("b", 4));

        List<ObjectNode> all = store.find("r");
        assertEquals(3, all.size());
        assertEquals("b", all.get(0).path("name").asText());
        assertEquals(4, all.get(0).path("n").asInt());
        assertEquals("a", all.get(1).path("name").asText());
        assertEquals("c", all.get(2).path("name").asText());
    }

    @Test
    public void testFindWithFilter() {
        RelationStore store = new InMemoryRelationStore();
        store.put("r", "a", rec("a", 1));
        store.put("r", "b", rec("b", 2));
        store.put("r", "c", rec("c", 1));

        ObjectNode filter = JsonNodeFactory.instance.objectNode().put("n", 1);
        List<ObjectNode> hits = store.find("r", filter);
        assertEquals(2, hits.size());
        assertEquals("a", hits.get(0).path("name").asText());
        assertEquals("c", hits.get(1).path("name").asText());

        assertEquals(3, store.find("r", JsonNodeFactory.instance.objectNode()).size());
        assertTrue(store.find("nothing").isEmpty());

        ObjectNode noField = JsonNodeFactory.instance.objectNode().put("missing", true);
        assertTrue(store.find("r", noField).isEmpty());
    }

    @Test
    public void testUpdate() {
        RelationStore store = new InMemoryRelationStore();
        assertFalse(store.update("r", "a", r -> r.put("n", 5)).isPresent());

        store.put("r", "a", rec("a", 1));
        Optional<ObjectNode> updated = store.update("r", "a", r -> r.put("n", r.path("n").asInt() + 1));
        assertTrue(updated.isPresent());
        assertEquals(2, updated.get().path("n").asInt());
        assertEquals(2, store.get("r", "a").get().path("n").asInt());
    }

    @Test
    public void testConcurrentUpdatesAreAtomicPerKey() throws Exception {
        RelationStore store = new InMemoryRelationStore();
        store.put("r", "counter", rec("counter", 0));

        Thread[] threads = new Thread[8];
        for (int t = 0; t < threads.length; t++) {
            threads[t] = new Thread(() -> {
                for (int i = 0; i < 500; i++)
                    store.update("r", "counter", r -> r.put("n", r.path("n").asInt() + 1));
            });
            threads[t].start();
        }
        for (Thread t : threads)
            t.join();

        assertEquals(4000, store.get("r", "counter").get().path("n").asInt());
    }

    @Test
    public void testRelationsListsOnlyNonEmpty() {
        RelationStore store = new InMemoryRelationStore();
        store.put("zeta", "a", rec("a", 1));
        store.put("alpha", "a", rec("a", 1));
        store.put("gone", "a", rec("a", 1));
        store.delete("gone", "a");

        assertEquals(Set.of("alpha", "zeta"), store.relations());
        assertEquals("alpha", store.relations().iterator().next());
    }

    @Test
    public void testFailingChangeHookRollsBack() {
        boolean[] failing = { false };
        InMemoryRelationStore store = new InMemoryRelationStore() {
            @Override
            protected void onRelationChanged(String relation, Map<String, ObjectNode> records) {
                if (failing[0])
                    throw new StoreException("disk full", null);
            }
        };
        store.put("r", "a", rec("a", 1));
        store.put("r", "b", rec("b", 2));
        failing[0] = true;

        assertThrows(StoreException.class, () -> store.put("r", "a", rec("a", 9)));
        assertThrows(StoreException.class, () -> store.delete("r", "a"));
        assertThrows(StoreException.class, () -> store.update("r", "b", n -> n.put("n", 9)));

        List<ObjectNode> all = store.find("r");
        assertEquals(2, all.size());
        assertEquals("a", all.get(0).path("name").asText());
        assertEquals(1, all.get(0).path("n").asInt());
        assertEquals(2, all.get(1).path("n").asInt());
    }
}
