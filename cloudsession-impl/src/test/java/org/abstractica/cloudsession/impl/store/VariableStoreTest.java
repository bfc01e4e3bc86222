package org.abstractica.cloudsession.impl.store;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link VariableStore}.
 */
class VariableStoreTest
{
    private VariableStore store;

    @BeforeEach
    void setUp()
    {
        store = new VariableStore();
    }

    @Test
    void apply_firstValueCreates()
    {
        assertEquals(VariableStore.ApplyResult.CREATED, store.apply("☁ x", "1"));
        assertTrue(store.has("☁ x"));
        assertEquals(Optional.of("1"), store.get("☁ x"));
    }

    @Test
    void apply_secondValueUpdates()
    {
        store.apply("☁ x", "1");

        assertEquals(VariableStore.ApplyResult.UPDATED, store.apply("☁ x", "2"));
        assertEquals(Optional.of("2"), store.get("☁ x"));
        assertEquals(1, store.size());
    }

    @Test
    void apply_sameValueStillUpdate()
    {
        store.apply("☁ x", "1");

        assertEquals(VariableStore.ApplyResult.UPDATED, store.apply("☁ x", "1"));
    }

    @Test
    void get_unknownIsEmpty()
    {
        assertTrue(store.isEmpty());
        assertEquals(Optional.empty(), store.get("☁ missing"));
        assertFalse(store.has("☁ missing"));
    }

    @Test
    void snapshot_isDetachedCopy()
    {
        store.apply("☁ a", "1");
        Map<String, String> snapshot = store.snapshot();
        store.apply("☁ b", "2");

        assertEquals(Map.of("☁ a", "1"), snapshot);
        assertThrows(UnsupportedOperationException.class, () -> snapshot.put("☁ c", "3"));
    }
}
