package com.ryuqq.saga.core.model;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Payload 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class PayloadTest {

    @Test
    void of_NullOrEmptyMap_ReturnsEmpty() {
        assertSame(Payload.empty(), Payload.of((Map<String, ?>) null));
        assertSame(Payload.empty(), Payload.of(Map.of()));
        assertTrue(Payload.empty().isEmpty());
    }

    @Test
    void of_Map_CopiesValues() {
        // Given
        Map<String, Object> source = new HashMap<>();
        source.put("order_id", "123");

        // When
        Payload payload = Payload.of(source);
        source.put("order_id", "changed");

        // Then
        assertEquals("123", payload.get("order_id"));
    }

    @Test
    void of_NullKey_ThrowsException() {
        Map<String, Object> source = new HashMap<>();
        source.put(null, "value");

        assertThrows(IllegalArgumentException.class, () -> Payload.of(source));
    }

    @Test
    void of_NullValue_IsAllowed() {
        Payload payload = Payload.of("note", null);

        assertTrue(payload.containsKey("note"));
        assertNull(payload.get("note"));
    }

    @Test
    void asMap_IsUnmodifiable() {
        Payload payload = Payload.of("a", 1);

        assertThrows(UnsupportedOperationException.class, () -> payload.asMap().put("b", 2));
    }

    @Test
    void with_ReturnsNewPayload_OriginalUnchanged() {
        // Given
        Payload original = Payload.of("a", 1);

        // When
        Payload updated = original.with("b", 2);

        // Then
        assertEquals(1, original.size());
        assertEquals(2, updated.size());
        assertEquals(2, updated.get("b"));
    }

    @Test
    void merge_UpdatesWinOnConflict() {
        // Given
        Payload shared = Payload.of("order_id", "123").with("status", "new");

        // When
        Payload merged = shared.merge(Payload.of("status", "paid").with("payment_id", "PAY-9"));

        // Then
        assertEquals("123", merged.get("order_id"));
        assertEquals("paid", merged.get("status"));
        assertEquals("PAY-9", merged.get("payment_id"));
    }

    @Test
    void merge_NullOrEmpty_ReturnsSameInstance() {
        Payload payload = Payload.of("a", 1);

        assertSame(payload, payload.merge(null));
        assertSame(payload, payload.merge(Payload.empty()));
    }

    @Test
    void asMap_PreservesInsertionOrder() {
        Map<String, Object> source = new LinkedHashMap<>();
        source.put("z", 1);
        source.put("a", 2);
        source.put("m", 3);

        assertEquals(List.of("z", "a", "m"), List.copyOf(Payload.of(source).asMap().keySet()));
    }

    @Test
    void equals_SameContent_AreEqual() {
        Payload a = Payload.of("k", "v");
        Payload b = Payload.of(Map.of("k", "v"));

        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
    }
}
