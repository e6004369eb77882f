package com.trustplatform.common.policy;

import com.trustplatform.common.exception.ResourceNotFoundException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ResponsePolicySetTest {

    private ResponsePolicySet set;

    private static ResponsePolicy policy(String id, int priority) {
        return ResponsePolicy.of(id, id, priority, List.of(), List.of());
    }

    @BeforeEach
    void setUp() {
        set = new ResponsePolicySet();
    }

    @Test
    @DisplayName("ordered by priority, ties keep insertion order")
    void ordering() {
        set.add(policy("c", 30));
        set.add(policy("a", 10));
        set.add(policy("b1", 20));
        set.add(policy("b2", 20));

        assertEquals(List.of("a", "b1", "b2", "c"), set.ordered().stream().map(ResponsePolicy::policyId).toList());
    }

    @Test
    @DisplayName("same id replaces")
    void replace() {
        set.add(policy("a", 10));
        set.add(policy("a", 5));

        assertEquals(1, set.size());
        assertEquals(5, set.get("a").priority());
    }

    @Test
    @DisplayName("remove and lookup of unknown ids")
    void removeAndMissing() {
        set.add(policy("a", 10));

        assertTrue(set.remove("a"));
        assertFalse(set.remove("a"));
        ResourceNotFoundException ex = assertThrows(ResourceNotFoundException.class, () -> set.get("a"));
        assertEquals("Policy", ex.getResourceType());
        assertThrows(ResourceNotFoundException.class, () -> set.setEnabled("a", false));
    }

    @Test
    @DisplayName("setEnabled toggles in place")
    void toggle() {
        set.add(policy("a", 10));
        set.add(policy("b", 20));

        set.setEnabled("a", false);

        assertFalse(set.get("a").enabled());
        assertEquals("a", set.ordered().get(0).policyId());
    }
}
