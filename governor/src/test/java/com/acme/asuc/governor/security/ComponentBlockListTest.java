package com.acme.asuc.governor.security;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ComponentBlockListTest {

    @Test
    void shouldBlockUntilUnblocked() {
        ComponentBlockList list = new ComponentBlockList();
        list.block("pkg_update", "misbehaving");
        assertTrue(list.isBlocked("pkg_update"));
        assertFalse(list.isBlocked("feeds"));
        assertFalse(list.isBlocked(null));

        assertTrue(list.unblock("pkg_update"));
        assertFalse(list.unblock("pkg_update"));
        assertFalse(list.isBlocked("pkg_update"));
    }

    @Test
    void shouldBlockAllSkippingNulls() {
        ComponentBlockList list = new ComponentBlockList();
        list.blockAll(Arrays.asList("a", null, "b"), null);
        assertEquals(Set.of("a", "b"), list.blockedComponents());
    }
}
