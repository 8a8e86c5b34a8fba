package com.sankeydsl.loader.semantic;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.sankeydsl.loader.semantic.DagEnforcer.Decision;
import org.junit.jupiter.api.Test;

class DagEnforcerTest {

    @Test
    void rejectsSelfLoops() {
        assertEquals(Decision.SELF_LOOP, new DagEnforcer().offer("a", "a"));
    }

    @Test
    void rejectsEdgeClosingATransitiveCycle() {
        DagEnforcer enforcer = new DagEnforcer();
        assertEquals(Decision.ACCEPTED, enforcer.offer("a", "b"));
        assertEquals(Decision.ACCEPTED, enforcer.offer("b", "c"));
        assertEquals(Decision.CLOSES_CYCLE, enforcer.offer("c", "a"));
        assertFalse(enforcer.reaches("c", "a"), "Refused edges are not recorded");
    }

    @Test
    void allowsDiamonds() {
        DagEnforcer enforcer = new DagEnforcer();
        assertEquals(Decision.ACCEPTED, enforcer.offer("a", "b"));
        assertEquals(Decision.ACCEPTED, enforcer.offer("a", "c"));
        assertEquals(Decision.ACCEPTED, enforcer.offer("b", "d"));
        assertEquals(Decision.ACCEPTED, enforcer.offer("c", "d"));
        assertEquals(Decision.ACCEPTED, enforcer.offer("a", "d"));
        assertTrue(enforcer.reaches("a", "d"));
        assertFalse(enforcer.reaches("d", "a"));
    }

    @Test
    void handlesLongChainsWithoutRecursion() {
        DagEnforcer enforcer = new DagEnforcer();
        int length = 50_000;
        for (int i = 0; i < length; i++) {
            assertEquals(Decision.ACCEPTED, enforcer.offer("n" + i, "n" + (i + 1)));
        }
        assertEquals(Decision.CLOSES_CYCLE, enforcer.offer("n" + length, "n0"));
    }
}
