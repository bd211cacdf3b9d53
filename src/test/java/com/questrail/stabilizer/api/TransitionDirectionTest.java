package com.questrail.stabilizer.api;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TransitionDirectionTest {

    @Test
    void directionFollowsTargetValue() {
        assertEquals(TransitionDirection.FALSE_TO_TRUE, TransitionDirection.of(false, true));
        assertEquals(TransitionDirection.TRUE_TO_FALSE, TransitionDirection.of(true, false));

        assertTrue(TransitionDirection.FALSE_TO_TRUE.target());
        assertFalse(TransitionDirection.TRUE_TO_FALSE.target());
    }

    @Test
    void equalValuesAreNotATransition() {
        assertThrows(IllegalArgumentException.class, () -> TransitionDirection.of(true, true));
        assertThrows(IllegalArgumentException.class, () -> TransitionDirection.of(false, false));
    }
}
