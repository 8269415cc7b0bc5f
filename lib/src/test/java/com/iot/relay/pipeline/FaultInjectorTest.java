package com.iot.relay.pipeline;

import org.junit.jupiter.api.Test;

import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class FaultInjectorTest {

    @Test
    void testNeverAndAlways() {
        assertFalse(FaultInjector.never().shouldFail());
        assertTrue(FaultInjector.always().shouldFail());
    }

    @Test
    void testEveryNthFiresOnMultiples() {
        FaultInjector injector = FaultInjector.everyNth(3);

        assertFalse(injector.shouldFail());
        assertFalse(injector.shouldFail());
        assertTrue(injector.shouldFail());
        assertFalse(injector.shouldFail());
        assertFalse(injector.shouldFail());
        assertTrue(injector.shouldFail());
    }

    @Test
    void testEveryNthInstancesKeepSeparateCounters() {
        FaultInjector first = FaultInjector.everyNth(2);
        FaultInjector second = FaultInjector.everyNth(2);

        first.shouldFail();
        assertTrue(first.shouldFail());
        assertFalse(second.shouldFail());
    }

    @Test
    void testProbabilityBounds() {
        assertFalse(FaultInjector.probability(0.0, new Random(42)).shouldFail());
        assertTrue(FaultInjector.probability(1.0, new Random(42)).shouldFail());
        assertThrows(IllegalArgumentException.class, () -> FaultInjector.probability(1.5, new Random()));
        assertThrows(IllegalArgumentException.class, () -> FaultInjector.everyNth(0));
    }

    @Test
    void testToggle() {
        FaultInjector.Toggle toggle = FaultInjector.toggle();

        assertFalse(toggle.shouldFail());
        toggle.engage();
        assertTrue(toggle.shouldFail());
        assertTrue(toggle.shouldFail());
        toggle.clear();
        assertFalse(toggle.shouldFail());
    }
}
