package com.fedround.monitor;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;

public class FailureDetectorTest {

    @Test
    public void testSilentWorkerIsDeclaredDead() {
        AtomicLong clock = new AtomicLong(0);
        List<Integer> evicted = new ArrayList<>();
        FailureDetector detector = new FailureDetector(evicted::add, 1_000, 100, clock::get);

        detector.ping(0);
        detector.ping(1);
        clock.set(800);
        detector.ping(1);

        clock.set(1_500);
        assertEquals(List.of(0), detector.checkWorkers());
        assertEquals(List.of(0), evicted);
        assertEquals(1, detector.getTrackedWorkerCount());

        clock.set(1_700);
        assertTrue(detector.checkWorkers().isEmpty());
        clock.set(1_900);
        assertEquals(List.of(1), detector.checkWorkers());
    }

    @Test
    public void testForgottenWorkerIsNotReported() {
        AtomicLong clock = new AtomicLong(0);
        List<Integer> evicted = new ArrayList<>();
        FailureDetector detector = new FailureDetector(evicted::add, 1_000, 100, clock::get);

        detector.ping(3);
        detector.forget(3);
        clock.set(5_000);

        assertTrue(detector.checkWorkers().isEmpty());
        assertTrue(evicted.isEmpty());
    }

    @Test
    public void testCallbackErrorDoesNotStopChecks() {
        AtomicLong clock = new AtomicLong(0);
        FailureDetector detector = new FailureDetector(id -> {
            throw new IllegalStateException("callback broken");
        }, 1_000, 100, clock::get);

        detector.ping(0);
        detector.ping(1);
        clock.set(2_000);

        assertEquals(2, detector.checkWorkers().size());
        assertEquals(0, detector.getTrackedWorkerCount());
    }
}
