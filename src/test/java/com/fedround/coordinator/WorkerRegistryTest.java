package com.fedround.coordinator;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class WorkerRegistryTest {

    @Test
    public void testRegisterAndReplace() {
        WorkerRegistry registry = new WorkerRegistry();
        FakeWorker original = new FakeWorker(1, 5, 0.0);
        FakeWorker restarted = new FakeWorker(1, 5, 0.0);

        assertTrue(registry.register(1, original));
        assertFalse(registry.register(1, restarted));

        assertEquals(1, registry.size());
        assertSame(restarted, registry.snapshot().get(1));
    }

    @Test
    public void testSnapshotIsOrderedCopy() {
        WorkerRegistry registry = new WorkerRegistry();
        registry.register(2, new FakeWorker(2, 5, 0.0));
        registry.register(0, new FakeWorker(0, 5, 0.0));
        registry.register(1, new FakeWorker(1, 5, 0.0));

        Map<Integer, ?> snapshot = registry.snapshot();
        assertEquals(List.of(0, 1, 2), new ArrayList<>(snapshot.keySet()));

        registry.remove(1);
        assertEquals(3, snapshot.size());
        assertFalse(registry.contains(1));
        assertFalse(registry.remove(1));
    }

    @Test
    public void testAwaitSize() throws Exception {
        WorkerRegistry registry = new WorkerRegistry();
        assertFalse(registry.awaitSize(1, 0));
        assertFalse(registry.awaitSize(1, 50));

        Thread joiner = new Thread(() -> {
            try {
                Thread.sleep(100);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            registry.register(0, new FakeWorker(0, 5, 0.0));
        });
        joiner.start();

        assertTrue(registry.awaitSize(1, 5_000));
        joiner.join();
    }
}
