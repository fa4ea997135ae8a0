package com.routewise.core.history;

import com.routewise.core.model.ExecutionOutcome;
import com.routewise.core.model.HistoryRecord;
import com.routewise.core.model.RoutingDecision;
import com.routewise.core.model.TaskProfile;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class RoutingHistoryTest {

    static HistoryRecord record(String handlerId, double confidence) {
        var decision = new RoutingDecision(handlerId, confidence, handlerId + " evaluation", List.of(),
                TaskProfile.general(), false, Instant.now());
        return new HistoryRecord(decision, ExecutionOutcome.succeeded(handlerId, 5), Instant.now());
    }

    @Test
    @DisplayName("default capacity is 100")
    void defaultCapacity() {
        assertEquals(100, new RoutingHistory().capacity());
    }

    @Test
    @DisplayName("capacity below one is rejected")
    void invalidCapacity() {
        assertThrows(IllegalArgumentException.class, () -> new RoutingHistory(0));
    }

    @Test
    @DisplayName("150 appends keep the 100 most recent in order")
    void evictsOldest() {
        var history = new RoutingHistory();
        for (int i = 1; i <= 150; i++) {
            history.append(record("handler-" + i, 0.5));
        }

        List<HistoryRecord> snapshot = history.snapshot();
        assertEquals(100, history.size());
        assertEquals("handler-51", snapshot.get(0).decision().selectedHandlerId());
        assertEquals("handler-150", snapshot.get(99).decision().selectedHandlerId());
    }

    @Test
    @DisplayName("snapshot is an immutable copy")
    void snapshotIsCopy() {
        var history = new RoutingHistory(5);
        history.append(record("frontend", 0.9));
        var snapshot = history.snapshot();

        history.append(record("backend", 0.8));

        assertEquals(1, snapshot.size());
        assertThrows(UnsupportedOperationException.class, () -> snapshot.add(record("x", 0.1)));
    }

    @Test
    @DisplayName("concurrent appends never exceed capacity or lose the count")
    void concurrentAppends() throws Exception {
        var history = new RoutingHistory(100);
        int threads = 8;
        int perThread = 50;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        var start = new CountDownLatch(1);
        var done = new CountDownLatch(threads);
        try {
            for (int t = 0; t < threads; t++) {
                pool.execute(() -> {
                    try {
                        start.await();
                        for (int i = 0; i < perThread; i++) {
                            history.append(record("frontend", 0.9));
                            assertTrue(history.size() <= 100);
                        }
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    } finally {
                        done.countDown();
                    }
                });
            }
            start.countDown();
            assertTrue(done.await(10, TimeUnit.SECONDS));
        } finally {
            pool.shutdownNow();
        }

        assertEquals(100, history.size());
    }
}
