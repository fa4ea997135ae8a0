package com.routewise.core.history;

import com.routewise.core.model.HistoryRecord;

import java.util.ArrayDeque;
import java.util.List;

/**
 * Bounded, thread-safe record of past routing decisions and their outcomes.
 * <p>
 * Records are kept in completion order. Once {@code capacity} records are held, each
 * append evicts the oldest one under the same lock, so {@code size() <= capacity}
 * holds at every observable point.
 */
public class RoutingHistory {

    public static final int DEFAULT_CAPACITY = 100;

    private final int capacity;
    private final ArrayDeque<HistoryRecord> records;

    public RoutingHistory() {
        this(DEFAULT_CAPACITY);
    }

    public RoutingHistory(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("History capacity must be >= 1: " + capacity);
        }
        this.capacity = capacity;
        this.records = new ArrayDeque<>(capacity);
    }

    public void append(HistoryRecord record) {
        synchronized (records) {
            if (records.size() == capacity) {
                records.pollFirst();
            }
            records.addLast(record);
        }
    }

    /**
     * Consistent copy of the current records, oldest first.
     */
    public List<HistoryRecord> snapshot() {
        synchronized (records) {
            return List.copyOf(records);
        }
    }

    public int size() {
        synchronized (records) {
            return records.size();
        }
    }

    public int capacity() {
        return capacity;
    }
}
