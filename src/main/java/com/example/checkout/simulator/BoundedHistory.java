package com.example.checkout.simulator;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Thread-safe record of the most recent entries. Once full, each addition evicts the oldest entry.
 */
public class BoundedHistory<T> {

    private final int capacity;
    private final Deque<T> entries;

    public BoundedHistory(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
        this.entries = new ArrayDeque<>(capacity);
    }

    public synchronized void add(T entry) {
        if (entries.size() == capacity) {
            entries.removeFirst();
        }
        entries.addLast(entry);
    }

    /**
     * Oldest first.
     */
    public synchronized List<T> snapshot() {
        return List.copyOf(entries);
    }
}
