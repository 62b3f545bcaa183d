package com.flagship.wager_engine.game;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Bounded feed of resolved rounds, most recent first. The oldest entry is dropped once
 * the capacity is reached.
 */
public class RoundHistory {

    private final int capacity;
    private final Deque<RoundHistoryEntry> entries;

    public RoundHistory(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("History capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
        this.entries = new ArrayDeque<>(capacity);
    }

    public synchronized void record(RoundHistoryEntry entry) {
        entries.addFirst(entry);
        while (entries.size() > capacity) {
            entries.removeLast();
        }
    }

    /**
     * @throws IllegalArgumentException if {@code limit} is not positive
     */
    public synchronized List<RoundHistoryEntry> recent(int limit) {
        if (limit < 1) {
            throw new IllegalArgumentException("History limit must be positive: " + limit);
        }
        List<RoundHistoryEntry> result = new ArrayList<>(Math.min(limit, entries.size()));
        for (RoundHistoryEntry entry : entries) {
            if (result.size() >= limit) {
                break;
            }
            result.add(entry);
        }
        return result;
    }

    public synchronized List<RoundHistoryEntry> all() {
        return new ArrayList<>(entries);
    }

    public synchronized int size() {
        return entries.size();
    }
}
