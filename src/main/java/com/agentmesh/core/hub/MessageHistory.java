package com.agentmesh.core.hub;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;

/**
 * Bounded, insertion-ordered ring buffer of routed messages. Oldest entries are evicted at capacity.
 */
class MessageHistory {

    private final int capacity;
    private final ArrayDeque<HistoryEntry> entries;

    MessageHistory(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("History capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
        this.entries = new ArrayDeque<>(Math.min(capacity, 1024));
    }

    synchronized void add(HistoryEntry entry) {
        if (entries.size() == capacity) {
            entries.pollFirst();
        }
        entries.addLast(entry);
    }

    synchronized List<HistoryEntry> list(HistoryFilter filter) {
        var result = new ArrayList<HistoryEntry>();
        for (var entry : entries) {
            if (filter.matches(entry)) {
                result.add(entry);
            }
        }
        return result;
    }

    synchronized int size() {
        return entries.size();
    }

    int capacity() {
        return capacity;
    }
}
