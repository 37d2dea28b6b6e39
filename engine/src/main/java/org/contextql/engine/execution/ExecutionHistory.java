package org.contextql.engine.execution;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Bounded, thread-safe log of recent executions. The oldest record is dropped
 * once the capacity is reached.
 */
public class ExecutionHistory {

    private final int capacity;
    private final Deque<ExecutionRecord> records = new ArrayDeque<>();

    public ExecutionHistory(int capacity) {
        if (capacity < 0) {
            throw new IllegalArgumentException("Capacity cannot be negative: " + capacity);
        }
        this.capacity = capacity;
    }

    public synchronized void append(ExecutionRecord record) {
        if (capacity == 0) {
            return;
        }
        if (records.size() == capacity) {
            records.removeFirst();
        }
        records.addLast(record);
    }

    /**
     * @return Records oldest first
     */
    public synchronized List<ExecutionRecord> records() {
        return new ArrayList<>(records);
    }

    public synchronized List<ExecutionRecord> forContext(String contextId) {
        return records.stream().filter(r -> r.contextId().equals(contextId)).toList();
    }

    public synchronized int size() {
        return records.size();
    }
}
