package com.netctl.fib.util;

import com.netctl.fib.model.PerfTrace;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;

/**
 * Bounded history of completed perf traces; the oldest is evicted first.
 *
 * <p>
 * The owner thread appends, query threads copy. Both hold the monitor only
 * for the duration of an O(capacity) copy at most.
 */
public final class PerfHistory {
    private final int capacity;
    private final ArrayDeque<PerfTrace> traces;

    public PerfHistory(int capacity) {
        if (capacity < 1)
            throw new IllegalArgumentException("capacity must be >= 1, got " + capacity);
        this.capacity = capacity;
        this.traces = new ArrayDeque<>(capacity);
    }

    public synchronized void add(PerfTrace trace) {
        if (traces.size() == capacity)
            traces.pollFirst();
        traces.addLast(trace);
    }

    /** Oldest first. */
    public synchronized List<PerfTrace> snapshot() {
        return new ArrayList<>(traces);
    }

    public synchronized PerfTrace latest() {
        return traces.peekLast();
    }

    public synchronized int size() {
        return traces.size();
    }

    public int capacity() {
        return capacity;
    }

    public synchronized void clear() {
        traces.clear();
    }
}
