package com.waypoint.router.latency;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Bounded FIFO of latency samples for one region. All access goes through this object's monitor.
 */
final class LatencyWindow {

    private final int capacity;
    private final Deque<Long> samples;

    LatencyWindow(int capacity) {
        this.capacity = capacity;
        this.samples = new ArrayDeque<>(capacity + 1);
    }

    synchronized void record(long latencyMs) {
        samples.addLast(latencyMs);
        while (samples.size() > capacity) {
            samples.removeFirst();
        }
    }

    synchronized long[] snapshot() {
        long[] copy = new long[samples.size()];
        int i = 0;
        for (Long sample : samples) {
            copy[i++] = sample;
        }
        return copy;
    }

    synchronized int size() {
        return samples.size();
    }
}
