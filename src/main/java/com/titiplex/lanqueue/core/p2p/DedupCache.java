package com.titiplex.lanqueue.core.p2p;

import java.util.ArrayDeque;
import java.util.HashSet;
import java.util.Set;

/**
 * Bounded set of recently seen item ids. Eviction is FIFO by first insertion; seeing an id
 * again does not refresh it. Not thread-safe, callers hold the session lock.
 */
public class DedupCache {
    public static final int DEFAULT_CAPACITY = 512;

    private final ArrayDeque<String> order = new ArrayDeque<>();
    private final Set<String> set = new HashSet<>();
    private final int capacity;

    public DedupCache(int capacity) {
        if (capacity <= 0) throw new IllegalArgumentException("capacity must be > 0: " + capacity);
        this.capacity = capacity;
    }

    public boolean contains(String id) {
        return set.contains(id);
    }

    public void insert(String id) {
        if (!set.add(id)) return;
        order.addLast(id);
        while (order.size() > capacity) {
            set.remove(order.removeFirst());
        }
    }

    /**
     * Inserts {@code id} if absent.
     *
     * @return true if the id had not been seen yet
     */
    public boolean markSeen(String id) {
        if (contains(id)) return false;
        insert(id);
        return true;
    }

    public int size() {
        return order.size();
    }

    public int capacity() {
        return capacity;
    }
}
