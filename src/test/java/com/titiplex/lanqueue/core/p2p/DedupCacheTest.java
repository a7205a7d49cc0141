package com.titiplex.lanqueue.core.p2p;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DedupCacheTest {

    @Test
    void evictsOldestOnceCapacityIsExceeded() {
        DedupCache cache = new DedupCache(3);
        cache.insert("a");
        cache.insert("b");
        cache.insert("c");
        assertThat(cache.contains("a")).isTrue();

        cache.insert("d");

        assertThat(cache.contains("a")).isFalse();
        assertThat(cache.contains("b")).isTrue();
        assertThat(cache.contains("c")).isTrue();
        assertThat(cache.contains("d")).isTrue();
        assertThat(cache.size()).isEqualTo(3);
    }

    @Test
    void reinsertDoesNotRefreshPosition() {
        DedupCache cache = new DedupCache(3);
        cache.insert("a");
        cache.insert("b");
        cache.insert("c");

        // "a" seen again: still first in line for eviction
        cache.insert("a");
        cache.insert("d");

        assertThat(cache.contains("a")).isFalse();
        assertThat(cache.size()).isEqualTo(3);
    }

    @Test
    void markSeenReportsFirstSightingOnly() {
        DedupCache cache = new DedupCache(DedupCache.DEFAULT_CAPACITY);

        assertThat(cache.markSeen("x")).isTrue();
        assertThat(cache.markSeen("x")).isFalse();
        assertThat(cache.size()).isEqualTo(1);
    }

    @Test
    void sizeNeverExceedsCapacity() {
        DedupCache cache = new DedupCache(16);
        for (int i = 0; i < 1000; i++) {
            cache.insert("id-" + i);
            assertThat(cache.size()).isLessThanOrEqualTo(16);
        }
        assertThat(cache.contains("id-999")).isTrue();
        assertThat(cache.contains("id-983")).isFalse();
        assertThat(cache.contains("id-984")).isTrue();
    }

    @Test
    void rejectsNonPositiveCapacity() {
        assertThatThrownBy(() -> new DedupCache(0)).isInstanceOf(IllegalArgumentException.class);
    }
}
