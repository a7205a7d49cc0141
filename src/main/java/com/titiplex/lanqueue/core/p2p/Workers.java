package com.titiplex.lanqueue.core.p2p;

import org.slf4j.Logger;

import java.io.Closeable;
import java.io.IOException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

final class Workers {

    private Workers() {
    }

    /**
     * Cached pool of daemon threads named {@code prefix-N}, one pool per engine.
     */
    static ExecutorService newPool(String prefix) {
        AtomicInteger n = new AtomicInteger();
        return Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, prefix + "-" + n.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    static void close(Closeable c, Logger log) {
        if (c == null) return;
        try {
            c.close();
        } catch (IOException e) {
            log.debug("close failed: {}", e.getMessage());
        }
    }
}
