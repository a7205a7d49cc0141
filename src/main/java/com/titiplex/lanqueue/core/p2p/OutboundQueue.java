package com.titiplex.lanqueue.core.p2p;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;

/**
 * Unbounded FIFO of encoded frames for one connection, drained to the socket by {@link #run()}.
 * Closing the queue (or a write failure) ends the drain loop.
 */
public class OutboundQueue implements Runnable {
    private static final Logger log = LoggerFactory.getLogger(OutboundQueue.class);
    private static final byte[] POISON = new byte[0];

    private final BlockingQueue<byte[]> frames = new LinkedBlockingQueue<>();
    private final OutputStream out;
    private final String label;
    private volatile boolean open = true;

    public OutboundQueue(OutputStream out, String label) {
        this.out = out;
        this.label = label;
    }

    /**
     * Queues a frame. Returns false once the queue is closed.
     */
    public boolean offer(byte[] frame) {
        if (!open) return false;
        return frames.offer(frame);
    }

    public boolean isOpen() {
        return open;
    }

    public void close() {
        if (!open) return;
        open = false;
        frames.offer(POISON);
    }

    @Override
    public void run() {
        try {
            while (true) {
                byte[] frame = frames.take();
                if (frame == POISON) break;
                out.write(frame);
                out.flush();
            }
        } catch (IOException e) {
            log.debug("[{}] write failed: {}", label, e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            open = false;
            frames.clear();
        }
    }
}
