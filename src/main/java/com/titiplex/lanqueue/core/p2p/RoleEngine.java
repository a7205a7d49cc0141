package com.titiplex.lanqueue.core.p2p;

/**
 * A running host listener or client connection. At most one is installed in
 * {@link SessionState} at any time.
 */
public interface RoleEngine {

    /**
     * Closes every socket owned by the engine and stops its threads. Idempotent.
     */
    void stop();

    /**
     * True while the engine can still move frames.
     */
    boolean isLive();
}
