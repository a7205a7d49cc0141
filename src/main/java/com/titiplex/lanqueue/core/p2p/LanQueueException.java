package com.titiplex.lanqueue.core.p2p;

/**
 * Caller-visible failure of a lifecycle command. The message is meant for the user.
 */
public class LanQueueException extends RuntimeException {

    public enum Kind {
        /** Host listener could not be bound. */
        BIND,
        /** Outbound connection failed or broke during the handshake. */
        CONNECT,
        /** Connect or handshake did not finish in time. */
        TIMEOUT,
        /** Host rejected the credentials. */
        AUTH_REJECTED,
        /** Peer answered with something other than the expected envelope. */
        PROTOCOL
    }

    private final Kind kind;

    public LanQueueException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public LanQueueException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public Kind kind() {
        return kind;
    }
}
