package com.titiplex.lanqueue.core.p2p;

import com.titiplex.lanqueue.core.model.LanClipboardItem;
import com.titiplex.lanqueue.core.model.LanQueueMember;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.DataInputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.net.SocketTimeoutException;
import java.util.List;
import java.util.concurrent.ExecutorService;

/**
 * Client side of the queue: one authenticated connection to the host, with a writer task
 * draining {@link #outbound()} and a read loop forwarding items and membership snapshots to the
 * observer. Never reconnects on its own.
 */
public class ClientEngine implements RoleEngine {
    private static final Logger log = LoggerFactory.getLogger(ClientEngine.class);
    static final String AUTH_FAILED = "Authentication failed";
    static final String INVALID_AUTH_RESPONSE = "Invalid auth response";

    private final Socket socket;
    private final DataInputStream in;
    private final OutboundQueue outbound;
    private final SessionState state;
    private final LanQueueObserver observer;
    private final EnvelopeCodec codec;
    private final String target;
    private final ExecutorService workers = Workers.newPool("lan-client");
    private volatile boolean running = true;

    private ClientEngine(Socket socket, DataInputStream in, OutputStream out, SessionState state,
                         LanQueueObserver observer, EnvelopeCodec codec, String target) {
        this.socket = socket;
        this.in = in;
        this.state = state;
        this.observer = observer;
        this.codec = codec;
        this.target = target;
        this.outbound = new OutboundQueue(out, "host " + target);
    }

    /**
     * Connects and authenticates. Connect, auth write and auth read are each bounded by
     * {@code timeoutMs}.
     *
     * @throws LanQueueException TIMEOUT, CONNECT, AUTH_REJECTED or PROTOCOL
     */
    public static ClientEngine connect(String host, int port, String password, String selfId, String selfName,
                                       SessionState state, LanQueueObserver observer, EnvelopeCodec codec,
                                       int timeoutMs) {
        String target = host + ":" + port;
        byte[] authFrame;
        try {
            authFrame = codec.toFrame(new Envelope.AuthRequest(password, selfId, selfName));
        } catch (IllegalArgumentException e) {
            throw new LanQueueException(LanQueueException.Kind.PROTOCOL, "Auth request not sendable: " + e.getMessage(), e);
        }
        Socket socket = new Socket();
        try {
            socket.connect(new InetSocketAddress(host, port), timeoutMs);
        } catch (SocketTimeoutException e) {
            Workers.close(socket, log);
            throw new LanQueueException(LanQueueException.Kind.TIMEOUT, timeoutMessage(timeoutMs), e);
        } catch (IOException e) {
            Workers.close(socket, log);
            throw new LanQueueException(LanQueueException.Kind.CONNECT, "Failed to connect: " + e.getMessage(), e);
        }

        try {
            socket.setTcpNoDelay(true);
            socket.setSoTimeout(timeoutMs);
            DataInputStream in = new DataInputStream(new BufferedInputStream(socket.getInputStream()));
            OutputStream out = new BufferedOutputStream(socket.getOutputStream());

            out.write(authFrame);
            out.flush();

            byte[] payload = FrameCodec.readFrame(in);
            Envelope env;
            try {
                env = codec.parse(payload);
            } catch (IOException e) {
                throw new LanQueueException(LanQueueException.Kind.PROTOCOL, INVALID_AUTH_RESPONSE, e);
            }
            if (!(env instanceof Envelope.AuthResponse resp)) {
                throw new LanQueueException(LanQueueException.Kind.PROTOCOL, INVALID_AUTH_RESPONSE);
            }
            if (!resp.ok()) {
                String reason = resp.reason() == null || resp.reason().isBlank() ? AUTH_FAILED : resp.reason();
                throw new LanQueueException(LanQueueException.Kind.AUTH_REJECTED, reason);
            }

            socket.setSoTimeout(0);
            return new ClientEngine(socket, in, out, state, observer, codec, target);
        } catch (SocketTimeoutException e) {
            Workers.close(socket, log);
            throw new LanQueueException(LanQueueException.Kind.TIMEOUT, timeoutMessage(timeoutMs), e);
        } catch (IOException e) {
            Workers.close(socket, log);
            throw new LanQueueException(LanQueueException.Kind.CONNECT, "Connection lost during handshake: " + e.getMessage(), e);
        } catch (LanQueueException e) {
            Workers.close(socket, log);
            throw e;
        }
    }

    private static String timeoutMessage(int timeoutMs) {
        String span = timeoutMs % 1000 == 0 ? (timeoutMs / 1000) + "s" : timeoutMs + "ms";
        return "Connection timeout (" + span + ")";
    }

    /**
     * Starts the writer and the read loop. Install the engine in the session state first so a
     * loop that ends at once can still switch the role off.
     */
    public void start() {
        workers.execute(outbound);
        workers.execute(this::readLoop);
        log.info("joined {}", target);
    }

    public OutboundQueue outbound() {
        return outbound;
    }

    @Override
    public boolean isLive() {
        return running && outbound.isOpen();
    }

    @Override
    public void stop() {
        if (!running) return;
        running = false;
        outbound.close();
        Workers.close(socket, log);
        workers.shutdownNow();
    }

    private void readLoop() {
        try {
            while (running) {
                byte[] payload = FrameCodec.readFrame(in);
                Envelope env;
                try {
                    env = codec.parse(payload);
                } catch (IOException e) {
                    log.debug("skipping unparseable frame from {}: {}", target, e.getMessage());
                    continue;
                }
                if (env instanceof Envelope.ClipboardItem ci) {
                    onItem(ci.item());
                } else if (env instanceof Envelope.MemberUpdate mu) {
                    List<LanQueueMember> members = mu.members() == null ? List.of() : mu.members();
                    if (state.replaceMembers(this, members)) observer.onMembers(members);
                }
            }
        } catch (IOException e) {
            if (running) log.info("connection to {} lost: {}", target, e.getMessage());
        } finally {
            running = false;
            outbound.close();
            Workers.close(socket, log);
            if (state.clientDisconnected(this)) {
                observer.onStatus(state.status());
                observer.onMembers(List.of());
            }
            workers.shutdown();
        }
    }

    private void onItem(LanClipboardItem item) {
        if (item == null || item.id() == null || item.id().isBlank()) return;
        if (state.markSeen(item.id())) observer.onItem(item);
    }
}
