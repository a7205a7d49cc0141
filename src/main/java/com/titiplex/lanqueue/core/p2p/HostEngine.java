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
import java.net.ServerSocket;
import java.net.Socket;
import java.net.SocketAddress;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;

/**
 * Host side of the queue: accepts clients, authenticates them and relays clipboard items
 * between them.
 *
 * <p>Per connection: read one {@code auth_request}, answer with {@code auth_response}, then run
 * the relay loop until the socket dies. Items received from a peer go to every other peer,
 * never back to the sender. Each membership change is pushed to all peers as a full
 * {@code member_update} snapshot.
 */
public class HostEngine implements RoleEngine {
    private static final Logger log = LoggerFactory.getLogger(HostEngine.class);
    static final String INVALID_PASSWORD = "Invalid password";

    private final ServerSocket server;
    private final SessionState state;
    private final LanQueueObserver observer;
    private final EnvelopeCodec codec;
    private final ExecutorService workers = Workers.newPool("lan-host");
    private final Set<Socket> connections = ConcurrentHashMap.newKeySet();
    private volatile boolean running = true;

    private HostEngine(ServerSocket server, SessionState state, LanQueueObserver observer, EnvelopeCodec codec) {
        this.server = server;
        this.state = state;
        this.observer = observer;
        this.codec = codec;
    }

    /**
     * Binds a listener on all interfaces. Port 0 picks an ephemeral port.
     */
    public static HostEngine bind(int port, SessionState state, LanQueueObserver observer, EnvelopeCodec codec) throws IOException {
        ServerSocket server = new ServerSocket();
        try {
            server.setReuseAddress(true);
            server.bind(new InetSocketAddress(port));
        } catch (IOException e) {
            Workers.close(server, log);
            throw e;
        }
        return new HostEngine(server, state, observer, codec);
    }

    public int localPort() {
        return server.getLocalPort();
    }

    public void start() {
        workers.execute(this::acceptLoop);
    }

    @Override
    public void stop() {
        if (!running) return;
        running = false;
        Workers.close(server, log);
        for (Socket s : connections) Workers.close(s, log);
        connections.clear();
        workers.shutdownNow();
        log.info("host listener on port {} stopped", server.getLocalPort());
    }

    @Override
    public boolean isLive() {
        return running && !server.isClosed();
    }

    // ---------- accept ----------

    private void acceptLoop() {
        log.info("host listening on port {}", server.getLocalPort());
        while (running) {
            Socket s;
            try {
                s = server.accept();
            } catch (IOException e) {
                if (running) log.warn("accept failed, listener closing: {}", e.getMessage());
                break;
            }
            connections.add(s);
            if (!running) {
                connections.remove(s);
                Workers.close(s, log);
                break;
            }
            try {
                workers.execute(() -> handle(s));
            } catch (RejectedExecutionException e) {
                connections.remove(s);
                Workers.close(s, log);
                break;
            }
        }
    }

    // ---------- per connection ----------

    private void handle(Socket s) {
        String addr = describe(s.getRemoteSocketAddress());
        try (s) {
            s.setTcpNoDelay(true);
            DataInputStream in = new DataInputStream(new BufferedInputStream(s.getInputStream()));
            OutputStream out = new BufferedOutputStream(s.getOutputStream());

            Envelope.AuthRequest auth = awaitAuth(in, addr);
            if (auth == null) return;

            boolean ok = state.passwordMatches(auth.password());
            out.write(codec.toFrame(ok ? Envelope.AuthResponse.accepted() : Envelope.AuthResponse.rejected(INVALID_PASSWORD)));
            out.flush();
            if (!ok) {
                log.info("rejected {} ({}): invalid password", auth.clientId(), addr);
                return;
            }
            relay(s, in, out, auth.clientId(), SessionState.normalizeName(auth.clientName()), addr);
        } catch (IOException e) {
            if (running) log.debug("connection {} closed: {}", addr, e.getMessage());
        } finally {
            connections.remove(s);
        }
    }

    private Envelope.AuthRequest awaitAuth(DataInputStream in, String addr) {
        try {
            Envelope env = codec.read(in);
            if (env instanceof Envelope.AuthRequest req && req.clientId() != null && !req.clientId().isBlank()) {
                return req;
            }
            log.info("dropping {}: first frame is not a valid auth_request", addr);
        } catch (IOException e) {
            log.info("dropping {}: unreadable auth frame ({})", addr, e.getMessage());
        }
        return null;
    }

    private void relay(Socket s, DataInputStream in, OutputStream out, String clientId, String name, String addr) throws IOException {
        OutboundQueue outbound = new OutboundQueue(out, "peer " + clientId);
        PeerHandle handle = new PeerHandle(outbound, s, name, addr);
        try {
            workers.execute(outbound);
        } catch (RejectedExecutionException e) {
            return;
        }

        PeerHandle previous;
        synchronized (state) {
            if (!state.isActive(this)) {
                outbound.close();
                return;
            }
            previous = state.registerPeer(clientId, handle);
        }
        if (previous != null) {
            // same client id reconnected; drop the old link so that client sees EOF
            log.info("peer {} reconnected from {}, closing {}", clientId, addr, previous.addr());
            previous.outbound().close();
            Workers.close(previous.socket(), log);
        }
        log.info("peer {} ({}) joined as {}", clientId, addr, name);
        publishMembers();

        try {
            while (running) {
                byte[] payload = FrameCodec.readFrame(in);
                Envelope env;
                try {
                    env = codec.parse(payload);
                } catch (IOException e) {
                    log.debug("skipping unparseable frame from {}: {}", clientId, e.getMessage());
                    continue;
                }
                if (env instanceof Envelope.ClipboardItem ci) {
                    relayItem(clientId, ci.item());
                }
            }
        } finally {
            outbound.close();
            if (state.removePeer(clientId, handle)) {
                log.info("peer {} ({}) left", clientId, addr);
                if (state.isActive(this)) publishMembers();
            }
        }
    }

    private void relayItem(String fromId, LanClipboardItem item) {
        if (item == null || item.id() == null || item.id().isBlank()) return;
        List<OutboundQueue> targets;
        synchronized (state) {
            if (!state.markSeen(item.id())) return;
            targets = state.peerQueuesExcept(fromId);
        }
        observer.onItem(item);
        if (targets.isEmpty()) return;
        byte[] frame;
        try {
            frame = codec.toFrame(new Envelope.ClipboardItem(item));
        } catch (IllegalArgumentException e) {
            log.warn("item {} from {} not relayed: {}", item.id(), fromId, e.getMessage());
            return;
        }
        for (OutboundQueue q : targets) q.offer(frame);
    }

    private void publishMembers() {
        List<LanQueueMember> members;
        List<OutboundQueue> queues;
        synchronized (state) {
            members = state.members();
            queues = state.peerQueues();
        }
        byte[] frame = codec.toFrame(new Envelope.MemberUpdate(members));
        for (OutboundQueue q : queues) q.offer(frame);
        observer.onMembers(members);
    }

    private static String describe(SocketAddress a) {
        if (a instanceof InetSocketAddress isa) {
            return isa.getAddress() != null
                    ? isa.getAddress().getHostAddress() + ":" + isa.getPort()
                    : isa.getHostString() + ":" + isa.getPort();
        }
        return a == null ? null : a.toString();
    }
}
