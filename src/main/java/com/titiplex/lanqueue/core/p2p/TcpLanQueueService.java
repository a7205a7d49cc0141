package com.titiplex.lanqueue.core.p2p;

import com.titiplex.lanqueue.core.crypto.PasswordHasher;
import com.titiplex.lanqueue.core.model.LanClipboardItem;
import com.titiplex.lanqueue.core.model.LanQueueMember;
import com.titiplex.lanqueue.core.model.LanQueueStatus;
import com.titiplex.lanqueue.core.model.Role;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.List;

/**
 * Star-topology queue over plain TCP. Lifecycle commands are serialized on this service's
 * monitor and always stop the previous engine before installing the next one; bookkeeping
 * goes through {@link SessionState}'s own monitor.
 */
@Service
public class TcpLanQueueService implements LanQueueService {
    private static final Logger log = LoggerFactory.getLogger(TcpLanQueueService.class);
    public static final String ANY_ADDRESS = "0.0.0.0";

    private final SessionState state;
    private final LanQueueObserver observer;
    private final EnvelopeCodec codec;
    private final int handshakeTimeoutMs;

    public TcpLanQueueService(SessionState state,
                              LanQueueObserver observer,
                              EnvelopeCodec codec,
                              @Value("${app.lanqueue.handshake-timeout-ms:3000}") int handshakeTimeoutMs) {
        this.state = state;
        this.observer = new SafeObserver(observer);
        this.codec = codec;
        this.handshakeTimeoutMs = handshakeTimeoutMs;
    }

    // ---------- lifecycle ----------

    @Override
    public synchronized LanQueueStatus startHost(int port, String password, String queueName, String memberName) {
        checkPort(port);
        teardown();
        String selfName = SessionState.normalizeName(memberName);
        if (selfName == null) selfName = SessionState.normalizeName(queueName);

        HostEngine engine;
        try {
            engine = HostEngine.bind(port, state, observer, codec);
        } catch (IOException e) {
            state.resetOff();
            observer.onStatus(state.status());
            throw new LanQueueException(LanQueueException.Kind.BIND, "Failed to bind host port: " + e.getMessage(), e);
        }

        state.reset(Role.HOST, ANY_ADDRESS, engine.localPort(), selfName, PasswordHasher.hash(password));
        state.installEngine(engine);
        engine.start();

        LanQueueStatus status = state.status();
        observer.onStatus(status);
        observer.onMembers(state.members());
        return status;
    }

    @Override
    public synchronized LanQueueStatus join(String host, int port, String password, String memberName) {
        checkPort(port);
        if (host == null || host.isBlank()) throw new IllegalArgumentException("host is required");
        teardown();
        String selfName = SessionState.normalizeName(memberName);
        state.reset(Role.CLIENT, host.trim(), port, selfName, null);

        ClientEngine engine;
        try {
            engine = ClientEngine.connect(host.trim(), port, password, state.selfId(), selfName,
                    state, observer, codec, handshakeTimeoutMs);
        } catch (LanQueueException e) {
            log.info("join {}:{} failed ({}): {}", host, port, e.kind(), e.getMessage());
            observer.onStatus(state.status());
            throw e;
        }

        state.installEngine(engine);
        engine.start();

        LanQueueStatus status = state.status();
        observer.onStatus(status);
        return status;
    }

    @Override
    public synchronized void leave() {
        teardown();
        state.resetOff();
        observer.onStatus(state.status());
        observer.onMembers(List.of());
    }

    private void teardown() {
        RoleEngine old = state.detachEngine();
        if (old != null) old.stop();
    }

    // ---------- items ----------

    @Override
    public void send(LanClipboardItem item) {
        if (item == null) return;
        LanClipboardItem stamped;
        List<OutboundQueue> targets;
        synchronized (state) {
            stamped = state.stamp(item);
            targets = state.markSeen(stamped.id()) ? state.outboundTargets() : null;
        }
        if (targets == null) {
            log.debug("item {} already seen, not sent", stamped.id());
        } else if (!targets.isEmpty()) {
            try {
                byte[] frame = codec.toFrame(new Envelope.ClipboardItem(stamped));
                for (OutboundQueue q : targets) q.offer(frame);
            } catch (IllegalArgumentException e) {
                log.warn("item {} not sent: {}", stamped.id(), e.getMessage());
            }
        }
        observer.onStatus(state.status());
    }

    // ---------- queries ----------

    @Override
    public LanQueueStatus status() {
        return state.status();
    }

    @Override
    public List<LanQueueMember> members() {
        return state.members();
    }

    private static void checkPort(int port) {
        if (port < 0 || port > 0xFFFF) throw new IllegalArgumentException("port out of range: " + port);
    }
}
