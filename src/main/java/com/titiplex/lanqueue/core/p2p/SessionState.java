package com.titiplex.lanqueue.core.p2p;

import com.titiplex.lanqueue.core.crypto.PasswordHasher;
import com.titiplex.lanqueue.core.model.LanClipboardItem;
import com.titiplex.lanqueue.core.model.LanQueueMember;
import com.titiplex.lanqueue.core.model.LanQueueStatus;
import com.titiplex.lanqueue.core.model.Role;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Process-wide queue state: role, identity, peers, dedup cache and the active engine.
 * Every access goes through this object's monitor; no network I/O happens under it.
 */
@Component
public class SessionState {
    private final String selfId = UUID.randomUUID().toString();
    private final DedupCache dedup;
    private final Map<String, PeerHandle> peers = new LinkedHashMap<>();

    private Role role = Role.OFF;
    private String host;
    private Integer port;
    private String selfName;
    private String passwordHash;
    private RoleEngine engine;
    private List<LanQueueMember> hostSnapshot;

    public SessionState(@Value("${app.lanqueue.dedup-capacity:512}") int dedupCapacity) {
        this.dedup = new DedupCache(dedupCapacity);
    }

    public String selfId() {
        return selfId;
    }

    public synchronized String selfName() {
        return selfName;
    }

    public synchronized Role role() {
        return role;
    }

    // ---------- lifecycle ----------

    /**
     * Uninstalls the active engine and drops all peers. The caller stops the returned engine
     * outside the lock.
     */
    public synchronized RoleEngine detachEngine() {
        RoleEngine old = engine;
        engine = null;
        peers.clear();
        hostSnapshot = null;
        return old;
    }

    public synchronized void reset(Role newRole, String newHost, Integer newPort, String newSelfName, String newPasswordHash) {
        role = newRole;
        host = newHost;
        port = newPort;
        selfName = newSelfName;
        passwordHash = newPasswordHash;
        hostSnapshot = null;
    }

    /**
     * Leaves identity (self name) alone and clears everything else.
     */
    public synchronized void resetOff() {
        role = Role.OFF;
        host = null;
        port = null;
        passwordHash = null;
        peers.clear();
        hostSnapshot = null;
    }

    public synchronized void installEngine(RoleEngine e) {
        engine = e;
    }

    public synchronized boolean isActive(RoleEngine e) {
        return e != null && engine == e;
    }

    /**
     * Called by a client engine whose read loop ended. Only the active engine may switch the
     * role off; a replaced engine is ignored.
     *
     * @return true if the state changed
     */
    public synchronized boolean clientDisconnected(RoleEngine e) {
        if (!isActive(e)) return false;
        engine = null;
        role = Role.OFF;
        hostSnapshot = null;
        return true;
    }

    /**
     * Stores the membership snapshot a client received from its host. Replaces the previous
     * snapshot; ignored unless {@code e} is the active client engine.
     *
     * @return true if the snapshot was stored
     */
    public synchronized boolean replaceMembers(RoleEngine e, List<LanQueueMember> snapshot) {
        if (role != Role.CLIENT || !isActive(e)) return false;
        hostSnapshot = Collections.unmodifiableList(new ArrayList<>(snapshot));
        return true;
    }

    // ---------- host bookkeeping ----------

    public synchronized boolean passwordMatches(String password) {
        return PasswordHasher.matches(password, passwordHash);
    }

    /**
     * @return the handle previously registered under {@code clientId}, or null
     */
    public synchronized PeerHandle registerPeer(String clientId, PeerHandle handle) {
        return peers.put(clientId, handle);
    }

    /**
     * Removes {@code clientId} only if it still maps to {@code handle}.
     */
    public synchronized boolean removePeer(String clientId, PeerHandle handle) {
        return peers.remove(clientId, handle);
    }

    public synchronized int peerCount() {
        return peers.size();
    }

    public synchronized List<OutboundQueue> peerQueues() {
        List<OutboundQueue> out = new ArrayList<>(peers.size());
        for (PeerHandle p : peers.values()) out.add(p.outbound());
        return out;
    }

    public synchronized List<OutboundQueue> peerQueuesExcept(String clientId) {
        List<OutboundQueue> out = new ArrayList<>(peers.size());
        for (Map.Entry<String, PeerHandle> e : peers.entrySet()) {
            if (!e.getKey().equals(clientId)) out.add(e.getValue().outbound());
        }
        return out;
    }

    // ---------- items ----------

    /**
     * @return true if {@code id} is new (and is now remembered)
     */
    public synchronized boolean markSeen(String id) {
        return dedup.markSeen(id);
    }

    public synchronized boolean hasSeen(String id) {
        return dedup.contains(id);
    }

    /**
     * Fills in a missing id, origin and sender name.
     */
    public synchronized LanClipboardItem stamp(LanClipboardItem item) {
        LanClipboardItem out = item;
        if (out.id() == null || out.id().isBlank()) out = out.withId(UUID.randomUUID().toString());
        if (out.origin() == null || out.origin().isBlank()) out = out.withOrigin(selfId);
        if (out.senderName() == null) out = out.withSenderName(selfName);
        return out;
    }

    /**
     * Where a locally sent item goes: every peer when hosting, the host connection when joined.
     */
    public synchronized List<OutboundQueue> outboundTargets() {
        return switch (role) {
            case HOST -> peerQueues();
            case CLIENT -> engine instanceof ClientEngine ce && ce.isLive() ? List.of(ce.outbound()) : List.of();
            case OFF -> List.of();
        };
    }

    // ---------- snapshots ----------

    public synchronized LanQueueStatus status() {
        boolean connected = switch (role) {
            case HOST -> true;
            case CLIENT -> engine != null && engine.isLive();
            case OFF -> false;
        };
        return new LanQueueStatus(role, connected, host, port, selfId, selfName);
    }

    public synchronized List<LanQueueMember> members() {
        if (role == Role.OFF) return List.of();
        if (role == Role.CLIENT && hostSnapshot != null) return hostSnapshot;
        List<LanQueueMember> out = new ArrayList<>(peers.size() + 1);
        out.add(new LanQueueMember(selfId, selfName, null, true));
        for (Map.Entry<String, PeerHandle> e : peers.entrySet()) {
            PeerHandle p = e.getValue();
            out.add(new LanQueueMember(e.getKey(), p.name(), p.addr(), false));
        }
        return out;
    }

    public static String normalizeName(String name) {
        if (name == null) return null;
        String t = name.trim();
        return t.isEmpty() ? null : t;
    }
}
