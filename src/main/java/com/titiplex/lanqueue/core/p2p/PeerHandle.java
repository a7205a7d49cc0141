package com.titiplex.lanqueue.core.p2p;

import java.net.Socket;

/**
 * Host-side record of one authenticated client.
 *
 * @param outbound frames queued towards the client
 * @param socket   the client's connection, closed when the peer is replaced; null in tests
 * @param name     normalized display name, may be null
 * @param addr     remote socket address as {@code ip:port}, may be null
 */
public record PeerHandle(OutboundQueue outbound, Socket socket, String name, String addr) {
}
