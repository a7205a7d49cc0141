package com.titiplex.lanqueue.core.p2p;

import java.io.DataInputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;

/**
 * Length-prefixed framing: {@code [u32 big-endian length N][N bytes payload]}.
 */
public final class FrameCodec {
    public static final int HEADER_SIZE = 4;
    // images are capped at 5 MB upstream; the rest is JSON/base64 overhead
    public static final int MAX_FRAME_SIZE = 6 * 1024 * 1024;

    private FrameCodec() {
    }

    public static byte[] encode(byte[] payload) {
        if (payload == null || payload.length == 0)
            throw new IllegalArgumentException("empty frame payload");
        if (payload.length > MAX_FRAME_SIZE)
            throw new IllegalArgumentException("frame payload too large: " + payload.length);
        return ByteBuffer.allocate(HEADER_SIZE + payload.length)
                .putInt(payload.length)
                .put(payload)
                .array();
    }

    /**
     * Blocks until one whole frame has been read. The length prefix is validated before any
     * payload byte is consumed.
     *
     * @throws EOFException       if the stream ends before or inside a frame
     * @throws FrameSizeException if the declared length is 0 or above {@link #MAX_FRAME_SIZE}
     */
    public static byte[] readFrame(InputStream in) throws IOException {
        DataInputStream din = in instanceof DataInputStream d ? d : new DataInputStream(in);
        long len = Integer.toUnsignedLong(din.readInt());
        if (len == 0 || len > MAX_FRAME_SIZE) throw new FrameSizeException(len);
        byte[] payload = new byte[(int) len];
        din.readFully(payload);
        return payload;
    }
}
