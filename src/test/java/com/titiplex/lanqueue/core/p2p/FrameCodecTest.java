package com.titiplex.lanqueue.core.p2p;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.EOFException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FrameCodecTest {

    @Test
    @DisplayName("length prefix is 4 bytes big-endian")
    void encodeWritesBigEndianLength() {
        byte[] payload = "{\"hello\":\"world\"}".getBytes(StandardCharsets.UTF_8);

        byte[] frame = FrameCodec.encode(payload);

        assertThat(frame).hasSize(4 + payload.length);
        assertThat(ByteBuffer.wrap(frame).getInt()).isEqualTo(payload.length);
        assertThat(Arrays.copyOfRange(frame, 4, frame.length)).isEqualTo(payload);
    }

    @Test
    void readsBackConsecutiveFrames() throws Exception {
        byte[] a = "first".getBytes(StandardCharsets.UTF_8);
        byte[] b = "second frame".getBytes(StandardCharsets.UTF_8);
        ByteBuffer both = ByteBuffer.allocate(8 + a.length + b.length)
                .put(FrameCodec.encode(a))
                .put(FrameCodec.encode(b));
        ByteArrayInputStream in = new ByteArrayInputStream(both.array());

        assertThat(FrameCodec.readFrame(in)).isEqualTo(a);
        assertThat(FrameCodec.readFrame(in)).isEqualTo(b);
        assertThat(in.available()).isZero();
    }

    @Test
    @DisplayName("payload at the 6 MiB ceiling round-trips")
    void maxSizedPayload() throws Exception {
        byte[] payload = new byte[FrameCodec.MAX_FRAME_SIZE];
        payload[0] = 1;
        payload[payload.length - 1] = 2;

        byte[] read = FrameCodec.readFrame(new ByteArrayInputStream(FrameCodec.encode(payload)));

        assertThat(read).isEqualTo(payload);
    }

    @Test
    void rejectsZeroLength() {
        ByteArrayInputStream in = new ByteArrayInputStream(new byte[]{0, 0, 0, 0, 42});

        assertThatThrownBy(() -> FrameCodec.readFrame(in))
                .isInstanceOf(FrameSizeException.class)
                .satisfies(e -> assertThat(((FrameSizeException) e).declaredLength()).isZero());
        assertThat(in.available()).isEqualTo(1);
    }

    @Test
    @DisplayName("oversized length is rejected before any payload byte is read")
    void rejectsOversizedLength() {
        byte[] header = ByteBuffer.allocate(4 + 3).putInt(FrameCodec.MAX_FRAME_SIZE + 1).put(new byte[3]).array();
        ByteArrayInputStream in = new ByteArrayInputStream(header);

        assertThatThrownBy(() -> FrameCodec.readFrame(in)).isInstanceOf(FrameSizeException.class);
        assertThat(in.available()).isEqualTo(3);
    }

    @Test
    void lengthAboveSignedRangeIsRejected() {
        ByteArrayInputStream in = new ByteArrayInputStream(new byte[]{(byte) 0xFF, (byte) 0xFF, (byte) 0xFF, (byte) 0xFF});

        assertThatThrownBy(() -> FrameCodec.readFrame(in))
                .isInstanceOf(FrameSizeException.class)
                .satisfies(e -> assertThat(((FrameSizeException) e).declaredLength()).isEqualTo(0xFFFFFFFFL));
    }

    @Test
    void truncatedPayloadIsEof() {
        byte[] frame = FrameCodec.encode("truncated".getBytes(StandardCharsets.UTF_8));
        ByteArrayInputStream in = new ByteArrayInputStream(Arrays.copyOf(frame, frame.length - 2));

        assertThatThrownBy(() -> FrameCodec.readFrame(in)).isInstanceOf(EOFException.class);
    }

    @Test
    void encodeRefusesEmptyAndOversizedPayloads() {
        assertThatThrownBy(() -> FrameCodec.encode(new byte[0])).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> FrameCodec.encode(new byte[FrameCodec.MAX_FRAME_SIZE + 1]))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
