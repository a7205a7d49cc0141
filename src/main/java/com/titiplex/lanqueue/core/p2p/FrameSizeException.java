package com.titiplex.lanqueue.core.p2p;

import java.io.IOException;

/**
 * A frame declared a length of zero or above {@link FrameCodec#MAX_FRAME_SIZE}. The stream
 * position is lost after this, so the connection has to be closed.
 */
public class FrameSizeException extends IOException {
    private final long declaredLength;

    public FrameSizeException(long declaredLength) {
        super("Invalid frame size: " + declaredLength);
        this.declaredLength = declaredLength;
    }

    public long declaredLength() {
        return declaredLength;
    }
}
