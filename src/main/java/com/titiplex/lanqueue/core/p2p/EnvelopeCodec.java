package com.titiplex.lanqueue.core.p2p;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;

/**
 * JSON (UTF-8) encoding of {@link Envelope}s, on top of {@link FrameCodec}.
 */
@Component
public class EnvelopeCodec {
    private final ObjectMapper mapper = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    public byte[] toJson(Envelope env) {
        try {
            return mapper.writeValueAsBytes(env);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize " + env.getClass().getSimpleName(), e);
        }
    }

    public byte[] toFrame(Envelope env) {
        return FrameCodec.encode(toJson(env));
    }

    /**
     * @throws IOException if the payload is not a known envelope
     */
    public Envelope parse(byte[] payload) throws IOException {
        return mapper.readValue(payload, Envelope.class);
    }

    /**
     * Reads one frame and parses it. Framing errors and parse errors both surface as
     * {@link IOException}; callers that must tell them apart read the frame themselves.
     */
    public Envelope read(InputStream in) throws IOException {
        return parse(FrameCodec.readFrame(in));
    }
}
