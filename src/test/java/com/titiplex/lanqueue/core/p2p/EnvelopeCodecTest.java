package com.titiplex.lanqueue.core.p2p;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.titiplex.lanqueue.core.model.LanClipboardItem;
import com.titiplex.lanqueue.core.model.LanQueueMember;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EnvelopeCodecTest {
    private final EnvelopeCodec codec = new EnvelopeCodec();
    private final ObjectMapper mapper = new ObjectMapper();

    private JsonNode json(Envelope env) throws IOException {
        return mapper.readTree(codec.toJson(env));
    }

    @Test
    void authRequestWireShape() throws Exception {
        JsonNode node = json(new Envelope.AuthRequest("secret", "client-1", null));

        assertThat(node.get("type").asText()).isEqualTo("auth_request");
        assertThat(node.get("password").asText()).isEqualTo("secret");
        assertThat(node.get("client_id").asText()).isEqualTo("client-1");
        assertThat(node.has("client_name")).isTrue();
        assertThat(node.get("client_name").isNull()).isTrue();
    }

    @Test
    void authResponseWireShape() throws Exception {
        JsonNode ok = json(Envelope.AuthResponse.accepted());
        JsonNode rejected = json(Envelope.AuthResponse.rejected("Invalid password"));

        assertThat(ok.get("type").asText()).isEqualTo("auth_response");
        assertThat(ok.get("ok").asBoolean()).isTrue();
        assertThat(ok.get("reason").isNull()).isTrue();
        assertThat(rejected.get("ok").asBoolean()).isFalse();
        assertThat(rejected.get("reason").asText()).isEqualTo("Invalid password");
    }

    @Test
    void clipboardItemWireShape() throws Exception {
        LanClipboardItem item = new LanClipboardItem("i1", "text", "hi", "2024-01-01T00:00:00Z", "o1", null);

        JsonNode node = json(new Envelope.ClipboardItem(item));

        assertThat(node.get("type").asText()).isEqualTo("clipboard_item");
        JsonNode i = node.get("item");
        assertThat(i.get("id").asText()).isEqualTo("i1");
        assertThat(i.get("kind").asText()).isEqualTo("text");
        assertThat(i.get("payload").asText()).isEqualTo("hi");
        assertThat(i.get("timestamp").asText()).isEqualTo("2024-01-01T00:00:00Z");
        assertThat(i.get("origin").asText()).isEqualTo("o1");
        assertThat(i.get("sender_name").isNull()).isTrue();
    }

    @Test
    void memberUpdateWireShape() throws Exception {
        JsonNode node = json(new Envelope.MemberUpdate(List.of(
                new LanQueueMember("h", "Host", null, true),
                new LanQueueMember("c", null, "10.0.0.2:5000", false))));

        assertThat(node.get("type").asText()).isEqualTo("member_update");
        JsonNode members = node.get("members");
        assertThat(members).hasSize(2);
        assertThat(members.get(0).get("is_self").asBoolean()).isTrue();
        assertThat(members.get(1).get("addr").asText()).isEqualTo("10.0.0.2:5000");
        assertThat(members.get(1).get("name").isNull()).isTrue();
        assertThat(members.get(0).has("self")).isFalse();
    }

    @Test
    void parsesEachVariantFromWireJson() throws Exception {
        Envelope auth = parse("{\"type\":\"auth_request\",\"password\":\"p\",\"client_id\":\"c\",\"client_name\":\"Ann\"}");
        Envelope members = parse("{\"type\":\"member_update\",\"members\":[{\"id\":\"x\",\"name\":null,\"addr\":null,\"is_self\":true}]}");
        Envelope item = parse("{\"type\":\"clipboard_item\",\"item\":{\"id\":\"1\",\"kind\":\"image\",\"payload\":\"AAAA\",\"timestamp\":\"t\",\"origin\":\"o\",\"sender_name\":\"Bob\"}}");

        assertThat(auth).isEqualTo(new Envelope.AuthRequest("p", "c", "Ann"));
        assertThat(members).isEqualTo(new Envelope.MemberUpdate(List.of(new LanQueueMember("x", null, null, true))));
        assertThat(item).isEqualTo(new Envelope.ClipboardItem(new LanClipboardItem("1", "image", "AAAA", "t", "o", "Bob")));
    }

    @Test
    void unknownFieldsAreIgnored() throws Exception {
        Envelope env = parse("{\"type\":\"auth_response\",\"ok\":true,\"reason\":null,\"extra\":42}");

        assertThat(env).isEqualTo(Envelope.AuthResponse.accepted());
    }

    @Test
    void unknownTypeAndGarbageAreRejected() {
        assertThatThrownBy(() -> parse("{\"type\":\"ping\"}")).isInstanceOf(IOException.class);
        assertThatThrownBy(() -> parse("not json")).isInstanceOf(IOException.class);
        assertThatThrownBy(() -> parse("{\"ok\":true}")).isInstanceOf(IOException.class);
    }

    @Test
    void frameIsLengthPrefixedJson() throws Exception {
        Envelope env = new Envelope.AuthRequest("p", "c", null);

        byte[] frame = codec.toFrame(env);

        assertThat(frame.length).isEqualTo(4 + codec.toJson(env).length);
        assertThat(codec.read(new ByteArrayInputStream(frame))).isEqualTo(env);
    }

    private Envelope parse(String json) throws IOException {
        return codec.parse(json.getBytes(StandardCharsets.UTF_8));
    }
}
