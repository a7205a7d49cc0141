package com.titiplex.lanqueue.core.p2p;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.annotation.JsonTypeName;
import com.titiplex.lanqueue.core.model.LanClipboardItem;
import com.titiplex.lanqueue.core.model.LanQueueMember;

import java.util.List;

/**
 * Messages exchanged inside frames. The {@code type} property selects the variant.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = Envelope.AuthRequest.class, name = "auth_request"),
        @JsonSubTypes.Type(value = Envelope.AuthResponse.class, name = "auth_response"),
        @JsonSubTypes.Type(value = Envelope.ClipboardItem.class, name = "clipboard_item"),
        @JsonSubTypes.Type(value = Envelope.MemberUpdate.class, name = "member_update")
})
public sealed interface Envelope {

    /** Client to host, first frame after connecting. */
    @JsonTypeName("auth_request")
    record AuthRequest(
            @JsonProperty("password") String password,
            @JsonProperty("client_id") String clientId,
            @JsonProperty("client_name") String clientName
    ) implements Envelope {
    }

    /** Host to client, answer to {@link AuthRequest}. */
    @JsonTypeName("auth_response")
    record AuthResponse(
            @JsonProperty("ok") boolean ok,
            @JsonProperty("reason") String reason
    ) implements Envelope {
        public static AuthResponse accepted() {
            return new AuthResponse(true, null);
        }

        public static AuthResponse rejected(String reason) {
            return new AuthResponse(false, reason);
        }
    }

    @JsonTypeName("clipboard_item")
    record ClipboardItem(@JsonProperty("item") LanClipboardItem item) implements Envelope {
    }

    /** Full membership snapshot; receivers replace their list. */
    @JsonTypeName("member_update")
    record MemberUpdate(@JsonProperty("members") List<LanQueueMember> members) implements Envelope {
    }
}
