package com.titiplex.lanqueue.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One shared clipboard entry. Produced by the clipboard capture side, consumed by observers.
 * {@code payload} is opaque here (plain text, or base64 for images).
 */
public record LanClipboardItem(
        @JsonProperty("id") String id,
        @JsonProperty("kind") String kind,
        @JsonProperty("payload") String payload,
        @JsonProperty("timestamp") String timestamp,
        @JsonProperty("origin") String origin,     // self id of the original sender
        @JsonProperty("sender_name") String senderName
) {
    public static LanClipboardItem text(String payload, String timestamp) {
        return new LanClipboardItem("", "text", payload, timestamp, "", null);
    }

    public LanClipboardItem withId(String newId) {
        return new LanClipboardItem(newId, kind, payload, timestamp, origin, senderName);
    }

    public LanClipboardItem withOrigin(String newOrigin) {
        return new LanClipboardItem(id, kind, payload, timestamp, newOrigin, senderName);
    }

    public LanClipboardItem withSenderName(String newSenderName) {
        return new LanClipboardItem(id, kind, payload, timestamp, origin, newSenderName);
    }
}
