package com.titiplex.lanqueue.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record LanQueueMember(
        @JsonProperty("id") String id,
        @JsonProperty("name") String name,
        @JsonProperty("addr") String addr,
        @JsonProperty("is_self") boolean isSelf
) {
}
