package com.titiplex.lanqueue.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record LanQueueStatus(
        @JsonProperty("role") Role role,
        @JsonProperty("connected") boolean connected,
        @JsonProperty("host") String host,
        @JsonProperty("port") Integer port,
        @JsonProperty("self_id") String selfId,
        @JsonProperty("self_name") String selfName
) {
}
