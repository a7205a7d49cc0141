package com.titiplex.lanqueue.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum Role {
    @JsonProperty("off") OFF,
    @JsonProperty("host") HOST,
    @JsonProperty("client") CLIENT
}
