package com.titiplex.engagement.core.todo;

import com.fasterxml.jackson.annotation.JsonProperty;

public record SyncResult(
        @JsonProperty("success") boolean success,
        @JsonProperty("message") String message,
        @JsonProperty("added") int added
) {
}
