package com.example.terminal_bridge.store;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Durable bookkeeping for one client token. Terminal processes themselves are never persisted.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SessionRecord {
    private String id;
    private String uuid;
    @JsonProperty("created_at")
    private Instant createdAt;
    @JsonProperty("last_active")
    private Instant lastActive;
    private SessionStatus status;
    private String metadata;
}
