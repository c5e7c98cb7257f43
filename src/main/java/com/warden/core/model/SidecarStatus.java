package com.warden.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.time.Instant;

/**
 * Point-in-time view of one tenant's sidecar, assembled from lock-free reads.
 * All fields except {@code tenantId} and {@code running} may be null.
 */
public record SidecarStatus(
    @JsonProperty("tenant_id") String tenantId,
    @JsonProperty("running") boolean running,
    @JsonProperty("pid") Long pid,
    @JsonProperty("host") String host,
    @JsonProperty("port") Integer port,
    @JsonProperty("primary_url") String primaryUrl,
    @JsonProperty("legacy_url") String legacyUrl,
    @JsonProperty("started_at") Instant startedAt,
    @JsonProperty("last_error") String lastError
) implements Serializable {

    public static SidecarStatus absent(String tenantId, String lastError) {
        return new SidecarStatus(tenantId, false, null, null, null, null, null, null, lastError);
    }
}
