package com.warden.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.warden.core.model.AuthConfig;

/**
 * Inbound JSON body for POST /api/v1/sidecars/{tenantId}.
 *
 * @param endpoint   streamable-HTTP endpoint the sidecar fronts
 * @param legacyUrl  SSE endpoint; nullable, defaults to {@code endpoint + "/sse"}
 * @param authConfig tenant auth settings, including the bind host and port
 */
public record StartSidecarRequest(
    String endpoint,
    @JsonProperty("legacy_url") String legacyUrl,
    @JsonProperty("auth_config") AuthConfig authConfig
) {}
