package com.warden.sidecar;

import com.warden.core.model.AuthConfig;
import com.warden.core.model.SidecarStatus;
import com.warden.sidecar.platform.OutputCapture;

import java.time.Instant;

/**
 * A running sidecar as tracked by {@link TenantRegistry}.
 *
 * @param authConfig the settings the sidecar was launched with, compared on the next start
 * @param capture    output capture kept alive until the sidecar is stopped
 */
public record ProcessEntry(
        String tenantId,
        Process process,
        String host,
        int port,
        String primaryUrl,
        String legacyUrl,
        AuthConfig authConfig,
        long pid,
        Instant startedAt,
        OutputCapture capture
) {

    public boolean isAlive() {
        return process.isAlive();
    }

    public SidecarStatus toStatus(String lastError) {
        return new SidecarStatus(tenantId, isAlive(), pid, host, port, primaryUrl, legacyUrl, startedAt, lastError);
    }
}
