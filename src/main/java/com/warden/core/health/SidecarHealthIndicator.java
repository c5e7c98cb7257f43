package com.warden.core.health;

import com.warden.core.model.SidecarStatus;
import com.warden.sidecar.SidecarSupervisor;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Actuator health indicator for supervised sidecars.
 * <p>
 * UP when every tracked sidecar is alive, DEGRADED when some died or failed to start,
 * UNKNOWN when supervision is disabled. Details list each tenant's port or last error.
 */
@Component("sidecarsHealthIndicator")
public class SidecarHealthIndicator implements HealthIndicator {

    private final SidecarSupervisor supervisor;

    public SidecarHealthIndicator(SidecarSupervisor supervisor) {
        this.supervisor = supervisor;
    }

    @Override
    public Health health() {
        if (!supervisor.isEnabled()) {
            return Health.unknown().withDetail("reason", "disabled in settings").build();
        }

        var builder = Health.up();
        boolean anyDown = false;
        int running = 0;
        for (SidecarStatus status : supervisor.listStatuses()) {
            if (status.running()) {
                running++;
                builder.withDetail(status.tenantId(), "UP (port " + status.port() + ")");
            } else {
                anyDown = true;
                builder.withDetail(status.tenantId(),
                        "DOWN: " + (status.lastError() != null ? status.lastError() : "process exited"));
            }
        }
        builder.withDetail("sidecars.running", running);
        return anyDown ? builder.status("DEGRADED").build() : builder.build();
    }
}
