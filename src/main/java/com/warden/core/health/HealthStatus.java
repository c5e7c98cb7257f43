package com.warden.core.health;

import java.util.List;
import java.util.Map;

/**
 * Result of one {@link HealthCheckService} check.
 *
 * @param tenants tenants whose sidecars made this check fail; empty for host-level checks
 */
public record HealthStatus(
    String component,
    Status status,
    String detail,
    Map<String, String> metadata,
    List<String> tenants
) {
    public enum Status { UP, DEGRADED, DOWN }

    public HealthStatus {
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
        tenants = tenants == null ? List.of() : List.copyOf(tenants);
    }

    public static HealthStatus up(String component, String detail, Map<String, String> metadata) {
        return new HealthStatus(component, Status.UP, detail, metadata, List.of());
    }

    public static HealthStatus degraded(String component, String detail) {
        return new HealthStatus(component, Status.DEGRADED, detail, Map.of(), List.of());
    }

    public static HealthStatus down(String component, String detail) {
        return new HealthStatus(component, Status.DOWN, detail, Map.of(), List.of());
    }

    /** DEGRADED because the named tenants have no running sidecar. */
    public static HealthStatus tenantsDown(String component, String detail, List<String> tenants) {
        return new HealthStatus(component, Status.DEGRADED, detail, Map.of(), tenants);
    }

    public boolean isUp() {
        return status == Status.UP;
    }
}
