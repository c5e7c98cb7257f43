package com.warden.sidecar;

import com.warden.core.metrics.WardenMetrics;
import com.warden.sidecar.platform.ProcessKiller;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Decides whether a tenant may use a port, and frees it when the current holder is
 * something the supervisor itself left behind.
 *
 * <p>Only two kinds of holder are ever killed: the requesting tenant's own tracked
 * process, and untracked processes carrying the sidecar signature. A live sidecar of
 * another tenant, or any process not recognized as ours, ends in a
 * {@link PortConflictException}.
 */
@Component
public class PortArbiter {

    private static final Logger log = LoggerFactory.getLogger(PortArbiter.class);

    private final PortProbe portProbe;
    private final TenantRegistry registry;
    private final ProcessKiller processKiller;
    private final SidecarProperties properties;
    private final WardenMetrics metrics;

    public PortArbiter(PortProbe portProbe, TenantRegistry registry, ProcessKiller processKiller,
                       SidecarProperties properties, WardenMetrics metrics) {
        this.portProbe = portProbe;
        this.registry = registry;
        this.processKiller = processKiller;
        this.properties = properties;
        this.metrics = metrics;
    }

    /**
     * Must be called while holding {@code tenantId}'s start lock.
     *
     * @throws SidecarConfigurationException when the port or host is invalid
     * @throws PortConflictException         when the port is held by someone we must not kill
     * @throws InterruptedException          while waiting for a killed process to release the port
     */
    public void ensurePortAvailable(int port, String host, String tenantId) throws InterruptedException {
        if (isFree(port, host, tenantId)) {
            log.debug("Port {} is available, proceeding with sidecar startup", port);
            return;
        }

        Optional<String> owner = registry.ownerOfPort(port);
        if (owner.isPresent() && !owner.get().equals(tenantId)) {
            String other = owner.get();
            Optional<ProcessEntry> otherEntry = registry.get(other);
            if (otherEntry.isPresent() && otherEntry.get().isAlive()) {
                log.error("Port {} requested by tenant {} is already in use by tenant {}. "
                        + "Will not kill an active sidecar.", port, tenantId, other);
                metrics.recordPortConflict("tenant");
                throw new PortConflictException("Port " + port + " is already in use by another project. "
                        + "Please choose a different port (e.g., " + (port + 1) + ") "
                        + "or disable OAuth on the other project first.", tenantId);
            }
            log.debug("Port {} was tracked to tenant {} but its process died. Allowing tenant {} to take it.",
                    port, other, tenantId);
            releaseStale(other);
            reclaimFromZombies(port, host, tenantId);
            return;
        }

        if (owner.isPresent()) {
            Optional<ProcessEntry> own = registry.get(tenantId);
            if (own.isEmpty() || !own.get().isAlive()) {
                log.debug("Port {} is tracked to tenant {} but its process died, releasing it", port, tenantId);
                releaseStale(tenantId);
                reclaimFromZombies(port, host, tenantId);
                return;
            }
            log.debug("Port {} is in use by tenant {}'s own process (likely stuck in startup). Killing it to retry.",
                    port, tenantId);
            boolean killed = processKiller.killProcessOnPort(port);
            if (killed) {
                log.debug("Killed own process on port {}. Waiting for the port to be released...", port);
            }
            registry.release(tenantId).ifPresent(entry -> entry.capture().close());
            Thread.sleep(properties.getPortReleaseWait().toMillis());
            if (!isFree(port, host, tenantId)) {
                log.error("Port {} is still in use after killing own process", port);
                throw new PortConflictException("Port " + port + " is still in use after killing process", tenantId);
            }
            return;
        }

        log.error("Port {} is in use by an unknown process. Will not kill an external application.", port);
        throw foreignConflict(port, tenantId);
    }

    private void reclaimFromZombies(int port, String host, String tenantId) throws InterruptedException {
        if (isFree(port, host, tenantId)) {
            return;
        }
        if (sweepZombies(port)) {
            Thread.sleep(properties.getZombieReleaseWait().toMillis());
            if (isFree(port, host, tenantId)) {
                return;
            }
        }
        log.error("Port {} is still held by an unknown process after releasing stale ownership", port);
        throw foreignConflict(port, tenantId);
    }

    /**
     * Sweeps the port on behalf of {@code tenantId}, unless another tenant's live sidecar
     * owns it. That case is left to {@link #ensurePortAvailable} to report as a conflict.
     */
    public boolean sweepZombies(int port, String tenantId) {
        Optional<String> owner = registry.liveOwnerOfPort(port);
        if (owner.isPresent() && !owner.get().equals(tenantId)) {
            log.debug("Port {} belongs to tenant {}'s live sidecar, skipping zombie sweep for tenant {}",
                    port, owner.get(), tenantId);
            return false;
        }
        return sweepZombies(port);
    }

    /**
     * Kills orphaned sidecars for the port. Processes descended from a tracked sidecar are
     * never orphans. Failures are logged and reported as "nothing killed".
     */
    public boolean sweepZombies(int port) {
        try {
            boolean killed = processKiller.killZombieProcessesForPort(port, registry::isTrackedProcess);
            if (killed) {
                metrics.recordZombiesKilled();
                log.debug("Killed zombie processes, port {} should now be free", port);
            }
            return killed;
        } catch (RuntimeException e) {
            log.warn("Failed to check/kill zombie processes (non-fatal): {}. Continuing...", e.getMessage());
            return false;
        }
    }

    private void releaseStale(String tenantId) {
        registry.release(tenantId).ifPresent(entry -> entry.capture().close());
    }

    private boolean isFree(int port, String host, String tenantId) {
        try {
            return portProbe.isPortFree(port, host);
        } catch (IllegalArgumentException e) {
            log.error("Invalid port or host for tenant {}: {}", tenantId, e.getMessage());
            throw new SidecarConfigurationException(e.getMessage(), tenantId, e);
        }
    }

    private PortConflictException foreignConflict(int port, String tenantId) {
        metrics.recordPortConflict("foreign");
        return new PortConflictException("Port " + port + " is already in use by another application. "
                + "Please choose a different port (e.g., " + (port + 1) + ") or free up the port manually.",
                tenantId);
    }
}
