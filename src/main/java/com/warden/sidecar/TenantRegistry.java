package com.warden.sidecar;

import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-memory bookkeeping of which tenant runs which sidecar on which port.
 *
 * <p>Individual reads and writes are thread-safe. Compound changes for one tenant
 * (register, release) must be made while holding that tenant's {@link #lockFor lock};
 * readers may see a state between two such changes.
 */
@Component
public class TenantRegistry {

    private final Map<String, ProcessEntry> entries = new ConcurrentHashMap<>();
    private final Map<Integer, String> portOwners = new ConcurrentHashMap<>();
    private final Map<Long, String> pidOwners = new ConcurrentHashMap<>();
    private final Map<String, String> lastErrors = new ConcurrentHashMap<>();
    private final Map<String, ReentrantLock> locks = new ConcurrentHashMap<>();
    private final Map<String, PendingStart> activeStarts = new ConcurrentHashMap<>();

    public void register(ProcessEntry entry) {
        entries.put(entry.tenantId(), entry);
        portOwners.put(entry.port(), entry.tenantId());
        pidOwners.put(entry.pid(), entry.tenantId());
    }

    public Optional<ProcessEntry> get(String tenantId) {
        return Optional.ofNullable(entries.get(tenantId));
    }

    /**
     * Drops the tenant's entry together with its port and PID ownership. Ownership that
     * already points at another tenant is left alone.
     *
     * @return the removed entry, if there was one
     */
    public Optional<ProcessEntry> release(String tenantId) {
        ProcessEntry entry = entries.remove(tenantId);
        if (entry == null) {
            return Optional.empty();
        }
        portOwners.remove(entry.port(), tenantId);
        pidOwners.remove(entry.pid(), tenantId);
        return Optional.of(entry);
    }

    public Optional<String> ownerOfPort(int port) {
        return Optional.ofNullable(portOwners.get(port));
    }

    public boolean isTrackedPid(long pid) {
        return pidOwners.containsKey(pid);
    }

    /**
     * True when the process or one of its ancestors is a tracked sidecar. Launchers such
     * as {@code uvx} fork the server that actually listens, so the listener's PID is
     * usually not the one we launched.
     */
    public boolean isTrackedProcess(long pid) {
        if (isTrackedPid(pid)) {
            return true;
        }
        Optional<ProcessHandle> current = ProcessHandle.of(pid).flatMap(ProcessHandle::parent);
        while (current.isPresent()) {
            long ancestor = current.get().pid();
            if (isTrackedPid(ancestor)) {
                return true;
            }
            current = current.get().parent();
        }
        return false;
    }

    /** Owner of the port, but only while that tenant's sidecar is alive. */
    public Optional<String> liveOwnerOfPort(int port) {
        return ownerOfPort(port).filter(owner -> get(owner).map(ProcessEntry::isAlive).orElse(false));
    }

    public Set<String> tenants() {
        return Set.copyOf(entries.keySet());
    }

    public Optional<String> lastError(String tenantId) {
        return Optional.ofNullable(lastErrors.get(tenantId));
    }

    public void setLastError(String tenantId, String message) {
        lastErrors.put(tenantId, message);
    }

    public void clearLastError(String tenantId) {
        lastErrors.remove(tenantId);
    }

    /** Tenants that have a recorded failure but may have no entry. */
    public Set<String> tenantsWithErrors() {
        return Set.copyOf(lastErrors.keySet());
    }

    /** One lock per tenant, created on first use and kept for the life of the registry. */
    public ReentrantLock lockFor(String tenantId) {
        return locks.computeIfAbsent(tenantId, id -> new ReentrantLock());
    }

    /**
     * Makes {@code start} the tenant's in-flight start.
     *
     * @return the start it replaced, if any
     */
    public Optional<PendingStart> replaceActiveStart(String tenantId, PendingStart start) {
        return Optional.ofNullable(activeStarts.put(tenantId, start));
    }

    public Optional<PendingStart> activeStart(String tenantId) {
        return Optional.ofNullable(activeStarts.get(tenantId));
    }

    public Set<String> startingTenants() {
        return Set.copyOf(activeStarts.keySet());
    }

    /** Clears the in-flight start only if it is still {@code start}. */
    public void clearActiveStart(String tenantId, PendingStart start) {
        activeStarts.remove(tenantId, start);
    }
}
