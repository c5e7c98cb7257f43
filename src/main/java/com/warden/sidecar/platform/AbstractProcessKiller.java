package com.warden.sidecar.platform;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.LongPredicate;

/**
 * Port and zombie sweeps shared by all platforms. Subclasses supply PID discovery,
 * signalling and the test for "this process is one of our sidecars".
 */
public abstract class AbstractProcessKiller implements ProcessKiller {

    private static final Logger log = LoggerFactory.getLogger(AbstractProcessKiller.class);

    protected final SystemCommandRunner runner;
    protected final String signature;

    protected AbstractProcessKiller(SystemCommandRunner runner, String signature) {
        this.runner = runner;
        this.signature = signature == null ? "" : signature;
    }

    @Override
    public boolean killProcessOnPort(int port) {
        long self = ProcessHandle.current().pid();
        List<Long> pids = listPidsOnPort(port);
        if (pids.isEmpty()) {
            log.debug("No process found listening on port {}", port);
            return false;
        }

        boolean killedAny = false;
        for (long pid : pids) {
            if (pid == self) {
                log.warn("Port {} is held by this process; refusing to kill it", port);
                continue;
            }
            log.debug("Killing process {} on port {}", pid, port);
            if (forceKill(pid)) {
                killedAny = true;
            } else {
                log.warn("Failed to kill process {} on port {}", pid, port);
            }
        }
        return killedAny;
    }

    @Override
    public boolean killZombieProcessesForPort(int port, LongPredicate isTracked) {
        if (signature.isBlank()) {
            log.debug("No sidecar signature configured, skipping zombie sweep for port {}", port);
            return false;
        }

        long self = ProcessHandle.current().pid();
        Set<Long> signed = new LinkedHashSet<>(findBySignature(port));
        Set<Long> candidates = new LinkedHashSet<>();

        for (long pid : listPidsOnPort(port)) {
            if (isTracked.test(pid)) {
                log.debug("Process {} on port {} is tracked, skipping", pid, port);
            } else if (matchesSignature(pid, signed)) {
                candidates.add(pid);
            } else {
                log.debug("Process {} on port {} is not a sidecar, leaving it alone", pid, port);
            }
        }
        for (long pid : signed) {
            if (!isTracked.test(pid)) {
                candidates.add(pid);
            }
        }
        candidates.remove(self);

        if (candidates.isEmpty()) {
            return false;
        }
        log.info("Found {} orphaned sidecar process(es) for port {}: {}", candidates.size(), port, candidates);

        boolean killedAny = false;
        for (long pid : candidates) {
            if (forceKill(pid)) {
                log.debug("Killed orphaned sidecar {}", pid);
                killedAny = true;
            } else {
                log.warn("Failed to kill orphaned sidecar {} for port {}", pid, port);
            }
        }
        return killedAny;
    }

    /**
     * Decides whether a process listening on the port is one of our sidecars.
     *
     * @param signed PIDs already identified by {@link #findBySignature(int)}
     */
    protected abstract boolean matchesSignature(long pid, Set<Long> signed);

    /** PIDs of sidecar processes launched for {@code port}, found by command line. */
    protected List<Long> findBySignature(int port) {
        return List.of();
    }

    static Long parsePid(String token) {
        try {
            long pid = Long.parseLong(token.strip());
            return pid > 0 ? pid : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
