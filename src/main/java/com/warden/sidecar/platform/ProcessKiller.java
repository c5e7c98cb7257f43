package com.warden.sidecar.platform;

import java.util.List;
import java.util.function.LongPredicate;

/**
 * Platform-specific inspection and termination of operating system processes.
 *
 * <p>Implementations are best effort. They never throw for a process that is already
 * gone, lacks permissions or cannot be inspected; they report failure and move on.
 */
public interface ProcessKiller {

    /** PIDs with a TCP socket listening on {@code port}. Empty when none or unknown. */
    List<Long> listPidsOnPort(int port);

    /** Asks a process to exit. */
    boolean terminate(long pid);

    /** Kills a process without giving it a chance to clean up. */
    boolean forceKill(long pid);

    /**
     * Kills every process listening on {@code port}, except this JVM.
     *
     * @return {@code true} when at least one process was signalled
     */
    boolean killProcessOnPort(int port);

    /**
     * Kills orphaned sidecars for {@code port}: processes that carry the sidecar
     * signature but are not tracked by any tenant.
     *
     * @param isTracked answers whether a PID belongs to a live tracked sidecar
     * @return {@code true} when at least one process was killed
     */
    boolean killZombieProcessesForPort(int port, LongPredicate isTracked);

    String platformName();
}
