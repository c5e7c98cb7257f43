package com.warden.sidecar;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Graceful-then-forceful termination of a sidecar and everything it spawned.
 */
@Component
public class ProcessTerminator {

    private static final Logger log = LoggerFactory.getLogger(ProcessTerminator.class);

    private final SidecarProperties properties;

    public ProcessTerminator(SidecarProperties properties) {
        this.properties = properties;
    }

    /**
     * Asks the process tree to exit, waits up to the configured grace period, then kills
     * whatever is left. Returns once the process is gone or the forced kill was sent.
     */
    public void terminate(Process process) throws InterruptedException {
        // uvx runs the sidecar as a child; collect descendants before the parent goes away
        var descendants = process.descendants().toList();

        if (process.isAlive()) {
            descendants.forEach(ProcessHandle::destroy);
            process.destroy();
            if (process.waitFor(properties.getTerminateGrace().toMillis(), TimeUnit.MILLISECONDS)) {
                log.debug("Process {} exited gracefully", process.pid());
            } else {
                log.debug("Process {} did not exit within {}s, killing it",
                        process.pid(), properties.getTerminateGrace().toSeconds());
                process.destroyForcibly();
                process.waitFor(properties.getTerminateGrace().toMillis(), TimeUnit.MILLISECONDS);
            }
        }
        descendants.stream().filter(ProcessHandle::isAlive).forEach(ProcessHandle::destroyForcibly);
    }

    /** Terminates without propagating an interrupt to the caller; the flag is re-asserted. */
    public void terminateQuietly(Process process) {
        try {
            terminate(process);
        } catch (InterruptedException e) {
            kill(process);
            Thread.currentThread().interrupt();
        }
    }

    /** Force-kills the process tree without waiting. */
    public void kill(Process process) {
        var descendants = process.descendants().toList();
        process.destroyForcibly();
        descendants.forEach(ProcessHandle::destroyForcibly);
    }
}
