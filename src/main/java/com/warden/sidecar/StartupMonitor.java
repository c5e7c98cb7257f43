package com.warden.sidecar;

import com.warden.sidecar.SidecarLauncher.LaunchedSidecar;
import com.warden.sidecar.platform.OutputCapture.CapturedOutput;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Watches a freshly launched sidecar until it binds its port, exits, or runs out of
 * checks. Every outcome other than a successful bind leaves the process terminated and
 * its capture closed.
 */
@Component
public class StartupMonitor {

    private static final Logger log = LoggerFactory.getLogger(StartupMonitor.class);

    private final PortProbe portProbe;
    private final ErrorClassifier errorClassifier;
    private final ProcessTerminator terminator;
    private final SidecarProperties properties;

    public StartupMonitor(PortProbe portProbe, ErrorClassifier errorClassifier,
                          ProcessTerminator terminator, SidecarProperties properties) {
        this.portProbe = portProbe;
        this.errorClassifier = errorClassifier;
        this.terminator = terminator;
        this.properties = properties;
    }

    /**
     * Polls up to {@code maxChecks} times, sleeping {@code delay} before each check.
     *
     * @throws SidecarStartupException when the process exits or never binds
     * @throws InterruptedException    when cancelled; the process is terminated first
     */
    public void awaitBinding(String tenantId, LaunchedSidecar sidecar, String host, int port,
                             int maxChecks, Duration delay) throws InterruptedException {
        Process process = sidecar.process();
        try {
            for (int check = 1; check <= maxChecks; check++) {
                Thread.sleep(delay.toMillis());

                if (!process.isAlive()) {
                    throw crashed(tenantId, sidecar, host, port);
                }
                if (!portProbe.isPortFree(port, host)) {
                    log.debug("Sidecar for tenant {} bound to port {} (check {}/{})",
                            tenantId, port, check, maxChecks);
                    sidecar.capture().detach();
                    return;
                }
                log.debug("Sidecar for tenant {} not yet bound to port {} (check {}/{})",
                        tenantId, port, check, maxChecks);
                sidecar.capture().drainAvailable();
            }
        } catch (InterruptedException e) {
            log.debug("Sidecar startup cancelled for tenant {}, terminating process {}", tenantId, process.pid());
            terminator.terminateQuietly(process);
            sidecar.capture().close();
            throw e;
        }

        if (!process.isAlive()) {
            throw crashed(tenantId, sidecar, host, port);
        }

        log.error("Sidecar for tenant {} never bound to port {}", tenantId, port);
        log.error("  - Checked {} times over {} seconds", maxChecks, maxChecks * delay.toMillis() / 1000.0);
        try {
            terminator.terminate(process);
        } catch (InterruptedException e) {
            log.debug("Cancelled while terminating unbound sidecar {} for tenant {}, killing it",
                    process.pid(), tenantId);
            terminator.kill(process);
            sidecar.capture().close();
            throw e;
        }
        CapturedOutput output = sidecar.capture().collect(properties.getOutputReadTimeout());
        String message = errorClassifier.classify(output.stdout(), output.stderr(), sidecar.serverUrl());
        logFailure(tenantId, sidecar, host, port, output, message,
                "  - Process is running (PID: " + process.pid() + ") but failed to bind to port " + port);
        sidecar.capture().close();
        throw new SidecarStartupException(message, tenantId);
    }

    private SidecarStartupException crashed(String tenantId, LaunchedSidecar sidecar, String host, int port) {
        CapturedOutput output = sidecar.capture().collect(properties.getOutputReadTimeout());
        String message = errorClassifier.classify(output.stdout(), output.stderr(), sidecar.serverUrl());
        logFailure(tenantId, sidecar, host, port, output, message,
                "  - Process died with exit code: " + sidecar.process().exitValue());
        sidecar.capture().close();
        return new SidecarStartupException(message, tenantId);
    }

    private static void logFailure(String tenantId, LaunchedSidecar sidecar, String host, int port,
                                   CapturedOutput output, String message, String cause) {
        log.error("Sidecar startup failed for tenant {}:", tenantId);
        log.error(cause);
        log.error("  - Target: {}:{}", host, port);
        log.error("  - Command: {}", sidecar.redactedCommand());
        if (!output.stderr().isBlank()) {
            log.error("  - Error output: {}", output.stderr().strip());
        }
        if (!output.stdout().isBlank()) {
            log.error("  - Standard output: {}", output.stdout().strip());
        }
        log.error("  - Error message: {}", message);
    }
}
