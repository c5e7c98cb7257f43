package com.warden.sidecar;

import com.warden.core.model.AuthConfig;
import com.warden.sidecar.platform.OutputCapture;
import com.warden.sidecar.platform.OutputCaptureFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.List;

/**
 * Spawns one sidecar process. The child inherits this process's environment; output
 * goes to an {@link OutputCapture} chosen for the platform.
 */
@Component
public class SidecarLauncher {

    private static final Logger log = LoggerFactory.getLogger(SidecarLauncher.class);

    private final SidecarCommandLine commandLine;
    private final OutputCaptureFactory captureFactory;

    public SidecarLauncher(SidecarCommandLine commandLine, OutputCaptureFactory captureFactory) {
        this.commandLine = commandLine;
        this.captureFactory = captureFactory;
    }

    /**
     * A freshly spawned sidecar that has not yet been verified.
     *
     * @param redactedCommand command line with secrets masked, for diagnostics
     * @param serverUrl       address named in classified error messages
     */
    public record LaunchedSidecar(Process process, OutputCapture capture, String redactedCommand, String serverUrl) {}

    public LaunchedSidecar launch(String tenantId, String host, int port, String primaryUrl, String legacyUrl,
                                  AuthConfig auth) {
        List<String> command = commandLine.build(host, port, primaryUrl, legacyUrl, auth);
        String redacted = String.join(" ", SidecarCommandLine.redact(command));
        log.debug("Starting sidecar for tenant {} with command: {}", tenantId, redacted);

        OutputCapture capture = captureFactory.create(tenantId);
        var builder = new ProcessBuilder(command);
        capture.redirect(builder);

        Process process;
        try {
            process = builder.start();
        } catch (IOException e) {
            capture.close();
            log.error("Failed to launch sidecar for tenant {}: {}", tenantId, e.getMessage());
            throw new SidecarStartupException("Failed to launch sidecar: " + e.getMessage(), tenantId, e);
        }
        capture.attach(process);
        log.debug("Sidecar process started with PID {}, monitoring startup for tenant {}", process.pid(), tenantId);

        String serverUrl = auth == null || auth.oauthServerUrl() == null || auth.oauthServerUrl().isBlank()
                ? host + ":" + port
                : auth.oauthServerUrl();
        return new LaunchedSidecar(process, capture, redacted, serverUrl);
    }
}
