package com.warden.dispatch.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.warden.core.model.AuthConfig;
import com.warden.core.model.AuthMode;
import com.warden.core.model.SidecarStatus;
import com.warden.sidecar.SidecarException;
import com.warden.sidecar.SidecarProperties;
import com.warden.sidecar.SidecarSupervisor;
import com.warden.sidecar.SidecarSupervisor.StartOptions;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.IOException;
import java.nio.file.Path;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;

/**
 * CLI command: warden run --tenant T --endpoint URL --port P
 * <p>
 * Starts one sidecar in the foreground and keeps it running until it exits or the
 * command is interrupted. The sidecar is stopped when the application context closes.
 */
@Command(name = "run", mixinStandardHelpOptions = true, description = "Run one tenant's sidecar in the foreground")
@Component
public class RunCommand implements Callable<Integer> {

    static final long WATCH_INTERVAL_MS = 1000;

    @Option(names = {"--tenant", "-t"}, required = true, description = "Tenant id")
    String tenantId;

    @Option(names = {"--endpoint", "-e"}, required = true, description = "Streamable-HTTP endpoint to front")
    String endpoint;

    @Option(names = "--legacy-url", description = "SSE endpoint; defaults to <endpoint>/sse")
    String legacyUrl;

    @Option(names = "--host", defaultValue = "localhost", description = "Bind host (default: ${DEFAULT-VALUE})")
    String host;

    @Option(names = {"--port", "-p"}, description = "Bind port")
    Integer port;

    @Option(names = "--auth-type", defaultValue = "none", description = "none, apikey or oauth")
    String authType;

    @Option(names = "--api-key", description = "Key for --auth-type apikey")
    String apiKey;

    @Option(names = "--auth-config", description = "JSON file with the full auth settings; overrides the options above")
    Path authConfigFile;

    @Option(names = "--max-retries", description = "Launch attempts before giving up")
    Integer maxRetries;

    private final SidecarSupervisor supervisor;
    private final SidecarProperties properties;
    private final ObjectMapper objectMapper;

    public RunCommand(SidecarSupervisor supervisor, SidecarProperties properties, ObjectMapper objectMapper) {
        this.supervisor = supervisor;
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        AuthConfig auth;
        try {
            auth = resolveAuthConfig();
        } catch (IOException | IllegalArgumentException e) {
            ConsoleOutput.error("Invalid auth settings: " + e.getMessage());
            return 2;
        }

        var defaults = StartOptions.from(properties);
        var options = new StartOptions(maxRetries != null ? maxRetries : defaults.maxRetries(),
                defaults.maxStartupChecks(), defaults.startupDelay());

        ConsoleOutput.info("Starting sidecar for tenant " + tenantId + "...");
        SidecarStatus status;
        try {
            status = supervisor.start(tenantId, endpoint, legacyUrl, auth, options);
        } catch (SidecarException e) {
            ConsoleOutput.error(e.getMessage());
            return 1;
        } catch (CancellationException e) {
            ConsoleOutput.error("Start cancelled");
            return 130;
        }
        ConsoleOutput.sidecar(status);
        ConsoleOutput.info("Press Ctrl+C to stop.");

        try {
            while (supervisor.getStatus(tenantId).running()) {
                Thread.sleep(WATCH_INTERVAL_MS);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return 130;
        }

        ConsoleOutput.error("Sidecar for tenant " + tenantId + " exited");
        ConsoleOutput.sidecar(supervisor.getStatus(tenantId));
        return 1;
    }

    AuthConfig resolveAuthConfig() throws IOException {
        if (authConfigFile != null) {
            return objectMapper.readValue(authConfigFile.toFile(), AuthConfig.class);
        }
        AuthMode mode = AuthMode.fromValue(authType);
        var builder = AuthConfig.builder(mode).host(host).apiKey(apiKey);
        if (port != null) {
            builder.port(port);
        }
        return builder.build();
    }
}
