package com.warden.core.health;

import com.warden.core.model.SidecarStatus;
import com.warden.sidecar.SidecarProperties;
import com.warden.sidecar.SidecarSupervisor;
import com.warden.sidecar.platform.ProcessKiller;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.File;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Service
public class HealthCheckService {

    private static final Logger log = LoggerFactory.getLogger(HealthCheckService.class);

    private final SidecarSupervisor supervisor;
    private final SidecarProperties properties;
    private final ProcessKiller processKiller;

    public HealthCheckService(SidecarSupervisor supervisor, SidecarProperties properties,
                              ProcessKiller processKiller) {
        this.supervisor = supervisor;
        this.properties = properties;
        this.processKiller = processKiller;
    }

    public List<HealthStatus> checkAll() {
        var results = new ArrayList<HealthStatus>();
        results.add(checkSupervisor());
        results.add(checkLauncher());
        results.add(checkSidecars());
        return results;
    }

    private HealthStatus checkSupervisor() {
        if (!properties.isEnabled()) {
            return HealthStatus.degraded("supervisor", "Sidecar supervision disabled in settings");
        }
        return HealthStatus.up("supervisor", "Sidecar supervision enabled",
                Map.of("platform", processKiller.platformName()));
    }

    private HealthStatus checkLauncher() {
        if (properties.getCommand() == null || properties.getCommand().isEmpty()) {
            return HealthStatus.down("launcher", "No launch command configured");
        }
        String program = properties.getCommand().get(0);
        var found = findExecutable(program);
        if (found == null) {
            log.warn("Launcher '{}' not found on PATH", program);
            return HealthStatus.down("launcher", "'" + program + "' not found on PATH");
        }
        return HealthStatus.up("launcher", "Launcher available", Map.of("path", found.toString()));
    }

    private HealthStatus checkSidecars() {
        List<SidecarStatus> statuses = supervisor.listStatuses();
        long running = statuses.stream().filter(SidecarStatus::running).count();
        List<String> failing = statuses.stream()
                .filter(s -> !s.running())
                .map(SidecarStatus::tenantId)
                .toList();
        if (!failing.isEmpty()) {
            return HealthStatus.tenantsDown("sidecars", running + " running, " + failing.size() + " down", failing);
        }
        return HealthStatus.up("sidecars", running + " running", Map.of());
    }

    static Path findExecutable(String program) {
        try {
            Path direct = Path.of(program);
            if (direct.isAbsolute()) {
                return Files.isExecutable(direct) ? direct : null;
            }
            String pathEnv = System.getenv("PATH");
            if (pathEnv == null) {
                return null;
            }
            for (String dir : pathEnv.split(File.pathSeparator)) {
                if (dir.isBlank()) {
                    continue;
                }
                for (String candidate : List.of(program, program + ".exe")) {
                    Path path = Path.of(dir, candidate);
                    if (Files.isRegularFile(path) && Files.isExecutable(path)) {
                        return path;
                    }
                }
            }
        } catch (InvalidPathException e) {
            log.debug("Invalid launcher path '{}': {}", program, e.getMessage());
        }
        return null;
    }
}
