package com.warden.dispatch.api;

import com.warden.core.model.SidecarStatus;
import com.warden.sidecar.PortConflictException;
import com.warden.sidecar.SidecarConfigurationException;
import com.warden.sidecar.SidecarDisabledException;
import com.warden.sidecar.SidecarException;
import com.warden.sidecar.SidecarProperties;
import com.warden.sidecar.SidecarSupervisor;
import com.warden.sidecar.SidecarSupervisor.StartOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;

/**
 * REST controller for per-tenant sidecar lifecycle operations.
 */
@RestController
@RequestMapping("/api/v1/sidecars")
public class SidecarController {

    private static final Logger log = LoggerFactory.getLogger(SidecarController.class);

    private final SidecarSupervisor supervisor;
    private final SidecarProperties properties;

    public SidecarController(SidecarSupervisor supervisor, SidecarProperties properties) {
        this.supervisor = supervisor;
        this.properties = properties;
    }

    /**
     * GET /api/v1/sidecars: Every tenant with a sidecar or a recorded failure.
     */
    @GetMapping
    public List<SidecarStatus> listSidecars() {
        return supervisor.listStatuses();
    }

    /**
     * GET /api/v1/sidecars/{tenantId}: One tenant's sidecar, 404 when the tenant
     * has neither a sidecar nor a recorded failure.
     */
    @GetMapping("/{tenantId}")
    public ResponseEntity<SidecarStatus> getSidecar(@PathVariable String tenantId) {
        SidecarStatus status = supervisor.getStatus(tenantId);
        if (status.pid() == null && status.lastError() == null) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(status);
    }

    /**
     * POST /api/v1/sidecars/{tenantId}: Start or restart the tenant's sidecar. Blocks
     * until it is bound or has failed; an unchanged running sidecar is returned as is.
     */
    @PostMapping("/{tenantId}")
    public ResponseEntity<?> startSidecar(@PathVariable String tenantId,
                                          @RequestBody StartSidecarRequest request) {
        log.info("Start requested for tenant {}", tenantId);
        try {
            SidecarStatus status = supervisor.start(tenantId, request.endpoint(), request.legacyUrl(),
                    request.authConfig(), StartOptions.from(properties));
            return ResponseEntity.ok(status);
        } catch (SidecarException e) {
            return errorResponse(tenantId, e);
        } catch (CancellationException e) {
            log.info("Start for tenant {} was superseded", tenantId);
            return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of(
                    "tenant_id", tenantId,
                    "error", "Start was superseded by a newer request or a stop"));
        }
    }

    /**
     * DELETE /api/v1/sidecars/{tenantId}: Stop the tenant's sidecar; a no-op when none runs.
     */
    @DeleteMapping("/{tenantId}")
    public ResponseEntity<Map<String, String>> stopSidecar(@PathVariable String tenantId) {
        log.info("Stop requested for tenant {}", tenantId);
        try {
            supervisor.stop(tenantId);
        } catch (SidecarException e) {
            return errorResponse(tenantId, e);
        }
        return ResponseEntity.ok(Map.of("tenant_id", tenantId, "status", "stopped"));
    }

    private static ResponseEntity<Map<String, String>> errorResponse(String tenantId, SidecarException e) {
        HttpStatus status;
        if (e instanceof SidecarDisabledException) {
            status = HttpStatus.SERVICE_UNAVAILABLE;
        } else if (e instanceof SidecarConfigurationException) {
            status = HttpStatus.BAD_REQUEST;
        } else if (e instanceof PortConflictException) {
            status = HttpStatus.CONFLICT;
        } else {
            status = HttpStatus.BAD_GATEWAY;
        }
        log.warn("Sidecar request for tenant {} failed ({}): {}", tenantId, status.value(), e.getMessage());
        return ResponseEntity.status(status).body(Map.of("tenant_id", tenantId, "error", e.getMessage()));
    }
}
