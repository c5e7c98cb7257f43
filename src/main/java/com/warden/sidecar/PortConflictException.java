package com.warden.sidecar;

/**
 * Thrown when the requested port is held by another live tenant or by a process
 * Warden does not own. Never retried.
 */
public class PortConflictException extends SidecarException {

    public PortConflictException(String message, String tenantId) {
        super(message, tenantId);
    }
}
