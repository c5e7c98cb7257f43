package com.warden.sidecar;

/**
 * Thrown by every supervisor operation while {@code warden.sidecar.enabled} is false.
 */
public class SidecarDisabledException extends SidecarException {

    public SidecarDisabledException(String message, String tenantId) {
        super(message, tenantId);
    }
}
