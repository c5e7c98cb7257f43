package com.warden.sidecar;

/**
 * Thrown when a launched sidecar exits before binding its port or never binds
 * within the check budget. Retried up to the configured attempt count.
 */
public class SidecarStartupException extends SidecarException {

    public SidecarStartupException(String message, String tenantId) {
        super(message, tenantId);
    }

    public SidecarStartupException(String message, String tenantId, Throwable cause) {
        super(message, tenantId, cause);
    }
}
