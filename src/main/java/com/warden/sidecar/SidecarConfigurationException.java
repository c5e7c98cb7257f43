package com.warden.sidecar;

/**
 * Thrown when a start request carries invalid or incomplete settings. Never retried.
 */
public class SidecarConfigurationException extends SidecarException {

    public SidecarConfigurationException(String message, String tenantId) {
        super(message, tenantId);
    }

    public SidecarConfigurationException(String message, String tenantId, Throwable cause) {
        super(message, tenantId, cause);
    }
}
