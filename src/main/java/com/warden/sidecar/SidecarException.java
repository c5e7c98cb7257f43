package com.warden.sidecar;

/**
 * Base class for all sidecar supervision failures. Carries the tenant the failure
 * belongs to so callers and logs can attribute it.
 */
public class SidecarException extends RuntimeException {

    private final String tenantId;

    public SidecarException(String message, String tenantId) {
        super(messageOrGeneric(message));
        this.tenantId = tenantId;
    }

    public SidecarException(String message, String tenantId, Throwable cause) {
        super(messageOrGeneric(message), cause);
        this.tenantId = tenantId;
    }

    /** Tenant the failure belongs to; may be null when the tenant was not known. */
    public String getTenantId() {
        return tenantId;
    }

    private static String messageOrGeneric(String message) {
        return message == null || message.isBlank() ? ErrorClassifier.GENERIC_STARTUP_ERROR : message;
    }
}
