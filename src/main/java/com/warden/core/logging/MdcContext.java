package com.warden.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing Warden-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setTenant(String tenantId) {
        MDC.put("tenantId", tenantId);
    }

    public static void setAttempt(String tenantId, int attempt) {
        MDC.put("tenantId", tenantId);
        MDC.put("attempt", String.valueOf(attempt));
    }

    public static void clear() {
        MDC.remove("tenantId");
        MDC.remove("attempt");
    }
}
