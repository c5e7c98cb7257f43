package com.warden.sidecar.platform;

import java.util.Locale;

/**
 * Operating system family that decides how sidecar processes are inspected and killed.
 */
public enum OsFamily {
    UNIX,
    WINDOWS;

    public static OsFamily detect() {
        String os = System.getProperty("os.name", "").toLowerCase(Locale.ROOT);
        return os.startsWith("windows") ? WINDOWS : UNIX;
    }

    /**
     * Resolves the {@code warden.sidecar.platform} setting.
     *
     * @param configured "auto", "unix" or "windows"; null or blank means auto
     */
    public static OsFamily resolve(String configured) {
        if (configured == null || configured.isBlank() || configured.equalsIgnoreCase("auto")) {
            return detect();
        }
        return switch (configured.strip().toLowerCase(Locale.ROOT)) {
            case "unix", "linux", "mac", "macos" -> UNIX;
            case "windows" -> WINDOWS;
            default -> throw new IllegalArgumentException("Unknown sidecar platform: " + configured);
        };
    }
}
