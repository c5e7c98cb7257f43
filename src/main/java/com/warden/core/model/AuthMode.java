package com.warden.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * How a sidecar authenticates its incoming callers.
 */
public enum AuthMode {
    NONE("none"),
    API_KEY("apikey"),
    OAUTH("oauth");

    private final String value;

    AuthMode(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    /**
     * Parses the wire value. Accepts {@code apikey}, {@code api-key} and {@code api_key}
     * for the key mode; {@code null} or blank maps to {@link #NONE}.
     */
    @JsonCreator
    public static AuthMode fromValue(String raw) {
        if (raw == null || raw.isBlank()) {
            return NONE;
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT).replace("-", "").replace("_", "");
        for (AuthMode mode : values()) {
            if (mode.value.equals(normalized)) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unknown auth type: " + raw);
    }
}
