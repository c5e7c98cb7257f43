package com.warden.sidecar;

import com.warden.core.model.AuthConfig;
import com.warden.core.model.AuthMode;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Builds the sidecar command line and its log-safe form.
 */
@Component
public class SidecarCommandLine {

    static final String REDACTED = "***REDACTED***";

    private static final List<String> SECRET_MARKERS = List.of("secret", "key", "token");

    private final SidecarProperties properties;

    public SidecarCommandLine(SidecarProperties properties) {
        this.properties = properties;
    }

    /**
     * @param primaryUrl streamable-HTTP endpoint the sidecar fronts
     * @param legacyUrl  SSE endpoint the sidecar fronts
     */
    public List<String> build(String host, int port, String primaryUrl, String legacyUrl, AuthConfig auth) {
        List<String> command = new ArrayList<>(properties.launchPrefix());
        command.addAll(List.of(
                "--port", String.valueOf(port),
                "--host", host,
                "--mode", "http",
                "--endpoint", primaryUrl,
                "--sse-url", legacyUrl));
        command.addAll(properties.getExtraArgs());

        if (auth != null && auth.mode() == AuthMode.OAUTH) {
            command.addAll(List.of("--auth_type", "oauth"));
            command.addAll(List.of("--env", "ENABLE_OAUTH", "True"));
            oauthEnvironment(auth).forEach((key, value) -> command.addAll(List.of("--env", key, value)));
        }
        return command;
    }

    /** OAuth settings passed as {@code --env} pairs; blank values are left out. */
    static Map<String, String> oauthEnvironment(AuthConfig auth) {
        Map<String, String> env = new LinkedHashMap<>();
        putIfPresent(env, "OAUTH_HOST", auth.oauthHost());
        putIfPresent(env, "OAUTH_PORT", auth.oauthPort());
        putIfPresent(env, "OAUTH_SERVER_URL", auth.oauthServerUrl());
        putIfPresent(env, "OAUTH_CALLBACK_URL", auth.effectiveCallbackUrl());
        putIfPresent(env, "OAUTH_CLIENT_ID", auth.oauthClientId());
        putIfPresent(env, "OAUTH_CLIENT_SECRET", auth.oauthClientSecret());
        putIfPresent(env, "OAUTH_AUTH_URL", auth.oauthAuthUrl());
        putIfPresent(env, "OAUTH_TOKEN_URL", auth.oauthTokenUrl());
        putIfPresent(env, "OAUTH_MCP_SCOPE", auth.oauthMcpScope());
        putIfPresent(env, "OAUTH_PROVIDER_SCOPE", auth.oauthProviderScope());
        return env;
    }

    /**
     * Copy of {@code command} safe for logs: the value of every {@code --env KEY VALUE}
     * triple whose key mentions a secret, key or token is replaced.
     */
    public static List<String> redact(List<String> command) {
        List<String> safe = new ArrayList<>(command.size());
        int i = 0;
        while (i < command.size()) {
            String arg = command.get(i);
            if (arg.equals("--env") && i + 2 < command.size()) {
                String key = command.get(i + 1);
                safe.add(arg);
                safe.add(key);
                safe.add(isSecret(key) ? REDACTED : command.get(i + 2));
                i += 3;
                continue;
            }
            safe.add(arg);
            i++;
        }
        return safe;
    }

    private static boolean isSecret(String key) {
        String lower = key.toLowerCase(Locale.ROOT);
        return SECRET_MARKERS.stream().anyMatch(lower::contains);
    }

    private static void putIfPresent(Map<String, String> env, String key, String value) {
        if (value != null && !value.isBlank()) {
            env.put(key, value);
        }
    }
}
