package com.warden.sidecar;

import com.warden.core.model.AuthConfig;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * Decides whether a running sidecar must be restarted for a new {@link AuthConfig}.
 *
 * <p>Only fields that the sidecar actually consumes for the mode are compared, and
 * blank values compare equal to absent ones.
 */
@Component
public class ConfigDiffer {

    private static final List<Function<AuthConfig, String>> OAUTH_FIELDS = List.of(
            AuthConfig::host,
            AuthConfig::port,
            AuthConfig::oauthHost,
            AuthConfig::oauthPort,
            AuthConfig::oauthServerUrl,
            AuthConfig::oauthCallbackUrl,
            AuthConfig::oauthCallbackPath,
            AuthConfig::oauthClientId,
            AuthConfig::oauthClientSecret,
            AuthConfig::oauthAuthUrl,
            AuthConfig::oauthTokenUrl,
            AuthConfig::oauthMcpScope,
            AuthConfig::oauthProviderScope
    );

    private static final List<Function<AuthConfig, String>> API_KEY_FIELDS = List.of(AuthConfig::apiKey);

    public boolean hasChanged(AuthConfig existing, AuthConfig updated) {
        if (existing == null && updated == null) {
            return false;
        }
        if (existing == null || updated == null) {
            return true;
        }
        if (existing.mode() != updated.mode()) {
            return true;
        }

        List<Function<AuthConfig, String>> fields = switch (updated.mode()) {
            case OAUTH -> OAUTH_FIELDS;
            case API_KEY -> API_KEY_FIELDS;
            case NONE -> List.of();
        };
        for (var field : fields) {
            if (!Objects.equals(normalize(field.apply(existing)), normalize(field.apply(updated)))) {
                return true;
            }
        }
        return false;
    }

    static String normalize(String value) {
        return value == null || value.isEmpty() ? null : value;
    }
}
