package com.warden.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;

/**
 * Per-tenant authentication settings handed to a sidecar.
 *
 * <p>The supervisor treats this as opaque data except for validation of the oauth
 * fields, restart diffing and redaction. Ports are kept as strings because tenant
 * settings arrive from loosely typed storage; they are parsed when a start is requested.
 *
 * @param mode               authentication mode
 * @param host               bind host used when {@code oauthHost} is blank
 * @param port               bind port used when {@code oauthPort} is blank
 * @param apiKey             key value for {@link AuthMode#API_KEY}
 * @param oauthHost          host the sidecar's OAuth endpoint binds to
 * @param oauthPort          port the sidecar's OAuth endpoint binds to
 * @param oauthServerUrl     public URL of the sidecar's OAuth server
 * @param oauthCallbackUrl   OAuth redirect URL
 * @param oauthCallbackPath  legacy alias of {@code oauthCallbackUrl}
 * @param oauthClientId      client id registered with the provider
 * @param oauthClientSecret  client secret registered with the provider
 * @param oauthAuthUrl       provider authorization endpoint
 * @param oauthTokenUrl      provider token endpoint
 * @param oauthMcpScope      scope requested from callers
 * @param oauthProviderScope scope requested from the provider
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AuthConfig(
    @JsonProperty("auth_type") AuthMode mode,
    @JsonProperty("host") String host,
    @JsonProperty("port") String port,
    @JsonProperty("api_key") String apiKey,
    @JsonProperty("oauth_host") String oauthHost,
    @JsonProperty("oauth_port") String oauthPort,
    @JsonProperty("oauth_server_url") String oauthServerUrl,
    @JsonProperty("oauth_callback_url") String oauthCallbackUrl,
    @JsonProperty("oauth_callback_path") String oauthCallbackPath,
    @JsonProperty("oauth_client_id") String oauthClientId,
    @JsonProperty("oauth_client_secret") String oauthClientSecret,
    @JsonProperty("oauth_auth_url") String oauthAuthUrl,
    @JsonProperty("oauth_token_url") String oauthTokenUrl,
    @JsonProperty("oauth_mcp_scope") String oauthMcpScope,
    @JsonProperty("oauth_provider_scope") String oauthProviderScope
) implements Serializable {

    private static final String REDACTED = "***REDACTED***";

    public AuthConfig {
        mode = mode != null ? mode : AuthMode.NONE;
    }

    /** Host the sidecar binds to: the OAuth host when set, otherwise the plain host. */
    @JsonIgnore
    public String bindHost() {
        return isBlank(oauthHost) ? host : oauthHost;
    }

    /** Raw port the sidecar binds to: the OAuth port when set, otherwise the plain port. */
    @JsonIgnore
    public String bindPort() {
        return isBlank(oauthPort) ? port : oauthPort;
    }

    /** Callback URL, falling back to the legacy callback path. */
    @JsonIgnore
    public String effectiveCallbackUrl() {
        return isBlank(oauthCallbackUrl) ? oauthCallbackPath : oauthCallbackUrl;
    }

    @Override
    public String toString() {
        return "AuthConfig[mode=" + mode.value()
                + ", host=" + host + ", port=" + port
                + ", apiKey=" + mask(apiKey)
                + ", oauthHost=" + oauthHost + ", oauthPort=" + oauthPort
                + ", oauthServerUrl=" + oauthServerUrl
                + ", oauthCallbackUrl=" + effectiveCallbackUrl()
                + ", oauthClientId=" + oauthClientId
                + ", oauthClientSecret=" + mask(oauthClientSecret)
                + ", oauthAuthUrl=" + oauthAuthUrl + ", oauthTokenUrl=" + oauthTokenUrl
                + ", oauthMcpScope=" + oauthMcpScope + ", oauthProviderScope=" + oauthProviderScope
                + "]";
    }

    public static Builder builder(AuthMode mode) {
        return new Builder().mode(mode);
    }

    public Builder toBuilder() {
        return new Builder()
                .mode(mode).host(host).port(port).apiKey(apiKey)
                .oauthHost(oauthHost).oauthPort(oauthPort).oauthServerUrl(oauthServerUrl)
                .oauthCallbackUrl(oauthCallbackUrl).oauthCallbackPath(oauthCallbackPath)
                .oauthClientId(oauthClientId).oauthClientSecret(oauthClientSecret)
                .oauthAuthUrl(oauthAuthUrl).oauthTokenUrl(oauthTokenUrl)
                .oauthMcpScope(oauthMcpScope).oauthProviderScope(oauthProviderScope);
    }

    private static String mask(String value) {
        return isBlank(value) ? value : REDACTED;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    public static final class Builder {
        private AuthMode mode = AuthMode.NONE;
        private String host;
        private String port;
        private String apiKey;
        private String oauthHost;
        private String oauthPort;
        private String oauthServerUrl;
        private String oauthCallbackUrl;
        private String oauthCallbackPath;
        private String oauthClientId;
        private String oauthClientSecret;
        private String oauthAuthUrl;
        private String oauthTokenUrl;
        private String oauthMcpScope;
        private String oauthProviderScope;

        private Builder() {}

        public Builder mode(AuthMode mode) { this.mode = mode; return this; }
        public Builder host(String host) { this.host = host; return this; }
        public Builder port(String port) { this.port = port; return this; }
        public Builder port(int port) { this.port = String.valueOf(port); return this; }
        public Builder apiKey(String apiKey) { this.apiKey = apiKey; return this; }
        public Builder oauthHost(String oauthHost) { this.oauthHost = oauthHost; return this; }
        public Builder oauthPort(String oauthPort) { this.oauthPort = oauthPort; return this; }
        public Builder oauthPort(int oauthPort) { this.oauthPort = String.valueOf(oauthPort); return this; }
        public Builder oauthServerUrl(String url) { this.oauthServerUrl = url; return this; }
        public Builder oauthCallbackUrl(String url) { this.oauthCallbackUrl = url; return this; }
        public Builder oauthCallbackPath(String path) { this.oauthCallbackPath = path; return this; }
        public Builder oauthClientId(String clientId) { this.oauthClientId = clientId; return this; }
        public Builder oauthClientSecret(String secret) { this.oauthClientSecret = secret; return this; }
        public Builder oauthAuthUrl(String url) { this.oauthAuthUrl = url; return this; }
        public Builder oauthTokenUrl(String url) { this.oauthTokenUrl = url; return this; }
        public Builder oauthMcpScope(String scope) { this.oauthMcpScope = scope; return this; }
        public Builder oauthProviderScope(String scope) { this.oauthProviderScope = scope; return this; }

        public AuthConfig build() {
            return new AuthConfig(mode, host, port, apiKey, oauthHost, oauthPort, oauthServerUrl,
                    oauthCallbackUrl, oauthCallbackPath, oauthClientId, oauthClientSecret,
                    oauthAuthUrl, oauthTokenUrl, oauthMcpScope, oauthProviderScope);
        }
    }
}
