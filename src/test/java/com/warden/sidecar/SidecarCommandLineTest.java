package com.warden.sidecar;

import com.warden.core.model.AuthConfig;
import com.warden.core.model.AuthMode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SidecarCommandLineTest {

    private final SidecarCommandLine commandLine = new SidecarCommandLine(new SidecarProperties());

    private static AuthConfig oauth() {
        return AuthConfig.builder(AuthMode.OAUTH)
                .oauthHost("localhost").oauthPort(9000)
                .oauthServerUrl("http://localhost:9000")
                .oauthCallbackPath("http://localhost:9000/cb")
                .oauthClientId("client-1").oauthClientSecret("s3cret")
                .oauthAuthUrl("https://idp/auth").oauthTokenUrl("https://idp/token")
                .oauthMcpScope("")
                .build();
    }

    @Test
    @DisplayName("builds the launcher prefix, bind arguments and extra args in order")
    void plainCommand() {
        List<String> command = commandLine.build("localhost", 8100, "http://up/mcp", "http://up/mcp/sse",
                AuthConfig.builder(AuthMode.NONE).build());

        assertEquals(List.of(
                "uvx", "mcp-composer==0.1.0.8.10",
                "--port", "8100",
                "--host", "localhost",
                "--mode", "http",
                "--endpoint", "http://up/mcp",
                "--sse-url", "http://up/mcp/sse",
                "--disable-composer-tools"), command);
    }

    @Test
    @DisplayName("oauth adds the auth type and one --env pair per non-blank field")
    void oauthCommand() {
        List<String> command = commandLine.build("localhost", 9000, "http://up/mcp", "http://up/mcp/sse", oauth());

        int authType = command.indexOf("--auth_type");
        assertTrue(authType > 0);
        assertEquals("oauth", command.get(authType + 1));
        assertEquals(List.of("--env", "ENABLE_OAUTH", "True"), command.subList(authType + 2, authType + 5));
        assertTrue(Collections.indexOfSubList(command, List.of("--env", "OAUTH_CLIENT_SECRET", "s3cret")) > 0);
        assertTrue(Collections.indexOfSubList(command,
                List.of("--env", "OAUTH_CALLBACK_URL", "http://localhost:9000/cb")) > 0);
        assertFalse(command.contains("OAUTH_MCP_SCOPE"));
    }

    @Test
    @DisplayName("oauthEnvironment keeps a stable key order")
    void environmentOrder() {
        var env = SidecarCommandLine.oauthEnvironment(oauth());
        assertEquals(List.of("OAUTH_HOST", "OAUTH_PORT", "OAUTH_SERVER_URL", "OAUTH_CALLBACK_URL",
                "OAUTH_CLIENT_ID", "OAUTH_CLIENT_SECRET", "OAUTH_AUTH_URL", "OAUTH_TOKEN_URL"),
                List.copyOf(env.keySet()));
    }

    @Test
    @DisplayName("redact masks secret, key and token values and leaves the rest")
    void redact() {
        List<String> command = commandLine.build("localhost", 9000, "http://up/mcp", "http://up/mcp/sse", oauth());
        List<String> safe = SidecarCommandLine.redact(command);

        assertEquals(command.size(), safe.size());
        assertFalse(safe.contains("s3cret"));
        assertFalse(safe.contains("https://idp/token"));
        assertTrue(Collections.indexOfSubList(safe,
                List.of("--env", "OAUTH_CLIENT_SECRET", SidecarCommandLine.REDACTED)) > 0);
        assertTrue(Collections.indexOfSubList(safe, List.of("--env", "OAUTH_CLIENT_ID", "client-1")) > 0);
        assertTrue(Collections.indexOfSubList(safe, List.of("--env", "ENABLE_OAUTH", "True")) > 0);
    }

    @Test
    @DisplayName("redact ignores a trailing --env without a value")
    void redactTruncated() {
        assertEquals(List.of("run", "--env", "API_KEY"), SidecarCommandLine.redact(List.of("run", "--env", "API_KEY")));
    }
}
