package com.warden.core.model;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class AuthConfigTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Nested
    @DisplayName("AuthMode")
    class Modes {

        @Test
        @DisplayName("fromValue accepts every spelling of the key mode")
        void apiKeySpellings() {
            assertEquals(AuthMode.API_KEY, AuthMode.fromValue("apikey"));
            assertEquals(AuthMode.API_KEY, AuthMode.fromValue("api-key"));
            assertEquals(AuthMode.API_KEY, AuthMode.fromValue("API_KEY"));
        }

        @Test
        @DisplayName("fromValue maps null and blank to NONE")
        void blankIsNone() {
            assertEquals(AuthMode.NONE, AuthMode.fromValue(null));
            assertEquals(AuthMode.NONE, AuthMode.fromValue("  "));
        }

        @Test
        @DisplayName("fromValue rejects unknown modes")
        void unknownMode() {
            assertThrows(IllegalArgumentException.class, () -> AuthMode.fromValue("kerberos"));
        }
    }

    @Test
    @DisplayName("null mode defaults to NONE")
    void nullModeDefaults() {
        var config = AuthConfig.builder(null).host("localhost").build();
        assertEquals(AuthMode.NONE, config.mode());
    }

    @Test
    @DisplayName("bind address prefers the oauth host and port")
    void bindAddressPrefersOAuth() {
        var config = AuthConfig.builder(AuthMode.OAUTH)
                .host("0.0.0.0").port(8000)
                .oauthHost("localhost").oauthPort(9000)
                .build();
        assertEquals("localhost", config.bindHost());
        assertEquals("9000", config.bindPort());
    }

    @Test
    @DisplayName("bind address falls back to host and port when oauth fields are blank")
    void bindAddressFallback() {
        var config = AuthConfig.builder(AuthMode.API_KEY)
                .host("127.0.0.1").port(8000).oauthHost("").build();
        assertEquals("127.0.0.1", config.bindHost());
        assertEquals("8000", config.bindPort());
    }

    @Test
    @DisplayName("callback path substitutes for a blank callback URL")
    void callbackFallback() {
        var config = AuthConfig.builder(AuthMode.OAUTH)
                .oauthCallbackPath("http://localhost:9000/callback").build();
        assertEquals("http://localhost:9000/callback", config.effectiveCallbackUrl());
    }

    @Test
    @DisplayName("toString masks the client secret and api key")
    void toStringRedacts() {
        var config = AuthConfig.builder(AuthMode.OAUTH)
                .apiKey("key-123")
                .oauthClientId("client")
                .oauthClientSecret("s3cret")
                .build();
        String text = config.toString();
        assertFalse(text.contains("s3cret"));
        assertFalse(text.contains("key-123"));
        assertTrue(text.contains("client"));
        assertTrue(text.contains("***REDACTED***"));
    }

    @Test
    @DisplayName("deserializes snake_case JSON with numeric ports")
    void deserializesSnakeCase() throws Exception {
        String json = """
                {"auth_type":"oauth","oauth_host":"localhost","oauth_port":9000,
                 "oauth_client_id":"abc","oauth_client_secret":"xyz",
                 "oauth_server_url":"http://localhost:9000"}
                """;
        var config = mapper.readValue(json, AuthConfig.class);
        assertEquals(AuthMode.OAUTH, config.mode());
        assertEquals("9000", config.oauthPort());
        assertEquals("xyz", config.oauthClientSecret());
        assertEquals("http://localhost:9000", config.oauthServerUrl());
    }

    @Test
    @DisplayName("serializes the mode by its wire value and omits null fields")
    void serializesWireValue() throws Exception {
        var config = AuthConfig.builder(AuthMode.API_KEY).apiKey("k").build();
        String json = mapper.writeValueAsString(config);
        assertTrue(json.contains("\"auth_type\":\"apikey\""));
        assertTrue(json.contains("\"api_key\":\"k\""));
        assertFalse(json.contains("oauth_host"));
    }

    @Test
    @DisplayName("toBuilder copies every field")
    void toBuilderCopies() {
        var original = AuthConfig.builder(AuthMode.OAUTH)
                .host("h").port(1).oauthHost("oh").oauthPort(2).oauthServerUrl("s")
                .oauthClientId("id").oauthClientSecret("secret").oauthMcpScope("scope")
                .build();
        assertEquals(original, original.toBuilder().build());
    }
}
