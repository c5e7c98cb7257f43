package com.warden.sidecar;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SidecarPropertiesTest {

    @Test
    @DisplayName("defaults match the documented budget")
    void defaults() {
        var props = new SidecarProperties();
        assertTrue(props.isEnabled());
        assertEquals(3, props.getMaxRetries());
        assertEquals(40, props.getMaxStartupChecks());
        assertEquals(Duration.ofSeconds(2), props.getStartupDelay());
        assertEquals(Duration.ofSeconds(3), props.getZombieReleaseWait());
        assertEquals("auto", props.getPlatform());
    }

    @Test
    @DisplayName("launch prefix pins the default version")
    void defaultLaunchPrefix() {
        assertEquals(List.of("uvx", "mcp-composer==0.1.0.8.10"), new SidecarProperties().launchPrefix());
    }

    @Test
    @DisplayName("a bare version becomes a compatible-release constraint")
    void bareVersion() {
        var props = new SidecarProperties();
        props.setVersion("0.2.1");
        assertEquals("~=0.2.1", props.normalizedVersion());
    }

    @Test
    @DisplayName("operator-prefixed versions are kept")
    void operatorVersions() {
        var props = new SidecarProperties();
        for (String version : List.of("==1.0", ">=1.0", "~=1.0", "!=1.0", "<2", "===1.0.0")) {
            props.setVersion(version);
            assertEquals(version, props.normalizedVersion());
        }
    }

    @Test
    @DisplayName("blank version falls back to the default and other values are verbatim")
    void blankAndVerbatim() {
        var props = new SidecarProperties();
        props.setVersion("  ");
        assertEquals(SidecarProperties.DEFAULT_VERSION, props.normalizedVersion());
        props.setVersion("@latest");
        assertEquals("@latest", props.normalizedVersion());
    }

    @Test
    @DisplayName("no package name means the command is used as is")
    void noPackage() {
        var props = new SidecarProperties();
        props.setCommand(List.of("/opt/sidecar/bin/run"));
        props.setPackageName("");
        assertEquals(List.of("/opt/sidecar/bin/run"), props.launchPrefix());
    }

    @Test
    @DisplayName("signature falls back to the package name")
    void signature() {
        var props = new SidecarProperties();
        assertEquals("mcp-composer", props.effectiveSignature());
        props.setSignature("my-sidecar");
        assertEquals("my-sidecar", props.effectiveSignature());
    }
}
