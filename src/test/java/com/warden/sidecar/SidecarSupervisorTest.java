package com.warden.sidecar;

import com.warden.core.metrics.WardenMetrics;
import com.warden.core.model.AuthConfig;
import com.warden.core.model.AuthMode;
import com.warden.core.model.SidecarStatus;
import com.warden.sidecar.SidecarLauncher.LaunchedSidecar;
import com.warden.sidecar.SidecarSupervisor.StartOptions;
import com.warden.sidecar.platform.OutputCapture;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.slf4j.MDC;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class SidecarSupervisorTest {

    private static final String TENANT = "acme";
    private static final String ENDPOINT = "http://upstream/mcp";
    private static final StartOptions FAST = new StartOptions(3, 1, Duration.ZERO);

    private SidecarProperties properties;
    private TenantRegistry registry;
    private PortArbiter portArbiter;
    private SidecarLauncher launcher;
    private StartupMonitor monitor;
    private ProcessTerminator terminator;
    private SimpleMeterRegistry meters;
    private SidecarSupervisor supervisor;
    private final AtomicInteger nextPid = new AtomicInteger(4000);

    @BeforeEach
    void setUp() {
        properties = new SidecarProperties();
        properties.setRetryCooldown(Duration.ofMillis(1));
        properties.setStaleKillTimeout(Duration.ofSeconds(1));
        registry = new TenantRegistry();
        portArbiter = mock(PortArbiter.class);
        launcher = mock(SidecarLauncher.class);
        monitor = mock(StartupMonitor.class);
        terminator = mock(ProcessTerminator.class);
        meters = new SimpleMeterRegistry();
        supervisor = new SidecarSupervisor(properties, registry, new ConfigDiffer(), portArbiter, launcher,
                monitor, terminator, new WardenMetrics(meters));

        when(launcher.launch(anyString(), anyString(), anyInt(), anyString(), anyString(), any()))
                .thenAnswer(invocation -> launched());
    }

    @AfterEach
    void tearDown() {
        supervisor.stopAll();
    }

    private LaunchedSidecar launched() {
        Process process = mock(Process.class);
        when(process.isAlive()).thenReturn(true);
        when(process.pid()).thenReturn((long) nextPid.incrementAndGet());
        return new LaunchedSidecar(process, mock(OutputCapture.class), "uvx mcp-composer", "localhost:9000");
    }

    private static AuthConfig oauth() {
        return AuthConfig.builder(AuthMode.OAUTH)
                .oauthHost("localhost").oauthPort(9000)
                .oauthServerUrl("http://localhost:9000")
                .oauthClientId("client").oauthClientSecret("secret")
                .oauthAuthUrl("https://idp/auth").oauthTokenUrl("https://idp/token")
                .build();
    }

    private SidecarStatus start(AuthConfig auth) {
        return supervisor.start(TENANT, ENDPOINT, null, auth, FAST);
    }

    private double starts(String outcome) {
        var counter = meters.find("warden.sidecar.starts").tag("outcome", outcome).counter();
        return counter == null ? 0 : counter.count();
    }

    @Nested
    @DisplayName("start")
    class Start {

        @Test
        @DisplayName("launches, registers and reports the sidecar")
        void startsSidecar() throws Exception {
            SidecarStatus status = start(oauth());

            assertTrue(status.running());
            assertEquals(9000, status.port());
            assertEquals("localhost", status.host());
            assertEquals(ENDPOINT + "/sse", status.legacyUrl());
            assertEquals(9000, supervisor.getPort(TENANT).orElseThrow());
            assertTrue(registry.isTrackedPid(status.pid()));
            verify(portArbiter).ensurePortAvailable(9000, "localhost", TENANT);
            assertEquals(1.0, starts("started"));
        }

        @Test
        @DisplayName("derives the legacy URL without doubling slashes")
        void legacyUrlDefault() {
            supervisor.start(TENANT, "http://upstream/mcp/", "", oauth(), FAST);

            verify(launcher).launch(eq(TENANT), eq("localhost"), eq(9000), eq("http://upstream/mcp/"),
                    eq("http://upstream/mcp/sse"), any());
        }

        @Test
        @DisplayName("an explicit legacy URL is passed through")
        void explicitLegacyUrl() {
            supervisor.start(TENANT, ENDPOINT, "http://legacy/sse", oauth(), FAST);

            verify(launcher).launch(eq(TENANT), anyString(), anyInt(), eq(ENDPOINT), eq("http://legacy/sse"), any());
        }

        @Test
        @DisplayName("an unchanged running sidecar is returned without relaunching")
        void idempotentStart() {
            SidecarStatus first = start(oauth());
            SidecarStatus second = start(oauth());

            assertEquals(first.pid(), second.pid());
            verify(launcher, times(1)).launch(anyString(), anyString(), anyInt(), anyString(), anyString(), any());
            verify(terminator, never()).terminateQuietly(any());
            assertEquals(1.0, starts("unchanged"));
        }

        @Test
        @DisplayName("changed oauth settings restart the sidecar")
        void configChangeRestarts() throws Exception {
            SidecarStatus first = start(oauth());
            Process firstProcess = registry.get(TENANT).orElseThrow().process();

            SidecarStatus second = start(oauth().toBuilder().oauthClientSecret("rotated").build());

            assertNotEquals(first.pid(), second.pid());
            verify(terminator).terminate(firstProcess);
            assertFalse(registry.isTrackedPid(first.pid()));
            assertEquals(1.0, meters.find("warden.sidecar.restarts").tag("reason", "config_changed")
                    .counter().count());
        }

        @Test
        @DisplayName("a new port with otherwise equal settings restarts on that port")
        void portChangeRestarts() throws Exception {
            AuthConfig before = AuthConfig.builder(AuthMode.NONE).host("localhost").port(9001).build();
            SidecarStatus first = start(before);
            Process firstProcess = registry.get(TENANT).orElseThrow().process();

            SidecarStatus second = start(before.toBuilder().port(9002).build());

            assertNotEquals(first.pid(), second.pid());
            assertEquals(9002, second.port());
            assertEquals(9002, supervisor.getPort(TENANT).orElseThrow());
            verify(terminator).terminate(firstProcess);
            verify(portArbiter).ensurePortAvailable(9002, "localhost", TENANT);
            assertEquals(1.0, meters.find("warden.sidecar.restarts").tag("reason", "address_changed")
                    .counter().count());
        }

        @Test
        @DisplayName("a new host with the same api key restarts the sidecar")
        void hostChangeRestarts() {
            AuthConfig before = AuthConfig.builder(AuthMode.API_KEY).host("localhost").port(9001).apiKey("k").build();
            SidecarStatus first = start(before);

            SidecarStatus second = start(before.toBuilder().host("127.0.0.1").build());

            assertNotEquals(first.pid(), second.pid());
            assertEquals("127.0.0.1", second.host());
        }

        @Test
        @DisplayName("a dead sidecar is replaced and its old port swept")
        void deadSidecarRestarts() throws Exception {
            start(oauth());
            Process dead = registry.get(TENANT).orElseThrow().process();
            when(dead.isAlive()).thenReturn(false);

            SidecarStatus status = start(oauth());

            assertTrue(status.running());
            verify(terminator, never()).terminate(dead);
            verify(portArbiter, atLeast(3)).sweepZombies(9000, TENANT);
            assertEquals(1.0, meters.find("warden.sidecar.restarts").tag("reason", "process_died")
                    .counter().count());
        }

        @Test
        @DisplayName("a start failure is retried and a later success clears the last error")
        void retryThenSucceed() throws Exception {
            registry.setLastError(TENANT, "earlier failure");
            doThrow(new SidecarStartupException("Sidecar startup timed out. Please try again.", TENANT))
                    .doNothing()
                    .when(monitor).awaitBinding(eq(TENANT), any(), anyString(), anyInt(), anyInt(), any());

            SidecarStatus status = start(oauth());

            assertTrue(status.running());
            verify(launcher, times(2)).launch(anyString(), anyString(), anyInt(), anyString(), anyString(), any());
            verify(portArbiter, times(2)).ensurePortAvailable(9000, "localhost", TENANT);
            verify(terminator, times(1)).terminateQuietly(any());
            assertTrue(supervisor.getLastError(TENANT).isEmpty());
        }

        @Test
        @DisplayName("exhausted retries record the last error")
        void retriesExhausted() throws Exception {
            doThrow(new SidecarStartupException("Address localhost:9000 is already in use.", TENANT))
                    .when(monitor).awaitBinding(eq(TENANT), any(), anyString(), anyInt(), anyInt(), any());

            var e = assertThrows(SidecarStartupException.class, () -> start(oauth()));

            assertEquals("Address localhost:9000 is already in use.", e.getMessage());
            verify(launcher, times(3)).launch(anyString(), anyString(), anyInt(), anyString(), anyString(), any());
            verify(terminator, times(3)).terminateQuietly(any());
            assertEquals("Address localhost:9000 is already in use.", supervisor.getLastError(TENANT).orElseThrow());
            assertTrue(supervisor.getPort(TENANT).isEmpty());
            assertEquals(1.0, starts("failed"));
        }

        @Test
        @DisplayName("a port conflict is not retried")
        void portConflictNotRetried() throws Exception {
            doThrow(new PortConflictException("Port 9000 is already in use by another project.", TENANT))
                    .when(portArbiter).ensurePortAvailable(9000, "localhost", TENANT);

            assertThrows(PortConflictException.class, () -> start(oauth()));

            verify(launcher, never()).launch(anyString(), anyString(), anyInt(), anyString(), anyString(), any());
            assertEquals("Port 9000 is already in use by another project.",
                    supervisor.getLastError(TENANT).orElseThrow());
            assertEquals(1.0, starts("rejected"));
        }
    }

    @Nested
    @DisplayName("validation")
    class Validation {

        private void assertRejected(String expected, Runnable start) {
            var e = assertThrows(SidecarConfigurationException.class, start::run);
            assertEquals(expected, e.getMessage());
            verify(launcher, never()).launch(anyString(), anyString(), anyInt(), anyString(), anyString(), any());
            verifyNoInteractions(portArbiter);
        }

        @Test
        @DisplayName("missing oauth fields are listed")
        void missingSecret() {
            var auth = AuthConfig.builder(AuthMode.OAUTH)
                    .oauthHost("localhost").oauthPort(9000)
                    .oauthServerUrl("http://localhost:9000")
                    .oauthClientId("").oauthAuthUrl("a").oauthTokenUrl("t")
                    .build();

            assertRejected("Invalid OAuth configuration: Missing required fields: oauth_client_secret; "
                    + "Empty required fields: oauth_client_id", () -> start(auth));
            assertTrue(supervisor.getLastError(TENANT).orElseThrow().contains("oauth_client_secret"));
        }

        @Test
        @DisplayName("endpoint, auth settings, port and host are required")
        void requiredInputs() {
            var noPort = AuthConfig.builder(AuthMode.NONE).host("localhost").build();
            var badPort = AuthConfig.builder(AuthMode.NONE).host("localhost").port("http").build();
            var noHost = AuthConfig.builder(AuthMode.NONE).port(8100).build();

            assertRejected("No endpoint provided", () -> supervisor.start(TENANT, " ", null, noPort, FAST));
            assertRejected("No auth settings provided", () -> supervisor.start(TENANT, ENDPOINT, null, null, FAST));
            assertRejected("No port provided", () -> start(noPort));
            assertRejected("Invalid port: http", () -> start(badPort));
            assertRejected("No host provided", () -> start(noHost));
        }

        @Test
        @DisplayName("non-oauth modes bind to host and port")
        void apiKeyMode() {
            var auth = AuthConfig.builder(AuthMode.API_KEY).host("127.0.0.1").port(8100).apiKey("k").build();

            SidecarStatus status = start(auth);

            assertEquals(8100, status.port());
            assertEquals("127.0.0.1", status.host());
        }
    }

    @Nested
    @DisplayName("stop")
    class Stop {

        @Test
        @DisplayName("stop terminates the sidecar and releases its port")
        void stop() throws Exception {
            start(oauth());
            var entry = registry.get(TENANT).orElseThrow();

            supervisor.stop(TENANT);

            verify(terminator).terminate(entry.process());
            verify(entry.capture()).close();
            assertTrue(supervisor.getPort(TENANT).isEmpty());
            assertTrue(registry.ownerOfPort(9000).isEmpty());
            assertEquals(1.0, meters.find("warden.sidecar.stops").counter().count());
        }

        @Test
        @DisplayName("stop and stopAll log under the tenant's MDC key")
        void stopSetsTenantMdc() throws Exception {
            supervisor.start("a", ENDPOINT, null, oauth(), FAST);
            supervisor.start("b", ENDPOINT, null, oauth().toBuilder().oauthPort(9001).build(), FAST);
            List<String> seen = new ArrayList<>();
            doAnswer(invocation -> seen.add(MDC.get("tenantId"))).when(terminator).terminate(any());

            supervisor.stop("a");
            assertNull(MDC.get("tenantId"));
            supervisor.stopAll();

            assertEquals(List.of("a", "b"), seen);
            assertNull(MDC.get("tenantId"));
        }

        @Test
        @DisplayName("stop of an unknown tenant is a no-op")
        void stopUnknown() {
            assertDoesNotThrow(() -> supervisor.stop("nobody"));
            verifyNoInteractions(terminator);
        }

        @Test
        @DisplayName("teardown failures are logged and tracking is still released")
        void stopFailureReleases() throws Exception {
            start(oauth());
            doThrow(new IllegalStateException("boom")).when(terminator).terminate(any());

            assertDoesNotThrow(() -> supervisor.stop(TENANT));
            assertTrue(registry.get(TENANT).isEmpty());
        }

        @Test
        @DisplayName("stopAll stops every tenant")
        void stopAll() {
            supervisor.start("a", ENDPOINT, null, oauth(), FAST);
            supervisor.start("b", ENDPOINT, null, oauth().toBuilder().oauthPort(9001).build(), FAST);

            supervisor.stopAll();

            assertTrue(registry.tenants().isEmpty());
        }

        @Test
        @DisplayName("stop cancels an in-flight start")
        void stopCancelsStart() throws Exception {
            var entered = new CountDownLatch(1);
            doAnswer(invocation -> {
                entered.countDown();
                Thread.sleep(TimeUnit.SECONDS.toMillis(30));
                return null;
            }).when(monitor).awaitBinding(eq(TENANT), any(), anyString(), anyInt(), anyInt(), any());

            var future = supervisor.startAsync(TENANT, ENDPOINT, null, oauth(), FAST);
            assertTrue(entered.await(5, TimeUnit.SECONDS));

            supervisor.stop(TENANT);

            assertThrows(CancellationException.class, future::get);
            assertTrue(registry.get(TENANT).isEmpty());
            assertTrue(registry.activeStart(TENANT).isEmpty());
        }
    }

    @Test
    @DisplayName("a newer start supersedes the in-flight one")
    void supersede() throws Exception {
        var entered = new CountDownLatch(1);
        var calls = new AtomicInteger();
        doAnswer(invocation -> {
            if (calls.incrementAndGet() == 1) {
                entered.countDown();
                Thread.sleep(TimeUnit.SECONDS.toMillis(30));
            }
            return null;
        }).when(monitor).awaitBinding(eq(TENANT), any(), anyString(), anyInt(), anyInt(), any());

        var first = supervisor.startAsync(TENANT, ENDPOINT, null, oauth(), FAST);
        assertTrue(entered.await(5, TimeUnit.SECONDS));

        SidecarStatus status = start(oauth().toBuilder().oauthClientSecret("newer").build());

        assertTrue(status.running());
        assertThrows(CancellationException.class, first::get);
        assertEquals("newer", registry.get(TENANT).orElseThrow().authConfig().oauthClientSecret());
        assertEquals(1.0, starts("cancelled"));
    }

    @Test
    @DisplayName("a start cancelled inside the startup monitor kills the launched sidecar")
    void cancelledMonitorKillsSidecar() throws Exception {
        doThrow(new InterruptedException()).when(monitor)
                .awaitBinding(eq(TENANT), any(), anyString(), anyInt(), anyInt(), any());

        assertThrows(CancellationException.class, () -> start(oauth()));

        var launchedSidecar = ArgumentCaptor.forClass(LaunchedSidecar.class);
        verify(monitor).awaitBinding(eq(TENANT), launchedSidecar.capture(), anyString(), anyInt(), anyInt(), any());
        verify(terminator).kill(launchedSidecar.getValue().process());
        verify(launchedSidecar.getValue().capture()).close();
        assertTrue(registry.get(TENANT).isEmpty());
        assertFalse(registry.isTrackedPid(launchedSidecar.getValue().process().pid()));
        assertEquals(1.0, starts("cancelled"));
    }

    @Test
    @DisplayName("startAsync surfaces failures through the future")
    void asyncFailure() {
        var future = supervisor.startAsync(TENANT, ENDPOINT, null, null, FAST);

        var e = assertThrows(ExecutionException.class, future::get);
        assertInstanceOf(SidecarConfigurationException.class, e.getCause());
    }

    @Nested
    @DisplayName("feature gate")
    class Disabled {

        @BeforeEach
        void disable() {
            properties.setEnabled(false);
        }

        @Test
        @DisplayName("start, stop and getPort are refused when disabled")
        void gated() {
            var e = assertThrows(SidecarDisabledException.class, () -> start(oauth()));
            assertEquals("Sidecar supervision is disabled in settings", e.getMessage());
            assertThrows(SidecarDisabledException.class, () -> supervisor.stop(TENANT));
            assertThrows(SidecarDisabledException.class, () -> supervisor.getPort(TENANT));
            verifyNoInteractions(launcher);
        }

        @Test
        @DisplayName("status queries still answer when disabled")
        void queriesAnswer() {
            assertFalse(supervisor.getStatus(TENANT).running());
            assertTrue(supervisor.listStatuses().isEmpty());
            assertTrue(supervisor.getLastError(TENANT).isEmpty());
        }
    }

    @Test
    @DisplayName("listStatuses includes failed tenants in tenant order")
    void listStatuses() {
        supervisor.start("b", ENDPOINT, null, oauth(), FAST);
        registry.setLastError("a", "Port 9000 is already in use by another project.");

        List<SidecarStatus> statuses = supervisor.listStatuses();

        assertEquals(List.of("a", "b"), statuses.stream().map(SidecarStatus::tenantId).toList());
        assertFalse(statuses.get(0).running());
        assertEquals("Port 9000 is already in use by another project.", statuses.get(0).lastError());
        assertTrue(statuses.get(1).running());
    }

    @Test
    @DisplayName("StartOptions rejects empty budgets")
    void startOptionsValidation() {
        assertThrows(IllegalArgumentException.class, () -> new StartOptions(0, 1, Duration.ZERO));
        assertThrows(IllegalArgumentException.class, () -> new StartOptions(1, 0, Duration.ZERO));
        assertThrows(IllegalArgumentException.class, () -> new StartOptions(1, 1, Duration.ofSeconds(-1)));
    }
}
