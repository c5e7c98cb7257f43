package com.warden.sidecar;

import com.warden.core.logging.MdcContext;
import com.warden.core.metrics.WardenMetrics;
import com.warden.core.model.AuthConfig;
import com.warden.core.model.AuthMode;
import com.warden.core.model.SidecarStatus;
import com.warden.sidecar.SidecarLauncher.LaunchedSidecar;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

/**
 * Starts, restarts and stops one sidecar process per tenant.
 *
 * <p>Operations on one tenant are serialized by that tenant's lock; different tenants
 * proceed in parallel. A new start for a tenant supersedes its in-flight start: the old
 * one is cancelled, cleans up whatever it launched, and only then does the new one run.
 *
 * <p>Start bodies run on a dedicated pool so that a caller blocked in
 * {@link #start(String, String, AuthConfig)} can be interrupted without leaving
 * a half-started sidecar behind.
 */
@Service
public class SidecarSupervisor {

    private static final Logger log = LoggerFactory.getLogger(SidecarSupervisor.class);

    private static final List<Map.Entry<String, Function<AuthConfig, String>>> REQUIRED_OAUTH_FIELDS = List.of(
            Map.entry("oauth_host", AuthConfig::oauthHost),
            Map.entry("oauth_port", AuthConfig::oauthPort),
            Map.entry("oauth_server_url", AuthConfig::oauthServerUrl),
            Map.entry("oauth_auth_url", AuthConfig::oauthAuthUrl),
            Map.entry("oauth_token_url", AuthConfig::oauthTokenUrl),
            Map.entry("oauth_client_id", AuthConfig::oauthClientId),
            Map.entry("oauth_client_secret", AuthConfig::oauthClientSecret)
    );

    private final SidecarProperties properties;
    private final TenantRegistry registry;
    private final ConfigDiffer configDiffer;
    private final PortArbiter portArbiter;
    private final SidecarLauncher launcher;
    private final StartupMonitor startupMonitor;
    private final ProcessTerminator terminator;
    private final WardenMetrics metrics;

    private final AtomicInteger threadCounter = new AtomicInteger();
    private final ExecutorService startExecutor = Executors.newCachedThreadPool(r -> {
        Thread t = new Thread(r, "sidecar-start-" + threadCounter.incrementAndGet());
        t.setDaemon(true);
        return t;
    });

    /**
     * Per-call overrides of the retry and polling budget.
     *
     * @param maxRetries       launch attempts before giving up, at least 1
     * @param maxStartupChecks port checks per attempt, at least 1
     * @param startupDelay     pause before each port check
     */
    public record StartOptions(int maxRetries, int maxStartupChecks, Duration startupDelay) {

        public StartOptions {
            if (maxRetries < 1) {
                throw new IllegalArgumentException("maxRetries must be at least 1");
            }
            if (maxStartupChecks < 1) {
                throw new IllegalArgumentException("maxStartupChecks must be at least 1");
            }
            if (startupDelay == null || startupDelay.isNegative()) {
                throw new IllegalArgumentException("startupDelay must not be negative");
            }
        }

        public static StartOptions from(SidecarProperties properties) {
            return new StartOptions(properties.getMaxRetries(), properties.getMaxStartupChecks(),
                    properties.getStartupDelay());
        }
    }

    public SidecarSupervisor(SidecarProperties properties, TenantRegistry registry, ConfigDiffer configDiffer,
                             PortArbiter portArbiter, SidecarLauncher launcher, StartupMonitor startupMonitor,
                             ProcessTerminator terminator, WardenMetrics metrics) {
        this.properties = properties;
        this.registry = registry;
        this.configDiffer = configDiffer;
        this.portArbiter = portArbiter;
        this.launcher = launcher;
        this.startupMonitor = startupMonitor;
        this.terminator = terminator;
        this.metrics = metrics;
    }

    @PostConstruct
    void logState() {
        if (properties.isEnabled()) {
            log.info("Sidecar supervision is enabled; launching with {}", String.join(" ", properties.launchPrefix()));
        } else {
            log.info("Sidecar supervision is disabled in settings. OAuth will not be enabled for tenant endpoints.");
        }
    }

    // -- Start ---------------------------------------------------------------

    public SidecarStatus start(String tenantId, String endpoint, AuthConfig auth) {
        return start(tenantId, endpoint, null, auth, StartOptions.from(properties));
    }

    /**
     * Starts or restarts the tenant's sidecar and blocks until it is bound or has failed.
     *
     * <p>Returns at once when a live sidecar already runs with an equivalent
     * {@link AuthConfig}. If the calling thread is interrupted, the start is cancelled,
     * anything it launched is terminated, and the interrupt flag is re-asserted.
     *
     * @param legacyUrl SSE endpoint; defaults to {@code endpoint + "/sse"} when blank
     * @throws SidecarDisabledException      when supervision is disabled
     * @throws SidecarConfigurationException when the settings are incomplete or invalid
     * @throws PortConflictException         when the port is held by another tenant or an unknown process
     * @throws SidecarStartupException       when every attempt failed
     * @throws CancellationException         when a newer start or a stop superseded this one
     */
    public SidecarStatus start(String tenantId, String endpoint, String legacyUrl, AuthConfig auth,
                               StartOptions options) {
        PendingStart pending = submit(tenantId, endpoint, legacyUrl, auth, options);
        try {
            return pending.future().get();
        } catch (InterruptedException e) {
            log.debug("Caller interrupted while starting sidecar for tenant {}, cancelling", tenantId);
            cancel(tenantId, pending);
            Thread.currentThread().interrupt();
            throw new CancellationException("Sidecar start for tenant " + tenantId + " was interrupted");
        } catch (ExecutionException e) {
            throw unwrap(tenantId, e.getCause());
        }
    }

    /** Non-blocking variant of {@link #start(String, String, String, AuthConfig, StartOptions)}. */
    public Future<SidecarStatus> startAsync(String tenantId, String endpoint, String legacyUrl, AuthConfig auth,
                                            StartOptions options) {
        return submit(tenantId, endpoint, legacyUrl, auth, options).future();
    }

    private PendingStart submit(String tenantId, String endpoint, String legacyUrl, AuthConfig auth,
                                StartOptions options) {
        requireEnabled(tenantId);
        var previous = new PendingStart[1];
        PendingStart pending = new PendingStart(
                () -> runStart(tenantId, endpoint, legacyUrl, auth, options, previous[0]),
                self -> registry.clearActiveStart(tenantId, self));
        previous[0] = registry.replaceActiveStart(tenantId, pending).orElse(null);
        startExecutor.execute(pending);
        return pending;
    }

    private SidecarStatus runStart(String tenantId, String endpoint, String legacyUrl, AuthConfig auth,
                                   StartOptions options, PendingStart previous) throws InterruptedException {
        MdcContext.setTenant(tenantId);
        try {
            if (previous != null) {
                log.debug("Cancelling previous sidecar start for tenant {}", tenantId);
                previous.cancelAndAwait();
            }
            return doStart(tenantId, endpoint, legacyUrl, auth, options);
        } catch (SidecarConfigurationException | PortConflictException e) {
            registry.setLastError(tenantId, e.getMessage());
            metrics.recordStart("rejected");
            throw e;
        } catch (SidecarException e) {
            registry.setLastError(tenantId, e.getMessage());
            metrics.recordStart("failed");
            throw e;
        } catch (InterruptedException e) {
            log.debug("Sidecar start for tenant {} was cancelled", tenantId);
            metrics.recordStart("cancelled");
            throw e;
        } finally {
            MdcContext.clear();
        }
    }

    private SidecarStatus doStart(String tenantId, String endpoint, String legacyUrl, AuthConfig auth,
                                  StartOptions options) throws InterruptedException {
        if (endpoint == null || endpoint.isBlank()) {
            throw new SidecarConfigurationException("No endpoint provided", tenantId);
        }
        String effectiveLegacyUrl = legacyUrl == null || legacyUrl.isBlank()
                ? stripTrailingSlash(endpoint) + "/sse"
                : legacyUrl;
        if (auth == null) {
            throw new SidecarConfigurationException("No auth settings provided", tenantId);
        }
        validateOAuth(auth, tenantId);

        String host = auth.bindHost();
        int port = parsePort(auth.bindPort(), tenantId);
        if (host == null || host.isBlank()) {
            throw new SidecarConfigurationException("No host provided", tenantId);
        }
        log.debug("Starting sidecar for tenant {} on {}:{}", tenantId, host, port);

        ReentrantLock lock = registry.lockFor(tenantId);
        lock.lockInterruptibly();
        try {
            Optional<SidecarStatus> unchanged = reconcileExisting(tenantId, auth, host, port);
            if (unchanged.isPresent()) {
                return unchanged.get();
            }

            portArbiter.sweepZombies(port, tenantId);
            portArbiter.ensurePortAvailable(port, host, tenantId);

            SidecarStartupException lastFailure = null;
            for (int attempt = 1; attempt <= options.maxRetries(); attempt++) {
                MdcContext.setAttempt(tenantId, attempt);
                log.debug("Starting sidecar for tenant {} (attempt {}/{})", tenantId, attempt, options.maxRetries());
                try {
                    if (attempt > 1) {
                        log.debug("Re-checking port {} availability before retry", port);
                        portArbiter.ensurePortAvailable(port, host, tenantId);
                    }
                    return launchAndRegister(tenantId, host, port, endpoint, effectiveLegacyUrl, auth, options,
                            attempt);
                } catch (SidecarStartupException e) {
                    lastFailure = e;
                    log.error("Sidecar startup attempt {}/{} failed for tenant {}: {}",
                            attempt, options.maxRetries(), tenantId, e.getMessage());
                    if (attempt < options.maxRetries()) {
                        log.debug("Waiting {}s before retry attempt {}", properties.getRetryCooldown().toSeconds(),
                                attempt + 1);
                        Thread.sleep(properties.getRetryCooldown().toMillis());
                        portArbiter.sweepZombies(port, tenantId);
                    }
                } catch (SidecarConfigurationException | PortConflictException e) {
                    log.error("Configuration or port error for tenant {}, not retrying: {}", tenantId, e.getMessage());
                    throw e;
                }
            }
            log.error("Sidecar failed to start for tenant {} after {} attempts", tenantId, options.maxRetries());
            throw lastFailure;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Handles a sidecar already tracked for the tenant.
     *
     * @return the current status when the running sidecar can be kept as is
     */
    private Optional<SidecarStatus> reconcileExisting(String tenantId, AuthConfig auth, String host, int port)
            throws InterruptedException {
        Optional<ProcessEntry> existing = registry.get(tenantId);
        if (existing.isEmpty()) {
            return Optional.empty();
        }
        ProcessEntry entry = existing.get();
        if (entry.isAlive()) {
            if (!entry.host().equals(host) || entry.port() != port) {
                log.info("Bind address for tenant {} changed from {}:{} to {}:{}, restarting sidecar",
                        tenantId, entry.host(), entry.port(), host, port);
                metrics.recordRestart("address_changed");
                doStop(tenantId);
                return Optional.empty();
            }
            if (!configDiffer.hasChanged(entry.authConfig(), auth)) {
                log.debug("Sidecar already running for tenant {} with current config", tenantId);
                metrics.recordStart("unchanged");
                return Optional.of(entry.toStatus(null));
            }
            log.info("Config changed for tenant {}, restarting sidecar", tenantId);
            metrics.recordRestart("config_changed");
            doStop(tenantId);
            return Optional.empty();
        }

        log.info("Sidecar process died for tenant {}, restarting", tenantId);
        metrics.recordRestart("process_died");
        doStop(tenantId);
        sweepOldPort(entry.port(), tenantId);
        return Optional.empty();
    }

    /** Kills orphans of a dead sidecar on its old port, bounded by the stale-kill timeout. */
    private void sweepOldPort(int port, String tenantId) throws InterruptedException {
        Future<Boolean> sweep = startExecutor.submit(() -> portArbiter.sweepZombies(port, tenantId));
        try {
            sweep.get(properties.getStaleKillTimeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            sweep.cancel(true);
            log.error("Timeout while killing leftover processes on port {}", port);
        } catch (ExecutionException e) {
            log.warn("Failed to clean up port {}: {}", port, e.getCause().getMessage());
        } catch (InterruptedException e) {
            sweep.cancel(true);
            throw e;
        }
    }

    private SidecarStatus launchAndRegister(String tenantId, String host, int port, String endpoint,
                                            String legacyUrl, AuthConfig auth, StartOptions options, int attempt)
            throws InterruptedException {
        long started = System.nanoTime();
        LaunchedSidecar sidecar = launcher.launch(tenantId, host, port, endpoint, legacyUrl, auth);
        try {
            startupMonitor.awaitBinding(tenantId, sidecar, host, port, options.maxStartupChecks(),
                    options.startupDelay());
        } catch (RuntimeException e) {
            discard(sidecar);
            throw e;
        } catch (InterruptedException e) {
            terminator.kill(sidecar.process());
            sidecar.capture().close();
            throw e;
        }

        if (Thread.interrupted()) {
            discard(sidecar);
            throw new InterruptedException("Sidecar start cancelled after it bound port " + port);
        }

        Process process = sidecar.process();
        var entry = new ProcessEntry(tenantId, process, host, port, endpoint, legacyUrl, auth, process.pid(),
                Instant.now(), sidecar.capture());
        registry.register(entry);
        registry.clearLastError(tenantId);

        metrics.recordStartupDuration((System.nanoTime() - started) / 1_000_000);
        metrics.recordStart("started");
        log.info("Sidecar started for tenant {} on port {} (PID: {}) after {} attempt(s)",
                tenantId, port, process.pid(), attempt);
        return entry.toStatus(null);
    }

    private void discard(LaunchedSidecar sidecar) {
        terminator.terminateQuietly(sidecar.process());
        sidecar.capture().close();
    }

    private void validateOAuth(AuthConfig auth, String tenantId) {
        if (auth.mode() != AuthMode.OAUTH) {
            return;
        }
        List<String> missing = new ArrayList<>();
        List<String> empty = new ArrayList<>();
        for (var field : REQUIRED_OAUTH_FIELDS) {
            String value = field.getValue().apply(auth);
            if (value == null) {
                missing.add(field.getKey());
            } else if (value.isBlank()) {
                empty.add(field.getKey());
            }
        }

        List<String> parts = new ArrayList<>();
        if (!missing.isEmpty()) {
            parts.add("Missing required fields: " + String.join(", ", missing));
        }
        if (!empty.isEmpty()) {
            parts.add("Empty required fields: " + String.join(", ", empty));
        }
        if (!parts.isEmpty()) {
            throw new SidecarConfigurationException("Invalid OAuth configuration: " + String.join("; ", parts),
                    tenantId);
        }
    }

    private static int parsePort(String rawPort, String tenantId) {
        if (rawPort == null || rawPort.isBlank()) {
            throw new SidecarConfigurationException("No port provided", tenantId);
        }
        try {
            return Integer.parseInt(rawPort.strip());
        } catch (NumberFormatException e) {
            throw new SidecarConfigurationException("Invalid port: " + rawPort, tenantId, e);
        }
    }

    // -- Stop ----------------------------------------------------------------

    /**
     * Stops the tenant's sidecar, cancelling an in-flight start first. A tenant without a
     * sidecar is a no-op. Tracking is always released, even when signalling fails.
     */
    public void stop(String tenantId) {
        requireEnabled(tenantId);
        MdcContext.setTenant(tenantId);
        try {
            registry.activeStart(tenantId).ifPresent(pending -> cancel(tenantId, pending));

            ReentrantLock lock = registry.lockFor(tenantId);
            lock.lock();
            try {
                doStop(tenantId);
            } finally {
                lock.unlock();
            }
        } finally {
            MdcContext.clear();
        }
    }

    /** Stops every sidecar. Called on shutdown. */
    @PreDestroy
    public void stopAll() {
        Set<String> tenants = new TreeSet<>(registry.tenants());
        tenants.addAll(registry.startingTenants());
        log.debug("Stopping sidecars for {} tenant(s)", tenants.size());
        for (String tenantId : tenants) {
            MdcContext.setTenant(tenantId);
            registry.activeStart(tenantId).ifPresent(pending -> cancel(tenantId, pending));
            ReentrantLock lock = registry.lockFor(tenantId);
            lock.lock();
            try {
                doStop(tenantId);
            } catch (RuntimeException e) {
                log.error("Failed to stop sidecar for tenant {}: {}", tenantId, e.getMessage(), e);
            } finally {
                lock.unlock();
                MdcContext.clear();
            }
        }
        startExecutor.shutdownNow();
        log.info("All sidecars stopped");
    }

    private void doStop(String tenantId) {
        Optional<ProcessEntry> existing = registry.get(tenantId);
        if (existing.isEmpty()) {
            return;
        }
        ProcessEntry entry = existing.get();
        try {
            if (entry.isAlive()) {
                log.debug("Terminating sidecar process {} for tenant {}", entry.pid(), tenantId);
                terminator.terminate(entry.process());
            } else {
                log.debug("Sidecar process for tenant {} was already terminated", tenantId);
            }
        } catch (InterruptedException e) {
            entry.process().destroyForcibly();
            Thread.currentThread().interrupt();
        } catch (RuntimeException e) {
            log.error("Error stopping sidecar for tenant {}: {}", tenantId, e.getMessage(), e);
        } finally {
            registry.release(tenantId);
            entry.capture().close();
            metrics.recordStop();
            log.debug("Released port {} and PID {} from tenant {}", entry.port(), entry.pid(), tenantId);
        }
    }

    private void cancel(String tenantId, PendingStart pending) {
        try {
            pending.cancelAndAwait();
        } catch (InterruptedException e) {
            log.debug("Interrupted while waiting for the start of tenant {} to cancel", tenantId);
            Thread.currentThread().interrupt();
        } finally {
            registry.clearActiveStart(tenantId, pending);
        }
    }

    // -- Queries -------------------------------------------------------------

    public Optional<Integer> getPort(String tenantId) {
        requireEnabled(tenantId);
        return registry.get(tenantId).map(ProcessEntry::port);
    }

    public Optional<String> getLastError(String tenantId) {
        return registry.lastError(tenantId);
    }

    public SidecarStatus getStatus(String tenantId) {
        String lastError = registry.lastError(tenantId).orElse(null);
        return registry.get(tenantId)
                .map(entry -> entry.toStatus(lastError))
                .orElseGet(() -> SidecarStatus.absent(tenantId, lastError));
    }

    /** Status of every tenant that has a sidecar or a recorded failure, ordered by tenant id. */
    public List<SidecarStatus> listStatuses() {
        Set<String> tenants = new TreeSet<>(registry.tenants());
        tenants.addAll(registry.tenantsWithErrors());
        return tenants.stream()
                .map(this::getStatus)
                .sorted(Comparator.comparing(SidecarStatus::tenantId))
                .toList();
    }

    public boolean isEnabled() {
        return properties.isEnabled();
    }

    private void requireEnabled(String tenantId) {
        if (!properties.isEnabled()) {
            throw new SidecarDisabledException("Sidecar supervision is disabled in settings", tenantId);
        }
    }

    private static RuntimeException unwrap(String tenantId, Throwable cause) {
        if (cause instanceof RuntimeException runtime) {
            return runtime;
        }
        if (cause instanceof InterruptedException) {
            return new CancellationException("Sidecar start for tenant " + tenantId + " was cancelled");
        }
        return new SidecarStartupException(cause.getMessage(), tenantId, cause);
    }

    private static String stripTrailingSlash(String url) {
        String result = url;
        while (result.endsWith("/")) {
            result = result.substring(0, result.length() - 1);
        }
        return result;
    }
}
