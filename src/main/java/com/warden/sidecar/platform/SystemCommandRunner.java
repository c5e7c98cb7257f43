package com.warden.sidecar.platform;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs short-lived operating system utilities (lsof, netstat, taskkill, PowerShell)
 * with a hard time bound. Never throws for a failing or hanging utility; the result
 * says what happened and the caller decides.
 *
 * <p>An interrupted caller gets a failed result with its interrupt flag re-asserted.
 */
public class SystemCommandRunner {

    private static final Logger log = LoggerFactory.getLogger(SystemCommandRunner.class);

    private final Duration timeout;

    public SystemCommandRunner(Duration timeout) {
        this.timeout = timeout;
    }

    public record CommandResult(int exitCode, String stdout, String stderr, boolean timedOut) {

        public static CommandResult failed(String reason) {
            return new CommandResult(-1, "", reason == null ? "" : reason, false);
        }

        public boolean succeeded() {
            return exitCode == 0 && !timedOut;
        }
    }

    public CommandResult run(List<String> command) {
        return run(command, timeout);
    }

    public CommandResult run(List<String> command, Duration limit) {
        log.debug("Running: {}", String.join(" ", command));

        Process process;
        try {
            process = new ProcessBuilder(command)
                    .redirectInput(ProcessBuilder.Redirect.PIPE)
                    .start();
            process.getOutputStream().close();
        } catch (IOException e) {
            log.debug("Could not run {}: {}", command.get(0), e.getMessage());
            return CommandResult.failed(e.getMessage());
        }

        // Both pipes are read concurrently so a chatty stderr cannot stall stdout.
        CompletableFuture<String> stdout = CompletableFuture.supplyAsync(() -> readFully(process.getInputStream()));
        CompletableFuture<String> stderr = CompletableFuture.supplyAsync(() -> readFully(process.getErrorStream()));

        try {
            if (!process.waitFor(limit.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Command timed out after {}s: {}", limit.toSeconds(), command.get(0));
                process.destroyForcibly();
                return new CommandResult(-1, join(stdout), join(stderr), true);
            }
            int exitCode = process.exitValue();
            if (exitCode != 0) {
                log.debug("Command exited with code {}: {}", exitCode, String.join(" ", command));
            }
            return new CommandResult(exitCode, join(stdout), join(stderr), false);
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            return CommandResult.failed("interrupted");
        }
    }

    private static String readFully(InputStream in) {
        try (in) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static String join(CompletableFuture<String> output) {
        try {
            return output.get(1, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return "";
        } catch (ExecutionException | TimeoutException e) {
            log.trace("Output of command not fully read: {}", e.toString());
            return "";
        }
    }
}
