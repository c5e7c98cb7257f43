package com.warden.sidecar.platform;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Reads the child's pipes directly. While polling, only bytes that
 * {@link InputStream#available()} reports are read, so a tick never blocks.
 */
public class PipeOutputCapture implements OutputCapture {

    private static final Logger log = LoggerFactory.getLogger(PipeOutputCapture.class);

    private final String tenantId;
    private StreamBuffer stdout;
    private StreamBuffer stderr;

    public PipeOutputCapture(String tenantId) {
        this.tenantId = tenantId;
    }

    @Override
    public void redirect(ProcessBuilder builder) {
        builder.redirectOutput(ProcessBuilder.Redirect.PIPE)
                .redirectError(ProcessBuilder.Redirect.PIPE);
    }

    @Override
    public void attach(Process process) {
        this.stdout = new StreamBuffer("stdout", process.getInputStream());
        this.stderr = new StreamBuffer("stderr", process.getErrorStream());
    }

    @Override
    public List<String> drainAvailable() {
        if (stdout == null) {
            return List.of();
        }
        List<String> lines = new ArrayList<>();
        lines.addAll(stdout.drain());
        lines.addAll(stderr.drain());
        return lines;
    }

    @Override
    public CapturedOutput collect(Duration timeout) {
        if (stdout == null) {
            return CapturedOutput.EMPTY;
        }
        CompletableFuture<Void> out = CompletableFuture.runAsync(stdout::readToEnd);
        CompletableFuture<Void> err = CompletableFuture.runAsync(stderr::readToEnd);
        try {
            CompletableFuture.allOf(out, err).get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (TimeoutException e) {
            log.debug("Output of sidecar for tenant {} still open after {}ms, using what was read",
                    tenantId, timeout.toMillis());
        } catch (ExecutionException e) {
            log.debug("Error reading sidecar output for tenant {}: {}", tenantId, e.getCause().toString());
        }
        return new CapturedOutput(stdout.text(), stderr.text());
    }

    @Override
    public void detach() {
        if (stdout == null) {
            return;
        }
        pump(stdout);
        pump(stderr);
    }

    @Override
    public void close() {
        if (stdout == null) {
            return;
        }
        stdout.close();
        stderr.close();
    }

    private void pump(StreamBuffer buffer) {
        var reader = new Thread(() -> {
            try (var lines = new BufferedReader(new InputStreamReader(buffer.in, StandardCharsets.UTF_8))) {
                lines.lines().forEach(line -> logLine(buffer.name, line));
            } catch (IOException | UncheckedIOException e) {
                log.debug("Stopped reading sidecar {} for tenant {}: {}", buffer.name, tenantId, e.getMessage());
            }
        }, "sidecar-" + buffer.name + "-" + tenantId);
        reader.setDaemon(true);
        reader.start();
    }

    private void logLine(String stream, String line) {
        if (stream.equals("stderr") && line.toLowerCase(Locale.ROOT).contains("error")) {
            log.error("[sidecar:{}] {}", tenantId, line);
        } else {
            log.debug("[sidecar:{}] {}: {}", tenantId, stream, line);
        }
    }

    private final class StreamBuffer {
        private final String name;
        private final InputStream in;
        private final ByteArrayOutputStream all = new ByteArrayOutputStream();
        private final ByteArrayOutputStream partial = new ByteArrayOutputStream();

        private StreamBuffer(String name, InputStream in) {
            this.name = name;
            this.in = in;
        }

        List<String> drain() {
            List<String> lines = new ArrayList<>();
            try {
                int available = in.available();
                if (available <= 0) {
                    return lines;
                }
                byte[] chunk = new byte[Math.min(available, 8192)];
                int read = in.read(chunk, 0, chunk.length);
                if (read <= 0) {
                    return lines;
                }
                all.write(chunk, 0, read);
                partial.write(chunk, 0, read);

                // Lines are split on bytes; a UTF-8 sequence never contains '\n'
                byte[] pending = partial.toByteArray();
                int start = 0;
                for (int i = 0; i < pending.length; i++) {
                    if (pending[i] != '\n') {
                        continue;
                    }
                    String line = new String(pending, start, i - start, StandardCharsets.UTF_8).stripTrailing();
                    start = i + 1;
                    if (!line.isEmpty()) {
                        logLine(name, line);
                        lines.add(line);
                    }
                }
                partial.reset();
                partial.write(pending, start, pending.length - start);
            } catch (IOException e) {
                log.trace("Nothing to drain from sidecar {}: {}", name, e.getMessage());
            }
            return lines;
        }

        void readToEnd() {
            try {
                all.write(in.readAllBytes());
            } catch (IOException e) {
                log.trace("Sidecar {} closed while reading: {}", name, e.getMessage());
            }
        }

        String text() {
            return all.toString(StandardCharsets.UTF_8);
        }

        void close() {
            try {
                in.close();
            } catch (IOException e) {
                log.trace("Error closing sidecar {}: {}", name, e.getMessage());
            }
        }
    }
}
