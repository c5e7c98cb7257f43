package com.warden.sidecar.platform;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Sends the child's output to temporary files. Used where reading a live pipe could
 * block the poll loop; output is only inspected once the process has exited or the
 * poll loop gives up. The files live until {@link #close()}.
 */
public class FileOutputCapture implements OutputCapture {

    private static final Logger log = LoggerFactory.getLogger(FileOutputCapture.class);

    private final Path stdoutFile;
    private final Path stderrFile;
    private Process process;

    public FileOutputCapture(String tenantId) {
        this(tenantId, Path.of(System.getProperty("java.io.tmpdir")));
    }

    public FileOutputCapture(String tenantId, Path directory) {
        String prefix = "sidecar_" + sanitize(tenantId);
        try {
            this.stdoutFile = Files.createTempFile(directory, prefix + "_stdout_", ".log");
            this.stderrFile = Files.createTempFile(directory, prefix + "_stderr_", ".log");
        } catch (IOException e) {
            throw new UncheckedIOException("Could not create sidecar output files", e);
        }
    }

    @Override
    public void redirect(ProcessBuilder builder) {
        builder.redirectOutput(stdoutFile.toFile())
                .redirectError(stderrFile.toFile());
    }

    @Override
    public void attach(Process process) {
        this.process = process;
    }

    @Override
    public List<String> drainAvailable() {
        return List.of();
    }

    @Override
    public CapturedOutput collect(Duration timeout) {
        if (process != null && process.isAlive()) {
            try {
                process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        return new CapturedOutput(read(stdoutFile), read(stderrFile));
    }

    @Override
    public void detach() {
        // The child keeps writing to the files; nothing to pump.
    }

    @Override
    public void close() {
        delete(stdoutFile);
        delete(stderrFile);
    }

    Path stdoutFile() {
        return stdoutFile;
    }

    Path stderrFile() {
        return stderrFile;
    }

    private static String read(Path file) {
        try {
            return Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.debug("Could not read sidecar output {}: {}", file, e.getMessage());
            return "";
        }
    }

    private static void delete(Path file) {
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            // Windows keeps the file locked while a descendant still has it open
            log.debug("Could not delete sidecar output {}: {}", file, e.getMessage());
        }
    }

    private static String sanitize(String tenantId) {
        return tenantId == null ? "unknown" : tenantId.replaceAll("[^A-Za-z0-9_-]", "_");
    }
}
