package com.warden.sidecar.platform;

import java.time.Duration;
import java.util.List;

/**
 * Collects a sidecar's stdout and stderr for diagnostics while it starts up.
 *
 * <p>Lifecycle: {@link #redirect} before the process starts, {@link #attach} right after,
 * {@link #drainAvailable} while polling, then either {@link #collect} on failure or
 * {@link #detach} once the sidecar is up. {@link #close} releases whatever is left.
 */
public interface OutputCapture extends AutoCloseable {

    record CapturedOutput(String stdout, String stderr) {

        public static final CapturedOutput EMPTY = new CapturedOutput("", "");
    }

    void redirect(ProcessBuilder builder);

    void attach(Process process);

    /**
     * Reads whatever output is available without blocking and logs complete lines.
     *
     * @return the lines read by this call; always empty where the platform cannot read without blocking
     */
    List<String> drainAvailable();

    /**
     * Returns everything the process wrote so far, waiting at most {@code timeout} for
     * the streams to reach end of file.
     */
    CapturedOutput collect(Duration timeout);

    /** Keeps the streams drained for the rest of the process lifetime, without buffering. */
    void detach();

    @Override
    void close();
}
