package com.warden.sidecar.platform;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Linux and macOS: {@code lsof} maps ports to PIDs, {@link ProcessHandle} signals them.
 */
public class UnixProcessKiller extends AbstractProcessKiller {

    private static final Logger log = LoggerFactory.getLogger(UnixProcessKiller.class);

    public UnixProcessKiller(SystemCommandRunner runner, String signature) {
        super(runner, signature);
    }

    @Override
    public List<Long> listPidsOnPort(int port) {
        var result = runner.run(List.of("lsof", "-nP", "-t", "-iTCP:" + port, "-sTCP:LISTEN"));
        // lsof exits 1 when nothing matches
        if (result.timedOut() || (result.exitCode() != 0 && result.exitCode() != 1)) {
            log.debug("lsof failed for port {} (exit {}): {}", port, result.exitCode(), result.stderr().strip());
            return List.of();
        }
        return parseLsof(result.stdout());
    }

    static List<Long> parseLsof(String output) {
        List<Long> pids = new ArrayList<>();
        for (String line : output.split("\\R")) {
            Long pid = parsePid(line);
            if (pid != null && !pids.contains(pid)) {
                pids.add(pid);
            }
        }
        return pids;
    }

    @Override
    public boolean terminate(long pid) {
        return ProcessHandle.of(pid).map(ProcessHandle::destroy).orElse(false);
    }

    @Override
    public boolean forceKill(long pid) {
        return ProcessHandle.of(pid).map(ProcessHandle::destroyForcibly).orElse(false);
    }

    @Override
    protected boolean matchesSignature(long pid, Set<Long> signed) {
        return commandLineOf(pid).map(cmd -> cmd.contains(signature)).orElse(false);
    }

    private Optional<String> commandLineOf(long pid) {
        Optional<String> fromHandle = ProcessHandle.of(pid).flatMap(h -> h.info().commandLine());
        if (fromHandle.isPresent()) {
            return fromHandle;
        }
        // macOS hides other users' arguments from ProcessHandle; ps still shows them
        var result = runner.run(List.of("ps", "-p", String.valueOf(pid), "-o", "command="));
        if (!result.succeeded() || result.stdout().isBlank()) {
            return Optional.empty();
        }
        return Optional.of(result.stdout().strip());
    }

    @Override
    public String platformName() {
        return "unix";
    }
}
