package com.warden.sidecar.platform;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Windows: {@code netstat -ano} maps ports to PIDs, {@code taskkill} signals them and a
 * PowerShell CIM query finds sidecars by command line.
 *
 * <p>A PID reported by netstat only counts as a sidecar when the CIM query also returned
 * it, since netstat carries no command line.
 */
public class WindowsProcessKiller extends AbstractProcessKiller {

    private static final Logger log = LoggerFactory.getLogger(WindowsProcessKiller.class);

    private final ObjectMapper objectMapper;
    private final String systemRoot;

    public WindowsProcessKiller(SystemCommandRunner runner, String signature, ObjectMapper objectMapper) {
        this(runner, signature, objectMapper, System.getenv().getOrDefault("SYSTEMROOT", "C:\\Windows"));
    }

    WindowsProcessKiller(SystemCommandRunner runner, String signature, ObjectMapper objectMapper,
                         String systemRoot) {
        super(runner, signature);
        this.objectMapper = objectMapper;
        this.systemRoot = systemRoot;
    }

    @Override
    public List<Long> listPidsOnPort(int port) {
        var result = runner.run(List.of(system32("netstat.exe"), "-ano"));
        if (!result.succeeded()) {
            log.debug("netstat failed (exit {}): {}", result.exitCode(), result.stderr().strip());
            return List.of();
        }
        return parseNetstat(result.stdout(), port);
    }

    /**
     * Extracts listening PIDs for {@code port} from {@code netstat -ano} output. The local
     * address must end in exactly {@code :port}, so port 80 does not match 8080 or 8000.
     */
    static List<Long> parseNetstat(String output, int port) {
        String suffix = ":" + port;
        List<Long> pids = new ArrayList<>();
        for (String line : output.split("\\R")) {
            String[] parts = line.strip().split("\\s+");
            if (parts.length < 5 || !parts[0].equalsIgnoreCase("TCP")) {
                continue;
            }
            if (!parts[1].endsWith(suffix) || !parts[3].equalsIgnoreCase("LISTENING")) {
                continue;
            }
            Long pid = parsePid(parts[parts.length - 1]);
            if (pid != null && !pids.contains(pid)) {
                pids.add(pid);
            }
        }
        return pids;
    }

    @Override
    public boolean terminate(long pid) {
        return runner.run(List.of(system32("taskkill.exe"), "/PID", String.valueOf(pid))).succeeded();
    }

    @Override
    public boolean forceKill(long pid) {
        var result = runner.run(List.of(system32("taskkill.exe"), "/F", "/PID", String.valueOf(pid)));
        if (!result.succeeded()) {
            log.debug("taskkill returned {} for process {}: {}", result.exitCode(), pid, result.stderr().strip());
        }
        return result.succeeded();
    }

    @Override
    protected boolean matchesSignature(long pid, Set<Long> signed) {
        return signed.contains(pid);
    }

    @Override
    protected List<Long> findBySignature(int port) {
        String filter = "$_.CommandLine -like '*" + escapePowerShell(signature) + "*' -and "
                + "($_.CommandLine -like '*--port " + port + "*' -or $_.CommandLine -like '*--port=" + port + "*')";
        String script = "Get-CimInstance Win32_Process | Where-Object { " + filter + " } | "
                + "Select-Object ProcessId,CommandLine | ConvertTo-Json";
        var result = runner.run(List.of("powershell.exe", "-NoProfile", "-Command", script));
        if (!result.succeeded() || result.stdout().isBlank()) {
            if (result.timedOut()) {
                log.debug("PowerShell timed out while looking for orphaned sidecars");
            }
            return List.of();
        }
        return parseCimProcesses(result.stdout(), port);
    }

    /**
     * Parses the {@code ConvertTo-Json} output of the CIM query, which is a single object
     * for one match and an array for several. The {@code --port} wildcard is re-checked
     * exactly because {@code *--port 80*} also matches {@code --port 8080}.
     */
    List<Long> parseCimProcesses(String json, int port) {
        Pattern exactPort = Pattern.compile("--port[ =]" + port + "(?!\\d)");
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            log.debug("Failed to parse PowerShell output: {}", e.getOriginalMessage());
            return List.of();
        }

        List<JsonNode> nodes = new ArrayList<>();
        if (root.isArray()) {
            root.forEach(nodes::add);
        } else if (root.isObject()) {
            nodes.add(root);
        }

        List<Long> pids = new ArrayList<>();
        for (JsonNode node : nodes) {
            long pid = node.path("ProcessId").asLong(0);
            String commandLine = node.path("CommandLine").asText("");
            if (pid > 0 && exactPort.matcher(commandLine).find() && !pids.contains(pid)) {
                pids.add(pid);
            }
        }
        return pids;
    }

    private String system32(String executable) {
        return systemRoot + "\\System32\\" + executable;
    }

    private static String escapePowerShell(String value) {
        return value.replace("'", "''");
    }

    @Override
    public String platformName() {
        return "windows";
    }
}
