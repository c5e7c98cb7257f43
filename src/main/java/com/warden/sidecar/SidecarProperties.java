package com.warden.sidecar;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

@Component
@ConfigurationProperties(prefix = "warden.sidecar")
public class SidecarProperties {

    static final String DEFAULT_VERSION = "==0.1.0.8.10";

    private static final Pattern OPERATOR = Pattern.compile("===|==|!=|<=|>=|~=|<|>");
    private static final Pattern BARE_VERSION = Pattern.compile("\\d+(\\.\\d+)*");

    private boolean enabled = true;
    private List<String> command = new ArrayList<>(List.of("uvx"));
    private String packageName = "mcp-composer";
    private String version = DEFAULT_VERSION;
    private List<String> extraArgs = new ArrayList<>(List.of("--disable-composer-tools"));
    private String signature = "";
    private String platform = "auto";

    private int maxRetries = 3;
    private int maxStartupChecks = 40;
    private Duration startupDelay = Duration.ofSeconds(2);
    private Duration retryCooldown = Duration.ofSeconds(2);
    private Duration terminateGrace = Duration.ofSeconds(2);
    private Duration portReleaseWait = Duration.ofSeconds(2);
    private Duration zombieReleaseWait = Duration.ofSeconds(3);
    private Duration commandTimeout = Duration.ofSeconds(5);
    private Duration staleKillTimeout = Duration.ofSeconds(5);
    private Duration outputReadTimeout = Duration.ofSeconds(2);

    /**
     * Program and leading arguments that launch a sidecar, e.g.
     * {@code [uvx, mcp-composer~=0.1.0.8.10]}. When no package name is configured the
     * command is used as is.
     */
    public List<String> launchPrefix() {
        List<String> prefix = new ArrayList<>(command);
        if (packageName != null && !packageName.isBlank()) {
            prefix.add(packageName + normalizedVersion());
        }
        return prefix;
    }

    /**
     * Version constraint appended to the package name. A bare version such as
     * {@code 0.1.0} becomes {@code ~=0.1.0}; a value that starts with an operator, or
     * that is not recognizably a version, is kept; blank falls back to the default pin.
     */
    public String normalizedVersion() {
        String v = version == null ? "" : version.strip();
        if (v.isEmpty()) {
            return DEFAULT_VERSION;
        }
        if (OPERATOR.matcher(v).lookingAt()) {
            return v;
        }
        return BARE_VERSION.matcher(v).lookingAt() ? "~=" + v : v;
    }

    /** Command-line fragment identifying our sidecars in a process listing. */
    public String effectiveSignature() {
        if (signature != null && !signature.isBlank()) {
            return signature;
        }
        return packageName == null ? "" : packageName;
    }

    public boolean isEnabled() { return enabled; }
    public void setEnabled(boolean enabled) { this.enabled = enabled; }
    public List<String> getCommand() { return command; }
    public void setCommand(List<String> command) { this.command = command; }
    public String getPackageName() { return packageName; }
    public void setPackageName(String packageName) { this.packageName = packageName; }
    public String getVersion() { return version; }
    public void setVersion(String version) { this.version = version; }
    public List<String> getExtraArgs() { return extraArgs; }
    public void setExtraArgs(List<String> extraArgs) { this.extraArgs = extraArgs; }
    public String getSignature() { return signature; }
    public void setSignature(String signature) { this.signature = signature; }
    public String getPlatform() { return platform; }
    public void setPlatform(String platform) { this.platform = platform; }
    public int getMaxRetries() { return maxRetries; }
    public void setMaxRetries(int maxRetries) { this.maxRetries = maxRetries; }
    public int getMaxStartupChecks() { return maxStartupChecks; }
    public void setMaxStartupChecks(int maxStartupChecks) { this.maxStartupChecks = maxStartupChecks; }
    public Duration getStartupDelay() { return startupDelay; }
    public void setStartupDelay(Duration startupDelay) { this.startupDelay = startupDelay; }
    public Duration getRetryCooldown() { return retryCooldown; }
    public void setRetryCooldown(Duration retryCooldown) { this.retryCooldown = retryCooldown; }
    public Duration getTerminateGrace() { return terminateGrace; }
    public void setTerminateGrace(Duration terminateGrace) { this.terminateGrace = terminateGrace; }
    public Duration getPortReleaseWait() { return portReleaseWait; }
    public void setPortReleaseWait(Duration portReleaseWait) { this.portReleaseWait = portReleaseWait; }
    public Duration getZombieReleaseWait() { return zombieReleaseWait; }
    public void setZombieReleaseWait(Duration zombieReleaseWait) { this.zombieReleaseWait = zombieReleaseWait; }
    public Duration getCommandTimeout() { return commandTimeout; }
    public void setCommandTimeout(Duration commandTimeout) { this.commandTimeout = commandTimeout; }
    public Duration getStaleKillTimeout() { return staleKillTimeout; }
    public void setStaleKillTimeout(Duration staleKillTimeout) { this.staleKillTimeout = staleKillTimeout; }
    public Duration getOutputReadTimeout() { return outputReadTimeout; }
    public void setOutputReadTimeout(Duration outputReadTimeout) { this.outputReadTimeout = outputReadTimeout; }
}
