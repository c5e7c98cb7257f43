package com.warden.sidecar;

import org.springframework.stereotype.Component;

import java.util.List;
import java.util.function.Function;
import java.util.regex.Pattern;

/**
 * Maps raw sidecar output to a short user-facing message.
 *
 * <p>Patterns are tried in order against stderr followed by stdout; the first hit wins.
 * Output that matches nothing, including empty output, yields {@link #GENERIC_STARTUP_ERROR}.
 */
@Component
public class ErrorClassifier {

    public static final String GENERIC_STARTUP_ERROR =
            "Sidecar startup failed. Check OAuth configuration and check logs for more information.";

    private static final String DEFAULT_ADDRESS = "OAuth server URL";

    private record Rule(Pattern pattern, Function<String, String> message) {}

    private static final List<Rule> RULES = List.of(
            rule("address already in use",
                    address -> "Address " + address + " is already in use."),
            rule("permission denied",
                    address -> "Permission denied starting sidecar on address " + address + "."),
            rule("connection refused",
                    address -> "Connection refused on address " + address
                            + ". The address may be blocked or unavailable."),
            rule("bind.*failed",
                    address -> "Failed to bind to address " + address
                            + ". The address may be in use or unavailable."),
            rule("timeout",
                    address -> "Sidecar startup timed out. Please try again."),
            rule("invalid.*configuration",
                    address -> "Invalid sidecar configuration. Please check your settings."),
            rule("oauth.*error",
                    address -> "OAuth configuration error. Please check your OAuth settings."),
            rule("authentication.*failed",
                    address -> "Authentication failed. Please check your credentials.")
    );

    public String classify(String stdout, String stderr) {
        return classify(stdout, stderr, null);
    }

    /**
     * @param stdout    captured standard output, may be null
     * @param stderr    captured standard error, may be null
     * @param serverUrl address named in address-related messages; a placeholder is used when blank
     * @return the first matching friendly message, or the generic startup message
     */
    public String classify(String stdout, String stderr, String serverUrl) {
        String combined = ((stderr == null ? "" : stderr) + "\n" + (stdout == null ? "" : stdout)).strip();
        if (combined.isEmpty()) {
            return GENERIC_STARTUP_ERROR;
        }
        String address = serverUrl == null || serverUrl.isBlank() ? DEFAULT_ADDRESS : serverUrl;
        for (Rule rule : RULES) {
            if (rule.pattern().matcher(combined).find()) {
                return rule.message().apply(address);
            }
        }
        return GENERIC_STARTUP_ERROR;
    }

    private static Rule rule(String regex, Function<String, String> message) {
        return new Rule(Pattern.compile(regex, Pattern.CASE_INSENSITIVE), message);
    }
}
