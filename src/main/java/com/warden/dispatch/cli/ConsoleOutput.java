package com.warden.dispatch.cli;

import com.warden.core.model.SidecarStatus;
import picocli.CommandLine;

/**
 * ANSI-colored terminal output utilities for the Warden CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) WARDEN v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [WARDEN]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void sidecar(SidecarStatus status) {
        String state = status.running() ? "@|fg(green) RUNNING|@" : "@|fg(red) DOWN|@";
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  @|fg(magenta) [SIDECAR]|@ " + state + " " + status.tenantId()
                + (status.port() != null ? " on " + status.host() + ":" + status.port() : "")
                + (status.pid() != null ? " (PID " + status.pid() + ")" : "")));
        if (status.primaryUrl() != null) {
            System.out.println("    endpoint: " + status.primaryUrl());
            System.out.println("    sse:      " + status.legacyUrl());
        }
        if (status.lastError() != null) {
            System.out.println(CommandLine.Help.Ansi.AUTO.string(
                    "    @|fg(red) last error:|@ " + status.lastError()));
        }
    }
}
