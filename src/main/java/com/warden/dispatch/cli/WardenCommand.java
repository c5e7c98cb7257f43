package com.warden.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command for Warden.
 * Routes to subcommands: serve, run, health.
 */
@Command(
        name = "warden",
        mixinStandardHelpOptions = true,
        version = "Warden 0.1.0",
        description = "Per-tenant sidecar process supervisor",
        subcommands = {
                ServeCommand.class,
                RunCommand.class,
                HealthCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class WardenCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        new CommandLine(this).usage(System.out);
    }
}
