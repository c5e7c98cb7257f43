package com.warden.dispatch.cli;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.web.context.WebServerApplicationContext;
import org.springframework.context.ApplicationContext;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.IFactory;

/**
 * Runs the picocli command for CLI invocations. When the context started an embedded
 * web server the application is serving, and the server rather than picocli keeps
 * the JVM alive.
 */
@Component
public class CliRunner implements CommandLineRunner, ExitCodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(CliRunner.class);

    private final WardenCommand wardenCommand;
    private final IFactory factory;
    private final ApplicationContext context;
    private int exitCode;

    public CliRunner(WardenCommand wardenCommand, IFactory factory, ApplicationContext context) {
        this.wardenCommand = wardenCommand;
        this.factory = factory;
        this.context = context;
    }

    @Override
    public void run(String... args) {
        if (context instanceof WebServerApplicationContext web) {
            log.debug("Serving on port {}, not running a CLI command", web.getWebServer().getPort());
            return;
        }
        exitCode = new CommandLine(wardenCommand, factory).execute(args);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
