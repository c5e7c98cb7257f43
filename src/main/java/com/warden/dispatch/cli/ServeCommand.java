package com.warden.dispatch.cli;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.context.WebServerInitializedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: warden serve
 * <p>
 * Starts Warden as a long-running HTTP server exposing the sidecar REST API and
 * actuator endpoints. The web server is enabled by
 * {@link com.warden.WardenApplication#main} detecting "serve" in args, and
 * {@link CliRunner} skips picocli once the web server is up. The banner is printed
 * once Tomcat is ready.
 * <p>
 * Configure port via: {@code SERVER_PORT=9090 warden serve}
 */
@Command(name = "serve", mixinStandardHelpOptions = true,
        description = "Start the Warden HTTP server")
@Component
public class ServeCommand implements Runnable {

    @Value("${server.port:8080}")
    private int port;

    @Override
    public void run() {
        // Only reached through picocli, e.g. for --help; serve mode bypasses it.
        printBanner(port);
    }

    @EventListener
    public void onWebServerReady(WebServerInitializedEvent event) {
        printBanner(event.getWebServer().getPort());
    }

    private static void printBanner(int port) {
        ConsoleOutput.printBanner();
        ConsoleOutput.info("Warden server running on port " + port);
        System.out.println();
        System.out.println("  Sidecars:  http://localhost:" + port + "/api/v1/sidecars");
        System.out.println("  Health:    http://localhost:" + port + "/actuator/health");
        System.out.println();
        ConsoleOutput.info("Press Ctrl+C to stop. Running sidecars are stopped on exit.");
    }
}
