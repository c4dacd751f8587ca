package com.powerguard.dispatch.cli;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.context.WebServerInitializedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: powerguard serve
 * <p>
 * Starts the HTTP API used by the recommendation service and the permission flow.
 * The web server is enabled by {@link com.powerguard.PowerGuardApplication#main}
 * detecting "serve" in args; {@link CliRunner} then skips picocli so the embedded
 * server keeps the JVM alive. The banner is printed once Tomcat is ready.
 */
@Command(name = "serve", mixinStandardHelpOptions = true,
        description = "Start the PowerGuard HTTP server")
@Component
public class ServeCommand implements Runnable {

    @Value("${server.port:8080}")
    private int port;

    @Override
    public void run() {
        // Only reached through --help style invocations; CliRunner skips picocli for serve
        printBanner(port);
    }

    @EventListener
    public void onWebServerReady(WebServerInitializedEvent event) {
        printBanner(event.getWebServer().getPort());
    }

    private static void printBanner(int port) {
        ConsoleOutput.printBanner();
        ConsoleOutput.info("PowerGuard server running on port " + port);
        System.out.println();
        System.out.println("  Batches:       POST http://localhost:" + port + "/api/v1/batches");
        System.out.println("  History:       GET  http://localhost:" + port + "/api/v1/history");
        System.out.println("  Capabilities:  GET  http://localhost:" + port + "/api/v1/capabilities");
        System.out.println();
        ConsoleOutput.info("Press Ctrl+C to stop.");
    }
}
