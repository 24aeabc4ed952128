package com.backstop.dispatch.cli;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.context.WebServerInitializedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: backstop serve
 * <p>
 * Starts Backstop as an HTTP service a host UI process reports failures to. The web
 * server is enabled by {@link com.backstop.BackstopApplication#main} detecting "serve"
 * in the arguments; {@link CliRunner} then skips picocli. The banner is printed once the
 * web server is ready.
 */
@Command(name = "serve", mixinStandardHelpOptions = true,
        description = "Start the Backstop HTTP service")
@Component
public class ServeCommand implements Runnable {

    @Value("${server.port:8080}")
    private int port;

    @Override
    public void run() {
        printBanner(port);
    }

    @EventListener
    public void onWebServerReady(WebServerInitializedEvent event) {
        printBanner(event.getWebServer().getPort());
    }

    private static void printBanner(int port) {
        ConsoleOutput.printBanner();
        ConsoleOutput.info("Backstop service running on port " + port);
        System.out.println();
        System.out.println("  API:     http://localhost:" + port + "/api/v1");
        System.out.println("  Health:  http://localhost:" + port + "/api/v1/health");
        System.out.println();
        ConsoleOutput.info("Press Ctrl+C to stop.");
    }
}
