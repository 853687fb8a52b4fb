package com.vulnconsole.dispatch.cli;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.context.WebServerInitializedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: vulnconsole serve
 * <p>
 * Starts the HTTP API. The web server is enabled by
 * {@link com.vulnconsole.VulnConsoleApplication#main} detecting "serve" in args;
 * {@link CliRunner} then skips picocli and the banner is printed once the
 * server is listening.
 */
@Command(name = "serve", mixinStandardHelpOptions = true,
        description = "Start the vulnconsole HTTP API")
@Component
public class ServeCommand implements Runnable {

    @Value("${server.port:8080}")
    private int port;

    @Override
    public void run() {
        // Only reached through --help style invocations; serve mode bypasses picocli
        printBanner(port);
    }

    @EventListener
    public void onWebServerReady(WebServerInitializedEvent event) {
        printBanner(event.getWebServer().getPort());
    }

    private static void printBanner(int port) {
        ConsoleOutput.printBanner();
        ConsoleOutput.info("API listening on http://localhost:" + port + "/api/v1");
        ConsoleOutput.info("Press Ctrl+C to stop.");
    }
}
