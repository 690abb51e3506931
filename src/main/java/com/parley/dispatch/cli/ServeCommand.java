package com.parley.dispatch.cli;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.context.WebServerInitializedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: parley serve
 * <p>
 * Runs the orchestrator with the event API. {@link com.parley.ParleyApplication#main}
 * enables the web server and orchestrator auto-start when it sees "serve"; {@link CliRunner}
 * then skips picocli, so {@link #run()} only executes for {@code --help} style invocations.
 */
@Command(name = "serve", mixinStandardHelpOptions = true,
        description = "Start the orchestrator and the HTTP event API")
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
        ConsoleOutput.info("Parley running on port " + port);
        System.out.println();
        System.out.println("  Events:  POST http://localhost:" + port + "/api/v1/events");
        System.out.println("  Health:  http://localhost:" + port + "/api/v1/health");
        System.out.println();
        ConsoleOutput.info("Press Ctrl+C to stop.");
    }
}
