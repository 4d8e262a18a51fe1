package com.docweaver.dispatch.cli;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.context.WebServerInitializedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: docweaver serve
 * <p>
 * Starts Docweaver as a long-running HTTP server exposing the REST API and SSE event
 * streaming. {@link com.docweaver.DocweaverApplication#main} starts the web server instead
 * of running picocli when {@link DocweaverCli#isServeMode} holds, so {@link #run()} is only
 * reached for help. The startup banner is printed once the embedded server is ready.
 * <p>
 * Configure port via: {@code SERVER_PORT=9090 docweaver serve}
 */
@Command(name = "serve", mixinStandardHelpOptions = true,
        description = "Start the Docweaver HTTP server")
@Component
public class ServeCommand implements Runnable {

    @Value("${server.port:8080}")
    private int port;

    @Override
    public void run() {
        // Only reached via --help style invocations; serve mode bypasses picocli.
        printBanner(port);
    }

    @EventListener
    public void onWebServerReady(WebServerInitializedEvent event) {
        printBanner(event.getWebServer().getPort());
    }

    private static void printBanner(int port) {
        ConsoleOutput.printBanner();
        ConsoleOutput.info("Docweaver server running on port " + port);
        System.out.println();
        System.out.println("  API:     http://localhost:" + port + "/api/v1/documents");
        System.out.println("  Health:  http://localhost:" + port + "/api/v1/health");
        System.out.println();
        ConsoleOutput.info("Press Ctrl+C to stop.");
    }
}
