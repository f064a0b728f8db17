package com.planningpoker;

import com.planningpoker.server.PokerWebServer;
import com.planningpoker.server.ServerConfig;
import com.planningpoker.service.SessionCoordinator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Application entry point.
 * - Reads configuration from the environment.
 * - Starts the session coordinator and the web server.
 * - Stops both on shutdown.
 */
public class Main {
    private static final Logger log = LoggerFactory.getLogger(Main.class);

    public static void main(String[] args) throws Exception {
        log.info("Planning poker server starting...");

        ServerConfig config = ServerConfig.fromEnvironment();

        // === Coordinator owns all session state ===
        SessionCoordinator coordinator = SessionCoordinator.create(config.evictionWindow, config.sweepInterval);
        coordinator.start();

        // === Web server ===
        PokerWebServer webServer = new PokerWebServer(config, coordinator);
        try {
            webServer.start();
        } catch (Exception e) {
            log.error("Could not start web server on {}", config, e);
            coordinator.shutdown();
            System.exit(1);
        }

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutting down...");
            webServer.stop();
            coordinator.shutdown();
            log.info("Shutdown complete.");
        }, "shutdown"));

        log.info("Planning poker server started on {}", config);
        webServer.awaitTermination();
    }
}
