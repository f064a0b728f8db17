package com.planningpoker.server;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;

/**
 * Listen address, static asset directory and timing settings of the server.
 *
 * Read from the environment:
 * <ul>
 *   <li>{@code LISTEN_ON} - defaults to 127.0.0.1 (use 0.0.0.0 inside Docker)</li>
 *   <li>{@code PORT} - defaults to 8080, also used when the value does not parse</li>
 *   <li>{@code STATIC_DIR} - defaults to {@code public}</li>
 * </ul>
 */
public class ServerConfig {
    private static final Logger log = LoggerFactory.getLogger(ServerConfig.class);

    public static final String DEFAULT_INTERFACE = "127.0.0.1";
    public static final int DEFAULT_PORT = 8080;
    public static final String DEFAULT_STATIC_DIR = "public";

    public static final Duration HEARTBEAT_INTERVAL = Duration.ofSeconds(5);
    public static final Duration CLIENT_TIMEOUT = Duration.ofSeconds(10);
    public static final Duration SWEEP_INTERVAL = Duration.ofSeconds(5);
    public static final Duration EVICTION_WINDOW = Duration.ofSeconds(20);

    public final String listenInterface;
    public final int port;
    public final Path staticDir;
    public final Duration heartbeatInterval;
    public final Duration clientTimeout;
    public final Duration sweepInterval;
    public final Duration evictionWindow;

    public ServerConfig(String listenInterface, int port, Path staticDir,
                        Duration heartbeatInterval, Duration clientTimeout,
                        Duration sweepInterval, Duration evictionWindow) {
        this.listenInterface = listenInterface;
        this.port = port;
        this.staticDir = staticDir;
        this.heartbeatInterval = heartbeatInterval;
        this.clientTimeout = clientTimeout;
        this.sweepInterval = sweepInterval;
        this.evictionWindow = evictionWindow;
    }

    public static ServerConfig fromEnvironment() {
        return fromEnvironment(System.getenv());
    }

    public static ServerConfig fromEnvironment(Map<String, String> env) {
        return new ServerConfig(listenInterface(env), listenPort(env), staticDir(env),
                HEARTBEAT_INTERVAL, CLIENT_TIMEOUT, SWEEP_INTERVAL, EVICTION_WINDOW);
    }

    private static String listenInterface(Map<String, String> env) {
        String value = env.get("LISTEN_ON");
        if (value == null || value.isBlank()) {
            log.warn("No $LISTEN_ON set, falling back to {}", DEFAULT_INTERFACE);
            return DEFAULT_INTERFACE;
        }
        return value.trim();
    }

    private static int listenPort(Map<String, String> env) {
        String value = env.get("PORT");
        if (value == null) {
            log.warn("No $PORT environment variable set; falling back to {}", DEFAULT_PORT);
            return DEFAULT_PORT;
        }
        try {
            int port = Integer.parseInt(value.trim());
            if (port < 0 || port > 65535) {
                throw new NumberFormatException("out of range");
            }
            return port;
        } catch (NumberFormatException e) {
            log.error("Failed to parse port {}; falling back to {}", value, DEFAULT_PORT);
            return DEFAULT_PORT;
        }
    }

    private static Path staticDir(Map<String, String> env) {
        String value = env.get("STATIC_DIR");
        return Path.of(value == null || value.isBlank() ? DEFAULT_STATIC_DIR : value.trim());
    }

    @Override
    public String toString() {
        return listenInterface + ":" + port + " (static files from " + staticDir + ")";
    }
}
