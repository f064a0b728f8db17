package com.planningpoker.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Periodic task deleting sessions that stayed empty longer than the registry's eviction window.
 * Runs on the coordinator thread, like every other registry call.
 */
public class SessionSweeper implements Runnable {
    private static final Logger log = LoggerFactory.getLogger(SessionSweeper.class);

    private final SessionRegistry registry;
    private final Clock clock;

    public SessionSweeper(SessionRegistry registry, Clock clock) {
        this.registry = registry;
        this.clock = clock;
    }

    @Override
    public void run() {
        int evicted = sweep();
        if (evicted > 0) {
            log.debug("Sweep evicted {} sessions", evicted);
        }
    }

    /**
     * @return the number of sessions evicted
     */
    public int sweep() {
        Instant cutoff = clock.instant().minus(registry.evictionWindow());
        List<String> expired = registry.pendingEvictions().entrySet().stream()
                .filter(e -> e.getValue().isBefore(cutoff))
                .map(Map.Entry::getKey)
                .collect(Collectors.toList());
        expired.forEach(registry::evict);
        return expired.size();
    }
}
