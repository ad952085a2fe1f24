package com.flagship.client_ledger.observability;

import org.slf4j.MDC;

import java.util.UUID;

/**
 * MDC context for a replay run.
 *
 * Every log statement issued while a replay is in progress carries the
 * replay id, so warnings about rejected records can be traced back to the run
 * (and input) that produced them.
 */
public final class ReplayContext {

    public static final String REPLAY_ID_MDC_KEY = "replayId";
    public static final String SOURCE_MDC_KEY = "source";

    private ReplayContext() {
        // Utility class
    }

    /**
     * Starts a new replay context on the current thread and returns its id.
     */
    public static String start(String sourceName) {
        String id = generateReplayId();
        MDC.put(REPLAY_ID_MDC_KEY, id);
        if (sourceName != null) {
            MDC.put(SOURCE_MDC_KEY, sourceName);
        }
        return id;
    }

    /**
     * Gets the current replay id, or null outside of a replay.
     */
    public static String currentReplayId() {
        return MDC.get(REPLAY_ID_MDC_KEY);
    }

    /**
     * Clears the replay context from the current thread.
     * Should be called when the replay finishes, successfully or not.
     */
    public static void clear() {
        MDC.remove(REPLAY_ID_MDC_KEY);
        MDC.remove(SOURCE_MDC_KEY);
    }

    /**
     * Generates a new replay id.
     * Uses a shorter format for readability in logs.
     */
    public static String generateReplayId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }
}
