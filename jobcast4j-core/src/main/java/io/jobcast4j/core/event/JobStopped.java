package io.jobcast4j.core.event;

import java.time.Instant;

/**
 * Emitted when a running job is stopped manually, ahead of the run actually ending.
 */
public record JobStopped(String id, Instant time) implements RunningStateChange {

    @Override
    public boolean running() {
        return false;
    }
}
