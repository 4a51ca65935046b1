package io.jobcast4j.core.event;

import java.time.Instant;

/**
 * Emitted after every run, successful or not; a failure additionally emits {@link JobFinishedError}.
 */
public record JobFinishedOk(String id, Instant time) implements RunningStateChange {

    @Override
    public boolean running() {
        return false;
    }
}
