package io.jobcast4j.core.event;

import java.time.Instant;

public record JobStarted(String id, Instant time) implements RunningStateChange {

    @Override
    public boolean running() {
        return true;
    }
}
