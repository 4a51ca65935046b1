package io.jobcast4j.core.event;

import java.time.Instant;

public record JobFinishedError(String id, String message, Instant time) implements StatusEvent {

    @Override
    public StatusChannel channel() {
        return StatusChannel.ERROR;
    }
}
