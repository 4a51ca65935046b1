package io.jobcast4j.internal.hub;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.jobcast4j.core.event.JobFinishedError;
import io.jobcast4j.core.event.RunningStateChange;
import io.jobcast4j.core.event.StatusEvent;
import io.jobcast4j.core.event.StatusRecord;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * JSON glue between status events and the viewer wire format.
 */
public class StatusCodec {
    private final ObjectMapper objectMapper;

    public StatusCodec(ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
    }

    /**
     * Payload stored for an event: {@code {"running":true|false}} for output events, the error text for
     * error events.
     */
    public String payload(StatusEvent event) throws JsonProcessingException {
        if (event instanceof RunningStateChange change) {
            return objectMapper.writeValueAsString(Map.of("running", change.running()));
        }
        if (event instanceof JobFinishedError error) {
            return error.message() == null ? "" : error.message();
        }
        throw new IllegalArgumentException("Unsupported status event: " + event.getClass().getName());
    }

    /**
     * Serialize records as {@code [{"id":..,"out":..,"err":..}, ...]}.
     */
    public String encode(List<StatusRecord> records) throws JsonProcessingException {
        return objectMapper.writeValueAsString(records);
    }
}
