package io.jobcast4j.core.event;

/**
 * One entry of the outbound viewer payload: {@code {"id": ..., "out": ..., "err": ...}}.
 */
public record StatusRecord(String id, String out, String err) {
}
