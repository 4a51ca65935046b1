package io.jobcast4j.core.event;

/**
 * The two independent status streams. Not a priority ordering.
 */
public enum StatusChannel {
    OUTPUT,
    ERROR
}
