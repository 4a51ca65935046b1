package io.jobcast4j.internal.hub;

import io.jobcast4j.ViewerConnection;

import java.time.Instant;

/**
 * Hub-side record of a connected viewer. Only touched by the hub thread.
 */
final class Client {
    private final ViewerConnection connection;
    private Instant lastSeen;

    Client(ViewerConnection connection, Instant lastSeen) {
        this.connection = connection;
        this.lastSeen = lastSeen;
    }

    ViewerConnection connection() {
        return connection;
    }

    Instant lastSeen() {
        return lastSeen;
    }

    void touch(Instant at) {
        this.lastSeen = at;
    }
}
