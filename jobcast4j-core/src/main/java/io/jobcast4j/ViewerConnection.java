package io.jobcast4j;

import java.io.IOException;

/**
 * A live connection to one status viewer.
 */
public interface ViewerConnection {

    /**
     * Stable connection identity, used to match liveness signals to the connection.
     */
    String id();

    String remoteAddress();

    void send(String payload) throws IOException;

    /**
     * Close the connection. Safe to call more than once.
     */
    void close();
}
