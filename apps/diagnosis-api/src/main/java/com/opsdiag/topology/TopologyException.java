package com.opsdiag.topology;

/**
 * A topology document that cannot be turned into a snapshot.
 */
public class TopologyException extends RuntimeException {

    public TopologyException(String message) {
        super(message);
    }

    public TopologyException(String message, Throwable cause) {
        super(message, cause);
    }
}
