package com.opsdiag.signal;

/**
 * A signal rejected at ingestion: missing fields, unrecognized kind, or a timestamp
 * too far in the future.
 */
public class InvalidSignalException extends RuntimeException {

    public InvalidSignalException(String message) {
        super(message);
    }

    public InvalidSignalException(String message, Throwable cause) {
        super(message, cause);
    }
}
