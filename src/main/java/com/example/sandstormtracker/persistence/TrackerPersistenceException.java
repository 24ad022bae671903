package com.example.sandstormtracker.persistence;

/**
 * A cursor or checkpoint could not be written or read back.
 */
public class TrackerPersistenceException extends RuntimeException {

    public TrackerPersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
