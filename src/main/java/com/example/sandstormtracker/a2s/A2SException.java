package com.example.sandstormtracker.a2s;

/**
 * A server query attempt failed. Attempts failing this way are retried.
 */
public class A2SException extends Exception {

    public A2SException(String message) {
        super(message);
    }

    public A2SException(String message, Throwable cause) {
        super(message, cause);
    }
}
