package com.example.sandstormtracker.a2s;

/**
 * A response packet could not be decoded.
 */
public class A2SMalformedResponseException extends A2SException {

    public A2SMalformedResponseException(String message) {
        super(message);
    }

    public A2SMalformedResponseException(String message, Throwable cause) {
        super(message, cause);
    }
}
