package com.example.sandstormtracker.a2s;

public class A2STimeoutException extends A2SException {

    public A2STimeoutException(String message, Throwable cause) {
        super(message, cause);
    }
}
