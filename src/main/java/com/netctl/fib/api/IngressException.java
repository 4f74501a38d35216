package com.netctl.fib.api;

/**
 * The ingress subscription could not be established.
 */
public class IngressException extends Exception {

    public IngressException(String message) {
        super(message);
    }

    public IngressException(String message, Throwable cause) {
        super(message, cause);
    }
}
