package com.netctl.fib.io;

/**
 * The configuration is unreadable or inconsistent.
 */
public class FibConfigException extends RuntimeException {

    public FibConfigException(String message) {
        super(message);
    }

    public FibConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
