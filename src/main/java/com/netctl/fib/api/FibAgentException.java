package com.netctl.fib.api;

/**
 * A forwarding agent call failed: transport error, timeout, or the agent
 * rejected the request. Always considered transient and retried.
 */
public class FibAgentException extends Exception {

    public FibAgentException(String message) {
        super(message);
    }

    public FibAgentException(String message, Throwable cause) {
        super(message, cause);
    }
}
