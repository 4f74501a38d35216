package com.netctl.fib.model;

/**
 * An internal consistency check failed. This is a logic bug, not an
 * environmental condition: it is never retried and takes the pipeline down.
 */
public class FibInvariantException extends IllegalStateException {

    public FibInvariantException(String message) {
        super(message);
    }
}
