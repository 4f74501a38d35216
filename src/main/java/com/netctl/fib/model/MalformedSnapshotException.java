package com.netctl.fib.model;

/**
 * Raised when an incoming route snapshot (or one of its parts) is structurally
 * invalid. Ingestion catches it, logs it and drops the whole snapshot; nothing
 * downstream ever sees a partially valid snapshot.
 */
public class MalformedSnapshotException extends RuntimeException {

    public MalformedSnapshotException(String message) {
        super(message);
    }

    public MalformedSnapshotException(String message, Throwable cause) {
        super(message, cause);
    }
}
