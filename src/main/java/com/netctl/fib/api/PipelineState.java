package com.netctl.fib.api;

/**
 * Lifecycle of the FIB pipeline.
 *
 * <pre>
 * STOPPED -> STARTING -> RUNNING -> STOPPING -> STOPPED
 *                           \-> FAILED (fatal invariant violation)
 * </pre>
 */
public enum PipelineState {
    STOPPED,
    STARTING,
    RUNNING,
    STOPPING,
    FAILED
}
